package dev.commonsdl.relation;

import dev.commonsdl.dump.DumpFormatException;
import dev.commonsdl.dump.DumpRow;
import dev.commonsdl.dump.DumpScanner;
import dev.commonsdl.dump.RowParseException;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for the relation extractors. Runs a single forward pass of a {@link DumpScanner} over
 * one dump file and hands every row to {@link #process(DumpRow)}, which adds it to the lookup
 * structure being built.
 *
 * @param <T> The lookup structure built by the extractor
 */
public abstract class RelationExtractor<T> {
	private static final long PROGRESS_INTERVAL = 5_000_000;

	protected final Logger logger = LoggerFactory.getLogger(getClass());

	private long rowsAccepted;
	private long rowsRejected;
	private ExtractionStatistics statistics;

	/** The table name used in the insert statements of the dump */
	public abstract String table();

	/**
	 * Interpret one row.
	 *
	 * @param row The row
	 * @return true if the row was kept, false if it was filtered out
	 * @throws RowParseException if the row does not have the expected shape
	 */
	protected abstract boolean process(DumpRow row) throws RowParseException;

	/** The structure built so far */
	protected abstract T result();

	/**
	 * Extract the relation from a dump file.
	 *
	 * @param dumpFile The dump file
	 * @return The lookup structure
	 * @throws DumpFormatException if the dump cannot be read
	 */
	public T extract(Path dumpFile) throws DumpFormatException {
		DumpScanner scanner = new DumpScanner(dumpFile, table());
		logger.info("Extracting '{}' rows from {}", table(), dumpFile.getFileName());
		DumpScanner.RowCursor rows = scanner.open();
		try (rows) {
			DumpRow row;
			while ((row = rows.next()) != null) {
				try {
					if (process(row)) {
						rowsAccepted++;
					}
				} catch (RowParseException e) {
					reject(row, e);
				}
				if (row.ordinal() % PROGRESS_INTERVAL == 0) {
					logger.info("{}: {} rows read, {} kept", table(), row.ordinal(), rowsAccepted);
				}
			}
		} catch (IOException e) {
			throw new DumpFormatException(dumpFile, "failed to close dump: " + e.getMessage(), e);
		}
		statistics = new ExtractionStatistics(
				table(), rows.rowsRead() + rows.rowsMalformed(), rowsAccepted, rows.rowsMalformed() + rowsRejected);
		logger.info("Completed {}", statistics);
		return result();
	}

	/** Counters of the last completed pass, or null if none has completed */
	public ExtractionStatistics statistics() {
		return statistics;
	}

	private void reject(DumpRow row, RowParseException e) {
		rowsRejected++;
		if (rowsRejected <= 20) {
			logger.warn("Skipping row {} of '{}': {}", row.ordinal(), table(), e.getMessage());
		} else {
			logger.debug("Skipping row {} of '{}': {}", row.ordinal(), table(), e.getMessage());
		}
	}
}
