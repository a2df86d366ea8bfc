package dev.commonsdl.dump;

import dev.commonsdl.util.CompressionUtils;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams the rows of one table out of a compressed SQL bulk-export file. The file is decompressed
 * incrementally and never held in memory. Each call to {@link #open()} starts a new pass from the
 * beginning of the file.
 */
public class DumpScanner {
	public static final int DEFAULT_MAX_TUPLE_LENGTH = 1 << 20;

	private static final Logger logger = LoggerFactory.getLogger(DumpScanner.class);
	private static final int READER_BUFFER_SIZE = 1 << 16;
	private static final int MAX_LOGGED_ERRORS = 20;

	private final Path dumpFile;
	private final String table;
	private final int maxTupleLength;

	public DumpScanner(Path dumpFile, String table) {
		this(dumpFile, table, DEFAULT_MAX_TUPLE_LENGTH);
	}

	/**
	 * Create a scanner.
	 *
	 * @param dumpFile The dump file, compressed or plain {@code .sql}
	 * @param table The table whose insert statements are read
	 * @param maxTupleLength Tuples longer than this many characters are treated as malformed
	 */
	public DumpScanner(Path dumpFile, String table, int maxTupleLength) {
		this.dumpFile = dumpFile;
		this.table = table;
		this.maxTupleLength = maxTupleLength;
	}

	public Path dumpFile() {
		return dumpFile;
	}

	public String table() {
		return table;
	}

	/**
	 * Start a pass over the file.
	 *
	 * @return A cursor positioned before the first row
	 * @throws DumpFormatException if the file cannot be opened or its header is not recognized
	 */
	public RowCursor open() throws DumpFormatException {
		InputStream in;
		try {
			in = CompressionUtils.openDecompressed(dumpFile);
		} catch (IOException e) {
			throw new DumpFormatException(dumpFile, "cannot open dump: " + e.getMessage(), e);
		}
		logger.debug("Scanning table '{}' in {}", table, dumpFile);
		return new RowCursor(
				new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), READER_BUFFER_SIZE));
	}

	/** A single forward pass over the rows of the table */
	public class RowCursor implements Closeable {
		private final BufferedReader reader;
		private final InsertStatementReader statements;
		private long rowsRead;
		private long rowsMalformed;

		private RowCursor(BufferedReader reader) {
			this.reader = reader;
			this.statements = new InsertStatementReader(reader, table, maxTupleLength, this::malformed);
		}

		/**
		 * Advance to the next well-formed row. Malformed rows are logged, counted and skipped.
		 *
		 * @return The next row, or null when the file is exhausted
		 * @throws DumpFormatException if the file stops being readable (corrupt or truncated stream)
		 */
		public DumpRow next() throws DumpFormatException {
			try {
				List<Object> values = statements.nextTuple();
				if (values == null) {
					return null;
				}
				rowsRead++;
				return new DumpRow(rowsRead + rowsMalformed, values);
			} catch (IOException e) {
				throw new DumpFormatException(
						dumpFile, "read failed after " + rowsRead + " rows: " + e.getMessage(), e);
			}
		}

		private void malformed(RowParseException e) {
			rowsMalformed++;
			long ordinal = rowsRead + rowsMalformed;
			if (rowsMalformed <= MAX_LOGGED_ERRORS) {
				logger.warn("Skipping malformed row {} in {}: {}", ordinal, dumpFile.getFileName(), e.getMessage());
			} else if (rowsMalformed == MAX_LOGGED_ERRORS + 1) {
				logger.warn("Too many malformed rows in {}, further ones are logged at debug level", dumpFile.getFileName());
			} else {
				logger.debug("Skipping malformed row {} in {}: {}", ordinal, dumpFile.getFileName(), e.getMessage());
			}
		}

		/** Number of well-formed rows returned so far */
		public long rowsRead() {
			return rowsRead;
		}

		/** Number of tuples skipped because they could not be tokenized */
		public long rowsMalformed() {
			return rowsMalformed;
		}

		/** Number of insert statements for the table seen so far */
		public long statementsRead() {
			return statements.statements();
		}

		@Override
		public void close() throws IOException {
			reader.close();
		}
	}
}
