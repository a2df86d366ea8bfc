package dev.commonsdl.download;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only log of files that could not be downloaded, one {@code title<TAB>KIND: reason} line per
 * failure. A title is written at most once per run.
 */
public class FailureLog {
	public static final String FILE_NAME = "invalid.txt";

	private final Path logFile;
	private final Set<String> recorded = new HashSet<>();

	public FailureLog(Path logFile) {
		this.logFile = logFile;
	}

	/** The failure log inside an output directory */
	public static FailureLog in(Path outputDir) {
		return new FailureLog(outputDir.resolve(FILE_NAME));
	}

	public Path logFile() {
		return logFile;
	}

	/**
	 * Append a failure.
	 *
	 * @return false if the title was already recorded during this run
	 */
	public synchronized boolean record(String title, FetchException.Kind kind, String reason) throws IOException {
		if (!recorded.add(title)) {
			return false;
		}
		String line = clean(title) + "\t" + kind + ": " + clean(reason == null ? "" : reason) + "\n";
		Files.writeString(
				logFile, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
		return true;
	}

	/** One parsed line of a failure log */
	public record Entry(String title, String kind, String reason) {}

	/** Read every entry of a failure log, empty if the file does not exist */
	public static List<Entry> read(Path logFile) throws IOException {
		List<Entry> entries = new ArrayList<>();
		if (!Files.exists(logFile)) {
			return entries;
		}
		for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
			if (line.isBlank()) {
				continue;
			}
			int tab = line.indexOf('\t');
			if (tab < 0) {
				entries.add(new Entry(line, "", ""));
				continue;
			}
			String rest = line.substring(tab + 1);
			int colon = rest.indexOf(": ");
			entries.add(
					colon < 0
							? new Entry(line.substring(0, tab), rest, "")
							: new Entry(line.substring(0, tab), rest.substring(0, colon), rest.substring(colon + 2)));
		}
		return entries;
	}

	private static String clean(String text) {
		return text.replace('\t', ' ').replace('\r', ' ').replace('\n', ' ');
	}
}
