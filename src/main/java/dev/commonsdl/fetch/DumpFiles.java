package dev.commonsdl.fetch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Location of the three dumps a fetch reads, named {@code <wiki>-<version>-<table>.sql.gz}. An
 * uncompressed {@code .sql} file is used when no compressed one exists.
 */
public record DumpFiles(Path linkTarget, Path categoryLinks, Path page) {
	public static final String DEFAULT_WIKI = "commonswiki";
	public static final String DEFAULT_VERSION = "latest";

	public static DumpFiles locate(Path dumpsDir, String wiki, String version) {
		return new DumpFiles(
				resolve(dumpsDir, wiki, version, "linktarget"),
				resolve(dumpsDir, wiki, version, "categorylinks"),
				resolve(dumpsDir, wiki, version, "page"));
	}

	public static String fileName(String wiki, String version, String table) {
		return wiki + "-" + version + "-" + table + ".sql.gz";
	}

	private static Path resolve(Path dumpsDir, String wiki, String version, String table) {
		Path compressed = dumpsDir.resolve(fileName(wiki, version, table));
		Path plain = dumpsDir.resolve(wiki + "-" + version + "-" + table + ".sql");
		return !Files.exists(compressed) && Files.exists(plain) ? plain : compressed;
	}

	/**
	 * Check that every dump is a readable file.
	 *
	 * @throws NoSuchFileException naming the missing dumps
	 */
	public void validate() throws IOException {
		List<String> missing = new ArrayList<>();
		for (Path dump : List.of(linkTarget, categoryLinks, page)) {
			if (!Files.isRegularFile(dump) || !Files.isReadable(dump)) {
				missing.add(dump.toString());
			}
		}
		if (!missing.isEmpty()) {
			throw new NoSuchFileException(String.join(", ", missing), null, "dump file missing");
		}
	}
}
