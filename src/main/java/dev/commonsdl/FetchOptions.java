package dev.commonsdl;

import dev.commonsdl.fetch.DumpFiles;
import dev.commonsdl.fetch.FetchConfig;
import dev.commonsdl.resolve.CategoryTitles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import picocli.CommandLine.Option;

/** Options of the fetch phase */
public class FetchOptions {
	@Option(
			names = {"-c", "--category-file"},
			description = "File with one category per line; blank lines and lines starting with # are ignored",
			required = true)
	Path categoryFile;

	@Option(
			names = {"-d", "--dumps-dir"},
			description = "Directory containing the database dumps (default: dumps)",
			defaultValue = "dumps")
	Path dumpsDir;

	@Option(
			names = {"--wiki"},
			description = "Wiki name in the dump file names (default: " + DumpFiles.DEFAULT_WIKI + ")",
			defaultValue = DumpFiles.DEFAULT_WIKI)
	String wiki;

	@Option(
			names = {"--dump-version"},
			description = "Dump version in the dump file names (default: " + DumpFiles.DEFAULT_VERSION + ")",
			defaultValue = DumpFiles.DEFAULT_VERSION)
	String dumpVersion;

	@Option(
			names = {"--no-recursive"},
			description = "Only collect files directly in the listed categories, not in their subcategories")
	boolean noRecursive;

	@Option(
			names = {"--extensions"},
			description = "Comma-separated list of file extensions to keep (e.g., jpg,jpeg); all files by default",
			split = ",")
	List<String> extensions;

	FetchConfig toConfig() throws IOException {
		List<String> categories = CategoryTitles.readCategoryFile(categoryFile);
		return new FetchConfig(
				categories,
				DumpFiles.locate(dumpsDir, wiki, dumpVersion),
				!noRecursive,
				extensions == null ? Set.of() : Set.copyOf(extensions));
	}
}
