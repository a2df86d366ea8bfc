package dev.commonsdl;

import java.nio.file.Path;
import picocli.CommandLine.Option;

/** Location of the progress index, shared by all commands */
public class IndexOptions {
	@Option(
			names = {"-i", "--index-file"},
			description = "Progress index file (default: progress-index.json)",
			defaultValue = "progress-index.json")
	Path indexFile;
}
