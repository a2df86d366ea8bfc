package dev.commonsdl;

import dev.commonsdl.download.FailureLog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Clean command to reset progress. Downloaded media files are never touched; only the progress
 * index, the failure log and partial downloads left behind by an interrupted run.
 */
@Command(
		name = "clean",
		description = "Remove the progress index, the failure log and partial downloads",
		mixinStandardHelpOptions = true)
public class CleanCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	private IndexOptions indexOptions;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory with the downloaded files and the failure log (default: downloads)",
			defaultValue = "downloads")
	private Path outputDir;

	@Option(
			names = {"--keep-index"},
			description = "Keep the progress index")
	private boolean keepIndex;

	@Option(
			names = {"--keep-failure-log"},
			description = "Keep the failure log")
	private boolean keepFailureLog;

	@Option(
			names = {"--yes"},
			description = "Actually delete the files; without it only shows what would be deleted")
	private boolean confirmed;

	@Override
	public Integer call() throws Exception {
		logger.info("Commons Bulk Downloader - Clean");
		logger.info("===============================");

		List<Path> filesToDelete = new ArrayList<>();
		try {
			if (!keepIndex && Files.exists(indexOptions.indexFile)) {
				filesToDelete.add(indexOptions.indexFile);
			}
			Path failureLog = outputDir.resolve(FailureLog.FILE_NAME);
			if (!keepFailureLog && Files.exists(failureLog)) {
				filesToDelete.add(failureLog);
			}
			filesToDelete.addAll(partialDownloads(outputDir));
		} catch (IOException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}

		if (filesToDelete.isEmpty()) {
			logger.info("No files to delete.");
			return 0;
		}

		logger.info("Files to delete: {}", filesToDelete.size());
		for (Path file : filesToDelete) {
			logger.info("  {}", file);
		}

		if (!confirmed) {
			logger.info("");
			logger.info("DRY RUN - No files were actually deleted.");
			logger.info("Run with --yes to perform actual deletion.");
			return 0;
		}

		int failedCount = 0;
		for (Path file : filesToDelete) {
			try {
				Files.deleteIfExists(file);
			} catch (IOException e) {
				logger.error("  Failed to delete {}: {}", file, e.getMessage());
				failedCount++;
			}
		}
		logger.info("");
		logger.info("Deleted: {} files", filesToDelete.size() - failedCount);
		return failedCount > 0 ? 1 : 0;
	}

	/** Temporary files of downloads that never completed */
	static List<Path> partialDownloads(Path outputDir) throws IOException {
		if (!Files.isDirectory(outputDir)) {
			return List.of();
		}
		try (Stream<Path> paths = Files.list(outputDir)) {
			return paths.filter(Files::isRegularFile)
					.filter(path -> {
						String name = path.getFileName().toString();
						return name.startsWith(".") && name.endsWith(".part");
					})
					.sorted()
					.toList();
		}
	}
}
