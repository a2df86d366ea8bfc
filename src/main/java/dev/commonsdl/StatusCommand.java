package dev.commonsdl;

import dev.commonsdl.download.FailureLog;
import dev.commonsdl.progress.IndexStatistics;
import dev.commonsdl.progress.ProgressStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Status command to show the counts of the progress index and the failure log */
@Command(
		name = "status",
		description = "Show the progress of earlier runs",
		mixinStandardHelpOptions = true)
public class StatusCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	private IndexOptions indexOptions;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory with the downloaded files and the failure log (default: downloads)",
			defaultValue = "downloads")
	private Path outputDir;

	@Option(
			names = {"--failures"},
			description = "List every entry of the failure log")
	private boolean listFailures;

	@Override
	public Integer call() throws Exception {
		logger.info("Commons Bulk Downloader - Status");
		logger.info("================================");
		logger.info("Index file: {}", indexOptions.indexFile.toAbsolutePath());
		logger.info("");

		IndexStatistics statistics;
		List<FailureLog.Entry> failures;
		try {
			statistics = ProgressStore.load(indexOptions.indexFile).statistics();
			failures = FailureLog.read(outputDir.resolve(FailureLog.FILE_NAME));
		} catch (IOException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}

		logger.info("Processed categories: {}", statistics.processedCategories());
		logger.info("Known files: {}", statistics.knownFiles());
		logger.info("   - downloaded: {}", statistics.downloaded());
		logger.info("   - pending: {}", statistics.pending());
		logger.info("   - invalid: {}", statistics.invalid());
		logger.info("");

		Map<String, Integer> failuresByKind = new TreeMap<>();
		for (FailureLog.Entry entry : failures) {
			failuresByKind.merge(entry.kind(), 1, Integer::sum);
		}
		logger.info("Failure log entries: {}", failures.size());
		failuresByKind.forEach((kind, count) -> logger.info("   - {}: {}", kind, count));
		if (listFailures) {
			logger.info("");
			for (FailureLog.Entry entry : failures) {
				logger.info("  {} [{}] {}", entry.title(), entry.kind(), entry.reason());
			}
		}
		return 0;
	}
}
