package dev.commonsdl;

import dev.commonsdl.download.DownloadConfig;
import dev.commonsdl.download.DownloadRunner;
import dev.commonsdl.download.DownloadSummary;
import dev.commonsdl.download.FailureLog;
import dev.commonsdl.progress.ProgressStore;
import dev.commonsdl.reporting.ProgressReporter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Download command to fetch the pending files of the progress index. Failed files are reported but
 * do not change the exit code; only errors that stop the whole run do.
 */
@Command(
		name = "download",
		description = "Download the files recorded in the progress index that are not downloaded yet",
		mixinStandardHelpOptions = true)
public class DownloadCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	private IndexOptions indexOptions;

	@Mixin
	private DownloadOptions downloadOptions;

	@Override
	public Integer call() throws Exception {
		logger.info("Commons Bulk Downloader - Download");
		logger.info("==================================");
		try (var reporter = new ProgressReporter()) {
			reporter.start();
			download(indexOptions.indexFile, downloadOptions.toConfig(), reporter);
			return 0;
		} catch (IOException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}

	/**
	 * Run the download phase and print its summary.
	 *
	 * @throws IOException if the progress index cannot be loaded or written
	 * @throws InterruptedException if interrupted while downloading
	 */
	static DownloadSummary download(Path indexFile, DownloadConfig config, ProgressReporter reporter)
			throws IOException, InterruptedException {
		logger.info("Index file: {}", indexFile.toAbsolutePath());
		logger.info("Output directory: {}", config.outputDir().toAbsolutePath());
		logger.info("Threads: {}", config.threads());
		if (config.limit() >= 0) {
			logger.info("Limit: {} files", config.limit());
		}
		if (config.dryRun()) {
			logger.info("Dry run: nothing will be downloaded");
		}
		logger.info("");

		ProgressStore store = ProgressStore.load(indexFile);
		if (store.statistics().knownFiles() == 0) {
			logger.info("No files in the progress index. Run 'fetch' first.");
			return new DownloadSummary(0, 0, 0, 0);
		}

		long startTime = System.currentTimeMillis();
		DownloadSummary summary = new DownloadRunner(config, store, reporter).run();

		logger.info("");
		logger.info("Download Summary");
		logger.info("================");
		logger.info("{}", config.dryRun() ? "Would download: " + summary.downloaded() : summary);
		if (summary.failed() > 0) {
			logger.info("Failures written to {}", config.outputDir().resolve(FailureLog.FILE_NAME));
		}
		logger.info("Index: {}", store.statistics());
		logger.info("Completed in {} seconds", (System.currentTimeMillis() - startTime) / 1000.0);
		return summary;
	}
}
