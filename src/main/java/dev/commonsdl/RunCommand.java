package dev.commonsdl;

import dev.commonsdl.fetch.FetchResult;
import dev.commonsdl.reporting.ProgressReporter;
import java.io.IOException;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** Run command: fetch followed by download */
@Command(
		name = "run",
		description = "Resolve the listed categories from the dumps, then download their files",
		mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	private IndexOptions indexOptions;

	@Mixin
	private FetchOptions fetchOptions;

	@Mixin
	private DownloadOptions downloadOptions;

	@Override
	public Integer call() throws Exception {
		logger.info("Commons Bulk Downloader");
		logger.info("=======================");
		try (var reporter = new ProgressReporter()) {
			reporter.start();
			FetchResult result = FetchCommand.fetch(indexOptions.indexFile, fetchOptions.toConfig(), reporter);
			if (!result.success()) {
				return 1;
			}
			logger.info("");
			DownloadCommand.download(indexOptions.indexFile, downloadOptions.toConfig(), reporter);
			return 0;
		} catch (IOException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}
}
