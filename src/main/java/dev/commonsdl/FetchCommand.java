package dev.commonsdl;

import dev.commonsdl.fetch.FetchConfig;
import dev.commonsdl.fetch.FetchPipeline;
import dev.commonsdl.fetch.FetchResult;
import dev.commonsdl.progress.ProgressStore;
import dev.commonsdl.relation.ExtractionStatistics;
import dev.commonsdl.reporting.ProgressReporter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** Fetch command to resolve the listed categories from the dumps into the progress index */
@Command(
		name = "fetch",
		description = "Scan the database dumps and record the files of the listed categories in the progress index",
		mixinStandardHelpOptions = true)
public class FetchCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	private IndexOptions indexOptions;

	@Mixin
	private FetchOptions fetchOptions;

	@Override
	public Integer call() throws Exception {
		logger.info("Commons Bulk Downloader - Fetch");
		logger.info("===============================");
		try (var reporter = new ProgressReporter()) {
			reporter.start();
			FetchResult result = fetch(indexOptions.indexFile, fetchOptions.toConfig(), reporter);
			return result.success() ? 0 : 1;
		} catch (IOException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}

	/**
	 * Run the fetch phase and print its summary.
	 *
	 * @throws IOException if the progress index cannot be loaded
	 */
	static FetchResult fetch(Path indexFile, FetchConfig config, ProgressReporter reporter) throws IOException {
		logger.info("Categories requested: {}", config.categories().size());
		logger.info("Dumps: {}", config.dumps().linkTarget().toAbsolutePath().getParent());
		logger.info("Index file: {}", indexFile.toAbsolutePath());
		logger.info("Recursive: {}", config.recursive());
		if (!config.extensions().isEmpty()) {
			logger.info("Extensions: {}", String.join(", ", config.extensions()));
		}
		logger.info("");

		ProgressStore store = ProgressStore.load(indexFile);
		long startTime = System.currentTimeMillis();
		FetchPipeline pipeline = new FetchPipeline(config, store, reporter);
		FetchResult result = pipeline.run();

		logger.info("");
		logger.info("Fetch Summary");
		logger.info("=============");
		for (ExtractionStatistics statistics : pipeline.statistics()) {
			logger.info("  {}", statistics);
		}
		for (String category : result.notFoundCategories()) {
			logger.info("  Not found: {}", category);
		}
		logger.info("{}", result);
		logger.info("Completed in {} seconds", (System.currentTimeMillis() - startTime) / 1000.0);
		return result;
	}
}
