package dev.commonsdl.download;

import dev.commonsdl.model.ResolvedFile;
import dev.commonsdl.progress.ProgressStore;
import dev.commonsdl.reporting.ProgressEvent;
import dev.commonsdl.reporting.ProgressReporter;
import dev.commonsdl.util.FileUtils;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Feeds the pending files of the progress index through a {@link DownloadManager} */
public class DownloadRunner {
	private static final Logger logger = LoggerFactory.getLogger(DownloadRunner.class);

	private final DownloadConfig config;
	private final ProgressStore store;
	private final ProgressReporter reporter;

	public DownloadRunner(DownloadConfig config, ProgressStore store, ProgressReporter reporter) {
		this.config = config;
		this.store = store;
		this.reporter = reporter;
	}

	/** Download with the HTTP fetcher, or only report when configured as a dry run */
	public DownloadSummary run() throws IOException, InterruptedException {
		MediaFetcher fetcher = new HttpMediaFetcher(
				new AdaptiveRateLimiter(), config.maxRetries(), config.requestTimeout());
		return run(fetcher);
	}

	/**
	 * Download every pending file of the index.
	 *
	 * @param fetcher Retrieves the media content
	 * @return The counts of the run
	 * @throws IOException if the output directory or the progress index cannot be written
	 * @throws InterruptedException if interrupted while waiting for the workers
	 */
	public DownloadSummary run(MediaFetcher fetcher) throws IOException, InterruptedException {
		List<ResolvedFile> pending = store.pending();
		logger.info("{} files pending", pending.size());

		DownloadManager manager;
		if (config.dryRun()) {
			manager = new NoOpDownloadManager(config);
		} else {
			FileUtils.ensureDirectory(config.outputDir());
			manager = new DefaultDownloadManager(
					config, fetcher, store, FailureLog.in(config.outputDir()), reporter);
		}

		reporter.report(ProgressEvent.started(DefaultDownloadManager.PHASE));
		manager.start();
		try {
			for (ResolvedFile file : pending) {
				manager.submit(file);
			}
		} finally {
			manager.shutdown();
			manager.awaitCompletion();
		}
		DownloadSummary summary = manager.summary();
		reporter.report(ProgressEvent.completed(DefaultDownloadManager.PHASE, summary.toString()));
		return summary;
	}
}
