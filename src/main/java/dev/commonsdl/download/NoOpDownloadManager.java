package dev.commonsdl.download;

import dev.commonsdl.model.ResolvedFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DownloadManager for dry runs. Reports what would be downloaded without fetching anything or
 * touching the progress index.
 */
public class NoOpDownloadManager implements DownloadManager {
	private static final Logger logger = LoggerFactory.getLogger(NoOpDownloadManager.class);

	private final DownloadConfig config;
	private final Set<String> submitted = ConcurrentHashMap.newKeySet();
	private final AtomicInteger wouldDownload = new AtomicInteger(0);
	private final AtomicInteger alreadyPresent = new AtomicInteger(0);
	private final AtomicInteger overLimit = new AtomicInteger(0);

	public NoOpDownloadManager(DownloadConfig config) {
		this.config = config;
	}

	@Override
	public void start() {
		logger.info("Dry run - no files will be downloaded");
	}

	@Override
	public boolean submit(ResolvedFile file) {
		if (!submitted.add(file.title())) {
			return false;
		}
		Path target = config.outputDir().resolve(MediaFiles.fileName(file.title()));
		if (Files.exists(target)) {
			alreadyPresent.incrementAndGet();
			logger.debug("Already present: {}", target);
		} else if (config.limit() >= 0 && wouldDownload.get() >= config.limit()) {
			overLimit.incrementAndGet();
		} else {
			wouldDownload.incrementAndGet();
			logger.info(
					"Would download {} ({}) from {}",
					file.title(),
					file.discoveredViaCategory(),
					MediaFiles.url(config.baseUrl(), file.title()));
		}
		return true;
	}

	@Override
	public void shutdown() {
		// Nothing queued
	}

	@Override
	public void awaitCompletion() {
		// Nothing to wait for
	}

	/** Files that would be fetched are reported as downloaded */
	@Override
	public DownloadSummary summary() {
		return new DownloadSummary(wouldDownload.get(), alreadyPresent.get(), 0, overLimit.get());
	}
}
