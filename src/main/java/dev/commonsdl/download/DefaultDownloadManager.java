package dev.commonsdl.download;

import dev.commonsdl.model.FileStatus;
import dev.commonsdl.model.ResolvedFile;
import dev.commonsdl.progress.ProgressStore;
import dev.commonsdl.reporting.ProgressEvent;
import dev.commonsdl.reporting.ProgressReporter;
import dev.commonsdl.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation that downloads media files with a fixed pool of worker threads draining a
 * shared queue. Every outcome is recorded in the {@link ProgressStore}; failures are also appended
 * to the {@link FailureLog}. A failing file never stops the other downloads.
 */
public class DefaultDownloadManager implements DownloadManager {
	public static final String PHASE = "download";
	private static final int PROGRESS_INTERVAL = 100;

	private static final Logger logger = LoggerFactory.getLogger(DefaultDownloadManager.class);

	private final BlockingQueue<ResolvedFile> downloadQueue;
	private final ExecutorService executorService;
	private final MediaFetcher fetcher;
	private final ProgressStore store;
	private final FailureLog failureLog;
	private final ProgressReporter reporter;
	private final DownloadConfig config;
	private final Set<String> submittedTitles;
	private final AtomicInteger activeDownloads;
	private final AtomicInteger completedDownloads;
	private final AtomicInteger alreadyPresent;
	private final AtomicInteger failedDownloads;
	private final AtomicInteger deferredDownloads;
	private final AtomicInteger fetchAttempts;
	private final AtomicInteger statusChanges;
	private volatile boolean shutdownRequested;

	/**
	 * Create a new DefaultDownloadManager.
	 *
	 * @param config The download configuration
	 * @param fetcher Retrieves the media content
	 * @param store The progress index receiving the outcome of every download
	 * @param failureLog The log receiving failed downloads
	 * @param reporter Receives periodic progress events
	 */
	public DefaultDownloadManager(
			DownloadConfig config,
			MediaFetcher fetcher,
			ProgressStore store,
			FailureLog failureLog,
			ProgressReporter reporter) {
		this.downloadQueue = new LinkedBlockingQueue<>();
		this.executorService = Executors.newFixedThreadPool(config.threads());
		this.fetcher = fetcher;
		this.store = store;
		this.failureLog = failureLog;
		this.reporter = reporter;
		this.config = config;
		this.submittedTitles = ConcurrentHashMap.newKeySet();
		this.activeDownloads = new AtomicInteger(0);
		this.completedDownloads = new AtomicInteger(0);
		this.alreadyPresent = new AtomicInteger(0);
		this.failedDownloads = new AtomicInteger(0);
		this.deferredDownloads = new AtomicInteger(0);
		this.fetchAttempts = new AtomicInteger(0);
		this.statusChanges = new AtomicInteger(0);
		this.shutdownRequested = false;
	}

	/**
	 * Start the download worker threads. Should be called once after construction.
	 */
	@Override
	public void start() {
		logger.info("Starting {} download workers into {}", config.threads(), config.outputDir());
		for (int i = 0; i < config.threads(); i++) {
			executorService.submit(this::downloadWorker);
		}
	}

	@Override
	public boolean submit(ResolvedFile file) {
		if (shutdownRequested) {
			throw new IllegalStateException("Cannot submit downloads after shutdown requested");
		}
		if (store.status(file.title()).isEmpty()) {
			throw new IllegalArgumentException("File not in progress index: " + file.title());
		}
		if (!submittedTitles.add(file.title())) {
			return false;
		}
		try {
			downloadQueue.put(file);
			logger.debug("Queued download for {}", file.title());
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while submitting download", e);
		}
	}

	@Override
	public void shutdown() {
		logger.debug("No more downloads will be submitted");
		shutdownRequested = true;
	}

	/**
	 * Wait for the queue to drain and all workers to finish, then flush the progress index one last
	 * time.
	 */
	@Override
	public void awaitCompletion() throws InterruptedException, IOException {
		shutdownRequested = true;
		executorService.shutdown();
		try {
			while (!executorService.awaitTermination(1, TimeUnit.SECONDS)) {
				logger.debug(
						"Downloads: {} queued, {} active, {} completed, {} failed",
						downloadQueue.size(),
						activeDownloads.get(),
						completedDownloads.get(),
						failedDownloads.get());
			}
		} catch (InterruptedException e) {
			executorService.shutdownNow();
			throw e;
		} finally {
			store.flush();
		}
		logger.info("Downloads finished: {}", summary());
	}

	@Override
	public DownloadSummary summary() {
		return new DownloadSummary(
				completedDownloads.get(), alreadyPresent.get(), failedDownloads.get(), deferredDownloads.get());
	}

	/** Worker thread that processes downloads from the queue */
	private void downloadWorker() {
		while (!shutdownRequested || !downloadQueue.isEmpty()) {
			try {
				ResolvedFile file = downloadQueue.poll(500, TimeUnit.MILLISECONDS);
				if (file == null) {
					continue;
				}
				activeDownloads.incrementAndGet();
				try {
					processDownload(file);
				} catch (RuntimeException e) {
					logger.error("Unexpected error while downloading {}", file.title(), e);
					recordFailure(file.title(), FetchException.Kind.TRANSPORT, e.toString());
				} finally {
					activeDownloads.decrementAndGet();
				}
				int processed = summary().total();
				if (processed % PROGRESS_INTERVAL == 0) {
					reporter.report(ProgressEvent.progress(PHASE, processed + " files processed: " + summary()));
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}
		}
	}

	/** Process a single file: skip it if present, otherwise fetch it into a temp file and move it in place */
	private void processDownload(ResolvedFile file) throws InterruptedException {
		String title = file.title();
		Path target = config.outputDir().resolve(MediaFiles.fileName(title));

		if (Files.exists(target)) {
			alreadyPresent.incrementAndGet();
			logger.debug("Already present: {}", target.getFileName());
			recordStatus(title, FileStatus.DOWNLOADED);
			return;
		}
		if (config.limit() >= 0 && fetchAttempts.incrementAndGet() > config.limit()) {
			deferredDownloads.incrementAndGet();
			return;
		}

		String url = MediaFiles.url(config.baseUrl(), title);
		Path tempFile = null;
		try {
			tempFile = FileUtils.createSiblingTempFile(target);
			long size = fetcher.fetch(url, tempFile);
			FileUtils.moveInPlace(tempFile, target);
			completedDownloads.incrementAndGet();
			logger.debug("Downloaded {} ({} bytes)", title, size);
			recordStatus(title, FileStatus.DOWNLOADED);
		} catch (FetchException e) {
			logger.warn("Failed to download {}: {}: {}", title, e.kind(), e.getMessage());
			recordFailure(title, e.kind(), e.getMessage());
		} catch (IOException e) {
			// local write problem, the file stays pending for the next run
			deferredDownloads.incrementAndGet();
			logger.error("Could not store {} in {}", title, config.outputDir(), e);
		} finally {
			deleteTempFile(tempFile);
		}
	}

	private void recordFailure(String title, FetchException.Kind kind, String message) {
		failedDownloads.incrementAndGet();
		recordStatus(title, FileStatus.INVALID);
		try {
			failureLog.record(title, kind, message);
		} catch (IOException e) {
			logger.error("Could not write {} to the failure log", title, e);
		}
	}

	private void recordStatus(String title, FileStatus status) {
		if (store.markStatus(title, status) && statusChanges.incrementAndGet() % config.flushInterval() == 0) {
			try {
				store.flush();
			} catch (IOException e) {
				logger.error("Failed to flush progress index {}", store.indexFile(), e);
			}
		}
	}

	private static void deleteTempFile(Path tempFile) {
		if (tempFile == null) {
			return;
		}
		try {
			Files.deleteIfExists(tempFile);
		} catch (IOException e) {
			logger.warn("Could not delete temporary file {}", tempFile, e);
		}
	}
}
