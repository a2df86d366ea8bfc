package dev.commonsdl.download;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration record for the download engine.
 *
 * @param outputDir Directory receiving one file per downloaded title and the failure log
 * @param threads Number of download workers
 * @param baseUrl Base URL of the media repository
 * @param maxRetries Retries for throttled, failing or unreachable requests
 * @param requestTimeout Timeout of a single request
 * @param limit Maximum number of files fetched in this run, -1 for unlimited
 * @param flushInterval Number of status changes between index flushes
 * @param dryRun Report what would be downloaded without fetching anything
 */
public record DownloadConfig(
		Path outputDir,
		int threads,
		String baseUrl,
		int maxRetries,
		Duration requestTimeout,
		int limit,
		int flushInterval,
		boolean dryRun) {

	public static final int DEFAULT_THREADS = 10;
	public static final int DEFAULT_MAX_RETRIES = 5;
	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(20);
	public static final int DEFAULT_FLUSH_INTERVAL = 25;

	public DownloadConfig {
		if (threads < 1) {
			throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
		}
		if (flushInterval < 1) {
			throw new IllegalArgumentException("Flush interval must be at least 1: " + flushInterval);
		}
		if (maxRetries < 0) {
			throw new IllegalArgumentException("Retry count must not be negative: " + maxRetries);
		}
		if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
			throw new IllegalArgumentException("Request timeout must be positive: " + requestTimeout);
		}
	}

	/** Defaults for everything but the output directory */
	public static DownloadConfig defaults(Path outputDir) {
		return new DownloadConfig(
				outputDir,
				DEFAULT_THREADS,
				MediaFiles.DEFAULT_BASE_URL,
				DEFAULT_MAX_RETRIES,
				DEFAULT_REQUEST_TIMEOUT,
				-1,
				DEFAULT_FLUSH_INTERVAL,
				false);
	}
}
