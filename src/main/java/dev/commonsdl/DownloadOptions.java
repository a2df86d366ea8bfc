package dev.commonsdl;

import dev.commonsdl.download.DownloadConfig;
import dev.commonsdl.download.MediaFiles;
import java.nio.file.Path;
import java.time.Duration;
import picocli.CommandLine.Option;

/** Options of the download phase */
public class DownloadOptions {
	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory to store downloaded files (default: downloads)",
			defaultValue = "downloads")
	Path outputDir;

	@Option(
			names = {"-t", "--threads"},
			description = "Number of parallel download threads (default: 10)",
			defaultValue = "10")
	int threads;

	@Option(
			names = {"--base-url"},
			description = "Base URL of the media repository (default: " + MediaFiles.DEFAULT_BASE_URL + ")",
			defaultValue = MediaFiles.DEFAULT_BASE_URL)
	String baseUrl;

	@Option(
			names = {"--max-retries"},
			description = "Retries for throttled, failing or unreachable requests (default: 5)",
			defaultValue = "5")
	int maxRetries;

	@Option(
			names = {"--timeout"},
			description = "Timeout of a single request in seconds (default: 20)",
			defaultValue = "20")
	int timeoutSeconds;

	@Option(
			names = {"--limit"},
			description = "Maximum number of files to fetch in this run (default: unlimited)",
			defaultValue = "-1")
	int limit;

	@Option(
			names = {"--flush-interval"},
			description = "Number of status changes between progress index writes (default: 25)",
			defaultValue = "25")
	int flushInterval;

	@Option(
			names = {"--dry-run"},
			description = "Show what would be downloaded without fetching anything")
	boolean dryRun;

	DownloadConfig toConfig() {
		return new DownloadConfig(
				outputDir,
				threads,
				baseUrl,
				maxRetries,
				Duration.ofSeconds(timeoutSeconds),
				limit,
				flushInterval,
				dryRun);
	}
}
