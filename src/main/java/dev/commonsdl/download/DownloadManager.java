package dev.commonsdl.download;

import dev.commonsdl.model.ResolvedFile;
import java.io.IOException;

/**
 * Interface for managing parallel downloads of media files. Implementations receive the pending
 * files of the progress index and record the outcome of each download there.
 */
public interface DownloadManager {
	/**
	 * Start the download manager. Should be called once after construction.
	 */
	void start();

	/**
	 * Submit a file for download.
	 *
	 * @param file The file to download
	 * @return false if the same title was submitted before
	 */
	boolean submit(ResolvedFile file);

	/**
	 * Signal that no more files will be submitted.
	 */
	void shutdown();

	/**
	 * Wait for all queued downloads to complete and write the final state of the progress index.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 * @throws IOException if the progress index cannot be written
	 */
	void awaitCompletion() throws InterruptedException, IOException;

	/**
	 * Get the counts of the run so far.
	 *
	 * @return The summary
	 */
	DownloadSummary summary();
}
