package dev.commonsdl.download;

/**
 * Result of a download run.
 *
 * @param downloaded Files fetched and written
 * @param alreadyPresent Files found on disk and marked downloaded without fetching
 * @param failed Files marked invalid
 * @param deferred Files left pending, because of the run limit or a local write error
 */
public record DownloadSummary(int downloaded, int alreadyPresent, int failed, int deferred) {

	public int total() {
		return downloaded + alreadyPresent + failed + deferred;
	}

	@Override
	public String toString() {
		return "%d downloaded, %d already present, %d failed, %d deferred"
				.formatted(downloaded, alreadyPresent, failed, deferred);
	}
}
