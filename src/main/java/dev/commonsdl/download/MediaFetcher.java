package dev.commonsdl.download;

import java.nio.file.Path;

/** Retrieves the bytes behind a media URL */
public interface MediaFetcher {
	/**
	 * Fetch a URL into a local file.
	 *
	 * @param url The URL to fetch
	 * @param destination The file to write the body to, replaced if it exists
	 * @return The number of bytes written
	 * @throws FetchException if the content could not be retrieved
	 * @throws InterruptedException if interrupted while waiting on the remote side or a backoff
	 */
	long fetch(String url, Path destination) throws FetchException, InterruptedException;
}
