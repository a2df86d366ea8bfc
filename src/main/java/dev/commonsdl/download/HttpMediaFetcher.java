package dev.commonsdl.download;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MediaFetcher} on top of {@link HttpClient}. Follows redirects, retries throttled, failing
 * and unreachable requests through a shared {@link AdaptiveRateLimiter} and rejects HTML or empty
 * bodies.
 */
public class HttpMediaFetcher implements MediaFetcher {
	private static final Logger logger = LoggerFactory.getLogger(HttpMediaFetcher.class);

	public static final String USER_AGENT = "commons-bulk-downloader/1.0 (category based bulk media download)";

	private final HttpClient httpClient;
	private final AdaptiveRateLimiter rateLimiter;
	private final int maxRetries;
	private final Duration requestTimeout;

	public HttpMediaFetcher(AdaptiveRateLimiter rateLimiter, int maxRetries, Duration requestTimeout) {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build();
		this.rateLimiter = rateLimiter;
		this.maxRetries = maxRetries;
		this.requestTimeout = requestTimeout;
	}

	@Override
	public long fetch(String url, Path destination) throws FetchException, InterruptedException {
		HttpRequest request;
		try {
			request = HttpRequest.newBuilder()
					.uri(URI.create(url))
					.timeout(requestTimeout)
					.header("User-Agent", USER_AGENT)
					.GET()
					.build();
		} catch (IllegalArgumentException e) {
			throw new FetchException(FetchException.Kind.TRANSPORT, "Invalid URL: " + url, e);
		}

		FetchException lastFailure = null;
		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			rateLimiter.await();
			HttpResponse<Path> response;
			try {
				response = httpClient.send(request, bodyHandler(destination));
			} catch (HttpTimeoutException e) {
				throw new FetchException(FetchException.Kind.TIMEOUT, "Timed out after " + requestTimeout, e);
			} catch (IOException e) {
				lastFailure = new FetchException(FetchException.Kind.TRANSPORT, describe(e), e);
				logger.debug("Attempt {} for {} failed: {}", attempt + 1, url, e.toString());
				rateLimiter.backoff(null);
				continue;
			}

			int status = response.statusCode();
			if (status >= 200 && status < 300) {
				rateLimiter.success();
				return checkContent(response, destination);
			}
			if (status == 404 || status == 410) {
				throw new FetchException(FetchException.Kind.NOT_FOUND, "HTTP status " + status);
			}
			if (status == 429) {
				lastFailure = new FetchException(FetchException.Kind.TRANSPORT, "HTTP status 429 (throttled)");
				rateLimiter.backoff(retryAfter(response).orElse(null));
				continue;
			}
			if (status >= 500) {
				lastFailure = new FetchException(FetchException.Kind.TRANSPORT, "HTTP status " + status);
				rateLimiter.backoff(null);
				continue;
			}
			throw new FetchException(FetchException.Kind.TRANSPORT, "HTTP status " + status);
		}
		throw new FetchException(
				lastFailure.kind(),
				lastFailure.getMessage() + " after " + (maxRetries + 1) + " attempts",
				lastFailure.getCause());
	}

	/** Only successful bodies are written to the destination */
	private static HttpResponse.BodyHandler<Path> bodyHandler(Path destination) {
		return info -> info.statusCode() >= 200 && info.statusCode() < 300
				? HttpResponse.BodySubscribers.ofFile(
						destination,
						StandardOpenOption.CREATE,
						StandardOpenOption.WRITE,
						StandardOpenOption.TRUNCATE_EXISTING)
				: HttpResponse.BodySubscribers.replacing(null);
	}

	private static long checkContent(HttpResponse<Path> response, Path destination) throws FetchException {
		String contentType = response.headers()
				.firstValue("Content-Type")
				.orElse("")
				.toLowerCase(Locale.ROOT);
		if (contentType.startsWith("text/html")) {
			throw new FetchException(FetchException.Kind.INVALID_CONTENT, "Received an HTML page instead of media");
		}
		long size;
		try {
			size = Files.size(destination);
		} catch (IOException e) {
			throw new FetchException(FetchException.Kind.TRANSPORT, "Body not written: " + describe(e), e);
		}
		if (size == 0) {
			throw new FetchException(FetchException.Kind.INVALID_CONTENT, "Empty response body");
		}
		return size;
	}

	/** Delay-seconds form of {@code Retry-After}; the HTTP-date form falls back to exponential backoff */
	static Optional<Long> retryAfter(HttpResponse<?> response) {
		return response.headers()
				.firstValue("Retry-After")
				.map(String::strip)
				.filter(value -> !value.isEmpty()
						&& value.length() <= 9
						&& value.chars().allMatch(Character::isDigit))
				.map(Long::valueOf);
	}

	private static String describe(IOException e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}
}
