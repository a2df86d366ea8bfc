package dev.commonsdl.download;

import java.time.Duration;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request pacing shared by all download workers. Every request waits the current delay. A backoff
 * grows the delay by a constant factor (or sets it to the server's {@code Retry-After}), capped at a
 * maximum, and pauses every worker until it has passed. Successes shrink the delay back towards the
 * base.
 */
public class AdaptiveRateLimiter {
	private static final Logger logger = LoggerFactory.getLogger(AdaptiveRateLimiter.class);

	public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
	public static final Duration DEFAULT_MAX = Duration.ofSeconds(60);
	public static final double DEFAULT_FACTOR = 2.0;

	private final long baseMillis;
	private final long maxMillis;
	private final double factor;
	private final LongSupplier clock;

	// guarded by this
	private long delayMillis;
	private long pausedUntilMillis;

	public AdaptiveRateLimiter() {
		this(DEFAULT_BASE, DEFAULT_MAX, DEFAULT_FACTOR);
	}

	public AdaptiveRateLimiter(Duration base, Duration max, double factor) {
		this(base, max, factor, System::currentTimeMillis);
	}

	AdaptiveRateLimiter(Duration base, Duration max, double factor, LongSupplier clock) {
		if (factor < 1.0) {
			throw new IllegalArgumentException("Backoff factor must be at least 1: " + factor);
		}
		this.baseMillis = base.toMillis();
		this.maxMillis = Math.max(baseMillis, max.toMillis());
		this.factor = factor;
		this.clock = clock;
		this.delayMillis = baseMillis;
	}

	/** Block until a pause in effect has passed, then wait the current delay */
	public void await() throws InterruptedException {
		long pause;
		long delay;
		synchronized (this) {
			pause = pausedUntilMillis - clock.getAsLong();
			delay = delayMillis;
		}
		if (pause > 0) {
			Thread.sleep(pause);
		}
		if (delay > 0) {
			Thread.sleep(delay);
		}
	}

	/** Relax the delay after a successful request */
	public synchronized void success() {
		delayMillis = Math.max(baseMillis, (long) (delayMillis / factor));
	}

	/**
	 * Slow down after the server signalled overload. While a pause is already in effect further
	 * backoffs from other workers do not extend it.
	 *
	 * @param retryAfterSeconds The server's {@code Retry-After} in seconds, or null to back off
	 *     exponentially
	 * @return The remaining pause
	 */
	public synchronized Duration backoff(Long retryAfterSeconds) {
		long now = clock.getAsLong();
		if (pausedUntilMillis > now) {
			return Duration.ofMillis(pausedUntilMillis - now);
		}
		long delay = retryAfterSeconds != null
				? Math.min(maxMillis, Math.max(0, retryAfterSeconds) * 1000)
				: Math.min(maxMillis, Math.max(baseMillis, (long) (delayMillis * factor)));
		delayMillis = delay;
		pausedUntilMillis = now + delay;
		logger.debug("Backing off for {} ms", delay);
		return Duration.ofMillis(delay);
	}

	public synchronized Duration currentDelay() {
		return Duration.ofMillis(delayMillis);
	}
}
