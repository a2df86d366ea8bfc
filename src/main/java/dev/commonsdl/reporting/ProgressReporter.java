package dev.commonsdl.reporting;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reporting thread that receives progress events from the pipeline phases and the download workers
 * and logs them in order. Keeps track of the phases still running and how long they took.
 */
public class ProgressReporter implements Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);
	private static final ProgressEvent POISON_PILL = ProgressEvent.progress("SHUTDOWN", "");

	private final BlockingQueue<ProgressEvent> eventQueue;
	private final Map<String, Instant> runningPhases;
	private final AtomicBoolean running;
	private Thread reporterThread;

	public ProgressReporter() {
		this.eventQueue = new LinkedBlockingQueue<>();
		this.runningPhases = new ConcurrentHashMap<>();
		this.running = new AtomicBoolean(false);
	}

	/** Start the reporter thread */
	public void start() {
		if (running.compareAndSet(false, true)) {
			reporterThread = new Thread(this, "ProgressReporter");
			reporterThread.setDaemon(false);
			reporterThread.start();
		}
	}

	/** Submit a progress event to be processed */
	public void report(ProgressEvent event) {
		try {
			eventQueue.put(event);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while submitting event", e);
		}
	}

	@Override
	public void run() {
		while (running.get() || !eventQueue.isEmpty()) {
			try {
				ProgressEvent event = eventQueue.take();
				if (event == POISON_PILL) {
					break;
				}
				processEvent(event);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Reporter thread interrupted");
				break;
			} catch (RuntimeException e) {
				logger.error("Error processing event", e);
			}
		}
	}

	void processEvent(ProgressEvent event) {
		switch (event.eventType()) {
			case STARTED -> {
				runningPhases.put(event.phase(), event.timestamp());
				logger.info("STARTED: {}", event.phase());
			}
			case PROGRESS -> logger.info("PROGRESS: {} - {}", event.phase(), event.message());
			case COMPLETED -> {
				Instant started = runningPhases.remove(event.phase());
				logger.info("COMPLETED: {} - {}{}", event.phase(), event.message(), elapsed(started, event));
			}
			case FAILED -> {
				Instant started = runningPhases.remove(event.phase());
				if (event.error() != null) {
					logger.error(
							"FAILED: {} - {}{}", event.phase(), event.message(), elapsed(started, event), event.error());
				} else {
					logger.error("FAILED: {} - {}{}", event.phase(), event.message(), elapsed(started, event));
				}
			}
		}
		if (!runningPhases.isEmpty()) {
			logger.debug("Running phases: {}", String.join(", ", runningPhases.keySet()));
		}
	}

	private static String elapsed(Instant started, ProgressEvent event) {
		if (started == null) {
			return "";
		}
		Duration duration = Duration.between(started, event.timestamp());
		return " (%d.%03ds)".formatted(duration.getSeconds(), duration.toMillisPart());
	}

	/** Get a snapshot of the phases that started but did not finish yet */
	public Set<String> getRunningPhases() {
		return Set.copyOf(runningPhases.keySet());
	}

	/** Shutdown the reporter and wait for all events to be processed */
	@Override
	public void close() {
		if (running.compareAndSet(true, false)) {
			try {
				eventQueue.put(POISON_PILL);
				if (reporterThread != null) {
					reporterThread.join(5000);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while shutting down reporter", e);
			}
		}
	}
}
