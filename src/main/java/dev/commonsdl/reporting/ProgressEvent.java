package dev.commonsdl.reporting;

import java.time.Instant;

/** A progress event of one pipeline phase (a dump pass, resolution or the download run) */
public record ProgressEvent(String phase, EventType eventType, String message, Instant timestamp, Throwable error) {
	public enum EventType {
		STARTED,
		PROGRESS,
		COMPLETED,
		FAILED
	}

	public static ProgressEvent started(String phase) {
		return new ProgressEvent(phase, EventType.STARTED, "Phase started", Instant.now(), null);
	}

	public static ProgressEvent progress(String phase, String message) {
		return new ProgressEvent(phase, EventType.PROGRESS, message, Instant.now(), null);
	}

	public static ProgressEvent completed(String phase, String message) {
		return new ProgressEvent(phase, EventType.COMPLETED, message, Instant.now(), null);
	}

	public static ProgressEvent failed(String phase, String message, Throwable error) {
		return new ProgressEvent(phase, EventType.FAILED, message, Instant.now(), error);
	}

	@Override
	public String toString() {
		return "[%s] %s: %s - %s".formatted(timestamp, phase, eventType, message);
	}
}
