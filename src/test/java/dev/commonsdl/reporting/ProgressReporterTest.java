package dev.commonsdl.reporting;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ProgressReporterTest {

	@Test
	void testTracksRunningPhases() {
		// Given
		ProgressReporter reporter = new ProgressReporter();

		// When
		reporter.processEvent(ProgressEvent.started("linktarget"));
		reporter.processEvent(ProgressEvent.started("page (files)"));
		reporter.processEvent(ProgressEvent.completed("linktarget", "done"));
		reporter.processEvent(ProgressEvent.failed("unknown", "boom", new IOException("boom")));

		// Then
		assertThat(reporter.getRunningPhases()).containsExactly("page (files)");
	}

	@Test
	void testFailureEndsPhase() {
		// Given
		ProgressReporter reporter = new ProgressReporter();
		reporter.processEvent(ProgressEvent.started("download"));

		// When
		reporter.processEvent(ProgressEvent.failed("download", "disk full", null));

		// Then
		assertThat(reporter.getRunningPhases()).isEmpty();
	}

	@Test
	void testCloseDrainsQueuedEvents() {
		// Given
		ProgressReporter reporter = new ProgressReporter();
		reporter.start();

		// When
		reporter.report(ProgressEvent.started("resolve"));
		reporter.report(ProgressEvent.progress("resolve", "halfway"));
		reporter.close();

		// Then
		assertThat(reporter.getRunningPhases()).containsExactly("resolve");
	}

	@Test
	void testEventToString() {
		// Given
		ProgressEvent event = new ProgressEvent(
				"download", ProgressEvent.EventType.PROGRESS, "100 files processed", Instant.EPOCH, null);

		// When/Then
		assertThat(event.toString()).isEqualTo("[1970-01-01T00:00:00Z] download: PROGRESS - 100 files processed");
	}
}
