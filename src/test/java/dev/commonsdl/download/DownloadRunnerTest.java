package dev.commonsdl.download;

import static org.assertj.core.api.Assertions.*;

import dev.commonsdl.model.FileStatus;
import dev.commonsdl.model.ResolvedFile;
import dev.commonsdl.progress.ProgressStore;
import dev.commonsdl.reporting.ProgressReporter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DownloadRunnerTest {

	@TempDir
	Path tempDir;

	private ProgressStore storeWithFiles() throws Exception {
		ProgressStore store = ProgressStore.load(tempDir.resolve("progress-index.json"));
		store.merge(
				List.of(
						new ResolvedFile("Cat1.jpg", "Category:Cats"),
						new ResolvedFile("Cat2.jpg", "Category:Cats"),
						new ResolvedFile("Dog1.jpg", "Category:Dogs")),
				List.of("Category:Cats", "Category:Dogs"));
		return store;
	}

	private DownloadConfig config(Path outputDir, int limit, boolean dryRun) {
		return new DownloadConfig(
				outputDir, 2, MediaFiles.DEFAULT_BASE_URL, 0, Duration.ofSeconds(5), limit, 25, dryRun);
	}

	@Test
	void testRunCreatesOutputDirectoryAndDownloads() throws Exception {
		// Given
		ProgressStore store = storeWithFiles();
		Path outputDir = tempDir.resolve("nested/downloads");
		DummyMediaFetcher fetcher = new DummyMediaFetcher();

		// When
		DownloadSummary summary;
		try (ProgressReporter reporter = new ProgressReporter()) {
			reporter.start();
			summary = new DownloadRunner(config(outputDir, -1, false), store, reporter).run(fetcher);
		}

		// Then
		assertThat(summary.downloaded()).isEqualTo(3);
		assertThat(outputDir.resolve("Cat2.jpg")).exists();
		assertThat(store.pending()).isEmpty();
	}

	@Test
	void testSecondRunFetchesNothing() throws Exception {
		// Given
		ProgressStore store = storeWithFiles();
		Path outputDir = tempDir.resolve("downloads");
		try (ProgressReporter reporter = new ProgressReporter()) {
			reporter.start();
			new DownloadRunner(config(outputDir, -1, false), store, reporter).run(new DummyMediaFetcher());

			// When
			DummyMediaFetcher fetcher = new DummyMediaFetcher();
			DownloadSummary summary = new DownloadRunner(config(outputDir, -1, false), store, reporter).run(fetcher);

			// Then
			assertThat(summary.total()).isZero();
			assertThat(fetcher.getRequestedUrls()).isEmpty();
		}
	}

	@Test
	void testDryRunTouchesNothing() throws Exception {
		// Given
		ProgressStore store = storeWithFiles();
		Path outputDir = tempDir.resolve("downloads");
		DummyMediaFetcher fetcher = new DummyMediaFetcher();

		// When
		DownloadSummary summary;
		try (ProgressReporter reporter = new ProgressReporter()) {
			reporter.start();
			summary = new DownloadRunner(config(outputDir, 2, true), store, reporter).run(fetcher);
		}

		// Then
		assertThat(summary).isEqualTo(new DownloadSummary(2, 0, 0, 1));
		assertThat(fetcher.getRequestedUrls()).isEmpty();
		assertThat(outputDir).doesNotExist();
		assertThat(store.status("Cat1.jpg")).contains(FileStatus.PENDING);
		assertThat(Files.exists(tempDir.resolve("progress-index.json"))).isFalse();
	}
}
