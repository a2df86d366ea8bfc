package dev.commonsdl.progress;

import static org.assertj.core.api.Assertions.*;

import dev.commonsdl.model.FileStatus;
import dev.commonsdl.model.ResolvedFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProgressStoreTest {

	@TempDir
	Path tempDir;

	@Test
	void testMissingFileYieldsEmptyIndex() throws Exception {
		// Given
		Path indexFile = tempDir.resolve("progress-index.json");

		// When
		ProgressStore store = ProgressStore.load(indexFile);

		// Then
		assertThat(store.statistics()).isEqualTo(new IndexStatistics(0, 0, 0, 0));
		assertThat(store.pending()).isEmpty();
		assertThat(indexFile).doesNotExist();
	}

	@Test
	void testFlushCreatesIndexAndParentDirectories() throws Exception {
		// Given
		Path indexFile = tempDir.resolve("work/state/progress-index.json");
		ProgressStore store = ProgressStore.load(indexFile);

		// When
		store.flush();

		// Then
		assertThat(indexFile).exists();
		assertThat(ProgressStore.load(indexFile).statistics().knownFiles()).isZero();
	}

	@Test
	void testCorruptFileIsFatalAndLeftUntouched() throws Exception {
		// Given
		Path indexFile = tempDir.resolve("progress-index.json");
		Files.writeString(indexFile, "{\"processedCategories\": [\"Category:Cats\"], \"knownFiles\": {");

		// When/Then
		assertThatThrownBy(() -> ProgressStore.load(indexFile))
				.isInstanceOf(IndexCorruptException.class)
				.hasMessageContaining("progress-index.json");
		assertThat(indexFile)
				.hasContent("{\"processedCategories\": [\"Category:Cats\"], \"knownFiles\": {");
	}

	@Test
	void testNullSectionsAreCorrupt() throws Exception {
		// Given
		Path indexFile = tempDir.resolve("progress-index.json");
		Files.writeString(indexFile, "{\"processedCategories\": null, \"knownFiles\": {}}");

		// When/Then
		assertThatThrownBy(() -> ProgressStore.load(indexFile)).isInstanceOf(IndexCorruptException.class);
	}

	@Test
	void testUnknownStatusIsCorrupt() throws Exception {
		// Given
		Path indexFile = tempDir.resolve("progress-index.json");
		Files.writeString(
				indexFile,
				"{\"processedCategories\": [], \"knownFiles\": {\"A.jpg\": {\"status\": \"LOST\", \"discoveredViaCategory\": \"Category:A\"}}}");

		// When/Then
		assertThatThrownBy(() -> ProgressStore.load(indexFile)).isInstanceOf(IndexCorruptException.class);
	}

	@Test
	void testUnknownFieldsAreIgnored() throws Exception {
		// Given
		Path indexFile = tempDir.resolve("progress-index.json");
		Files.writeString(
				indexFile,
				"{\"version\": 2, \"processedCategories\": [\"Category:Cats\"], \"knownFiles\": {"
						+ "\"Cat1.jpg\": {\"status\": \"DOWNLOADED\", \"discoveredViaCategory\": \"Category:Cats\", \"size\": 12}}}");

		// When
		ProgressStore store = ProgressStore.load(indexFile);

		// Then
		assertThat(store.isProcessed("Category:Cats")).isTrue();
		assertThat(store.status("Cat1.jpg")).contains(FileStatus.DOWNLOADED);
	}

	@Test
	void testMergeIsIdempotentAndKeepsExistingEntries() throws Exception {
		// Given
		ProgressStore store = ProgressStore.load(tempDir.resolve("progress-index.json"));
		List<ResolvedFile> files =
				List.of(new ResolvedFile("Cat1.jpg", "Category:Cats"), new ResolvedFile("Dog1.jpg", "Category:Dogs"));

		// When
		int first = store.merge(files, List.of("Category:Cats", "Category:Dogs"));
		store.markStatus("Cat1.jpg", FileStatus.DOWNLOADED);
		int second = store.merge(List.of(new ResolvedFile("Cat1.jpg", "Category:Kittens")), List.of("Category:Cats"));

		// Then
		assertThat(first).isEqualTo(2);
		assertThat(second).isZero();
		assertThat(store.status("Cat1.jpg")).contains(FileStatus.DOWNLOADED);
		assertThat(store.pending()).containsExactly(new ResolvedFile("Dog1.jpg", "Category:Dogs"));
		assertThat(store.statistics()).isEqualTo(new IndexStatistics(2, 1, 1, 0));
	}

	@Test
	void testFlushedIndexRoundTripsAndIsStable() throws Exception {
		// Given
		Path indexFile = tempDir.resolve("progress-index.json");
		ProgressStore store = ProgressStore.load(indexFile);
		store.merge(
				List.of(new ResolvedFile("Zebra.jpg", "Category:Z"), new ResolvedFile("Ant.jpg", "Category:A")),
				List.of("Category:Z", "Category:A"));
		store.markStatus("Ant.jpg", FileStatus.INVALID);

		// When
		store.flush();
		String firstWrite = Files.readString(indexFile);
		ProgressStore reloaded = ProgressStore.load(indexFile);
		reloaded.merge(List.of(new ResolvedFile("Ant.jpg", "Category:A")), List.of("Category:A"));
		reloaded.flush();

		// Then
		assertThat(reloaded.status("Ant.jpg")).contains(FileStatus.INVALID);
		assertThat(reloaded.status("Zebra.jpg")).contains(FileStatus.PENDING);
		assertThat(Files.readString(indexFile)).isEqualTo(firstWrite);
		assertThat(firstWrite.indexOf("Ant.jpg")).isLessThan(firstWrite.indexOf("Zebra.jpg"));
		try (Stream<Path> files = Files.list(tempDir)) {
			assertThat(files).containsExactly(indexFile);
		}
	}

	@Test
	void testMarkStatusOfUnknownFileFails() throws Exception {
		// Given
		ProgressStore store = ProgressStore.load(tempDir.resolve("progress-index.json"));

		// When/Then
		assertThatThrownBy(() -> store.markStatus("Nope.jpg", FileStatus.DOWNLOADED))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
