package dev.commonsdl;

import static org.assertj.core.api.Assertions.*;

import dev.commonsdl.model.FileStatus;
import dev.commonsdl.progress.ProgressStore;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {

	@TempDir
	Path tempDir;

	private Path dumpsDir;
	private Path categoryFile;
	private Path indexFile;
	private Path outputDir;

	@BeforeEach
	void setUp() throws Exception {
		dumpsDir = tempDir.resolve("dumps");
		Files.createDirectories(dumpsDir);
		DumpFixtures.writeCatsAndDogs(dumpsDir);
		categoryFile = tempDir.resolve("categories.txt");
		Files.writeString(categoryFile, "# animals\nCategory:Cats\n\n  Dogs  \n");
		indexFile = tempDir.resolve("progress-index.json");
		outputDir = tempDir.resolve("downloads");
	}

	private int execute(String... args) {
		return new CommandLine(new Main()).execute(args);
	}

	@Test
	void testMissingSubcommandIsUsageError() {
		assertThat(execute()).isEqualTo(2);
	}

	@Test
	void testFetchRequiresCategoryFile() {
		assertThat(execute("fetch", "-i", indexFile.toString())).isEqualTo(2);
	}

	@Test
	void testFetchRecordsFiles() throws Exception {
		// When
		int exitCode = execute(
				"fetch", "-c", categoryFile.toString(), "-d", dumpsDir.toString(), "-i", indexFile.toString());

		// Then
		assertThat(exitCode).isZero();
		ProgressStore store = ProgressStore.load(indexFile);
		assertThat(store.statistics().knownFiles()).isEqualTo(3);
		assertThat(store.status("Kitten1.png")).contains(FileStatus.PENDING);
	}

	@Test
	void testFetchWithMissingDumpsFails() {
		// When
		int exitCode = execute(
				"fetch",
				"-c",
				categoryFile.toString(),
				"-d",
				tempDir.resolve("nowhere").toString(),
				"-i",
				indexFile.toString());

		// Then
		assertThat(exitCode).isEqualTo(1);
		assertThat(indexFile).doesNotExist();
	}

	@Test
	void testFetchWithCorruptIndexFails() throws Exception {
		// Given
		Files.writeString(indexFile, "[1, 2");

		// When
		int exitCode = execute(
				"fetch", "-c", categoryFile.toString(), "-d", dumpsDir.toString(), "-i", indexFile.toString());

		// Then
		assertThat(exitCode).isEqualTo(1);
		assertThat(indexFile).hasContent("[1, 2");
	}

	@Test
	void testDryRunDownloadsNothing() throws Exception {
		// When
		int exitCode = execute(
				"run",
				"-c",
				categoryFile.toString(),
				"-d",
				dumpsDir.toString(),
				"-i",
				indexFile.toString(),
				"-o",
				outputDir.toString(),
				"--no-recursive",
				"--dry-run");

		// Then
		assertThat(exitCode).isZero();
		assertThat(outputDir).doesNotExist();
		assertThat(ProgressStore.load(indexFile).pending()).hasSize(2);
	}

	@Test
	void testDownloadWithoutIndexSucceeds() {
		assertThat(execute("download", "-i", indexFile.toString(), "-o", outputDir.toString()))
				.isZero();
	}

	@Test
	void testDownloadRejectsNonPositiveTimeout() {
		assertThat(execute("download", "-i", indexFile.toString(), "-o", outputDir.toString(), "--timeout", "0"))
				.isEqualTo(1);
		assertThat(outputDir).doesNotExist();
	}

	@Test
	void testStatusReadsIndex() {
		// Given
		execute("fetch", "-c", categoryFile.toString(), "-d", dumpsDir.toString(), "-i", indexFile.toString());

		// When/Then
		assertThat(execute("status", "-i", indexFile.toString(), "-o", outputDir.toString(), "--failures"))
				.isZero();
	}

	@Test
	void testCleanOnlyDeletesWhenConfirmed() throws Exception {
		// Given
		Files.createDirectories(outputDir);
		Files.writeString(indexFile, "{\"processedCategories\": [], \"knownFiles\": {}}");
		Files.writeString(outputDir.resolve("invalid.txt"), "Cat1.jpg\tNOT_FOUND: HTTP status 404\n");
		Files.writeString(outputDir.resolve(".Cat1.jpg123.part"), "partial");
		Files.writeString(outputDir.resolve("Dog1.jpg"), "media");

		// When
		int dryRun = execute("clean", "-i", indexFile.toString(), "-o", outputDir.toString());
		boolean keptAfterDryRun = Files.exists(indexFile);
		int confirmed = execute("clean", "-i", indexFile.toString(), "-o", outputDir.toString(), "--keep-failure-log", "--yes");

		// Then
		assertThat(dryRun).isZero();
		assertThat(keptAfterDryRun).isTrue();
		assertThat(confirmed).isZero();
		assertThat(indexFile).doesNotExist();
		assertThat(outputDir.resolve(".Cat1.jpg123.part")).doesNotExist();
		assertThat(outputDir.resolve("invalid.txt")).exists();
		assertThat(outputDir.resolve("Dog1.jpg")).exists();
	}
}
