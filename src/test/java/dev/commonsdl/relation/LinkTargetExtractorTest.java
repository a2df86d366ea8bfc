package dev.commonsdl.relation;

import static dev.commonsdl.DumpFixtures.*;
import static org.assertj.core.api.Assertions.*;

import dev.commonsdl.model.LinkTarget;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LinkTargetExtractorTest {

	@TempDir
	Path tempDir;

	@Test
	void testKeepsCategoryLinkTargetsOnly() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("linktarget.sql.gz"),
				insert(
						"linktarget",
						linkTarget(1, 14, "Cats"),
						linkTarget(2, 0, "Cats"),
						linkTarget(3, 6, "Cat1.jpg"),
						linkTarget(4, 14, "Dogs")));
		LinkTargetExtractor extractor = new LinkTargetExtractor();

		// When
		LinkTargetTable table = extractor.extract(dump);

		// Then
		assertThat(table.size()).isEqualTo(2);
		assertThat(table.idsFor("Cats")).containsExactly(1L);
		assertThat(table.get(4)).contains(new LinkTarget(4, 14, "Dogs"));
		assertThat(table.get(2)).isEmpty();
		assertThat(extractor.statistics().rowsRead()).isEqualTo(4);
		assertThat(extractor.statistics().rowsAccepted()).isEqualTo(2);
		assertThat(extractor.statistics().rowsMalformed()).isZero();
	}

	@Test
	void testTitleFilter() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("linktarget.sql.gz"),
				insert("linktarget", linkTarget(1, 14, "Cats"), linkTarget(4, 14, "Dogs")));

		// When
		LinkTargetTable table = new LinkTargetExtractor(Set.of("Dogs")).extract(dump);

		// Then
		assertThat(table.ids()).containsExactly(4L);
	}

	@Test
	void testRowsWithMissingColumnsAreCountedAsMalformed() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("linktarget.sql.gz"),
				insert("linktarget", "(1,14)", linkTarget(2, 14, "Dogs"), "(3,'x','Birds')"));
		LinkTargetExtractor extractor = new LinkTargetExtractor();

		// When
		LinkTargetTable table = extractor.extract(dump);

		// Then
		assertThat(table.ids()).containsExactly(2L);
		assertThat(extractor.statistics().rowsMalformed()).isEqualTo(2);
	}
}
