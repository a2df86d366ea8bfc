package dev.commonsdl.relation;

import static dev.commonsdl.DumpFixtures.*;
import static org.assertj.core.api.Assertions.*;

import dev.commonsdl.model.Namespace;
import dev.commonsdl.model.Page;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PageExtractorTest {

	@TempDir
	Path tempDir;

	@Test
	void testKeepsRequestedPagesOfRequestedNamespaces() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("page.sql.gz"),
				insert(
						"page",
						page(1, 6, "Cat1.jpg"),
						page(2, 6, "Dog1.jpg"),
						page(3, 14, "Kittens"),
						page(5, 0, "Cats_article")));

		// When
		PageTable pages = new PageExtractor(Set.of(1L, 3L, 5L), Set.of(Namespace.FILE)).extract(dump);

		// Then
		assertThat(pages.size()).isEqualTo(1);
		assertThat(pages.get(1)).contains(new Page(1, 6, "Cat1.jpg"));
		assertThat(pages.get(2)).isEmpty();
		assertThat(pages.get(3)).isEmpty();
	}

	@Test
	void testNullIdFilterKeepsEveryPageOfTheNamespace() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("page.sql.gz"), insert("page", page(1, 6, "Cat1.jpg"), page(3, 14, "Kittens")));

		// When
		PageTable pages = new PageExtractor(null, Set.of(Namespace.CATEGORY)).extract(dump);

		// Then
		assertThat(pages.get(3)).map(Page::title).contains("Kittens");
		assertThat(pages.size()).isEqualTo(1);
	}
}
