package dev.commonsdl.dump;

import static dev.commonsdl.DumpFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DumpScannerTest {

	@TempDir
	Path tempDir;

	@Test
	void testReadsRowsOfRequestedTableOnly() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("test.sql.gz"),
				HEADER
						+ insert("other", "(9,9,'Nope')")
						+ insert("linktarget", "(1,14,'Cats')", "(2,14,'Dogs')")
						+ "UNLOCK TABLES;\n"
						+ insert("linktarget", "(3,6,'Cat1.jpg')"));

		// When
		List<DumpRow> rows = readAll(new DumpScanner(dump, "linktarget"));

		// Then
		assertThat(rows).extracting(DumpRow::values)
				.containsExactly(
						Arrays.<Object>asList(1L, 14L, "Cats"),
						Arrays.<Object>asList(2L, 14L, "Dogs"),
						Arrays.<Object>asList(3L, 6L, "Cat1.jpg"));
	}

	@Test
	void testMalformedRowIsSkippedAndCounted() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("test.sql.gz"),
				insert("linktarget", "(1,14,'Cats')", "(2,14,'Bro)", "(3,14,'Dogs')", "(4,14,'Birds')"));
		DumpScanner scanner = new DumpScanner(dump, "linktarget");

		// When
		List<Object> ids = new ArrayList<>();
		long malformed;
		try (DumpScanner.RowCursor cursor = scanner.open()) {
			DumpRow row;
			while ((row = cursor.next()) != null) {
				ids.add(row.getLong(0));
			}
			malformed = cursor.rowsMalformed();
			assertThat(cursor.rowsRead()).isEqualTo(3);
			assertThat(cursor.statementsRead()).isEqualTo(1);
		}

		// Then
		assertThat(ids).containsExactly(1L, 3L, 4L);
		assertThat(malformed).isEqualTo(1);
	}

	@Test
	void testValueTypes() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("test.sql.gz"),
				insert("t", "(NULL,-5,0.25,'it\\'s','a''b','line\\nbreak',0x436174,_binary 'raw',12345678901234567890)"));

		// When
		List<DumpRow> rows = readAll(new DumpScanner(dump, "t"));

		// Then
		assertThat(rows).hasSize(1);
		DumpRow row = rows.get(0);
		assertThat(row.isNull(0)).isTrue();
		assertThat(row.getLong(1)).isEqualTo(-5L);
		assertThat(row.value(2)).isEqualTo(new BigDecimal("0.25"));
		assertThat(row.getString(3)).isEqualTo("it's");
		assertThat(row.getString(4)).isEqualTo("a'b");
		assertThat(row.getString(5)).isEqualTo("line\nbreak");
		assertThat(row.getString(6)).isEqualTo("Cat");
		assertThat(row.getString(7)).isEqualTo("raw");
		assertThat(row.value(8)).isEqualTo(new BigDecimal("12345678901234567890"));
	}

	@Test
	void testUnicodeTitles() throws Exception {
		// Given
		Path dump = gzip(tempDir.resolve("test.sql.gz"), insert("linktarget", "(1,14,'Gärten_in_Köln')"));

		// When
		List<DumpRow> rows = readAll(new DumpScanner(dump, "linktarget"));

		// Then
		assertThat(rows.get(0).getString(2)).isEqualTo("Gärten_in_Köln");
	}

	@Test
	void testStatementSeparatorsInsideStringsOfSkippedStatements() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("test.sql.gz"),
				"/* header; with semicolon */\n"
						+ insert("page", "(1,0,'a;b')", "(2,0,'INSERT INTO `linktarget` VALUES (5,14,''X'');')")
						+ "# comment line; INSERT INTO `linktarget` VALUES (6,14,'Y');\n"
						+ insert("linktarget", "(7,14,'Z')"));

		// When
		List<DumpRow> rows = readAll(new DumpScanner(dump, "linktarget"));

		// Then
		assertThat(rows).extracting(row -> row.values().get(0)).containsExactly(7L);
	}

	@Test
	void testMultiLineStatementsAndColumnLists() throws Exception {
		// Given
		String sql = "INSERT IGNORE INTO linktarget (lt_id, lt_namespace, lt_title) VALUES\n"
				+ "  (1, 14, 'Cats'),\n"
				+ "  (2, 14, 'Dogs');\n";
		Path dump = gzip(tempDir.resolve("test.sql.gz"), sql);

		// When
		List<DumpRow> rows = readAll(new DumpScanner(dump, "linktarget"));

		// Then
		assertThat(rows).extracting(row -> row.values().get(2)).containsExactly("Cats", "Dogs");
	}

	@Test
	void testPlainAndBzip2Files() throws Exception {
		// Given
		String sql = insert("linktarget", "(1,14,'Cats')");
		Path plain = tempDir.resolve("test.sql");
		Files.writeString(plain, sql);
		Path bzip2 = bzip2(tempDir.resolve("test.sql.bz2"), sql);

		// When/Then
		assertThat(readAll(new DumpScanner(plain, "linktarget"))).hasSize(1);
		assertThat(readAll(new DumpScanner(bzip2, "linktarget"))).hasSize(1);
	}

	@Test
	void testJdkGzipIsAccepted() throws Exception {
		// Given
		Path dump = tempDir.resolve("test.sql.gz");
		try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(dump))) {
			out.write(insert("linktarget", "(1,14,'Cats')").getBytes(StandardCharsets.UTF_8));
		}

		// When/Then
		assertThat(readAll(new DumpScanner(dump, "linktarget"))).hasSize(1);
	}

	@Test
	void testCorruptHeaderIsFatal() throws Exception {
		// Given
		Path dump = tempDir.resolve("broken.sql.gz");
		Files.write(dump, new byte[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12});
		DumpScanner scanner = new DumpScanner(dump, "linktarget");

		// When/Then
		assertThatThrownBy(scanner::open)
				.isInstanceOf(DumpFormatException.class)
				.hasMessageContaining("broken.sql.gz");
	}

	@Test
	void testTruncatedStreamIsFatal() throws Exception {
		// Given
		StringBuilder sql = new StringBuilder();
		for (int i = 0; i < 5000; i++) {
			sql.append(insert("linktarget", "(" + i + ",14,'Category_number_" + i + "')"));
		}
		Path full = gzip(tempDir.resolve("full.sql.gz"), sql.toString());
		byte[] bytes = Files.readAllBytes(full);
		Path truncated = tempDir.resolve("truncated.sql.gz");
		Files.write(truncated, Arrays.copyOf(bytes, bytes.length / 2));

		// When/Then
		assertThatThrownBy(() -> readAll(new DumpScanner(truncated, "linktarget")))
				.isInstanceOf(DumpFormatException.class);
	}

	@Test
	void testOversizedTupleIsSkipped() throws Exception {
		// Given
		String longTitle = "x".repeat(200);
		Path dump = gzip(
				tempDir.resolve("test.sql.gz"),
				insert("linktarget", "(1,14,'Cats')", "(2,14,'" + longTitle + "')", "(3,14,'Dogs')"));

		// When
		List<DumpRow> rows;
		long malformed;
		try (DumpScanner.RowCursor cursor = new DumpScanner(dump, "linktarget", 64).open()) {
			rows = new ArrayList<>();
			DumpRow row;
			while ((row = cursor.next()) != null) {
				rows.add(row);
			}
			malformed = cursor.rowsMalformed();
		}

		// Then
		assertThat(rows).extracting(row -> row.values().get(0)).containsExactly(1L, 3L);
		assertThat(malformed).isEqualTo(1);
	}

	@Test
	void testBoundariesInsideStringsOfBrokenTuplesAreIgnored() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("test.sql.gz"),
				insert(
						"linktarget",
						"(1,14,'Cats')",
						"(2,14,'a);b' x)",
						"(3,14,'Dogs')",
						"(4,14,'p),(9,14,q' junk)",
						"(5,14,'Birds')"));

		// When
		List<Object> ids = new ArrayList<>();
		long malformed;
		try (DumpScanner.RowCursor cursor = new DumpScanner(dump, "linktarget").open()) {
			DumpRow row;
			while ((row = cursor.next()) != null) {
				ids.add(row.getLong(0));
			}
			malformed = cursor.rowsMalformed();
		}

		// Then
		assertThat(ids).containsExactly(1L, 3L, 5L);
		assertThat(malformed).isEqualTo(2);
	}

	@Test
	void testWhitespaceAfterTupleCountsAgainstTupleLength() throws Exception {
		// Given
		Path dump = gzip(
				tempDir.resolve("test.sql.gz"),
				insert("linktarget", "(1,14,'Cats')", "(2,14,'Dogs')" + " ".repeat(200), "(3,14,'Birds')"));

		// When
		List<DumpRow> rows;
		long malformed;
		try (DumpScanner.RowCursor cursor = new DumpScanner(dump, "linktarget", 64).open()) {
			rows = new ArrayList<>();
			DumpRow row;
			while ((row = cursor.next()) != null) {
				rows.add(row);
			}
			malformed = cursor.rowsMalformed();
		}

		// Then
		assertThat(rows).extracting(row -> row.values().get(0)).containsExactly(1L, 3L);
		assertThat(malformed).isEqualTo(1);
	}

	@Test
	void testEachOpenStartsNewPass() throws Exception {
		// Given
		Path dump = gzip(tempDir.resolve("test.sql.gz"), insert("linktarget", "(1,14,'Cats')", "(2,14,'Dogs')"));
		DumpScanner scanner = new DumpScanner(dump, "linktarget");

		// When/Then
		assertThat(readAll(scanner)).hasSize(2);
		assertThat(readAll(scanner)).hasSize(2);
	}

	private static List<DumpRow> readAll(DumpScanner scanner) throws DumpFormatException, IOException {
		List<DumpRow> rows = new ArrayList<>();
		try (DumpScanner.RowCursor cursor = scanner.open()) {
			DumpRow row;
			while ((row = cursor.next()) != null) {
				rows.add(row);
			}
		}
		return rows;
	}
}
