package dev.commonsdl.resolve;

import dev.commonsdl.model.Namespace;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/** Title normalization following the media repository's title convention */
public class CategoryTitles {
	private static final Pattern UNDERSCORE_RUNS = Pattern.compile("_{2,}");

	private CategoryTitles() {
		// Utility class
	}

	/**
	 * Normalize a user supplied category name to the form used in the dumps: no {@code Category:}
	 * prefix, underscores instead of spaces, no leading, trailing or repeated underscores, first
	 * letter in upper case.
	 *
	 * @param raw The category name as typed by the user
	 * @return The normalized title, empty if nothing is left
	 */
	public static String normalize(String raw) {
		if (raw == null) {
			return "";
		}
		String title = raw.strip();
		String prefix = Namespace.CATEGORY_PREFIX;
		if (title.regionMatches(true, 0, prefix, 0, prefix.length())) {
			title = title.substring(prefix.length());
		}
		title = UNDERSCORE_RUNS.matcher(title.replace(' ', '_')).replaceAll("_");
		int start = 0;
		int end = title.length();
		while (start < end && title.charAt(start) == '_') {
			start++;
		}
		while (end > start && title.charAt(end - 1) == '_') {
			end--;
		}
		title = title.substring(start, end);
		if (title.isEmpty()) {
			return title;
		}
		int first = title.codePointAt(0);
		return new StringBuilder()
				.appendCodePoint(Character.toUpperCase(first))
				.append(title, Character.charCount(first), title.length())
				.toString();
	}

	/** Normalize every name, dropping empty ones and duplicates while keeping the input order */
	public static Set<String> normalizeAll(Collection<String> raw) {
		Set<String> titles = new LinkedHashSet<>();
		for (String name : raw) {
			String title = normalize(name);
			if (!title.isEmpty()) {
				titles.add(title);
			}
		}
		return titles;
	}

	/** The title with its {@code Category:} prefix */
	public static String qualified(String title) {
		return Namespace.CATEGORY_PREFIX + title;
	}

	/**
	 * Read a category file: UTF-8, one category per line, blank lines and lines starting with
	 * {@code #} ignored.
	 *
	 * @param categoryFile The file to read
	 * @return The category names in file order, not yet normalized
	 */
	public static List<String> readCategoryFile(Path categoryFile) throws IOException {
		List<String> categories = new ArrayList<>();
		for (String line : Files.readAllLines(categoryFile, StandardCharsets.UTF_8)) {
			String name = line.strip();
			if (!name.isEmpty() && !name.startsWith("#")) {
				categories.add(name);
			}
		}
		return categories;
	}
}
