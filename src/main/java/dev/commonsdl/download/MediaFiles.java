package dev.commonsdl.download;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/** Naming rules for media files: download URL and local file name */
public class MediaFiles {
	public static final String DEFAULT_BASE_URL = "https://commons.wikimedia.org";
	private static final String FILE_PATH = "/wiki/Special:FilePath/";

	private MediaFiles() {
		// Utility class
	}

	/** The redirecting download URL for a file title */
	public static String url(String baseUrl, String title) {
		String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		return base + FILE_PATH + URLEncoder.encode(title, StandardCharsets.UTF_8).replace("+", "%20");
	}

	/** The title with characters that are not allowed in file names replaced by {@code _} */
	public static String fileName(String title) {
		StringBuilder name = new StringBuilder(title.length());
		for (int i = 0; i < title.length(); i++) {
			char c = title.charAt(i);
			if (c < 0x20 || c == 0x7f || "/\\:*?\"<>|".indexOf(c) >= 0) {
				name.append('_');
			} else {
				name.append(c);
			}
		}
		String result = name.toString();
		if (result.equals(".") || result.equals("..")) {
			return result.replace('.', '_');
		}
		return result;
	}
}
