package dev.commonsdl.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Utility class for file operations */
public class FileUtils {

	private FileUtils() {
		// Utility class
	}

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (directory != null && !Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/**
	 * Create a temporary file next to the given target, so a later {@link #moveInPlace} stays on the
	 * same file system.
	 */
	public static Path createSiblingTempFile(Path target) throws IOException {
		Path dir = target.toAbsolutePath().getParent();
		ensureDirectory(dir);
		return Files.createTempFile(dir, "." + target.getFileName().toString(), ".part");
	}

	/**
	 * Move a fully written file over its target. Uses an atomic rename where the file system
	 * supports it.
	 */
	public static void moveInPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
