package dev.commonsdl.progress;

import java.io.IOException;
import java.nio.file.Path;

/** The progress index exists but cannot be read back. The file is left untouched. */
public class IndexCorruptException extends IOException {
	private final Path indexFile;

	public IndexCorruptException(Path indexFile, String message, Throwable cause) {
		super(indexFile.getFileName() + ": " + message, cause);
		this.indexFile = indexFile;
	}

	public Path indexFile() {
		return indexFile;
	}
}
