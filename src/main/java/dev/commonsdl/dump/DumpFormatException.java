package dev.commonsdl.dump;

import java.nio.file.Path;

/** A dump file that cannot be read at all, or stops being readable part way through */
public class DumpFormatException extends Exception {
	private final Path dumpFile;

	public DumpFormatException(Path dumpFile, String message, Throwable cause) {
		super(dumpFile.getFileName() + ": " + message, cause);
		this.dumpFile = dumpFile;
	}

	public Path dumpFile() {
		return dumpFile;
	}
}
