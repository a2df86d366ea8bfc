package dev.commonsdl.util;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utilities for reading compressed dump files. */
public class CompressionUtils {
	private static final Logger logger = LoggerFactory.getLogger(CompressionUtils.class);
	private static final int BUFFER_SIZE = 1 << 16;

	private CompressionUtils() {
		// Utility class
	}

	/**
	 * Open a file for incremental reading, decompressing it on the fly. The compression format is
	 * detected from the stream signature; files ending in {@code .sql} are read as they are.
	 *
	 * @param file The file to open
	 * @return A stream of decompressed bytes, to be closed by the caller
	 * @throws IOException if the file cannot be opened or its compression is not recognized
	 */
	public static InputStream openDecompressed(Path file) throws IOException {
		InputStream in = new BufferedInputStream(Files.newInputStream(file), BUFFER_SIZE);
		if (file.getFileName().toString().toLowerCase().endsWith(".sql")) {
			return in;
		}
		try {
			String format = CompressorStreamFactory.detect(in);
			logger.debug("Detected {} compression for {}", format, file.getFileName());
			return new CompressorStreamFactory(true).createCompressorInputStream(format, in);
		} catch (CompressorException e) {
			in.close();
			throw new IOException("Unrecognized compression format: " + e.getMessage(), e);
		}
	}
}
