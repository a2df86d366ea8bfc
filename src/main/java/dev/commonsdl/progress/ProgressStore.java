package dev.commonsdl.progress;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.commonsdl.model.FileEntry;
import dev.commonsdl.model.FileStatus;
import dev.commonsdl.model.ProgressIndex;
import dev.commonsdl.model.ResolvedFile;
import dev.commonsdl.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of the persisted {@link ProgressIndex}. All reads and writes of the index go through this
 * class and are synchronized, so download workers can report status changes concurrently.
 */
public class ProgressStore {
	private static final Logger logger = LoggerFactory.getLogger(ProgressStore.class);

	private static final ObjectMapper mapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
			.build();

	private final Path indexFile;
	private final ProgressIndex index;
	private boolean dirty;

	private ProgressStore(Path indexFile, ProgressIndex index, boolean dirty) {
		this.indexFile = indexFile;
		this.index = index;
		this.dirty = dirty;
	}

	/**
	 * Load the index from disk. A missing file yields an empty index that will be created by the
	 * first {@link #flush()}.
	 *
	 * @param indexFile The index file
	 * @return The store
	 * @throws IndexCorruptException if the file exists but does not hold a complete index
	 * @throws IOException if the file cannot be read
	 */
	public static ProgressStore load(Path indexFile) throws IOException {
		if (!Files.exists(indexFile)) {
			logger.info("No progress index at {}, starting with an empty one", indexFile);
			return new ProgressStore(indexFile, new ProgressIndex(), true);
		}
		ProgressIndex index;
		try {
			index = mapper.readValue(indexFile.toFile(), ProgressIndex.class);
		} catch (JsonProcessingException e) {
			throw new IndexCorruptException(indexFile, "not a valid progress index: " + e.getOriginalMessage(), e);
		}
		if (index == null || !index.isComplete()) {
			throw new IndexCorruptException(indexFile, "progress index is incomplete", null);
		}
		logger.info(
				"Loaded progress index with {} processed categories and {} known files",
				index.processedCategories().size(),
				index.knownFiles().size());
		return new ProgressStore(indexFile, index, false);
	}

	public Path indexFile() {
		return indexFile;
	}

	/**
	 * Add newly resolved files and processed categories. Existing entries keep their status and
	 * category.
	 *
	 * @param files The resolved files
	 * @param processedCategories Qualified titles of the categories that were fully scanned
	 * @return The number of files that were not known before
	 */
	public synchronized int merge(Collection<ResolvedFile> files, Collection<String> processedCategories) {
		int added = 0;
		for (ResolvedFile file : files) {
			if (!index.knownFiles().containsKey(file.title())) {
				index.knownFiles()
						.put(file.title(), new FileEntry(FileStatus.PENDING, file.discoveredViaCategory()));
				added++;
			}
		}
		boolean categoriesChanged = index.processedCategories().addAll(processedCategories);
		if (added > 0 || categoriesChanged) {
			dirty = true;
		}
		return added;
	}

	/**
	 * Record the outcome for a known file.
	 *
	 * @return true if the status changed
	 * @throws IllegalArgumentException if the file is not in the index
	 */
	public synchronized boolean markStatus(String title, FileStatus status) {
		FileEntry entry = index.knownFiles().get(title);
		if (entry == null) {
			throw new IllegalArgumentException("File not in progress index: " + title);
		}
		if (entry.status() == status) {
			return false;
		}
		entry.status(status);
		dirty = true;
		return true;
	}

	public synchronized Optional<FileStatus> status(String title) {
		return Optional.ofNullable(index.knownFiles().get(title)).map(FileEntry::status);
	}

	public synchronized boolean isProcessed(String qualifiedCategory) {
		return index.processedCategories().contains(qualifiedCategory);
	}

	/** Snapshot of the files that are not yet downloaded, in title order */
	public synchronized List<ResolvedFile> pending() {
		List<ResolvedFile> pending = new ArrayList<>();
		for (Map.Entry<String, FileEntry> entry : index.knownFiles().entrySet()) {
			if (entry.getValue().status() != FileStatus.DOWNLOADED) {
				pending.add(new ResolvedFile(entry.getKey(), entry.getValue().discoveredViaCategory()));
			}
		}
		return pending;
	}

	public synchronized IndexStatistics statistics() {
		int downloaded = 0;
		int pending = 0;
		int invalid = 0;
		for (FileEntry entry : index.knownFiles().values()) {
			switch (entry.status()) {
				case DOWNLOADED -> downloaded++;
				case PENDING -> pending++;
				case INVALID -> invalid++;
			}
		}
		return new IndexStatistics(index.processedCategories().size(), downloaded, pending, invalid);
	}

	/**
	 * Write the index if it changed since the last flush. The new content is written to a temporary
	 * file in the same directory and renamed over the index, so a crash leaves either the old or the
	 * new index on disk.
	 */
	public synchronized void flush() throws IOException {
		if (!dirty) {
			return;
		}
		Path tempFile = FileUtils.createSiblingTempFile(indexFile);
		try {
			try (var writer = Files.newBufferedWriter(tempFile)) {
				mapper.writeValue(writer, index);
				writer.write("\n");
			}
			FileUtils.moveInPlace(tempFile, indexFile);
		} finally {
			Files.deleteIfExists(tempFile);
		}
		dirty = false;
		logger.debug("Flushed progress index to {}", indexFile);
	}
}
