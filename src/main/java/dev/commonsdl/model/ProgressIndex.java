package dev.commonsdl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The persisted record of fully scanned categories and known media files. Sorted collections keep
 * the serialized form stable between runs. Instances are not thread-safe; all concurrent access goes
 * through {@link dev.commonsdl.progress.ProgressStore}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"processedCategories", "knownFiles"})
public class ProgressIndex {
	@JsonProperty("processedCategories")
	private TreeSet<String> processedCategories;

	@JsonProperty("knownFiles")
	private TreeMap<String, FileEntry> knownFiles;

	public ProgressIndex() {
		processedCategories = new TreeSet<>();
		knownFiles = new TreeMap<>();
	}

	public Set<String> processedCategories() {
		return processedCategories;
	}

	public Map<String, FileEntry> knownFiles() {
		return knownFiles;
	}

	/** Jackson leaves a field null when the document has an explicit {@code null} for it */
	@JsonIgnore
	public boolean isComplete() {
		if (processedCategories == null || knownFiles == null) {
			return false;
		}
		for (FileEntry entry : knownFiles.values()) {
			if (entry == null || entry.status() == null) {
				return false;
			}
		}
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ProgressIndex)) return false;
		ProgressIndex that = (ProgressIndex) o;
		return Objects.equals(processedCategories, that.processedCategories)
				&& Objects.equals(knownFiles, that.knownFiles);
	}

	@Override
	public int hashCode() {
		return Objects.hash(processedCategories, knownFiles);
	}
}
