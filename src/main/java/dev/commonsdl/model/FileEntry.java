package dev.commonsdl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/** Progress record of a single known media file */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"status", "discoveredViaCategory"})
public class FileEntry {
	@JsonProperty("status")
	private FileStatus status;

	@JsonProperty("discoveredViaCategory")
	private String discoveredViaCategory;

	public FileEntry() {
		status = FileStatus.PENDING;
	}

	public FileEntry(FileStatus status, String discoveredViaCategory) {
		this.status = status;
		this.discoveredViaCategory = discoveredViaCategory;
	}

	public FileStatus status() {
		return status;
	}

	public FileEntry status(FileStatus status) {
		this.status = status;
		return this;
	}

	public String discoveredViaCategory() {
		return discoveredViaCategory;
	}

	public FileEntry discoveredViaCategory(String discoveredViaCategory) {
		this.discoveredViaCategory = discoveredViaCategory;
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof FileEntry)) return false;
		FileEntry that = (FileEntry) o;
		return status == that.status && Objects.equals(discoveredViaCategory, that.discoveredViaCategory);
	}

	@Override
	public int hashCode() {
		return Objects.hash(status, discoveredViaCategory);
	}

	@Override
	public String toString() {
		return "FileEntry{status=" + status + ", discoveredViaCategory='" + discoveredViaCategory + "'}";
	}
}
