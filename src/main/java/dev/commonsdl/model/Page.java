package dev.commonsdl.model;

/** A row of the page relation */
public record Page(long id, int namespace, String title) {

	public boolean isFile() {
		return namespace == Namespace.FILE;
	}

	public boolean isCategory() {
		return namespace == Namespace.CATEGORY;
	}
}
