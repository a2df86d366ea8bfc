package dev.commonsdl.model;

/**
 * A row of the link-target relation: a (namespace, title) pair referenced by id from category
 * membership rows. Titles are kept exactly as they appear in the dump, without namespace prefix.
 */
public record LinkTarget(long id, int namespace, String title) {

	public boolean isCategory() {
		return namespace == Namespace.CATEGORY;
	}

	/** The title with its namespace prefix, e.g. {@code Category:Cats} */
	public String qualifiedTitle() {
		return isCategory() ? Namespace.CATEGORY_PREFIX + title : title;
	}
}
