package dev.commonsdl.relation;

import dev.commonsdl.dump.DumpRow;
import dev.commonsdl.dump.RowParseException;
import dev.commonsdl.model.Page;
import java.util.Set;

/**
 * Reads the {@code page} dump ({@code page_id, page_namespace, page_title, ...}) and keeps the pages
 * of the given namespaces whose id is referenced by a membership edge.
 */
public class PageExtractor extends RelationExtractor<PageTable> {
	private final Set<Long> pageIds;
	private final Set<Integer> namespaces;
	private final PageTable pages = new PageTable();

	/**
	 * @param pageIds Page ids of interest, or null to keep any page
	 * @param namespaces Namespaces to keep
	 */
	public PageExtractor(Set<Long> pageIds, Set<Integer> namespaces) {
		this.pageIds = pageIds;
		this.namespaces = Set.copyOf(namespaces);
	}

	@Override
	public String table() {
		return "page";
	}

	@Override
	protected boolean process(DumpRow row) throws RowParseException {
		if (row.size() < 3) {
			throw new RowParseException("Expected at least 3 columns, found " + row.size());
		}
		long id = row.getLong(0);
		if (pageIds != null && !pageIds.contains(id)) {
			return false;
		}
		int namespace = row.getInt(1);
		if (!namespaces.contains(namespace)) {
			return false;
		}
		String title = row.getString(2);
		if (title == null) {
			throw new RowParseException("Page " + id + " without title");
		}
		pages.add(new Page(id, namespace, title));
		return true;
	}

	@Override
	protected PageTable result() {
		return pages;
	}
}
