package dev.commonsdl.relation;

import dev.commonsdl.dump.DumpRow;
import dev.commonsdl.dump.RowParseException;
import dev.commonsdl.model.LinkTarget;
import dev.commonsdl.model.Namespace;
import java.util.Set;

/**
 * Reads the {@code linktarget} dump ({@code lt_id, lt_namespace, lt_title}) and keeps the
 * category-namespace link targets.
 */
public class LinkTargetExtractor extends RelationExtractor<LinkTargetTable> {
	private final Set<String> titleFilter;
	private final LinkTargetTable table = new LinkTargetTable();

	/** Keep every category link target */
	public LinkTargetExtractor() {
		this(null);
	}

	/**
	 * Keep only the category link targets with one of the given titles.
	 *
	 * @param titleFilter Normalized category titles without prefix, or null to keep all
	 */
	public LinkTargetExtractor(Set<String> titleFilter) {
		this.titleFilter = titleFilter;
	}

	@Override
	public String table() {
		return "linktarget";
	}

	@Override
	protected boolean process(DumpRow row) throws RowParseException {
		if (row.size() < 3) {
			throw new RowParseException("Expected 3 columns, found " + row.size());
		}
		int namespace = row.getInt(1);
		if (namespace != Namespace.CATEGORY) {
			return false;
		}
		String title = row.getString(2);
		if (title == null) {
			throw new RowParseException("Link target without title");
		}
		if (titleFilter != null && !titleFilter.contains(title)) {
			return false;
		}
		table.add(new LinkTarget(row.getLong(0), namespace, title));
		return true;
	}

	@Override
	protected LinkTargetTable result() {
		return table;
	}
}
