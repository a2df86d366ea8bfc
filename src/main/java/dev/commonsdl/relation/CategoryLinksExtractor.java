package dev.commonsdl.relation;

import dev.commonsdl.dump.DumpRow;
import dev.commonsdl.dump.RowParseException;
import dev.commonsdl.model.CategoryEdge;
import java.util.EnumSet;
import java.util.Set;

/**
 * Reads the {@code categorylinks} dump ({@code cl_from, cl_sortkey, cl_timestamp,
 * cl_sortkey_prefix, cl_type, cl_collation_id, cl_target_id}) into a {@link CategoryMembership}
 * index. Only edges of the requested kinds that point at a link target in the filter set are kept;
 * everything else is dropped while streaming.
 */
public class CategoryLinksExtractor extends RelationExtractor<CategoryMembership> {
	private static final int COLUMNS = 7;

	private final Set<Long> targetFilter;
	private final Set<CategoryEdge.Kind> kinds;
	private final CategoryMembership membership = new CategoryMembership();

	/**
	 * @param targetFilter Link-target ids of interest, or null to keep edges to any target
	 * @param kinds Edge kinds to keep
	 */
	public CategoryLinksExtractor(Set<Long> targetFilter, Set<CategoryEdge.Kind> kinds) {
		this.targetFilter = targetFilter;
		this.kinds = kinds.isEmpty() ? EnumSet.noneOf(CategoryEdge.Kind.class) : EnumSet.copyOf(kinds);
	}

	@Override
	public String table() {
		return "categorylinks";
	}

	@Override
	protected boolean process(DumpRow row) throws RowParseException {
		if (row.size() < COLUMNS) {
			throw new RowParseException("Expected " + COLUMNS + " columns, found " + row.size());
		}
		String type = row.getString(4);
		CategoryEdge.Kind kind = CategoryEdge.Kind.fromDumpValue(type);
		if (kind == null) {
			throw new RowParseException("Unknown membership type '" + type + "'");
		}
		if (!kinds.contains(kind)) {
			return false;
		}
		long targetId = row.getLong(6);
		if (targetFilter != null && !targetFilter.contains(targetId)) {
			return false;
		}
		membership.add(new CategoryEdge(row.getLong(0), targetId, kind));
		return true;
	}

	@Override
	protected CategoryMembership result() {
		return membership;
	}
}
