package dev.commonsdl.relation;

import dev.commonsdl.model.CategoryEdge;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Category membership edges grouped by the link target they point to. Only the edges kept by the
 * extractor are stored, together with the set of page ids they reference.
 */
public class CategoryMembership {
	/** A member of a category: the page and what kind of entity it is */
	public record Member(long pageId, CategoryEdge.Kind kind) {}

	private final Map<Long, List<Member>> membersByTarget = new HashMap<>();
	private final Set<Long> pageIds = new HashSet<>();
	private long edgeCount;

	public static CategoryMembership empty() {
		return new CategoryMembership();
	}

	public void add(CategoryEdge edge) {
		membersByTarget
				.computeIfAbsent(edge.toLinkTargetId(), k -> new ArrayList<>())
				.add(new Member(edge.fromPageId(), edge.kind()));
		pageIds.add(edge.fromPageId());
		edgeCount++;
	}

	/** Members of a link target in dump order */
	public List<Member> members(long linkTargetId) {
		List<Member> members = membersByTarget.get(linkTargetId);
		return members == null ? List.of() : Collections.unmodifiableList(members);
	}

	/** Members of a link target of one kind, in dump order */
	public List<Member> members(long linkTargetId, CategoryEdge.Kind kind) {
		return members(linkTargetId).stream().filter(m -> m.kind() == kind).toList();
	}

	/** Ids of every page referenced by a stored edge */
	public Set<Long> pageIds() {
		return Collections.unmodifiableSet(pageIds);
	}

	public long edgeCount() {
		return edgeCount;
	}
}
