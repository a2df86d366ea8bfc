package dev.commonsdl.relation;

import dev.commonsdl.model.LinkTarget;
import dev.commonsdl.model.Namespace;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory relation of the category link targets, looked up by id and, in reverse, by title. Only
 * the category namespace is held, so the title alone identifies a category and the reverse lookup
 * shares the title strings of the link targets.
 */
public class LinkTargetTable {
	private final Map<Long, LinkTarget> byId = new HashMap<>();
	private final Map<String, List<Long>> idsByTitle = new HashMap<>();

	/**
	 * Add a link target, replacing an earlier one with the same id.
	 *
	 * @return false if the link target is not in the category namespace and was ignored
	 */
	public boolean add(LinkTarget linkTarget) {
		if (linkTarget.namespace() != Namespace.CATEGORY) {
			return false;
		}
		LinkTarget previous = byId.put(linkTarget.id(), linkTarget);
		if (previous != null) {
			List<Long> ids = idsByTitle.get(previous.title());
			if (ids != null) {
				ids.remove(Long.valueOf(previous.id()));
			}
		}
		idsByTitle.computeIfAbsent(linkTarget.title(), k -> new ArrayList<>(1)).add(linkTarget.id());
		return true;
	}

	public Optional<LinkTarget> get(long id) {
		return Optional.ofNullable(byId.get(id));
	}

	/** All link-target ids of a category title (without prefix), in insertion order */
	public List<Long> idsFor(String title) {
		List<Long> ids = idsByTitle.get(title);
		return ids == null ? List.of() : Collections.unmodifiableList(ids);
	}

	public Set<Long> ids() {
		return Collections.unmodifiableSet(byId.keySet());
	}

	public int size() {
		return byId.size();
	}
}
