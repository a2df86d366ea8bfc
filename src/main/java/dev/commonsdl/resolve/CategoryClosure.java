package dev.commonsdl.resolve;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The categories reached from the requested ones, in breadth-first order.
 *
 * @param categories Categories to collect files from
 * @param notFound Requested categories without a link target, qualified
 * @param alreadyProcessed Categories skipped because an earlier run processed them, qualified
 */
public record CategoryClosure(List<Node> categories, List<String> notFound, List<String> alreadyProcessed) {

	/** A category and the link-target ids its members point at */
	public record Node(String title, List<Long> linkTargetIds) {
		public String qualifiedTitle() {
			return CategoryTitles.qualified(title);
		}
	}

	public Set<Long> linkTargetIds() {
		Set<Long> ids = new LinkedHashSet<>();
		for (Node node : categories) {
			ids.addAll(node.linkTargetIds());
		}
		return ids;
	}

	public List<String> qualifiedTitles() {
		return categories.stream().map(Node::qualifiedTitle).toList();
	}
}
