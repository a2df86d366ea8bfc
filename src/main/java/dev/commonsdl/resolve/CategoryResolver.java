package dev.commonsdl.resolve;

import dev.commonsdl.model.CategoryEdge;
import dev.commonsdl.model.Page;
import dev.commonsdl.model.ResolvedFile;
import dev.commonsdl.relation.CategoryMembership;
import dev.commonsdl.relation.LinkTargetTable;
import dev.commonsdl.relation.PageTable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins the link-target, membership and page relations into the set of media files reachable from
 * the requested categories. Subcategories are expanded breadth-first with an explicit visited set,
 * so cyclic category graphs terminate.
 */
public class CategoryResolver {
	private static final Logger logger = LoggerFactory.getLogger(CategoryResolver.class);

	private final boolean recursive;
	private final Predicate<String> alreadyProcessed;
	private final Set<String> extensions;

	public CategoryResolver(boolean recursive) {
		this(recursive, category -> false, Set.of());
	}

	/**
	 * @param recursive Whether to follow subcategory edges
	 * @param alreadyProcessed Tells whether a qualified category title was processed by an earlier run
	 * @param extensions File extensions to keep, without dot; empty keeps every file
	 */
	public CategoryResolver(boolean recursive, Predicate<String> alreadyProcessed, Set<String> extensions) {
		this.recursive = recursive;
		this.alreadyProcessed = alreadyProcessed;
		this.extensions = new HashSet<>();
		for (String extension : extensions) {
			String ext = extension.strip().toLowerCase(Locale.ROOT);
			this.extensions.add(ext.startsWith(".") ? ext.substring(1) : ext);
		}
	}

	/**
	 * Resolve the requested categories in one step, with membership and page tables that hold both
	 * the subcategory and the file data.
	 */
	public Resolution resolve(
			Collection<String> requested, LinkTargetTable linkTargets, CategoryMembership membership, PageTable pages) {
		return collectFiles(expand(requested, linkTargets, membership, pages), membership, pages);
	}

	/**
	 * Compute the categories to collect files from: the requested ones that are known and not yet
	 * processed, plus, when recursive, every subcategory reachable from them.
	 *
	 * @param requested Category names, normalized here
	 * @param linkTargets Category link targets
	 * @param subcategories Membership edges of kind {@link CategoryEdge.Kind#SUBCATEGORY}
	 * @param categoryPages Pages of the subcategories
	 * @return The closure in breadth-first order
	 */
	public CategoryClosure expand(
			Collection<String> requested,
			LinkTargetTable linkTargets,
			CategoryMembership subcategories,
			PageTable categoryPages) {
		Set<String> visited = new HashSet<>();
		Deque<CategoryClosure.Node> queue = new ArrayDeque<>();
		List<CategoryClosure.Node> categories = new ArrayList<>();
		List<String> notFound = new ArrayList<>();
		List<String> skipped = new ArrayList<>();

		for (String title : CategoryTitles.normalizeAll(requested)) {
			if (!visited.add(title)) {
				continue;
			}
			String qualified = CategoryTitles.qualified(title);
			if (alreadyProcessed.test(qualified)) {
				logger.debug("Skipping {} - already processed", qualified);
				skipped.add(qualified);
				continue;
			}
			List<Long> ids = linkTargets.idsFor(title);
			if (ids.isEmpty()) {
				logger.warn("Category not found: {}", qualified);
				notFound.add(qualified);
				continue;
			}
			queue.add(new CategoryClosure.Node(title, ids));
		}

		while (!queue.isEmpty()) {
			CategoryClosure.Node node = queue.poll();
			categories.add(node);
			if (!recursive) {
				continue;
			}
			for (long id : node.linkTargetIds()) {
				for (CategoryMembership.Member member : subcategories.members(id, CategoryEdge.Kind.SUBCATEGORY)) {
					Optional<Page> page = categoryPages.get(member.pageId());
					if (page.isEmpty() || !page.get().isCategory()) {
						continue;
					}
					String child = page.get().title();
					if (!visited.add(child)) {
						continue;
					}
					String qualified = CategoryTitles.qualified(child);
					if (alreadyProcessed.test(qualified)) {
						skipped.add(qualified);
						continue;
					}
					queue.add(new CategoryClosure.Node(child, linkTargets.idsFor(child)));
				}
			}
		}

		if (recursive) {
			logger.info(
					"Expanded {} requested categories to {} categories", requested.size(), categories.size());
		}
		return new CategoryClosure(List.copyOf(categories), List.copyOf(notFound), List.copyOf(skipped));
	}

	/**
	 * Collect the files of every category in the closure. A file reachable from several categories is
	 * attributed to the first one in traversal order.
	 *
	 * @param closure The categories to collect from
	 * @param files Membership edges of kind {@link CategoryEdge.Kind#FILE}
	 * @param filePages Pages of the member files
	 * @return The resolution
	 */
	public Resolution collectFiles(CategoryClosure closure, CategoryMembership files, PageTable filePages) {
		Map<String, ResolvedFile> resolved = new LinkedHashMap<>();
		long unresolvedPages = 0;
		for (CategoryClosure.Node node : closure.categories()) {
			for (long id : node.linkTargetIds()) {
				for (CategoryMembership.Member member : files.members(id, CategoryEdge.Kind.FILE)) {
					Optional<Page> page = filePages.get(member.pageId());
					if (page.isEmpty()) {
						unresolvedPages++;
						continue;
					}
					if (!page.get().isFile() || !acceptsExtension(page.get().title())) {
						continue;
					}
					resolved.putIfAbsent(
							page.get().title(), new ResolvedFile(page.get().title(), node.qualifiedTitle()));
				}
			}
		}
		if (unresolvedPages > 0) {
			logger.debug("{} file memberships point at pages missing from the page dump", unresolvedPages);
		}
		logger.info("Resolved {} files in {} categories", resolved.size(), closure.categories().size());
		return new Resolution(
				List.copyOf(resolved.values()),
				closure.qualifiedTitles(),
				closure.notFound(),
				closure.alreadyProcessed());
	}

	private boolean acceptsExtension(String title) {
		if (extensions.isEmpty()) {
			return true;
		}
		int dot = title.lastIndexOf('.');
		return dot >= 0 && extensions.contains(title.substring(dot + 1).toLowerCase(Locale.ROOT));
	}
}
