package dev.commonsdl.fetch;

import dev.commonsdl.dump.DumpFormatException;
import dev.commonsdl.model.CategoryEdge;
import dev.commonsdl.model.Namespace;
import dev.commonsdl.progress.ProgressStore;
import dev.commonsdl.relation.CategoryLinksExtractor;
import dev.commonsdl.relation.CategoryMembership;
import dev.commonsdl.relation.ExtractionStatistics;
import dev.commonsdl.relation.LinkTargetExtractor;
import dev.commonsdl.relation.LinkTargetTable;
import dev.commonsdl.relation.PageExtractor;
import dev.commonsdl.relation.PageTable;
import dev.commonsdl.relation.RelationExtractor;
import dev.commonsdl.reporting.ProgressEvent;
import dev.commonsdl.reporting.ProgressReporter;
import dev.commonsdl.resolve.CategoryClosure;
import dev.commonsdl.resolve.CategoryResolver;
import dev.commonsdl.resolve.CategoryTitles;
import dev.commonsdl.resolve.Resolution;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the requested categories into entries of the progress index. The dumps are read in several
 * filtered passes so only the rows that matter for the requested categories are kept in memory:
 *
 * <ol>
 *   <li>linktarget: category link targets
 *   <li>categorylinks: subcategory edges into known categories (recursive only)
 *   <li>page: pages of the subcategories (recursive only)
 *   <li>closure of the requested categories
 *   <li>categorylinks: file edges into the closure
 *   <li>page: pages of the member files
 * </ol>
 */
public class FetchPipeline {
	private static final Logger logger = LoggerFactory.getLogger(FetchPipeline.class);

	private final FetchConfig config;
	private final ProgressStore store;
	private final ProgressReporter reporter;
	private final List<ExtractionStatistics> statistics = new ArrayList<>();

	public FetchPipeline(FetchConfig config, ProgressStore store, ProgressReporter reporter) {
		this.config = config;
		this.store = store;
		this.reporter = reporter;
	}

	/**
	 * Resolve the requested categories, merge the result into the progress index and flush it.
	 * Failures are returned, not thrown; the index is left as it was.
	 */
	public FetchResult run() {
		try {
			Resolution resolution = resolve();
			int added = store.merge(resolution.files(), resolution.visitedCategories());
			store.flush();
			logger.info(
					"Added {} new files from {} categories to {}",
					added,
					resolution.visitedCategories().size(),
					store.indexFile());
			return FetchResult.success(
					resolution.visitedCategories().size(),
					resolution.files().size(),
					added,
					resolution.notFoundCategories(),
					rowsMalformed());
		} catch (DumpFormatException | IOException e) {
			logger.error("Fetch failed: {}", e.getMessage());
			return FetchResult.failure(e);
		}
	}

	/**
	 * Run the dump passes and resolve the requested categories without touching the index.
	 *
	 * @throws DumpFormatException if a dump is unreadable
	 * @throws IOException if a dump is missing
	 */
	public Resolution resolve() throws DumpFormatException, IOException {
		DumpFiles dumps = config.dumps();
		dumps.validate();

		CategoryResolver resolver = new CategoryResolver(config.recursive(), store::isProcessed, config.extensions());
		Set<String> requested = CategoryTitles.normalizeAll(config.categories());
		List<String> processed = requested.stream()
				.map(CategoryTitles::qualified)
				.filter(store::isProcessed)
				.toList();
		if (processed.size() == requested.size()) {
			logger.info("All {} categories were processed by earlier runs, skipping the dumps", requested.size());
			return new Resolution(List.of(), List.of(), List.of(), processed);
		}
		logger.info(
				"Resolving {} categories ({})", requested.size(), config.recursive() ? "recursive" : "not recursive");

		LinkTargetTable linkTargets =
				pass("linktarget", new LinkTargetExtractor(config.recursive() ? null : requested), dumps.linkTarget());

		CategoryMembership subcategories = CategoryMembership.empty();
		PageTable categoryPages = PageTable.empty();
		if (config.recursive()) {
			subcategories = pass(
					"categorylinks (subcategories)",
					new CategoryLinksExtractor(linkTargets.ids(), Set.of(CategoryEdge.Kind.SUBCATEGORY)),
					dumps.categoryLinks());
			categoryPages = pass(
					"page (categories)",
					new PageExtractor(subcategories.pageIds(), Set.of(Namespace.CATEGORY)),
					dumps.page());
		}

		CategoryClosure closure = resolver.expand(requested, linkTargets, subcategories, categoryPages);
		if (closure.categories().isEmpty()) {
			logger.info("No categories left to scan");
			return resolver.collectFiles(closure, CategoryMembership.empty(), PageTable.empty());
		}

		CategoryMembership files = pass(
				"categorylinks (files)",
				new CategoryLinksExtractor(closure.linkTargetIds(), Set.of(CategoryEdge.Kind.FILE)),
				dumps.categoryLinks());
		PageTable filePages =
				pass("page (files)", new PageExtractor(files.pageIds(), Set.of(Namespace.FILE)), dumps.page());

		reporter.report(ProgressEvent.started("resolve"));
		Resolution resolution = resolver.collectFiles(closure, files, filePages);
		reporter.report(ProgressEvent.completed(
				"resolve",
				resolution.files().size() + " files in " + resolution.visitedCategories().size() + " categories"));
		return resolution;
	}

	/** Counters of every pass run so far */
	public List<ExtractionStatistics> statistics() {
		return List.copyOf(statistics);
	}

	private long rowsMalformed() {
		return statistics.stream().mapToLong(ExtractionStatistics::rowsMalformed).sum();
	}

	private <T> T pass(String phase, RelationExtractor<T> extractor, Path dump) throws DumpFormatException {
		reporter.report(ProgressEvent.started(phase));
		try {
			T result = extractor.extract(dump);
			statistics.add(extractor.statistics());
			reporter.report(ProgressEvent.completed(phase, extractor.statistics().toString()));
			return result;
		} catch (DumpFormatException e) {
			reporter.report(ProgressEvent.failed(phase, e.getMessage(), e));
			throw e;
		}
	}
}
