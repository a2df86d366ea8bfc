package dev.commonsdl.resolve;

import dev.commonsdl.model.ResolvedFile;
import java.util.List;

/**
 * Outcome of category resolution.
 *
 * @param files Resolved files, each title once, in discovery order
 * @param visitedCategories Categories whose files were collected, qualified
 * @param notFoundCategories Requested categories without a link target, qualified
 * @param alreadyProcessedCategories Categories left out because an earlier run processed them
 */
public record Resolution(
		List<ResolvedFile> files,
		List<String> visitedCategories,
		List<String> notFoundCategories,
		List<String> alreadyProcessedCategories) {}
