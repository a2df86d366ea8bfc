package dev.commonsdl.fetch;

import java.util.List;
import java.util.Set;

/**
 * Configuration record for a fetch.
 *
 * @param categories Requested category names as given by the user
 * @param dumps The dumps to read
 * @param recursive Whether subcategories are followed
 * @param extensions File extensions to keep, empty for all
 */
public record FetchConfig(List<String> categories, DumpFiles dumps, boolean recursive, Set<String> extensions) {

	public FetchConfig {
		categories = List.copyOf(categories);
		extensions = Set.copyOf(extensions);
	}
}
