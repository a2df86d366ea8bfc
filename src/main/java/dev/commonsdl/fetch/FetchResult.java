package dev.commonsdl.fetch;

import java.util.List;

/** Result of a fetch execution */
public record FetchResult(
		boolean success,
		int categoriesProcessed,
		int filesResolved,
		int filesAdded,
		List<String> notFoundCategories,
		long rowsMalformed,
		Exception error) {

	public static FetchResult success(
			int categoriesProcessed,
			int filesResolved,
			int filesAdded,
			List<String> notFoundCategories,
			long rowsMalformed) {
		return new FetchResult(
				true, categoriesProcessed, filesResolved, filesAdded, notFoundCategories, rowsMalformed, null);
	}

	public static FetchResult failure(Exception error) {
		return new FetchResult(false, 0, 0, 0, List.of(), 0, error);
	}

	@Override
	public String toString() {
		return success
				? "SUCCESS (%d categories processed, %d files resolved, %d new files, %d categories not found, %d malformed rows)"
						.formatted(
								categoriesProcessed,
								filesResolved,
								filesAdded,
								notFoundCategories.size(),
								rowsMalformed)
				: "FAILED - %s".formatted(error != null ? error.getMessage() : "Unknown error");
	}
}
