package dev.commonsdl.progress;

/** Counts taken from a progress index */
public record IndexStatistics(int processedCategories, int downloaded, int pending, int invalid) {

	public int knownFiles() {
		return downloaded + pending + invalid;
	}

	@Override
	public String toString() {
		return "%d categories processed, %d files known (%d downloaded, %d pending, %d invalid)"
				.formatted(processedCategories, knownFiles(), downloaded, pending, invalid);
	}
}
