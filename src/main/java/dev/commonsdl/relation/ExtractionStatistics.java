package dev.commonsdl.relation;

/** Row counters of one extraction pass */
public record ExtractionStatistics(String table, long rowsRead, long rowsAccepted, long rowsMalformed) {

	@Override
	public String toString() {
		return "%s: %d rows read, %d kept, %d malformed".formatted(table, rowsRead, rowsAccepted, rowsMalformed);
	}
}
