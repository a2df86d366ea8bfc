package dev.commonsdl.model;

/**
 * A category membership: page {@code fromPageId} is a member of whatever link target {@code
 * toLinkTargetId} resolves to, as an entity of the given kind.
 */
public record CategoryEdge(long fromPageId, long toLinkTargetId, Kind kind) {

	public enum Kind {
		FILE("file"),
		SUBCATEGORY("subcat"),
		PAGE("page");

		private final String dumpValue;

		Kind(String dumpValue) {
			this.dumpValue = dumpValue;
		}

		public String dumpValue() {
			return dumpValue;
		}

		/**
		 * Map the {@code cl_type} column value to a kind.
		 *
		 * @param value The raw column value
		 * @return The kind, or null if the value is not one of {@code page}, {@code subcat}, {@code file}
		 */
		public static Kind fromDumpValue(String value) {
			for (Kind kind : values()) {
				if (kind.dumpValue.equals(value)) {
					return kind;
				}
			}
			return null;
		}
	}
}
