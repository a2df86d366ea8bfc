package dev.commonsdl.dump;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * One parenthesized tuple of an insert statement. Values are {@code null}, {@link Long}, {@link
 * BigDecimal} or {@link String}.
 */
public final class DumpRow {
	private final long ordinal;
	private final List<Object> values;

	public DumpRow(long ordinal, List<Object> values) {
		this.ordinal = ordinal;
		this.values = Collections.unmodifiableList(values);
	}

	/** 1-based position of the row in its dump, counting malformed rows too */
	public long ordinal() {
		return ordinal;
	}

	public int size() {
		return values.size();
	}

	public List<Object> values() {
		return values;
	}

	public Object value(int column) throws RowParseException {
		if (column < 0 || column >= values.size()) {
			throw new RowParseException("Row " + ordinal + " has " + values.size() + " columns, column " + column
					+ " requested");
		}
		return values.get(column);
	}

	public boolean isNull(int column) throws RowParseException {
		return value(column) == null;
	}

	public String getString(int column) throws RowParseException {
		Object value = value(column);
		if (value == null) {
			return null;
		}
		if (value instanceof BigDecimal) {
			return ((BigDecimal) value).toPlainString();
		}
		return value.toString();
	}

	/** Numeric value of a column; quoted numbers are accepted as well */
	public long getLong(int column) throws RowParseException {
		Object value = value(column);
		if (value instanceof Long) {
			return (Long) value;
		}
		if (value instanceof String) {
			try {
				return Long.parseLong(((String) value).trim());
			} catch (NumberFormatException e) {
				throw new RowParseException("Row " + ordinal + " column " + column + " is not a number: " + value, e);
			}
		}
		if (value instanceof BigDecimal) {
			try {
				return ((BigDecimal) value).longValueExact();
			} catch (ArithmeticException e) {
				throw new RowParseException("Row " + ordinal + " column " + column + " is not an integer: " + value, e);
			}
		}
		throw new RowParseException("Row " + ordinal + " column " + column + " is NULL");
	}

	public int getInt(int column) throws RowParseException {
		long value = getLong(column);
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			throw new RowParseException("Row " + ordinal + " column " + column + " is out of int range: " + value);
		}
		return (int) value;
	}

	@Override
	public String toString() {
		return "DumpRow#" + ordinal + values;
	}
}
