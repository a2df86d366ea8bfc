package dev.commonsdl.dump;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Splits the text of a SQL bulk export into the tuples of the {@code INSERT INTO `table` VALUES
 * (...),(...);} statements that target one table. Every other statement (schema definitions, locks,
 * comments, inserts into other tables) is skipped.
 *
 * <p>A tuple that cannot be tokenized is handed to the malformed-row listener and the reader
 * resynchronizes on the next {@code ),(} or {@code );} after the start of the broken tuple. Quoted
 * text is skipped while looking for that boundary; when the quotes of the broken tuple do not pair
 * up within {@code maxTupleLength} characters the boundary is searched again in the raw text. This
 * needs a reader that supports {@link Reader#mark(int)} with a read-ahead of at least {@code
 * maxTupleLength} characters.
 */
final class InsertStatementReader {
	private static final int NONE = -2;

	private enum State {
		BETWEEN_STATEMENTS,
		EXPECT_TUPLE,
		IN_TUPLE
	}

	private final Reader in;
	private final String table;
	private final int maxTupleLength;
	private final Consumer<RowParseException> malformedListener;
	private final StringBuilder token = new StringBuilder();

	private State state = State.BETWEEN_STATEMENTS;
	private int pushback = NONE;
	private int consumed;
	private long statements;

	InsertStatementReader(
			Reader in, String table, int maxTupleLength, Consumer<RowParseException> malformedListener) {
		if (!in.markSupported()) {
			throw new IllegalArgumentException("Reader must support mark/reset");
		}
		this.in = in;
		this.table = table;
		this.maxTupleLength = maxTupleLength;
		this.malformedListener = malformedListener;
	}

	/** Number of matching insert statements seen so far */
	long statements() {
		return statements;
	}

	/**
	 * Read the next well-formed tuple.
	 *
	 * @return The typed values of the tuple, or null at the end of the input
	 * @throws IOException if the underlying stream fails
	 */
	List<Object> nextTuple() throws IOException {
		while (true) {
			switch (state) {
				case BETWEEN_STATEMENTS -> {
					if (!seekInsert()) {
						return null;
					}
					state = State.EXPECT_TUPLE;
				}
				case EXPECT_TUPLE -> {
					int c = skipWhitespace();
					if (c == -1) {
						state = State.BETWEEN_STATEMENTS;
						return null;
					}
					if (c == ';') {
						state = State.BETWEEN_STATEMENTS;
					} else if (c == '(') {
						state = State.IN_TUPLE;
					} else {
						malformedListener.accept(new RowParseException("Expected '(' but found " + describe(c)));
						resync();
					}
				}
				case IN_TUPLE -> {
					mark();
					try {
						List<Object> values = parseTupleBody();
						int c = skipWhitespaceInTuple();
						if (c == ',') {
							state = State.EXPECT_TUPLE;
						} else if (c == ';' || c == -1) {
							state = State.BETWEEN_STATEMENTS;
						} else {
							throw new RowParseException("Unexpected " + describe(c) + " after tuple");
						}
						return values;
					} catch (RowParseException e) {
						malformedListener.accept(e);
						reset();
						resync();
					}
				}
			}
		}
	}

	// Statement framing

	private boolean seekInsert() throws IOException {
		while (true) {
			int c = skipWhitespace();
			if (c == -1) {
				return false;
			}
			if (c == ';') {
				continue;
			}
			if (c == '#') {
				skipLine();
				continue;
			}
			if (c == '-') {
				int n = read();
				if (n == '-') {
					skipLine();
				} else {
					pushback(n);
					skipStatement(NONE);
				}
				continue;
			}
			if (c == '/') {
				int n = read();
				if (n == '*') {
					skipBlockComment();
				} else {
					pushback(n);
					skipStatement(NONE);
				}
				continue;
			}
			if (isWordStart(c)) {
				String keyword = readWord(c);
				if (keyword.equalsIgnoreCase("INSERT") && matchesInsertHeader()) {
					statements++;
					return true;
				}
				skipStatement(NONE);
				continue;
			}
			skipStatement(c);
		}
	}

	/** Consumes {@code INTO `table` [(columns)] VALUES}, stopping early on anything else */
	private boolean matchesInsertHeader() throws IOException {
		String word = nextWord();
		if (word != null && word.equalsIgnoreCase("IGNORE")) {
			word = nextWord();
		}
		if (word == null || !word.equalsIgnoreCase("INTO")) {
			return false;
		}

		String name;
		int c = skipWhitespace();
		if (c == '`') {
			token.setLength(0);
			while ((c = read()) != -1 && c != '`') {
				token.append((char) c);
			}
			name = token.toString();
		} else if (isWordStart(c)) {
			name = readWord(c);
		} else {
			pushback(c);
			return false;
		}

		c = skipWhitespace();
		if (c == '(') {
			while ((c = read()) != -1 && c != ')') {
				// column list
			}
			c = skipWhitespace();
		}
		pushback(c);
		word = nextWord();
		if (word == null || !(word.equalsIgnoreCase("VALUES") || word.equalsIgnoreCase("VALUE"))) {
			return false;
		}
		return name.equals(table);
	}

	private void skipStatement(int first) throws IOException {
		int quote = 0;
		int c = first == NONE ? read() : first;
		while (c != -1) {
			if (quote != 0) {
				if (c == '\\' && quote != '`') {
					read();
				} else if (c == quote) {
					quote = 0;
				}
			} else if (c == '\'' || c == '"' || c == '`') {
				quote = c;
			} else if (c == ';') {
				return;
			}
			c = read();
		}
	}

	private void skipLine() throws IOException {
		int c;
		while ((c = read()) != -1 && c != '\n') {
			// comment text
		}
	}

	private void skipBlockComment() throws IOException {
		int prev = NONE;
		int c;
		while ((c = read()) != -1) {
			if (prev == '*' && c == '/') {
				return;
			}
			prev = c;
		}
	}

	/** Skip to the next tuple boundary after a broken tuple */
	private void resync() throws IOException {
		mark();
		if (!resyncOutsideQuotes()) {
			reset();
			resyncRaw();
		}
	}

	/**
	 * Look for the boundary outside quoted text, within {@code maxTupleLength} characters.
	 *
	 * @return false if no boundary was found in reach or a quote ran into a line break
	 */
	private boolean resyncOutsideQuotes() throws IOException {
		int quote = 0;
		int prev2 = NONE;
		int prev = NONE;
		int read = 0;
		while (read++ < maxTupleLength) {
			int c = read();
			if (c == -1) {
				state = State.BETWEEN_STATEMENTS;
				return true;
			}
			if (quote != 0) {
				if (c == '\n' || c == '\r') {
					return false;
				}
				if (c == '\\') {
					if (read++ >= maxTupleLength) {
						return false;
					}
					read();
				} else if (c == quote) {
					quote = 0;
				}
				prev2 = prev;
				prev = c;
				continue;
			}
			if (c == '\'' || c == '"') {
				quote = c;
			} else if (Character.isWhitespace(c)) {
				continue;
			} else if (prev == ')' && c == ';') {
				state = State.BETWEEN_STATEMENTS;
				return true;
			} else if (prev2 == ')' && prev == ',' && c == '(') {
				state = State.IN_TUPLE;
				return true;
			}
			prev2 = prev;
			prev = c;
		}
		return false;
	}

	/** Look for the boundary in the raw text; a statement end must be followed by whitespace */
	private void resyncRaw() throws IOException {
		int prev2 = NONE;
		int prev = NONE;
		int c;
		while ((c = read()) != -1) {
			if (Character.isWhitespace(c)) {
				continue;
			}
			if (prev == ')' && c == ';') {
				int n = read();
				if (n == -1 || Character.isWhitespace(n)) {
					state = State.BETWEEN_STATEMENTS;
					return;
				}
				pushback(n);
			} else if (prev2 == ')' && prev == ',' && c == '(') {
				state = State.IN_TUPLE;
				return;
			}
			prev2 = prev;
			prev = c;
		}
		state = State.BETWEEN_STATEMENTS;
	}

	// Tuple tokenizing

	private List<Object> parseTupleBody() throws IOException, RowParseException {
		List<Object> values = new ArrayList<>();
		int c = nextNonWhitespace();
		if (c == ')') {
			return values;
		}
		while (true) {
			values.add(parseValue(c));
			c = nextNonWhitespace();
			if (c == ')') {
				return values;
			}
			if (c != ',') {
				throw new RowParseException("Expected ',' or ')' but found " + describe(c));
			}
			c = nextNonWhitespace();
		}
	}

	private Object parseValue(int c) throws IOException, RowParseException {
		if (c == '\'' || c == '"') {
			return parseQuoted(c);
		}
		if (c == '0') {
			int n = next();
			if (n == 'x' || n == 'X') {
				return parseHex();
			}
			pushback(n);
			return parseNumber(c);
		}
		if (isDigit(c) || c == '-' || c == '+' || c == '.') {
			return parseNumber(c);
		}
		if (isWordStart(c)) {
			String word = readWordInTuple(c);
			if (word.equalsIgnoreCase("NULL")) {
				return null;
			}
			if (word.startsWith("_")) {
				// charset introducer, e.g. _binary 'abc'
				int q = nextNonWhitespace();
				if (q == '\'' || q == '"') {
					return parseQuoted(q);
				}
			}
			throw new RowParseException("Unexpected bare word '" + word + "'");
		}
		throw new RowParseException("Unexpected " + describe(c));
	}

	private String parseQuoted(int quote) throws IOException, RowParseException {
		token.setLength(0);
		while (true) {
			int c = next();
			if (c == '\\') {
				unescape(next());
			} else if (c == quote) {
				int n = next();
				if (n == quote) {
					token.append((char) quote);
				} else {
					pushback(n);
					return token.toString();
				}
			} else if (c == '\n' || c == '\r') {
				throw new RowParseException("Unterminated string literal");
			} else {
				token.append((char) c);
			}
		}
	}

	private void unescape(int c) {
		switch (c) {
			case '0' -> token.append('\0');
			case 'b' -> token.append('\b');
			case 'n' -> token.append('\n');
			case 'r' -> token.append('\r');
			case 't' -> token.append('\t');
			case 'Z' -> token.append((char) 26);
			// kept escaped, as MySQL does outside of LIKE patterns
			case '%', '_' -> token.append('\\').append((char) c);
			default -> token.append((char) c);
		}
	}

	private Object parseNumber(int first) throws IOException, RowParseException {
		token.setLength(0);
		token.append((char) first);
		boolean decimal = first == '.';
		int c;
		while (isDigit(c = next()) || c == '.' || c == 'e' || c == 'E' || c == '-' || c == '+') {
			decimal |= c == '.' || c == 'e' || c == 'E';
			token.append((char) c);
		}
		pushback(c);
		String text = token.toString();
		try {
			if (!decimal) {
				try {
					return Long.parseLong(text);
				} catch (NumberFormatException e) {
					// too large for a long
				}
			}
			return new BigDecimal(text);
		} catch (NumberFormatException e) {
			throw new RowParseException("Invalid number '" + text + "'", e);
		}
	}

	private String parseHex() throws IOException, RowParseException {
		token.setLength(0);
		int c;
		while (Character.digit(c = next(), 16) >= 0) {
			token.append((char) c);
		}
		pushback(c);
		if (token.length() == 0 || token.length() % 2 != 0) {
			throw new RowParseException("Invalid hex literal '0x" + token + "'");
		}
		byte[] bytes = new byte[token.length() / 2];
		for (int i = 0; i < bytes.length; i++) {
			bytes[i] = (byte) Integer.parseInt(token.substring(2 * i, 2 * i + 2), 16);
		}
		return new String(bytes, StandardCharsets.UTF_8);
	}

	private String readWordInTuple(int first) throws IOException, RowParseException {
		token.setLength(0);
		token.append((char) first);
		int c;
		while (isWordPart(c = next())) {
			token.append((char) c);
		}
		pushback(c);
		return token.toString();
	}

	// Character level

	private void mark() throws IOException {
		if (pushback != NONE) {
			throw new IllegalStateException("Cannot mark with a pushed back character");
		}
		in.mark(maxTupleLength);
		consumed = 0;
	}

	private void reset() throws IOException {
		in.reset();
		pushback = NONE;
		consumed = 0;
	}

	private int read() throws IOException {
		if (pushback != NONE) {
			int c = pushback;
			pushback = NONE;
			return c;
		}
		return in.read();
	}

	private void pushback(int c) {
		pushback = c;
	}

	/** Read inside a tuple, where running out of input or over the length limit breaks the row */
	private int next() throws IOException, RowParseException {
		if (++consumed >= maxTupleLength) {
			throw new RowParseException("Tuple longer than " + maxTupleLength + " characters");
		}
		int c = read();
		if (c == -1) {
			throw new RowParseException("Unexpected end of input inside tuple");
		}
		return c;
	}

	private int nextNonWhitespace() throws IOException, RowParseException {
		int c;
		while (Character.isWhitespace(c = next())) {
			// skip
		}
		return c;
	}

	/** Whitespace after a tuple still counts against the tuple length */
	private int skipWhitespaceInTuple() throws IOException, RowParseException {
		int c;
		do {
			if (++consumed >= maxTupleLength) {
				throw new RowParseException("Tuple longer than " + maxTupleLength + " characters");
			}
			c = read();
		} while (c != -1 && Character.isWhitespace(c));
		return c;
	}

	private int skipWhitespace() throws IOException {
		int c;
		while ((c = read()) != -1 && Character.isWhitespace(c)) {
			// skip
		}
		return c;
	}

	private String nextWord() throws IOException {
		int c = skipWhitespace();
		if (!isWordStart(c)) {
			pushback(c);
			return null;
		}
		return readWord(c);
	}

	private String readWord(int first) throws IOException {
		token.setLength(0);
		token.append((char) first);
		int c;
		while (isWordPart(c = read())) {
			token.append((char) c);
		}
		pushback(c);
		return token.toString();
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isWordStart(int c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isWordPart(int c) {
		return isWordStart(c) || isDigit(c) || c == '$' || c == '.';
	}

	private static String describe(int c) {
		return c == -1 ? "end of input" : "'" + (char) c + "'";
	}
}
