package dev.commonsdl.dump;

/** A single tuple that could not be parsed or mapped. Callers skip the row and count it. */
public class RowParseException extends Exception {

	public RowParseException(String message) {
		super(message);
	}

	public RowParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
