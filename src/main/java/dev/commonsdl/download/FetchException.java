package dev.commonsdl.download;

/** A single media file could not be fetched. Never aborts the other downloads. */
public class FetchException extends Exception {

	/** Failure classes written to the failure log */
	public enum Kind {
		TIMEOUT,
		NOT_FOUND,
		TRANSPORT,
		INVALID_CONTENT
	}

	private final Kind kind;

	public FetchException(Kind kind, String message) {
		this(kind, message, null);
	}

	public FetchException(Kind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public Kind kind() {
		return kind;
	}
}
