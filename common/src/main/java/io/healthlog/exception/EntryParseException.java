package io.healthlog.exception;

/**
 * Raised when a raw entry line cannot be turned into a parsed entry. The message is meant
 * to be shown to the user as-is.
 */
public class EntryParseException extends IllegalArgumentException {

	private static final long serialVersionUID = 4113692618092342741L;

	private final ParseFailure reason;

	public EntryParseException(ParseFailure reason, String message) {
		super(message);
		this.reason = reason;
	}

	public ParseFailure getReason() {
		return reason;
	}
}
