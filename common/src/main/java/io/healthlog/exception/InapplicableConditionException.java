package io.healthlog.exception;

/**
 * A recognised condition value whose dimension does not apply to the entry kind, or, when
 * re-validating a stored condition string, a value that is not a known condition at all
 * (in which case {@link #getDimension()} is null).
 */
public class InapplicableConditionException extends EntryParseException {

	private static final long serialVersionUID = -6795310853215338610L;

	private final String value;
	private final String entryKind;
	private final String dimension;

	public InapplicableConditionException(String value, String entryKind, String dimension) {
		super(ParseFailure.INAPPLICABLE_CONDITION, dimension == null
				? "Unknown condition: '" + value + "'"
				: "Condition '" + value + "' (" + dimension + ") does not apply to " + entryKind + " entries");
		this.value = value;
		this.entryKind = entryKind;
		this.dimension = dimension;
	}

	public String getValue() {
		return value;
	}

	public String getEntryKind() {
		return entryKind;
	}

	public String getDimension() {
		return dimension;
	}
}
