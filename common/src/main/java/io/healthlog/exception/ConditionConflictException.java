package io.healthlog.exception;

import java.util.List;

/**
 * Two values from the same condition dimension were supplied for one entry.
 */
public class ConditionConflictException extends EntryParseException {

	private static final long serialVersionUID = 2260587937440237085L;

	private final String dimension;
	private final List<String> values;

	public ConditionConflictException(String dimension, String firstValue, String secondValue) {
		super(ParseFailure.CONFLICTING_CONDITION,
				"Cannot specify both '" + firstValue + "' and '" + secondValue + "' (" + dimension + " dimension)");
		this.dimension = dimension;
		this.values = List.of(firstValue, secondValue);
	}

	public String getDimension() {
		return dimension;
	}

	/**
	 * @return the first-seen value followed by the conflicting one
	 */
	public List<String> getValues() {
		return values;
	}
}
