package io.healthlog.exception;

/**
 * Stable reason codes for entry parse failures, surfaced to the chat layer and logged by storage.
 */
public enum ParseFailure {
	EMPTY_INPUT("No tokens left after stripping directives"),
	MISSING_VALUE("Mandatory numeric value for the entry kind is absent"),
	UNPARSEABLE_REPS("No reps pattern found in exercise tokens"),
	INAPPLICABLE_CONDITION("Condition value does not apply to the entry kind"),
	CONFLICTING_CONDITION("Two condition values from the same dimension");

	private final String description;

	ParseFailure(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}
}
