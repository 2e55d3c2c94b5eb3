package io.healthlog.data.entry;

import java.util.Arrays;

/**
 * Closed set of entry kinds. The code is what storage records as the entry type and what the
 * export form carries in its {@code type} field.
 */
public enum EntryKind {
    EXERCISE("exercise", false),
    HEART_RATE("hr", true),
    HRV("hrv", true),
    TEMPERATURE("temp", true),
    BODYWEIGHT("weight", false),
    CONTROL_PAUSE("cp", true);

    private final String code;
    private final boolean supportsConditions;

    EntryKind(String code, boolean supportsConditions) {
        this.code = code;
        this.supportsConditions = supportsConditions;
    }

    public String getCode() {
        return code;
    }

    public boolean supportsConditions() {
        return supportsConditions;
    }

    public static EntryKind fromCode(String code) {
        return Arrays.stream(values())
            .filter(kind -> kind.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown entry type: " + code));
    }
}
