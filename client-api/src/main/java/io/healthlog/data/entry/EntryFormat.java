package io.healthlog.data.entry;

import com.google.common.base.Joiner;

import java.util.List;

/**
 * Display helpers shared by the entry records.
 */
public final class EntryFormat {

    private static final Joiner REPS_JOINER = Joiner.on(',');

    private EntryFormat() {
    }

    public static String number(double value) {
        return String.valueOf(value);
    }

    public static String reps(List<Integer> reps) {
        return "[" + REPS_JOINER.join(reps) + "]";
    }

    /**
     * Renders a stored condition string such as {@code resting,postprandial} as
     * {@code (resting, postprandial)}. Absent or empty input renders as the empty string.
     */
    public static String conditions(String conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return "";
        }
        return "(" + conditions.replace(",", ", ") + ")";
    }

    static String conditionsSuffix(String conditions) {
        String formatted = conditions(conditions);
        return formatted.isEmpty() ? "" : " " + formatted;
    }

    static String tagsSuffix(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        StringBuilder suffix = new StringBuilder();
        for (String tag : tags) {
            suffix.append(" @").append(tag);
        }
        return suffix.toString();
    }

    static List<String> copyTags(List<String> tags) {
        return tags == null ? null : List.copyOf(tags);
    }
}
