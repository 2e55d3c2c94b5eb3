package io.healthlog.processing.alias;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Independent alias namespaces. The key is the category's name in an alias file.
 */
public enum AliasCategory {
    EXERCISES("exercises"),
    HRV_METRICS("hrv_metrics"),
    CONDITIONS("conditions"),
    TAGS("tags");

    private final String key;

    AliasCategory(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<AliasCategory> lookup(String key) {
        return Arrays.stream(values()).filter(category -> category.key.equals(key)).findFirst();
    }

    /**
     * @throws IllegalArgumentException naming the valid keys when {@code key} is not a category
     */
    public static AliasCategory fromKey(String key) {
        return lookup(key).orElseThrow(() -> new IllegalArgumentException(
            "Invalid category '" + key + "'. Valid: "
                + Arrays.stream(values()).map(AliasCategory::getKey).collect(Collectors.joining(", "))));
    }
}
