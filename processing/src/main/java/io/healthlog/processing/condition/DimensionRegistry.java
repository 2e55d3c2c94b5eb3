package io.healthlog.processing.condition;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.healthlog.data.entry.EntryKind;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static catalog of condition dimensions and the value-to-dimension index.
 */
public final class DimensionRegistry {

    private static final ImmutableList<Dimension> BY_PRIORITY = Arrays.stream(Dimension.values())
        .sorted(Comparator.comparingInt(Dimension::getPriority))
        .collect(ImmutableList.toImmutableList());

    private static final ImmutableMap<String, Dimension> BY_VALUE = indexValues();

    static {
        long distinctPriorities = BY_PRIORITY.stream().mapToInt(Dimension::getPriority).distinct().count();
        Preconditions.checkState(distinctPriorities == BY_PRIORITY.size(), "dimension priorities must be unique");
    }

    private DimensionRegistry() {
    }

    // buildOrThrow rejects a value listed under two dimensions
    private static ImmutableMap<String, Dimension> indexValues() {
        ImmutableMap.Builder<String, Dimension> builder = ImmutableMap.builder();
        for (Dimension dimension : Dimension.values()) {
            dimension.getValues().forEach(value -> builder.put(value, dimension));
        }
        return builder.buildOrThrow();
    }

    /**
     * @return every dimension, ascending priority
     */
    public static List<Dimension> dimensions() {
        return BY_PRIORITY;
    }

    /**
     * @return dimensions usable on {@code kind}, ascending priority; empty for kinds without conditions
     */
    public static List<Dimension> applicableDimensions(EntryKind kind) {
        return BY_PRIORITY.stream()
            .filter(dimension -> dimension.appliesTo(kind))
            .collect(ImmutableList.toImmutableList());
    }

    public static Set<String> applicableValues(EntryKind kind) {
        return applicableDimensions(kind).stream()
            .flatMap(dimension -> dimension.getValues().stream())
            .collect(ImmutableSet.toImmutableSet());
    }

    public static Optional<Dimension> dimensionOf(String value) {
        return Optional.ofNullable(BY_VALUE.get(value));
    }

    public static Set<String> allValues() {
        return BY_VALUE.keySet();
    }
}
