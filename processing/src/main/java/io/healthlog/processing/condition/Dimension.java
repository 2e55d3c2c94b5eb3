package io.healthlog.processing.condition;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import io.healthlog.data.entry.EntryKind;

import java.util.Arrays;
import java.util.Set;

/**
 * A named axis of mutually exclusive condition values. Lower priority sorts first in a stored
 * condition string.
 */
public enum Dimension {
    ACTIVITY("activity", 1, ImmutableSet.of("waking", "resting", "active", "post-workout")),
    TIME_OF_DAY("time_of_day", 2, ImmutableSet.of("morning", "evening")),
    METABOLIC("metabolic", 3, ImmutableSet.of("postprandial", "fasted")),
    EMOTIONAL("emotional", 4, ImmutableSet.of("stressed", "relaxed")),
    // only temperature has a measurement technique
    TECHNIQUE("technique", 5, ImmutableSet.of("oral", "underarm", "forehead_ir", "ear"), EntryKind.TEMPERATURE);

    private final String label;
    private final int priority;
    private final ImmutableSet<String> values;
    private final ImmutableSet<EntryKind> applicableKinds;

    Dimension(String label, int priority, ImmutableSet<String> values, EntryKind... applicableKinds) {
        this.label = label;
        this.priority = priority;
        this.values = values;
        this.applicableKinds = applicableKinds.length == 0
            ? conditionKinds()
            : Sets.immutableEnumSet(Arrays.asList(applicableKinds));
    }

    private static ImmutableSet<EntryKind> conditionKinds() {
        return Arrays.stream(EntryKind.values())
            .filter(EntryKind::supportsConditions)
            .collect(Sets.toImmutableEnumSet());
    }

    public String getLabel() {
        return label;
    }

    public int getPriority() {
        return priority;
    }

    public Set<String> getValues() {
        return values;
    }

    public Set<EntryKind> getApplicableKinds() {
        return applicableKinds;
    }

    public boolean appliesTo(EntryKind kind) {
        return applicableKinds.contains(kind);
    }
}
