package io.healthlog.data.entry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A strength or bodyweight exercise. {@code reps} holds one element per set.
 */
public record ExerciseEntry(
    String name,
    @JsonProperty("weight_kg") Double weightKg,
    List<Integer> reps,
    Double rpe,
    LocalDateTime timestamp,
    List<String> tags
) implements ParsedEntry {

    public ExerciseEntry {
        Preconditions.checkNotNull(name, "exercise name");
        Preconditions.checkArgument(reps != null && !reps.isEmpty(), "exercise needs at least one set");
        Preconditions.checkArgument(reps.stream().allMatch(set -> set != null && set > 0), "reps must be positive: %s", reps);
        reps = List.copyOf(reps);
        tags = EntryFormat.copyTags(tags);
    }

    @JsonIgnore
    @Override
    public EntryKind kind() {
        return EntryKind.EXERCISE;
    }

    @JsonIgnore
    @Override
    public String displayString() {
        // a zero load is logged as bodyweight
        String weight = weightKg != null && weightKg != 0 ? EntryFormat.number(weightKg) + "kg" : "(BW)";
        String effort = rpe != null ? " RPE " + EntryFormat.number(rpe) : "";
        return name + " " + weight + " " + EntryFormat.reps(reps) + effort + EntryFormat.tagsSuffix(tags);
    }
}
