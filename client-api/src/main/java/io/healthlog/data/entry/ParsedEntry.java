package io.healthlog.data.entry;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One parsed log line. Instances are immutable; a different interpretation of the same text means
 * parsing replacement text, never mutating an entry.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExerciseEntry.class, name = "exercise"),
        @JsonSubTypes.Type(value = HeartRateEntry.class, name = "hr"),
        @JsonSubTypes.Type(value = HrvEntry.class, name = "hrv"),
        @JsonSubTypes.Type(value = TemperatureEntry.class, name = "temp"),
        @JsonSubTypes.Type(value = BodyweightEntry.class, name = "weight"),
        @JsonSubTypes.Type(value = ControlPauseEntry.class, name = "cp") }
)
public sealed interface ParsedEntry
    permits ExerciseEntry, HeartRateEntry, HrvEntry, TemperatureEntry, BodyweightEntry, ControlPauseEntry {

    LocalDateTime timestamp();

    /**
     * @return normalized tags in first-seen order, or null when the line carried none
     */
    List<String> tags();

    EntryKind kind();

    /**
     * Single-line rendering used for chat replies and for comparing an entry with its stored copy.
     */
    String displayString();
}
