package io.healthlog.data.entry;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;
import java.util.List;

public record HeartRateEntry(int bpm, String conditions, LocalDateTime timestamp, List<String> tags) implements ParsedEntry {

    public HeartRateEntry {
        tags = EntryFormat.copyTags(tags);
    }

    @JsonIgnore
    @Override
    public EntryKind kind() {
        return EntryKind.HEART_RATE;
    }

    @JsonIgnore
    @Override
    public String displayString() {
        return "HR " + bpm + " bpm" + EntryFormat.conditionsSuffix(conditions) + EntryFormat.tagsSuffix(tags);
    }
}
