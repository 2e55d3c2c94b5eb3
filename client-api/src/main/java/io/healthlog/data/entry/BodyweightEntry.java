package io.healthlog.data.entry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record BodyweightEntry(
    double kg,
    @JsonProperty("bodyfat_pct") Double bodyfatPct,
    LocalDateTime timestamp,
    List<String> tags
) implements ParsedEntry {

    public BodyweightEntry {
        tags = EntryFormat.copyTags(tags);
    }

    @JsonIgnore
    @Override
    public EntryKind kind() {
        return EntryKind.BODYWEIGHT;
    }

    @JsonIgnore
    @Override
    public String displayString() {
        String bodyfat = bodyfatPct != null ? " (" + EntryFormat.number(bodyfatPct) + "% BF)" : "";
        return "Weight " + EntryFormat.number(kg) + "kg" + bodyfat + EntryFormat.tagsSuffix(tags);
    }
}
