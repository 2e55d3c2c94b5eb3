package io.healthlog.data.entry;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Body temperature. The only kind whose conditions may name a measurement technique.
 */
public record TemperatureEntry(double celsius, String conditions, LocalDateTime timestamp, List<String> tags)
    implements ParsedEntry {

    public TemperatureEntry {
        tags = EntryFormat.copyTags(tags);
    }

    @JsonIgnore
    @Override
    public EntryKind kind() {
        return EntryKind.TEMPERATURE;
    }

    @JsonIgnore
    @Override
    public String displayString() {
        return "Temp " + EntryFormat.number(celsius) + "°C" + EntryFormat.conditionsSuffix(conditions)
            + EntryFormat.tagsSuffix(tags);
    }
}
