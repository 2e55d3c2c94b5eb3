package io.healthlog.data.entry;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Breath-hold control pause, in whole seconds.
 */
public record ControlPauseEntry(int seconds, String conditions, LocalDateTime timestamp, List<String> tags)
    implements ParsedEntry {

    public ControlPauseEntry {
        tags = EntryFormat.copyTags(tags);
    }

    @JsonIgnore
    @Override
    public EntryKind kind() {
        return EntryKind.CONTROL_PAUSE;
    }

    @JsonIgnore
    @Override
    public String displayString() {
        return "CP " + seconds + "s" + EntryFormat.conditionsSuffix(conditions) + EntryFormat.tagsSuffix(tags);
    }
}
