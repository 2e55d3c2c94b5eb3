package io.healthlog.data.entry;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Heart rate variability in milliseconds, measured with {@code metric} (rmssd unless stated).
 */
public record HrvEntry(double ms, String metric, String conditions, LocalDateTime timestamp, List<String> tags)
    implements ParsedEntry {

    public static final String DEFAULT_METRIC = "rmssd";

    public HrvEntry {
        metric = metric == null ? DEFAULT_METRIC : metric;
        tags = EntryFormat.copyTags(tags);
    }

    @JsonIgnore
    @Override
    public EntryKind kind() {
        return EntryKind.HRV;
    }

    @JsonIgnore
    @Override
    public String displayString() {
        return "HRV " + EntryFormat.number(ms) + "ms (" + metric + ")" + EntryFormat.conditionsSuffix(conditions)
            + EntryFormat.tagsSuffix(tags);
    }
}
