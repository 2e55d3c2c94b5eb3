package io.healthlog.processing.migration;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import io.healthlog.data.entry.EntryCodec;
import io.healthlog.data.entry.EntryKind;
import io.healthlog.data.entry.ParsedEntry;
import io.healthlog.processing.condition.ConditionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Upgrades exported entries written before conditions were unified. Older exports carried a single
 * {@code context} value, and temperature also had a separate {@code technique}.
 */
@Component
public class LegacyConditionsMigrator {

    private static final Logger log = LoggerFactory.getLogger(LegacyConditionsMigrator.class);

    static final String TYPE = "type";
    static final String CONTEXT = "context";
    static final String TECHNIQUE = "technique";
    static final String CONDITIONS = "conditions";

    private static final Joiner CONDITION_JOINER = Joiner.on(',');

    private final ConditionResolver conditionResolver;

    @Autowired
    public LegacyConditionsMigrator(ConditionResolver conditionResolver) {
        this.conditionResolver = conditionResolver;
    }

    /**
     * Returns a migrated copy of {@code exported}; the argument is not modified. Maps without legacy keys
     * come back unchanged.
     *
     * @throws IllegalArgumentException if the type is unknown or the migrated conditions are not valid
     */
    public Map<String, Object> migrate(Map<String, Object> exported) {
        Map<String, Object> migrated = new LinkedHashMap<>(exported);
        EntryKind kind = EntryKind.fromCode(String.valueOf(exported.get(TYPE)));
        String conditions;

        switch (kind) {
            case TEMPERATURE -> {
                if (!migrated.containsKey(CONTEXT) && !migrated.containsKey(TECHNIQUE)) {
                    return migrated;
                }
                // context values sort before technique in priority order
                List<String> parts = new ArrayList<>();
                addIfPresent(parts, migrated.remove(CONTEXT));
                addIfPresent(parts, migrated.remove(TECHNIQUE));
                conditions = parts.isEmpty() ? null : CONDITION_JOINER.join(parts);
            }
            case HEART_RATE, HRV, CONTROL_PAUSE -> {
                if (!migrated.containsKey(CONTEXT)) {
                    return migrated;
                }
                conditions = Strings.emptyToNull(Objects.toString(migrated.remove(CONTEXT), null));
            }
            default -> {
                return migrated;
            }
        }

        conditionResolver.validate(conditions, kind);
        migrated.put(CONDITIONS, conditions);
        log.debug("Migrated legacy {} entry to conditions [{}]", kind.getCode(), conditions);
        return migrated;
    }

    public ParsedEntry migrateToEntry(Map<String, Object> exported) {
        return EntryCodec.fromExport(migrate(exported));
    }

    private static void addIfPresent(List<String> parts, Object value) {
        if (value != null && !value.toString().isEmpty()) {
            parts.add(value.toString());
        }
    }
}
