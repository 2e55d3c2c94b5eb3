package io.healthlog.processing.migration;

import io.healthlog.data.entry.ParsedEntry;
import io.healthlog.data.entry.TemperatureEntry;
import io.healthlog.exception.InapplicableConditionException;
import io.healthlog.processing.condition.ConditionResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

class LegacyConditionsMigratorTest {

    private LegacyConditionsMigrator migrator;

    @BeforeEach
    public void setup() {
        migrator = new LegacyConditionsMigrator(new ConditionResolver());
    }

    private static Map<String, Object> exported(Object... keysAndValues) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    @Test
    public void migrate_temperature_mergesContextThenTechnique() {
        Map<String, Object> legacy = exported(
            "type", "temp", "celsius", 37.2, "context", "postprandial", "technique", "oral",
            "timestamp", "2025-11-02T07:30:00", "tags", null
        );

        Map<String, Object> migrated = migrator.migrate(legacy);

        assertEquals("postprandial,oral", migrated.get("conditions"));
        assertThat(migrated, not(hasKey("context")));
        assertThat(migrated, not(hasKey("technique")));
        // the argument is left alone
        assertThat(legacy, hasKey("context"));
    }

    @Test
    public void migrate_temperatureTechniqueOnly() {
        Map<String, Object> migrated = migrator.migrate(exported("type", "temp", "celsius", 36.5, "technique", "underarm"));
        assertEquals("underarm", migrated.get("conditions"));
    }

    @Test
    public void migrate_temperatureWithEmptyLegacyValues_hasNoConditions() {
        Map<String, Object> migrated = migrator.migrate(exported("type", "temp", "celsius", 36.5, "context", null, "technique", ""));
        assertThat(migrated, hasEntry("conditions", null));
        assertThat(migrated, not(hasKey("technique")));
    }

    @Test
    public void migrate_heartRate_renamesContext() {
        Map<String, Object> migrated = migrator.migrate(exported("type", "hr", "bpm", 58, "context", "resting"));
        assertEquals("resting", migrated.get("conditions"));
        assertThat(migrated, not(hasKey("context")));
    }

    @Test
    public void migrate_hrvAndControlPause_renameContext() {
        assertEquals("morning", migrator.migrate(exported("type", "hrv", "ms", 45.0, "context", "morning")).get("conditions"));
        assertEquals("morning", migrator.migrate(exported("type", "cp", "seconds", 40, "context", "morning")).get("conditions"));
    }

    @Test
    public void migrate_nonStringContext_isCheckedAsText() {
        Map<String, Object> legacy = exported("type", "hr", "bpm", 58, "context", 7);
        InapplicableConditionException e =
            assertThrows(InapplicableConditionException.class, () -> migrator.migrate(legacy));
        assertEquals("7", e.getValue());
    }

    @Test
    public void migrate_nonStringTechnique_isCheckedAsText() {
        Map<String, Object> legacy = exported("type", "temp", "celsius", 36.6, "technique", 3);
        assertThrows(InapplicableConditionException.class, () -> migrator.migrate(legacy));
    }

    @Test
    public void migrate_alreadyMigrated_isUnchanged() {
        Map<String, Object> current = exported("type", "hr", "bpm", 58, "conditions", "resting,postprandial", "tags", null);
        assertEquals(current, migrator.migrate(current));
    }

    @Test
    public void migrate_kindWithoutConditions_isUnchanged() {
        Map<String, Object> exercise = exported("type", "exercise", "name", "squat", "reps", List.of(5));
        assertEquals(exercise, migrator.migrate(exercise));
    }

    @Test
    public void migrate_invalidLegacyValue_throwsInapplicable() {
        Map<String, Object> legacy = exported("type", "hr", "bpm", 58, "context", "oral");
        assertThrows(InapplicableConditionException.class, () -> migrator.migrate(legacy));
    }

    @Test
    public void migrate_unknownType_throwsException() {
        assertThrows(IllegalArgumentException.class, () -> migrator.migrate(exported("type", "steps", "count", 9000)));
    }

    @Test
    public void migrateToEntry_producesCurrentEntry() {
        Map<String, Object> legacy = exported(
            "type", "temp", "celsius", 37.2, "context", "postprandial", "technique", "oral",
            "timestamp", "2025-11-02T07:30:00", "tags", null
        );

        ParsedEntry entry = migrator.migrateToEntry(legacy);

        TemperatureEntry temperature = assertInstanceOf(TemperatureEntry.class, entry);
        assertEquals("postprandial,oral", temperature.conditions());
        assertEquals("Temp 37.2°C (postprandial, oral)", temperature.displayString());
    }
}
