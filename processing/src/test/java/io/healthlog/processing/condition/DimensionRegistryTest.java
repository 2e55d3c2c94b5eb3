package io.healthlog.processing.condition;

import io.healthlog.data.entry.EntryKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

class DimensionRegistryTest {

    @Test
    public void dimensions_orderedByPriority() {
        assertEquals(
            List.of(Dimension.ACTIVITY, Dimension.TIME_OF_DAY, Dimension.METABOLIC, Dimension.EMOTIONAL, Dimension.TECHNIQUE),
            DimensionRegistry.dimensions()
        );
    }

    @Test
    public void applicableDimensions_temperature_includesTechnique() {
        assertThat(DimensionRegistry.applicableDimensions(EntryKind.TEMPERATURE), hasItem(Dimension.TECHNIQUE));
        assertThat(DimensionRegistry.applicableDimensions(EntryKind.TEMPERATURE), hasSize(5));
    }

    @Test
    public void applicableDimensions_heartRate_excludesTechnique() {
        List<Dimension> dimensions = DimensionRegistry.applicableDimensions(EntryKind.HEART_RATE);
        assertThat(dimensions, not(hasItem(Dimension.TECHNIQUE)));
        assertThat(dimensions, hasSize(4));
        assertEquals(dimensions, DimensionRegistry.applicableDimensions(EntryKind.HRV));
        assertEquals(dimensions, DimensionRegistry.applicableDimensions(EntryKind.CONTROL_PAUSE));
    }

    @Test
    public void applicableDimensions_kindsWithoutConditions_areEmpty() {
        assertThat(DimensionRegistry.applicableDimensions(EntryKind.EXERCISE), empty());
        assertThat(DimensionRegistry.applicableDimensions(EntryKind.BODYWEIGHT), empty());
        assertThat(DimensionRegistry.applicableValues(EntryKind.BODYWEIGHT), empty());
    }

    @Test
    public void applicableValues_heartRate() {
        Set<String> values = DimensionRegistry.applicableValues(EntryKind.HEART_RATE);
        assertThat(values, hasItems("resting", "morning", "postprandial", "stressed"));
        assertThat(values, not(hasItem("oral")));
    }

    @Test
    public void dimensionOf_knownAndUnknownValues() {
        assertEquals(Optional.of(Dimension.ACTIVITY), DimensionRegistry.dimensionOf("post-workout"));
        assertEquals(Optional.of(Dimension.TECHNIQUE), DimensionRegistry.dimensionOf("forehead_ir"));
        assertEquals(Optional.empty(), DimensionRegistry.dimensionOf("sleepy"));
    }

    @Test
    public void allValues_everyValueBelongsToExactlyOneDimension() {
        int declared = DimensionRegistry.dimensions().stream().mapToInt(dimension -> dimension.getValues().size()).sum();
        assertEquals(declared, DimensionRegistry.allValues().size());
        assertEquals(14, declared);
    }
}
