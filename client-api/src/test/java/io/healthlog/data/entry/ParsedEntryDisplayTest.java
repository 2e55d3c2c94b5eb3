package io.healthlog.data.entry;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParsedEntryDisplayTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 10, 14, 30, 0);

    @Test
    public void exerciseWithWeightAndRpe() {
        ExerciseEntry entry = new ExerciseEntry("squat", 100.0, List.of(5, 5, 5), 8.0, NOW, null);
        assertEquals("squat 100.0kg [5,5,5] RPE 8.0", entry.displayString());
    }

    @Test
    public void exerciseWithoutWeightShowsBodyweight() {
        ExerciseEntry entry = new ExerciseEntry("pullups", null, List.of(10, 10, 10), null, NOW, null);
        assertEquals("pullups (BW) [10,10,10]", entry.displayString());
    }

    @Test
    public void exerciseWithTags() {
        ExerciseEntry entry = new ExerciseEntry("squat", 100.0, List.of(5, 5, 5), null, NOW, List.of("gym", "pr"));
        assertEquals("squat 100.0kg [5,5,5] @gym @pr", entry.displayString());
    }

    @Test
    public void heartRate() {
        assertEquals("HR 72 bpm", new HeartRateEntry(72, null, NOW, null).displayString());
        assertEquals("HR 58 bpm (resting, postprandial) @oura",
            new HeartRateEntry(58, "resting,postprandial", NOW, List.of("oura")).displayString());
    }

    @Test
    public void hrvShowsMetric() {
        assertEquals("HRV 45.0ms (rmssd) (morning)", new HrvEntry(45.0, "rmssd", "morning", NOW, null).displayString());
    }

    @Test
    public void temperature() {
        assertEquals("Temp 36.6°C (oral)", new TemperatureEntry(36.6, "oral", NOW, null).displayString());
        assertEquals("Temp 37.2°C (postprandial, oral)",
            new TemperatureEntry(37.2, "postprandial,oral", NOW, null).displayString());
    }

    @Test
    public void bodyweight() {
        assertEquals("Weight 80.0kg (15.0% BF)", new BodyweightEntry(80.0, 15.0, NOW, null).displayString());
        assertEquals("Weight 82.5kg", new BodyweightEntry(82.5, null, NOW, null).displayString());
    }

    @Test
    public void controlPause() {
        assertEquals("CP 45s (morning)", new ControlPauseEntry(45, "morning", NOW, null).displayString());
        assertEquals("CP 35s", new ControlPauseEntry(35, null, NOW, null).displayString());
    }

    @Test
    public void conditionsFormatting() {
        assertEquals("(resting)", EntryFormat.conditions("resting"));
        assertEquals("(resting, postprandial)", EntryFormat.conditions("resting,postprandial"));
        assertEquals("", EntryFormat.conditions(null));
        assertEquals("", EntryFormat.conditions(""));
    }

    @Test
    public void entriesDoNotShareCallerLists() {
        List<Integer> reps = new ArrayList<>(List.of(5, 5));
        List<String> tags = new ArrayList<>(List.of("gym"));
        ExerciseEntry entry = new ExerciseEntry("squat", null, reps, null, NOW, tags);

        reps.add(99);
        tags.clear();

        assertEquals(List.of(5, 5), entry.reps());
        assertEquals(List.of("gym"), entry.tags());
        assertThrows(UnsupportedOperationException.class, () -> entry.reps().add(1));
    }

    @Test
    public void exerciseRequiresAtLeastOneSet() {
        assertThrows(IllegalArgumentException.class, () -> new ExerciseEntry("squat", 100.0, List.of(), null, NOW, null));
    }

    @Test
    public void exerciseRequiresPositiveReps() {
        IllegalArgumentException e = assertThrows(
            IllegalArgumentException.class,
            () -> new ExerciseEntry("squat", 100.0, List.of(5, 0, 5), null, NOW, null)
        );
        assertEquals("reps must be positive: [5, 0, 5]", e.getMessage());
    }

    @Test
    public void exerciseWithZeroWeightShowsBodyweight() {
        ExerciseEntry entry = new ExerciseEntry("dips", 0.0, List.of(12, 10), null, NOW, null);
        assertEquals("dips (BW) [12,10]", entry.displayString());
    }

    @Test
    public void kindFromCode() {
        assertEquals(EntryKind.CONTROL_PAUSE, EntryKind.fromCode("cp"));
        assertEquals(EntryKind.BODYWEIGHT, EntryKind.fromCode("weight"));
        assertThrows(IllegalArgumentException.class, () -> EntryKind.fromCode("steps"));
        assertFalse(EntryKind.EXERCISE.supportsConditions());
        assertTrue(EntryKind.TEMPERATURE.supportsConditions());
    }
}
