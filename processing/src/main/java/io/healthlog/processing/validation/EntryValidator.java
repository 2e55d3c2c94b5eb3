package io.healthlog.processing.validation;

import com.google.common.collect.ImmutableSet;
import io.healthlog.data.entry.BodyweightEntry;
import io.healthlog.data.entry.ControlPauseEntry;
import io.healthlog.data.entry.ExerciseEntry;
import io.healthlog.data.entry.HeartRateEntry;
import io.healthlog.data.entry.HrvEntry;
import io.healthlog.data.entry.ParsedEntry;
import io.healthlog.data.entry.TemperatureEntry;
import io.healthlog.processing.condition.ConditionResolver;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Re-checks an entry read back from storage. The parser accepts any well-formed number, so the
 * plausibility ranges the store enforces live here rather than in the field parsers.
 */
@Component
public class EntryValidator {

    private static final ImmutableSet<String> STORED_HRV_METRICS = ImmutableSet.of("rmssd", "sdnn", "other");

    private final ConditionResolver conditionResolver;

    @Autowired
    public EntryValidator(ConditionResolver conditionResolver) {
        this.conditionResolver = conditionResolver;
    }

    /**
     * @throws IllegalArgumentException naming the first field that is out of range, or from
     *     {@link ConditionResolver#validate} when the conditions are not valid for the entry kind
     */
    public void validate(ParsedEntry entry) {
        switch (entry.kind()) {
            case EXERCISE -> validateExercise((ExerciseEntry) entry);
            case HEART_RATE -> validateHeartRate((HeartRateEntry) entry);
            case HRV -> validateHrv((HrvEntry) entry);
            case TEMPERATURE -> validateTemperature((TemperatureEntry) entry);
            case BODYWEIGHT -> validateBodyweight((BodyweightEntry) entry);
            case CONTROL_PAUSE -> validateControlPause((ControlPauseEntry) entry);
        }
    }

    private void validateExercise(ExerciseEntry entry) {
        if (entry.weightKg() != null && entry.weightKg() < 0) {
            throw new IllegalArgumentException("Weight cannot be negative: " + entry.weightKg());
        }
        if (entry.rpe() != null && (entry.rpe() < 1 || entry.rpe() > 10)) {
            throw new IllegalArgumentException("RPE must be between 1 and 10: " + entry.rpe());
        }
    }

    private void validateHeartRate(HeartRateEntry entry) {
        if (entry.bpm() <= 0 || entry.bpm() >= 300) {
            throw new IllegalArgumentException("Heart rate out of range: " + entry.bpm() + " bpm");
        }
        conditionResolver.validate(entry.conditions(), entry.kind());
    }

    private void validateHrv(HrvEntry entry) {
        if (entry.ms() <= 0) {
            throw new IllegalArgumentException("HRV must be positive: " + entry.ms() + "ms");
        }
        if (!STORED_HRV_METRICS.contains(entry.metric())) {
            throw new IllegalArgumentException("Unknown HRV metric: " + entry.metric());
        }
        conditionResolver.validate(entry.conditions(), entry.kind());
    }

    private void validateTemperature(TemperatureEntry entry) {
        if (entry.celsius() <= 30 || entry.celsius() >= 45) {
            throw new IllegalArgumentException("Temperature out of range: " + entry.celsius() + "°C");
        }
        conditionResolver.validate(entry.conditions(), entry.kind());
    }

    private void validateBodyweight(BodyweightEntry entry) {
        if (entry.kg() <= 0 || entry.kg() >= 500) {
            throw new IllegalArgumentException("Bodyweight out of range: " + entry.kg() + "kg");
        }
        Double bodyfat = entry.bodyfatPct();
        if (bodyfat != null && (bodyfat <= 0 || bodyfat >= 100)) {
            throw new IllegalArgumentException("Body fat out of range: " + bodyfat + "%");
        }
    }

    private void validateControlPause(ControlPauseEntry entry) {
        if (entry.seconds() <= 0 || entry.seconds() >= 600) {
            throw new IllegalArgumentException("Seconds must be between 1 and 599");
        }
        conditionResolver.validate(entry.conditions(), entry.kind());
    }
}
