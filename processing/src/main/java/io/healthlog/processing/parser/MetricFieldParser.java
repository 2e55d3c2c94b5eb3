package io.healthlog.processing.parser;

import com.google.common.collect.ImmutableSet;
import io.healthlog.data.entry.BodyweightEntry;
import io.healthlog.data.entry.ControlPauseEntry;
import io.healthlog.data.entry.EntryKind;
import io.healthlog.data.entry.HeartRateEntry;
import io.healthlog.data.entry.HrvEntry;
import io.healthlog.data.entry.TemperatureEntry;
import io.healthlog.exception.EntryParseException;
import io.healthlog.exception.ParseFailure;
import io.healthlog.processing.alias.AliasCategory;
import io.healthlog.processing.condition.ConditionResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field parsers for the single-value metric kinds. Each receives the tokens after the kind keyword;
 * the first is the primary value and the rest are qualifiers.
 */
class MetricFieldParser {

    private static final ImmutableSet<String> HRV_METRICS = ImmutableSet.of("rmssd", "sdnn");
    private static final Pattern BODYFAT = Pattern.compile("^(\\d+(?:\\.\\d+)?)%?$");
    private static final Pattern SECONDS = Pattern.compile("^(\\d+)s?$");
    private static final int MAX_PAUSE_SECONDS = 600;

    private final ConditionResolver conditionResolver;

    MetricFieldParser(ConditionResolver conditionResolver) {
        this.conditionResolver = conditionResolver;
    }

    HeartRateEntry heartRate(List<String> tokens, EntryContext context) {
        requireValue(tokens, "Heart rate needs BPM value");
        int bpm = Numbers.parseInteger(tokens.get(0));
        String conditions = conditions(qualifiers(tokens), EntryKind.HEART_RATE, context);
        return new HeartRateEntry(bpm, conditions, context.timestamp(), context.tags());
    }

    HrvEntry hrv(List<String> tokens, EntryContext context) {
        requireValue(tokens, "HRV needs milliseconds value");
        double ms = Numbers.parseDecimal(tokens.get(0));

        String metric = HrvEntry.DEFAULT_METRIC;
        List<String> conditionTokens = new ArrayList<>();
        for (String token : qualifiers(tokens)) {
            String resolved = context.aliases().resolve(AliasCategory.HRV_METRICS, token);
            if (HRV_METRICS.contains(resolved)) {
                metric = resolved;
            } else {
                conditionTokens.add(token);
            }
        }

        String conditions = conditions(conditionTokens, EntryKind.HRV, context);
        return new HrvEntry(ms, metric, conditions, context.timestamp(), context.tags());
    }

    TemperatureEntry temperature(List<String> tokens, EntryContext context) {
        requireValue(tokens, "Temperature needs Celsius value");
        double celsius = Numbers.parseDecimal(tokens.get(0));
        String conditions = conditions(qualifiers(tokens), EntryKind.TEMPERATURE, context);
        return new TemperatureEntry(celsius, conditions, context.timestamp(), context.tags());
    }

    BodyweightEntry bodyweight(List<String> tokens, EntryContext context) {
        requireValue(tokens, "Bodyweight needs kg value");
        double kg = Numbers.parseDecimal(tokens.get(0));
        Double bodyfat = null;
        if (tokens.size() > 1) {
            Matcher matcher = BODYFAT.matcher(tokens.get(1));
            if (matcher.matches()) {
                bodyfat = Numbers.parseDecimal(matcher.group(1));
            }
        }
        return new BodyweightEntry(kg, bodyfat, context.timestamp(), context.tags());
    }

    /**
     * @throws IllegalArgumentException if the seconds value is malformed or not strictly between 0 and 600
     */
    ControlPauseEntry controlPause(List<String> tokens, EntryContext context) {
        requireValue(tokens, "Control pause needs seconds value");
        Matcher matcher = SECONDS.matcher(tokens.get(0));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid seconds value: " + tokens.get(0));
        }
        int seconds = Numbers.parseInteger(matcher.group(1));
        if (seconds <= 0 || seconds >= MAX_PAUSE_SECONDS) {
            throw new IllegalArgumentException("Seconds must be between 1 and " + (MAX_PAUSE_SECONDS - 1));
        }
        String conditions = conditions(qualifiers(tokens), EntryKind.CONTROL_PAUSE, context);
        return new ControlPauseEntry(seconds, conditions, context.timestamp(), context.tags());
    }

    private String conditions(List<String> tokens, EntryKind kind, EntryContext context) {
        return conditionResolver.resolve(tokens, kind, context.aliases().category(AliasCategory.CONDITIONS))
            .orElse(null);
    }

    private static List<String> qualifiers(List<String> tokens) {
        return tokens.subList(1, tokens.size());
    }

    private static void requireValue(List<String> tokens, String message) {
        if (tokens.isEmpty()) {
            throw new EntryParseException(ParseFailure.MISSING_VALUE, message);
        }
    }
}
