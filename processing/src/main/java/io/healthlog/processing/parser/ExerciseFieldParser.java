package io.healthlog.processing.parser;

import io.healthlog.data.entry.ExerciseEntry;
import io.healthlog.exception.EntryParseException;
import io.healthlog.exception.ParseFailure;
import io.healthlog.processing.alias.AliasCategory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the weight, reps and RPE slots of an exercise in one left-to-right scan. Tokens that fit no
 * open slot are skipped.
 */
class ExerciseFieldParser {

    private static final Pattern WEIGHT = Pattern.compile("^(\\d+(?:\\.\\d+)?)(kg)?$");
    private static final Pattern RPE = Pattern.compile("^(?:rpe)?(\\d+(?:\\.\\d+)?)$");
    private static final double MIN_RPE = 1.0;
    private static final double MAX_RPE = 10.0;

    /**
     * @param tokens the whole token stream; the first token is the exercise name
     */
    ExerciseEntry parse(List<String> tokens, EntryContext context) {
        if (tokens.size() < 2) {
            throw unparseableReps();
        }
        String name = context.aliases().resolve(AliasCategory.EXERCISES, tokens.get(0));
        List<String> fields = tokens.subList(1, tokens.size());

        Double weight = null;
        List<Integer> reps = null;
        Double rpe = null;

        for (int i = 0; i < fields.size(); i++) {
            String token = fields.get(i);

            if (weight == null && reps == null) {
                Matcher candidate = WEIGHT.matcher(token);
                if (candidate.matches()) {
                    // a lone trailing number is reps, not weight
                    boolean repsFollow = i + 1 < fields.size() && RepsPattern.matches(fields.get(i + 1));
                    if (!repsFollow && RepsPattern.matches(token)) {
                        reps = RepsPattern.parse(token);
                    } else {
                        weight = Numbers.parseDecimal(candidate.group(1));
                    }
                    continue;
                }
            }

            if (reps == null) {
                if (RepsPattern.matches(token)) {
                    reps = RepsPattern.parse(token);
                }
                continue;
            }

            if (rpe == null) {
                Matcher effort = RPE.matcher(token);
                if (effort.matches()) {
                    double value = Numbers.parseDecimal(effort.group(1));
                    if (value >= MIN_RPE && value <= MAX_RPE) {
                        rpe = value;
                    }
                }
            }
        }

        if (reps == null) {
            throw unparseableReps();
        }
        return new ExerciseEntry(name, weight, reps, rpe, context.timestamp(), context.tags());
    }

    private static EntryParseException unparseableReps() {
        return new EntryParseException(ParseFailure.UNPARSEABLE_REPS, "Could not parse reps");
    }
}
