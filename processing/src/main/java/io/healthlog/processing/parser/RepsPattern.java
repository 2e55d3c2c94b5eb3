package io.healthlog.processing.parser;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rep notation: {@code NxM} is N sets of M, {@code a,b,c} lists each set, a bare integer is one set.
 */
final class RepsPattern {

    private static final Pattern REPS = Pattern.compile("^(\\d+x\\d+|\\d+(,\\d+)*)$");
    private static final Pattern SETS_BY_REPS = Pattern.compile("^(\\d+)x(\\d+)$");
    private static final Splitter COMMA = Splitter.on(',');
    static final int MAX_SETS = 100;

    private RepsPattern() {
    }

    static boolean matches(String token) {
        return REPS.matcher(token).matches();
    }

    static List<Integer> parse(String token) {
        Matcher setsByReps = SETS_BY_REPS.matcher(token);
        if (setsByReps.matches()) {
            int sets = Numbers.parseInteger(setsByReps.group(1));
            int reps = Numbers.parseInteger(setsByReps.group(2));
            Preconditions.checkArgument(sets <= MAX_SETS, "Too many sets: %s (at most %s)", sets, MAX_SETS);
            return Collections.nCopies(sets, reps);
        }
        return COMMA.splitToStream(token)
            .map(Numbers::parseInteger)
            .collect(ImmutableList.toImmutableList());
    }
}
