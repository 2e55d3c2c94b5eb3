package io.healthlog.processing.parser;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import io.healthlog.data.entry.EntryKind;
import io.healthlog.data.entry.ParsedEntry;
import io.healthlog.exception.EntryParseException;
import io.healthlog.exception.ParseFailure;
import io.healthlog.processing.alias.AliasResolver;
import io.healthlog.processing.alias.AliasTable;
import io.healthlog.processing.condition.ConditionResolver;
import io.healthlog.processing.directive.DirectiveExtractor;
import io.healthlog.processing.directive.TagDirectives;
import io.healthlog.processing.directive.TimestampDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Turns one free-text log line into a {@link ParsedEntry}.
 *
 * <p>The line is lowercased, its timestamp directive and tags are extracted, and the first remaining
 * token selects the entry kind. A first token that is not a kind keyword starts an exercise, and the
 * whole token stream is handed to the exercise parser.</p>
 *
 * <p>Failures are reported by exception: {@link EntryParseException} for empty input, a missing
 * primary value or unreadable reps; the condition exceptions from {@link ConditionResolver}; and a plain
 * {@link IllegalArgumentException} (often a {@link NumberFormatException}) for malformed values.</p>
 */
@Component
public class EntryParser {

    private static final Logger log = LoggerFactory.getLogger(EntryParser.class);

    private static final ImmutableMap<String, EntryKind> KEYWORDS = ImmutableMap.<String, EntryKind>builder()
        .put("hr", EntryKind.HEART_RATE)
        .put("hrv", EntryKind.HRV)
        .put("temp", EntryKind.TEMPERATURE)
        .put("weight", EntryKind.BODYWEIGHT)
        .put("bw", EntryKind.BODYWEIGHT)
        .put("cp", EntryKind.CONTROL_PAUSE)
        .put("pause", EntryKind.CONTROL_PAUSE)
        .build();

    private static final Splitter TOKENS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final AliasResolver aliasResolver;
    private final DirectiveExtractor directives = new DirectiveExtractor();
    private final ExerciseFieldParser exerciseParser = new ExerciseFieldParser();
    private final MetricFieldParser metricParser;

    @Autowired
    public EntryParser(AliasResolver aliasResolver, ConditionResolver conditionResolver) {
        this.aliasResolver = aliasResolver;
        this.metricParser = new MetricFieldParser(conditionResolver);
    }

    public ParsedEntry parse(String text) {
        return parse(text, LocalDateTime.now());
    }

    /**
     * @param now reference time for timestamp directives, and the entry timestamp when there is none
     */
    public ParsedEntry parse(String text, LocalDateTime now) {
        Preconditions.checkNotNull(text, "entry text");
        Preconditions.checkNotNull(now, "reference time");
        try {
            ParsedEntry entry = parseNormalized(text.strip().toLowerCase(Locale.ROOT), now);
            log.debug("Parsed [{}] as {}", text, entry.displayString());
            return entry;
        } catch (IllegalArgumentException e) {
            log.debug("Could not parse [{}]: {}", text, e.getMessage());
            throw e;
        }
    }

    private ParsedEntry parseNormalized(String text, LocalDateTime now) {
        AliasTable aliases = aliasResolver.snapshot();

        TimestampDirective timestamp = directives.extractTimestamp(text, now);
        TagDirectives tags = directives.extractTags(timestamp.remaining(), aliases);

        List<String> tokens = TOKENS.splitToList(tags.remaining());
        if (tokens.isEmpty()) {
            throw new EntryParseException(ParseFailure.EMPTY_INPUT, "Empty input");
        }

        EntryContext context = new EntryContext(timestamp.timestamp(), tags.tags(), aliases);
        EntryKind kind = KEYWORDS.getOrDefault(tokens.get(0), EntryKind.EXERCISE);
        List<String> fields = tokens.subList(1, tokens.size());

        return switch (kind) {
            case EXERCISE -> exerciseParser.parse(tokens, context);
            case HEART_RATE -> metricParser.heartRate(fields, context);
            case HRV -> metricParser.hrv(fields, context);
            case TEMPERATURE -> metricParser.temperature(fields, context);
            case BODYWEIGHT -> metricParser.bodyweight(fields, context);
            case CONTROL_PAUSE -> metricParser.controlPause(fields, context);
        };
    }
}
