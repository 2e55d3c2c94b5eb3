package io.healthlog.processing.directive;

import com.google.common.base.CharMatcher;
import io.healthlog.processing.alias.AliasCategory;
import io.healthlog.processing.alias.AliasTable;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls {@code @}-prefixed directives out of an entry line.
 *
 * <p>Timestamp directives are checked in a fixed order (clock time, {@code @yesterday}, calendar date)
 * and only the first form found is used. Tags must be extracted after the timestamp, since
 * {@code @yesterday} would otherwise read as a tag.</p>
 */
public class DirectiveExtractor {

    private static final Pattern CLOCK_TIME = Pattern.compile("@(\\d{1,2}):(\\d{2})");
    private static final Pattern YESTERDAY = Pattern.compile("@yesterday");
    private static final Pattern CALENDAR_DATE = Pattern.compile("@(\\d{4}-\\d{2}-\\d{2})");
    private static final Pattern TAG = Pattern.compile("@([a-zA-Z][a-zA-Z0-9_-]*)");

    /**
     * @param now the reference instant; returned unchanged when the text has no timestamp directive
     * @throws IllegalArgumentException if the directive names an hour, minute or date that does not exist
     */
    public TimestampDirective extractTimestamp(String text, LocalDateTime now) {
        Matcher time = CLOCK_TIME.matcher(text);
        if (time.find()) {
            LocalDateTime timestamp;
            try {
                LocalTime clock = LocalTime.of(Integer.parseInt(time.group(1)), Integer.parseInt(time.group(2)));
                timestamp = now.toLocalDate().atTime(clock);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid time: " + time.group(), e);
            }
            return new TimestampDirective(timestamp, remove(text, time));
        }

        Matcher yesterday = YESTERDAY.matcher(text);
        if (yesterday.find()) {
            return new TimestampDirective(now.toLocalDate().minusDays(1).atStartOfDay(), remove(text, yesterday));
        }

        Matcher date = CALENDAR_DATE.matcher(text);
        if (date.find()) {
            LocalDateTime timestamp;
            try {
                timestamp = LocalDate.parse(date.group(1)).atStartOfDay();
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid date: " + date.group(), e);
            }
            return new TimestampDirective(timestamp, remove(text, date));
        }

        return new TimestampDirective(now, text);
    }

    /**
     * Removes every tag from {@code text}, resolving each through the tags alias category. Tags are
     * lowercased and deduplicated. The remaining text has its whitespace collapsed.
     */
    public TagDirectives extractTags(String text, AliasTable aliases) {
        Set<String> tags = new LinkedHashSet<>();
        Matcher matcher = TAG.matcher(text);
        while (matcher.find()) {
            String tag = matcher.group(1).toLowerCase(Locale.ROOT);
            tags.add(aliases.resolve(AliasCategory.TAGS, tag));
        }
        String remaining = CharMatcher.whitespace().trimAndCollapseFrom(matcher.replaceAll(""), ' ');
        return new TagDirectives(tags.isEmpty() ? null : List.copyOf(tags), remaining);
    }

    private static String remove(String text, Matcher match) {
        return (text.substring(0, match.start()) + text.substring(match.end())).strip();
    }
}
