package io.healthlog.processing.condition;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import io.healthlog.data.entry.EntryFormat;
import io.healthlog.data.entry.EntryKind;
import io.healthlog.exception.ConditionConflictException;
import io.healthlog.exception.InapplicableConditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Turns loose condition tokens into the canonical condition string for an entry kind, and re-checks
 * condition strings read back from storage.
 *
 * <p>The canonical form lists one value per dimension, ordered by dimension priority and joined with
 * commas, so any permutation of the same tokens produces the same string.</p>
 */
@Component
public class ConditionResolver {

    private static final Logger log = LoggerFactory.getLogger(ConditionResolver.class);

    private static final Joiner CONDITION_JOINER = Joiner.on(',');
    private static final Splitter CONDITION_SPLITTER = Splitter.on(',');

    /**
     * Resolves condition tokens for an entry.
     *
     * <p>Tokens are first mapped through {@code aliases}. Tokens that are not condition values are
     * skipped, since they may belong to another field of the entry.</p>
     *
     * @param tokens candidate tokens, in input order
     * @param kind the entry kind the conditions are for
     * @param aliases abbreviation to condition value; a miss leaves the token unchanged
     * @return the canonical condition string, or empty when no token was a condition
     * @throws InapplicableConditionException if a value's dimension does not apply to {@code kind}
     * @throws ConditionConflictException if two values share a dimension
     */
    public Optional<String> resolve(List<String> tokens, EntryKind kind, Map<String, String> aliases) {
        SortedMap<Dimension, String> found = new TreeMap<>(Comparator.comparingInt(Dimension::getPriority));

        for (String token : tokens) {
            String resolved = aliases.getOrDefault(token, token);
            Optional<Dimension> dimension = DimensionRegistry.dimensionOf(resolved);
            if (dimension.isEmpty()) {
                log.trace("Skipping non-condition token [{}] for {} entry", token, kind.getCode());
                continue;
            }
            record(found, dimension.get(), resolved, kind);
        }

        if (found.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(CONDITION_JOINER.join(found.values()));
    }

    /**
     * Checks a stored condition string against the same rules {@link #resolve} enforces. A null string
     * means no conditions and is valid.
     *
     * @throws InapplicableConditionException for an unknown value or one not applicable to {@code kind}
     * @throws ConditionConflictException if two values share a dimension
     */
    public void validate(String conditions, EntryKind kind) {
        if (conditions == null) {
            return;
        }
        SortedMap<Dimension, String> found = new TreeMap<>(Comparator.comparingInt(Dimension::getPriority));
        for (String value : CONDITION_SPLITTER.split(conditions)) {
            Dimension dimension = DimensionRegistry.dimensionOf(value)
                .orElseThrow(() -> new InapplicableConditionException(value, kind.getCode(), null));
            record(found, dimension, value, kind);
        }
    }

    public String format(String conditions) {
        return EntryFormat.conditions(conditions);
    }

    private static void record(SortedMap<Dimension, String> found, Dimension dimension, String value, EntryKind kind) {
        if (!dimension.appliesTo(kind)) {
            throw new InapplicableConditionException(value, kind.getCode(), dimension.getLabel());
        }
        String existing = found.get(dimension);
        if (existing != null) {
            throw new ConditionConflictException(dimension.getLabel(), existing, value);
        }
        found.put(dimension, value);
    }
}
