package io.healthlog.processing.alias;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the live alias table. Readers take the current snapshot without locking; {@link #reload()}
 * builds a complete replacement table before swapping it in, so a reader never sees a partial update.
 */
@Component
public class AliasResolver {

    private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

    private final AliasSource source;
    private final AtomicReference<AliasTable> table;

    @Autowired
    public AliasResolver(AliasSource source) {
        this.source = source;
        AliasTable initial = AliasTable.of(1, source.load());
        this.table = new AtomicReference<>(initial);
        log.info("Loaded {} aliases from {}", initial.size(), source.describe());
    }

    public AliasTable snapshot() {
        return table.get();
    }

    public long version() {
        return table.get().version();
    }

    public String resolve(AliasCategory category, String term) {
        return table.get().resolve(category, term);
    }

    public Map<String, String> categoryMap(AliasCategory category) {
        return table.get().category(category);
    }

    /**
     * Re-reads the source and replaces the live table. If the source fails, the current table stays
     * in place and the failure propagates.
     */
    public synchronized AliasTable reload() {
        AliasTable current = table.get();
        AliasTable next = AliasTable.of(current.version() + 1, source.load());
        table.set(next);
        log.info("Reloaded {} aliases from {} (version {})", next.size(), source.describe(), next.version());
        return next;
    }

    /**
     * Case-insensitive substring search over abbreviations and canonical terms of every category.
     */
    public List<AliasMatch> search(String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        AliasTable current = table.get();
        ImmutableList.Builder<AliasMatch> matches = ImmutableList.builder();
        for (AliasCategory category : AliasCategory.values()) {
            aliases(current, category).forEach((abbreviation, canonical) -> {
                if (abbreviation.contains(needle) || canonical.toLowerCase(Locale.ROOT).contains(needle)) {
                    matches.add(new AliasMatch(category, abbreviation, canonical));
                }
            });
        }
        return matches.build();
    }

    /**
     * @return the category's aliases sorted by abbreviation
     */
    public SortedMap<String, String> aliases(AliasCategory category) {
        return aliases(table.get(), category);
    }

    private static SortedMap<String, String> aliases(AliasTable snapshot, AliasCategory category) {
        return ImmutableSortedMap.copyOf(snapshot.category(category));
    }
}
