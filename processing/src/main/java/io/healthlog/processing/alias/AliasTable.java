package io.healthlog.processing.alias;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of every alias category. A new table is built on each reload, and a parse
 * holds one table for its whole duration.
 */
public final class AliasTable {

    private static final Logger log = LoggerFactory.getLogger(AliasTable.class);

    private final long version;
    private final ImmutableMap<AliasCategory, ImmutableMap<String, String>> categories;

    private AliasTable(long version, ImmutableMap<AliasCategory, ImmutableMap<String, String>> categories) {
        this.version = version;
        this.categories = categories;
    }

    public static AliasTable empty() {
        return of(0, Map.of());
    }

    /**
     * Builds a table from raw configuration. Abbreviations are lowercased since input is lowercased
     * before lookup. Unknown category keys are logged and skipped; missing categories are empty.
     */
    public static AliasTable of(long version, Map<String, Map<String, String>> raw) {
        EnumMap<AliasCategory, ImmutableMap<String, String>> byCategory = new EnumMap<>(AliasCategory.class);
        for (AliasCategory category : AliasCategory.values()) {
            byCategory.put(category, ImmutableMap.of());
        }
        raw.forEach((key, aliases) -> {
            Optional<AliasCategory> category = AliasCategory.lookup(key);
            if (category.isEmpty()) {
                log.warn("Skipping unknown alias category '{}'", key);
                return;
            }
            ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
            if (aliases != null) {
                aliases.forEach((abbreviation, canonical) -> {
                    if (canonical == null) {
                        log.warn("Skipping alias '{}' in category '{}': no canonical term", abbreviation, key);
                        return;
                    }
                    builder.put(abbreviation.toLowerCase(Locale.ROOT), canonical);
                });
            }
            byCategory.put(category.get(), builder.buildKeepingLast());
        });
        return new AliasTable(version, Maps.immutableEnumMap(byCategory));
    }

    public long version() {
        return version;
    }

    public Map<String, String> category(AliasCategory category) {
        return categories.get(category);
    }

    /**
     * @return the canonical term for {@code term}, or {@code term} itself when it has no alias
     */
    public String resolve(AliasCategory category, String term) {
        return categories.get(category).getOrDefault(term, term);
    }

    public int size() {
        return categories.values().stream().mapToInt(Map::size).sum();
    }
}
