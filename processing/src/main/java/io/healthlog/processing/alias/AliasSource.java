package io.healthlog.processing.alias;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Supplies the raw alias configuration: category key to (abbreviation to canonical term).
 */
public interface AliasSource {

    /**
     * Reads the current alias configuration. A source with nothing configured returns an empty map.
     *
     * @throws UncheckedIOException if the backing configuration exists but cannot be read
     */
    Map<String, Map<String, String>> load();

    /**
     * Short human-readable description used in log lines.
     */
    String describe();
}
