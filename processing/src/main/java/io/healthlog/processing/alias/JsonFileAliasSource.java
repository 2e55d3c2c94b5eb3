package io.healthlog.processing.alias;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Alias configuration kept in a user-editable JSON file of the form
 * {@code {"exercises": {"sq": "squat"}, "conditions": {...}}}.
 *
 * <p>This is the only writer of the file. Edits take effect in a running resolver after
 * {@link AliasResolver#reload()}.</p>
 */
public class JsonFileAliasSource implements AliasSource {

    private static final Logger log = LoggerFactory.getLogger(JsonFileAliasSource.class);

    static final TypeReference<Map<String, Map<String, String>>> ALIAS_FILE_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path path;

    public JsonFileAliasSource(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public Map<String, Map<String, String>> load() {
        if (!Files.exists(path)) {
            log.warn("Alias file {} does not exist, no aliases loaded", path);
            return Map.of();
        }
        try {
            return objectMapper.readValue(path.toFile(), ALIAS_FILE_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load aliases from " + path, e);
        }
    }

    @Override
    public String describe() {
        return path.toString();
    }

    /**
     * Adds a new alias. Existing aliases are never overwritten.
     *
     * @throws IllegalArgumentException if {@code abbreviation} is already defined in {@code category}
     */
    public synchronized void addAlias(AliasCategory category, String abbreviation, String canonical) throws IOException {
        String key = abbreviation.toLowerCase(Locale.ROOT);
        Map<String, Map<String, String>> aliases = readForUpdate();
        Map<String, String> categoryAliases = aliases.computeIfAbsent(category.getKey(), ignored -> new TreeMap<>());
        String existing = categoryAliases.get(key);
        if (existing != null) {
            throw new IllegalArgumentException(
                "Alias '" + key + "' already exists in " + category.getKey() + " (maps to '" + existing + "')");
        }
        categoryAliases.put(key, canonical);
        write(aliases);
        log.info("Added alias {} -> {} to {}", key, canonical, category.getKey());
    }

    /**
     * @return whether an alias was removed
     */
    public synchronized boolean removeAlias(AliasCategory category, String abbreviation) throws IOException {
        String key = abbreviation.toLowerCase(Locale.ROOT);
        Map<String, Map<String, String>> aliases = readForUpdate();
        Map<String, String> categoryAliases = aliases.get(category.getKey());
        if (categoryAliases == null || categoryAliases.remove(key) == null) {
            return false;
        }
        write(aliases);
        log.info("Removed alias {} from {}", key, category.getKey());
        return true;
    }

    private Map<String, Map<String, String>> readForUpdate() throws IOException {
        Map<String, Map<String, String>> copy = new TreeMap<>();
        if (!Files.exists(path)) {
            return copy;
        }
        Map<String, Map<String, String>> stored = objectMapper.readValue(path.toFile(), ALIAS_FILE_TYPE);
        stored.forEach((category, aliases) -> copy.put(category, aliases == null ? new TreeMap<>() : new TreeMap<>(aliases)));
        return copy;
    }

    // write beside the target then move, so a concurrent load never reads a half-written file
    private void write(Map<String, Map<String, String>> aliases) throws IOException {
        Path directory = path.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path staging = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(staging.toFile(), aliases);
            Files.move(staging, path, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(staging);
        }
    }
}
