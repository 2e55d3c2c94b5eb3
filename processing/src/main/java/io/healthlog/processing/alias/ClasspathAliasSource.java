package io.healthlog.processing.alias;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Read-only alias configuration bundled on the classpath. Used when no alias file is configured.
 */
public class ClasspathAliasSource implements AliasSource {

    private static final Logger log = LoggerFactory.getLogger(ClasspathAliasSource.class);

    public static final String DEFAULT_RESOURCE = "aliases.json";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String resource;

    public ClasspathAliasSource() {
        this(DEFAULT_RESOURCE);
    }

    public ClasspathAliasSource(String resource) {
        this.resource = resource;
    }

    @Override
    public Map<String, Map<String, String>> load() {
        try (InputStream in = ClasspathAliasSource.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Alias resource {} not found on classpath, no aliases loaded", resource);
                return Map.of();
            }
            return objectMapper.readValue(in, JsonFileAliasSource.ALIAS_FILE_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load aliases from classpath:" + resource, e);
        }
    }

    @Override
    public String describe() {
        return "classpath:" + resource;
    }
}
