package io.healthlog.data.entry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * Structured export form handed to storage. Every entry exports as a flat mapping with a {@code type}
 * discriminator, snake_case field keys, an ISO-8601 {@code timestamp} and a {@code tags} key that is
 * always present (null when the entry has no tags).
 *
 * <p>Importing does not re-validate conditions; callers reading from storage should run the result
 * through the processing module's entry validator.</p>
 */
public final class EntryCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<Map<String, Object>> EXPORT_TYPE = new TypeReference<>() {};

    private EntryCodec() {
    }

    public static Map<String, Object> export(ParsedEntry entry) {
        try {
            return MAPPER.readValue(toJson(entry), EXPORT_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not export " + entry.kind().getCode() + " entry", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the mapping has an unknown type or fields that do not match it
     */
    public static ParsedEntry fromExport(Map<String, Object> exported) {
        return MAPPER.convertValue(exported, ParsedEntry.class);
    }

    public static String toJson(ParsedEntry entry) throws JsonProcessingException {
        return MAPPER.writerFor(ParsedEntry.class).writeValueAsString(entry);
    }

    public static ParsedEntry fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, ParsedEntry.class);
    }
}
