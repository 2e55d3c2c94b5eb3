package io.healthlog.processing.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.healthlog.data.entry.EntryCodec;
import io.healthlog.data.entry.ParsedEntry;
import io.healthlog.processing.alias.AliasResolver;
import io.healthlog.processing.alias.ClasspathAliasSource;
import io.healthlog.processing.condition.ConditionResolver;
import io.healthlog.processing.validation.EntryValidator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExportRoundTripTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 10, 10, 15, 30);

    private static EntryParser parser;
    private static EntryValidator validator;

    @BeforeAll
    public static void setup() {
        ConditionResolver conditionResolver = new ConditionResolver();
        parser = new EntryParser(new AliasResolver(new ClasspathAliasSource()), conditionResolver);
        validator = new EntryValidator(conditionResolver);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "squat 100 3x5",
        "bp 80 5,5,8 rpe8.5 @gym",
        "pullups 3x10 @yesterday",
        "hr 58 resting postprandial",
        "hrv 45 sdnn morning @oura",
        "temp 37.2 oral pp @06:40",
        "weight 80 15%",
        "bw 79.4",
        "cp 45 morning @2026-01-02"
    })
    public void exportThenImport_preservesEntry(String text) {
        ParsedEntry parsed = parser.parse(text, NOW);

        Map<String, Object> exported = EntryCodec.export(parsed);
        ParsedEntry imported = EntryCodec.fromExport(exported);

        assertEquals(parsed.displayString(), imported.displayString());
        assertEquals(parsed, imported);
        assertEquals(parsed.kind().getCode(), exported.get("type"));
        assertTrue(exported.containsKey("tags"));
        validator.validate(imported);
    }

    @ParameterizedTest
    @ValueSource(strings = { "deadlift 150 1x5 8", "hr 60 rest @oura", "temp 36.6 ir" })
    public void jsonRoundTrip_preservesEntry(String text) throws JsonProcessingException {
        ParsedEntry parsed = parser.parse(text, NOW);
        assertEquals(parsed, EntryCodec.fromJson(EntryCodec.toJson(parsed)));
    }
}
