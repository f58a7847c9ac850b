package io.jobs4j.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads annotation option literals into engine option values.
 */
public final class OptionValues {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private OptionValues() {
    }

    /**
     * Parses {@code literal} as JSON ({@code "5"} -> 5, {@code "true"} -> true, {@code "{\"a\":1}"} -> map).
     * Text that is not valid JSON is returned unchanged, so {@code "nightly"} stays a string.
     *
     * @return parsed value, or {@code null} for the JSON literal {@code null}
     */
    public static Object parse(String literal) {
        if (literal == null) {
            return null;
        }
        try {
            return MAPPER.readValue(literal, Object.class);
        } catch (JsonProcessingException notJson) {
            return literal;
        }
    }
}
