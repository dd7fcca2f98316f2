package me.bechberger.logveil.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the text of a unit should be interpreted.
 */
public enum StructuredFormat {
    /** Plain line of text */
    NONE,
    /** JSON object or array (whole document or one JSON Lines record) */
    JSON,
    /** YAML document */
    YAML,
    /** XML document; key paths are element names starting with the root element */
    XML;

    @JsonCreator
    public static StructuredFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown structured format: " + value + " (expected none, json, yaml or xml)", e);
        }
    }

    @JsonValue
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
