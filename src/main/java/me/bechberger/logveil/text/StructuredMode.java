package me.bechberger.logveil.text;

import java.util.Locale;

/**
 * How a file is split into units.
 */
public enum StructuredMode {
    /** By file extension, and JSON objects on single lines of log files */
    AUTO,
    /** Every line is plain text */
    NONE,
    /** JSON documents or JSON Lines */
    JSON,
    /** One (possibly multi-document) YAML file */
    YAML,
    /** One XML document */
    XML;

    public static StructuredMode fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown structured mode: " + value + " (expected auto, none, json, yaml or xml)", e);
        }
    }
}
