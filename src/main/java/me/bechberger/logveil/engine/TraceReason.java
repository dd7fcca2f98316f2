package me.bechberger.logveil.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a value was redacted.
 */
public enum TraceReason {
    PATTERN_MATCH("pattern_match"),
    ENTROPY_DETECTION("entropy_detection"),
    KEY_PATH("key_path");

    private final String code;

    TraceReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
