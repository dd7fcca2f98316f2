package me.bechberger.logveil.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One piece of input for the engine: a line of a file or a structured document.
 *
 * @param source     File name or stream identifier, reported in traces
 * @param lineNumber 1-based line number of the unit within its source
 * @param text       The text to redact
 * @param format     {@link StructuredFormat#NONE} for plain text
 */
public record RedactionUnit(
    @JsonProperty("source") String source,
    @JsonProperty("line") int lineNumber,
    @JsonProperty("text") String text,
    @JsonProperty("structured") StructuredFormat format
) {
    public RedactionUnit {
        Objects.requireNonNull(text, "text");
        if (source == null) {
            source = "<input>";
        }
        if (format == null) {
            format = StructuredFormat.NONE;
        }
    }

    public static RedactionUnit line(String source, int lineNumber, String text) {
        return new RedactionUnit(source, lineNumber, text, StructuredFormat.NONE);
    }

    public static RedactionUnit structured(String source, int lineNumber, String text, StructuredFormat format) {
        return new RedactionUnit(source, lineNumber, text, format);
    }

    @JsonIgnore
    public boolean isStructured() {
        return format != StructuredFormat.NONE;
    }
}
