package me.bechberger.logveil.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one {@code redact} call: the sanitized text and what was changed.
 *
 * @param text   Sanitized text (structured units are re-serialized)
 * @param traces Redactions in detection order
 * @param notes  Input problems that were recovered from, e.g. a structured unit that did not parse
 */
public record SanitizedResult(
    @JsonProperty("text") String text,
    @JsonProperty("traces") List<RedactionTrace> traces,
    @JsonProperty("notes") List<String> notes
) {
    @JsonCreator
    public SanitizedResult {
        traces = traces == null ? List.of() : List.copyOf(traces);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public SanitizedResult(String text, List<RedactionTrace> traces) {
        this(text, traces, List.of());
    }

    @JsonIgnore
    public boolean isRedacted() {
        return !traces.isEmpty();
    }

    @JsonIgnore
    public boolean isDegraded() {
        return !notes.isEmpty();
    }
}
