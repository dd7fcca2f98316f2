package me.bechberger.logveil.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;

/**
 * Audit record of a single redaction.
 *
 * @param source        File name or stream identifier
 * @param lineNumber    1-based line number of the unit
 * @param path          Key path inside a structured unit, null for plain text
 * @param sequence      Detection order within the unit, starting at 0
 * @param originalValue The value that was removed
 * @param redactedValue What was written in its place
 * @param rule          Rule name, {@code entropy}, or {@code key_path:<path>}
 * @param reason        Detector that fired
 * @param entropyScore  Score in bits per symbol, entropy detections only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"source", "line", "path", "sequence", "original_value", "redacted_value", "rule", "reason",
    "entropy_score"})
public record RedactionTrace(
    @JsonProperty("source") String source,
    @JsonProperty("line") int lineNumber,
    @JsonProperty("path") @Nullable String path,
    @JsonProperty("sequence") int sequence,
    @JsonProperty("original_value") String originalValue,
    @JsonProperty("redacted_value") String redactedValue,
    @JsonProperty("rule") String rule,
    @JsonProperty("reason") TraceReason reason,
    @JsonProperty("entropy_score") @Nullable Double entropyScore
) {

    /** Total order of the audit log: source, then line, then detection order */
    public static final Comparator<RedactionTrace> AUDIT_ORDER = Comparator
        .comparing(RedactionTrace::source)
        .thenComparingInt(RedactionTrace::lineNumber)
        .thenComparingInt(RedactionTrace::sequence);

    /**
     * Line number for text units, key path for structured units.
     */
    @JsonIgnore
    public String location() {
        return path != null ? path : Integer.toString(lineNumber);
    }
}
