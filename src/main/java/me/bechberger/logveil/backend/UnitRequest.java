package me.bechberger.logveil.backend;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionUnit;
import me.bechberger.logveil.engine.StructuredFormat;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Request of the {@code redact-unit} protocol: the fields of a {@link RedactionUnit} plus,
 * optionally, the resolved profile to redact it with.
 * <p>
 * Without a profile the receiving engine uses the profile given on its own command line.
 *
 * @param profile Resolved profile configuration as produced by {@link Profile#toConfigTree()}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnitRequest(
    @JsonProperty("source") String source,
    @JsonProperty("line") int lineNumber,
    @JsonProperty("text") String text,
    @JsonProperty("structured") StructuredFormat format,
    @JsonProperty("profile") @Nullable JsonNode profile
) {
    public UnitRequest {
        Objects.requireNonNull(text, "text");
    }

    public static UnitRequest of(RedactionUnit unit, @Nullable Profile profile) {
        return new UnitRequest(unit.source(), unit.lineNumber(), unit.text(), unit.format(),
            profile == null ? null : profile.toConfigTree());
    }

    public RedactionUnit toUnit() {
        return new RedactionUnit(source, lineNumber, text, format);
    }
}
