package me.bechberger.logveil.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Entropy fallback settings.
 * <p>
 * Unset fields are inherited from the parent profile; whatever is still unset after
 * inheritance falls back to the defaults below.
 */
public class EntropyConfig {

    public static final boolean DEFAULT_ENABLED = true;
    public static final double DEFAULT_THRESHOLD = 4.5;
    public static final int DEFAULT_MIN_LENGTH = 20;

    @JsonProperty("enabled")
    private Boolean enabled;

    @JsonProperty("threshold")
    @JsonPropertyDescription("Minimum Shannon entropy in bits per symbol for a token to count as a secret")
    private Double threshold;

    @JsonProperty("min_length")
    @JsonPropertyDescription("Tokens shorter than this are never scored")
    private Integer minLength;

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }

    public Double getThreshold() { return threshold; }
    public void setThreshold(Double threshold) { this.threshold = threshold; }

    public Integer getMinLength() { return minLength; }
    public void setMinLength(Integer minLength) { this.minLength = minLength; }

    @JsonIgnore
    public boolean isEnabledOrDefault() {
        return enabled != null ? enabled : DEFAULT_ENABLED;
    }

    @JsonIgnore
    public double getThresholdOrDefault() {
        return threshold != null ? threshold : DEFAULT_THRESHOLD;
    }

    @JsonIgnore
    public int getMinLengthOrDefault() {
        return minLength != null ? minLength : DEFAULT_MIN_LENGTH;
    }

    /**
     * Fill every unset field from the parent.
     */
    public void mergeWith(EntropyConfig parent) {
        if (parent == null) return;
        if (enabled == null) enabled = parent.getEnabled();
        if (threshold == null) threshold = parent.getThreshold();
        if (minLength == null) minLength = parent.getMinLength();
    }
}
