package me.bechberger.logveil.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Key-path rule for structured input, e.g. {@code user.email} or {@code env.*.password}.
 */
public class KeyPathConfig {

    @JsonProperty("path")
    @JsonPropertyDescription("Dot-separated key path from the document root; '*' matches any single key")
    private String path;

    @JsonProperty("action")
    @JsonPropertyDescription("redact (replace with marker), mask (keep outer characters) or remove (drop the field)")
    private String action = "redact";

    @JsonProperty("replacement")
    private String replacement;

    public KeyPathConfig() {
    }

    public KeyPathConfig(String path) {
        this.path = path;
    }

    public KeyPathConfig(String path, String action) {
        this.path = path;
        this.action = action;
    }

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public String getReplacement() { return replacement; }
    public void setReplacement(String replacement) { this.replacement = replacement; }
}
