package me.bechberger.logveil.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * One pattern rule as written in a profile file.
 * <p>
 * The position of the rule in {@link ProfileConfig#getPatterns()} is its priority:
 * earlier rules consume their text before later rules scan the line.
 */
public class PatternRuleConfig {

    @JsonProperty("name")
    @JsonPropertyDescription("Unique rule identifier, reported in every trace the rule produces")
    private String name;

    @JsonProperty("pattern")
    @JsonPropertyDescription("Java regular expression")
    private String pattern;

    /**
     * Replacement template. May reference capture groups with {@code $1}, {@code ${name}}
     * or {@code \1}. Empty means {@code [REDACTED_<NAME>]}.
     */
    @JsonProperty("replacement")
    @JsonPropertyDescription("Replacement template, may reference capture groups ($1, ${name}, \\1)")
    private String replacement;

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("ignore_case")
    private boolean ignoreCase = false;

    @JsonProperty("description")
    private String description;

    public PatternRuleConfig() {
    }

    public PatternRuleConfig(String name, String pattern, String replacement) {
        this.name = name;
        this.pattern = pattern;
        this.replacement = replacement;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getPattern() { return pattern; }
    public void setPattern(String pattern) { this.pattern = pattern; }

    public String getReplacement() { return replacement; }
    public void setReplacement(String replacement) { this.replacement = replacement; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isIgnoreCase() { return ignoreCase; }
    public void setIgnoreCase(boolean ignoreCase) { this.ignoreCase = ignoreCase; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
