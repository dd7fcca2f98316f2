package me.bechberger.logveil.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A redaction profile as read from YAML/JSON, with parent inheritance support.
 *
 * <p>Pattern rule inheritance:</p>
 * <p>The child's rules come first and therefore win over the parent's rules. Parent rules
 * whose name the child redefines are dropped; all other parent rules are appended in their
 * original order. A child rule named <code>$PARENT</code> (with no pattern) marks the place
 * where the parent's rules are inserted instead:</p>
 *
 * <pre>
 * # parent.yaml
 * patterns:
 *   - name: jwt
 *   - name: email
 *
 * # child.yaml (default - child rules before parent rules)
 * patterns:
 *   - name: ticket_id      # Result: ticket_id, jwt, email
 *
 * # child.yaml (parent rules first)
 * patterns:
 *   - name: $PARENT
 *   - name: ticket_id      # Result: jwt, email, ticket_id
 * </pre>
 */
public class ProfileConfig {

    /** Marker for rule-list inheritance - replaced with the parent's rules */
    public static final String PARENT_MARKER = "$PARENT";

    public static final String DEFAULT_REDACTION_MARKER = "[REDACTED]";

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("parent")
    @JsonPropertyDescription("Preset name, file path, or 'none'")
    private String parent = "none";

    @JsonProperty("filename_patterns")
    @JsonPropertyDescription("File name globs this profile is chosen for with --profile auto")
    private List<String> filenamePatterns = new ArrayList<>();

    @JsonProperty("redaction_marker")
    @JsonPropertyDescription("Marker written by key-path rules without an explicit replacement")
    private String redactionMarker;

    @JsonProperty("patterns")
    private List<PatternRuleConfig> patterns = new ArrayList<>();

    @JsonProperty("entropy")
    private EntropyConfig entropy = new EntropyConfig();

    @JsonProperty("key_paths")
    private List<KeyPathConfig> keyPaths = new ArrayList<>();

    // Getters and setters
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getParent() { return parent; }
    public void setParent(String parent) { this.parent = parent; }

    public List<String> getFilenamePatterns() { return filenamePatterns; }
    public void setFilenamePatterns(List<String> filenamePatterns) { this.filenamePatterns = filenamePatterns; }

    public String getRedactionMarker() { return redactionMarker; }
    public void setRedactionMarker(String redactionMarker) { this.redactionMarker = redactionMarker; }

    @JsonIgnore
    public String getRedactionMarkerOrDefault() {
        return redactionMarker != null ? redactionMarker : DEFAULT_REDACTION_MARKER;
    }

    public List<PatternRuleConfig> getPatterns() { return patterns; }
    public void setPatterns(List<PatternRuleConfig> patterns) { this.patterns = patterns; }

    public EntropyConfig getEntropy() { return entropy; }
    public void setEntropy(EntropyConfig entropy) { this.entropy = entropy; }

    public List<KeyPathConfig> getKeyPaths() { return keyPaths; }
    public void setKeyPaths(List<KeyPathConfig> keyPaths) { this.keyPaths = keyPaths; }

    /**
     * Merge this profile with its parent. Child values override parent values.
     *
     * @param parentConfig The parent profile
     */
    public void mergeWith(ProfileConfig parentConfig) {
        if (parentConfig == null) return;

        if (name == null) name = parentConfig.getName();
        if (description == null) description = parentConfig.getDescription();
        if (redactionMarker == null) redactionMarker = parentConfig.getRedactionMarker();

        patterns = mergePatterns(patterns, parentConfig.getPatterns());

        if (entropy == null) {
            entropy = new EntropyConfig();
        }
        entropy.mergeWith(parentConfig.getEntropy());

        for (KeyPathConfig keyPath : parentConfig.getKeyPaths()) {
            boolean exists = keyPaths.stream()
                .anyMatch(k -> k.getPath() != null && k.getPath().equals(keyPath.getPath()));
            if (!exists) {
                keyPaths.add(keyPath);
            }
        }

        Set<String> globs = new LinkedHashSet<>(filenamePatterns);
        globs.addAll(parentConfig.getFilenamePatterns());
        filenamePatterns = new ArrayList<>(globs);
    }

    /**
     * Combine child and parent rule lists, honoring {@link #PARENT_MARKER}.
     */
    static List<PatternRuleConfig> mergePatterns(List<PatternRuleConfig> child, List<PatternRuleConfig> parent) {
        Set<String> childNames = child.stream()
            .map(PatternRuleConfig::getName)
            .filter(n -> n != null && !PARENT_MARKER.equals(n))
            .collect(Collectors.toSet());
        List<PatternRuleConfig> inherited = parent.stream()
            .filter(p -> !childNames.contains(p.getName()))
            .collect(Collectors.toList());

        boolean hasMarker = child.stream().anyMatch(p -> PARENT_MARKER.equals(p.getName()));
        List<PatternRuleConfig> result = new ArrayList<>();
        if (!hasMarker) {
            result.addAll(child);
            result.addAll(inherited);
            return result;
        }
        for (PatternRuleConfig rule : child) {
            if (PARENT_MARKER.equals(rule.getName())) {
                result.addAll(inherited);
            } else {
                result.add(rule);
            }
        }
        return result;
    }

    /**
     * Apply CLI options to override profile values
     */
    public void applyCliOptions(CliOptions cliOptions) {
        if (cliOptions == null) return;

        if (entropy == null) {
            entropy = new EntropyConfig();
        }
        if (cliOptions.isDisableEntropy()) {
            entropy.setEnabled(false);
        }
        if (cliOptions.getEntropyThreshold() != null) {
            entropy.setThreshold(cliOptions.getEntropyThreshold());
        }
        if (cliOptions.getEntropyMinLength() != null) {
            entropy.setMinLength(cliOptions.getEntropyMinLength());
        }

        // CLI regexes go first so they take precedence over the profile's rules
        if (cliOptions.getRedactionRegexes() != null && !cliOptions.getRedactionRegexes().isEmpty()) {
            List<PatternRuleConfig> cliRules = new ArrayList<>();
            for (String regex : cliOptions.getRedactionRegexes()) {
                cliRules.add(new PatternRuleConfig("cli_pattern_" + cliRules.size(), regex, null));
            }
            cliRules.addAll(patterns);
            patterns = cliRules;
        }

        if (cliOptions.getKeysToRedact() != null) {
            for (String key : cliOptions.getKeysToRedact()) {
                String path = key.trim();
                if (!path.isEmpty() && keyPaths.stream().noneMatch(k -> path.equals(k.getPath()))) {
                    keyPaths.add(new KeyPathConfig(path));
                }
            }
        }
    }

    /**
     * CLI options to be applied on top of a profile
     */
    public static class CliOptions {
        private boolean disableEntropy;
        private Double entropyThreshold;
        private Integer entropyMinLength;
        private List<String> redactionRegexes = new ArrayList<>();
        private List<String> keysToRedact = new ArrayList<>();

        public boolean isDisableEntropy() { return disableEntropy; }
        public void setDisableEntropy(boolean disableEntropy) { this.disableEntropy = disableEntropy; }

        public Double getEntropyThreshold() { return entropyThreshold; }
        public void setEntropyThreshold(Double entropyThreshold) { this.entropyThreshold = entropyThreshold; }

        public Integer getEntropyMinLength() { return entropyMinLength; }
        public void setEntropyMinLength(Integer entropyMinLength) { this.entropyMinLength = entropyMinLength; }

        public List<String> getRedactionRegexes() { return redactionRegexes; }
        public void setRedactionRegexes(List<String> redactionRegexes) { this.redactionRegexes = redactionRegexes; }

        public List<String> getKeysToRedact() { return keysToRedact; }
        public void setKeysToRedact(List<String> keysToRedact) { this.keysToRedact = keysToRedact; }
    }
}
