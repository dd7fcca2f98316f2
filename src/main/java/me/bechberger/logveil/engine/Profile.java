package me.bechberger.logveil.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.bechberger.logveil.ConfigLoader.ConfigurationException;
import me.bechberger.logveil.config.KeyPathConfig;
import me.bechberger.logveil.config.ProfileConfig;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A compiled, immutable redaction profile.
 * <p>
 * Built by {@link #compile(ProfileConfig)}, which performs every validation up front. A profile
 * that fails to compile never exists, so the engine has no error state of its own.
 * The revision is assigned by {@link ProfileHolder} when the profile is installed.
 * <p>
 * A profile remembers the resolved configuration it was compiled from, so an external engine
 * can be handed exactly the same rules ({@link #toConfigTree()}).
 */
public final class Profile {

    private static final ObjectMapper CONFIG_MAPPER = new ObjectMapper();

    private final String name;
    private final @Nullable String description;
    private final PatternRuleSet rules;
    private final EntropyAnalyzer entropy;
    private final StructuredPathRedactor keyPaths;
    private final String redactionMarker;
    private final List<String> filenamePatterns;
    private final long revision;
    private final ObjectNode config;

    private Profile(String name, @Nullable String description, PatternRuleSet rules, EntropyAnalyzer entropy,
                    StructuredPathRedactor keyPaths, String redactionMarker, List<String> filenamePatterns,
                    long revision, ObjectNode config) {
        this.name = name;
        this.description = description;
        this.rules = rules;
        this.entropy = entropy;
        this.keyPaths = keyPaths;
        this.redactionMarker = redactionMarker;
        this.filenamePatterns = List.copyOf(filenamePatterns);
        this.revision = revision;
        this.config = config;
    }

    /**
     * Compile a resolved profile configuration (parents already merged).
     *
     * @throws ConfigurationException if any rule, key path or entropy setting is invalid
     */
    public static Profile compile(ProfileConfig config) throws ConfigurationException {
        String name = config.getName() != null ? config.getName() : "custom";
        PatternRuleSet rules = PatternRuleSet.compile(config.getPatterns());
        EntropyAnalyzer entropy = EntropyAnalyzer.fromConfig(config.getEntropy());

        String marker = config.getRedactionMarkerOrDefault();
        List<KeyPathRule> keyPathRules = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (KeyPathConfig keyPath : config.getKeyPaths()) {
            KeyPathRule rule = KeyPathRule.compile(keyPath, marker);
            if (!seen.add(rule.getPath())) {
                throw new ConfigurationException(
                    "Duplicate key path: '" + rule.getPath() + "' in profile '" + name + "'\n" +
                    "Each key path may only be listed once."
                );
            }
            keyPathRules.add(rule);
        }

        return new Profile(name, config.getDescription(), rules, entropy, new StructuredPathRedactor(keyPathRules),
            marker, config.getFilenamePatterns(), 0, snapshot(config, name));
    }

    /**
     * The configuration as a standalone tree: parents are already merged in, so its parent is {@code none}.
     */
    private static ObjectNode snapshot(ProfileConfig config, String name) {
        ObjectNode tree = CONFIG_MAPPER.valueToTree(config);
        tree.put("name", name);
        tree.put("parent", "none");
        return tree;
    }

    /**
     * Profile without any rule; redaction is the identity.
     */
    public static Profile empty(String name) {
        ProfileConfig config = new ProfileConfig();
        config.getEntropy().setEnabled(false);
        return new Profile(name, null, PatternRuleSet.EMPTY, EntropyAnalyzer.DISABLED,
            new StructuredPathRedactor(List.of()), ProfileConfig.DEFAULT_REDACTION_MARKER, List.of(), 0,
            snapshot(config, name));
    }

    Profile withRevision(long revision) {
        return new Profile(name, description, rules, entropy, keyPaths, redactionMarker, filenamePatterns, revision,
            config);
    }

    public String getName() { return name; }

    public @Nullable String getDescription() { return description; }

    public PatternRuleSet getRules() { return rules; }

    public EntropyAnalyzer getEntropy() { return entropy; }

    public StructuredPathRedactor getKeyPaths() { return keyPaths; }

    public String getRedactionMarker() { return redactionMarker; }

    public List<String> getFilenamePatterns() { return filenamePatterns; }

    public long getRevision() { return revision; }

    /**
     * A copy of the resolved configuration; {@link #compile(ProfileConfig)} of it gives an equivalent profile.
     */
    public JsonNode toConfigTree() {
        return config.deepCopy();
    }

    @Override
    public String toString() {
        return "Profile{" + name + " rev " + revision + ", " + rules.enabledCount() + "/" + rules.size() +
            " rules, " + keyPaths.getRules().size() + " key paths, " + entropy + "}";
    }
}
