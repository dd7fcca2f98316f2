package me.bechberger.logveil.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for profile inheritance and command line overrides on the raw config.
 */
public class ProfileConfigTest {

    private static List<PatternRuleConfig> rules(String... names) {
        List<PatternRuleConfig> result = new ArrayList<>();
        for (String name : names) {
            result.add(ProfileConfig.PARENT_MARKER.equals(name)
                ? new PatternRuleConfig(name, null, null)
                : new PatternRuleConfig(name, name + "_pattern", null));
        }
        return result;
    }

    private static List<String> names(List<PatternRuleConfig> rules) {
        return rules.stream().map(PatternRuleConfig::getName).collect(Collectors.toList());
    }

    @Test
    public void testNoParentMarker_ChildRulesFirst() {
        List<PatternRuleConfig> result = ProfileConfig.mergePatterns(rules("x", "y"), rules("a", "b"));

        assertEquals(List.of("x", "y", "a", "b"), names(result));
    }

    @Test
    public void testParentMarkerAtBeginning() {
        List<PatternRuleConfig> result = ProfileConfig.mergePatterns(rules("$PARENT", "x"), rules("a", "b"));

        assertEquals(List.of("a", "b", "x"), names(result));
    }

    @Test
    public void testParentMarkerInMiddle() {
        List<PatternRuleConfig> result = ProfileConfig.mergePatterns(rules("x", "$PARENT", "y"), rules("a", "b"));

        assertEquals(List.of("x", "a", "b", "y"), names(result));
    }

    @Test
    public void testSameNameReplacesParentRule() {
        List<PatternRuleConfig> child = rules("b");
        child.get(0).setPattern("override");

        List<PatternRuleConfig> result = ProfileConfig.mergePatterns(child, rules("a", "b", "c"));

        assertEquals(List.of("b", "a", "c"), names(result));
        assertEquals("override", result.get(0).getPattern());
    }

    @Test
    public void testMergeFillsUnsetFields() {
        ProfileConfig parent = new ProfileConfig();
        parent.setName("parent");
        parent.setDescription("parent description");
        parent.setRedactionMarker("[HIDDEN]");
        parent.getEntropy().setThreshold(3.0);
        parent.getEntropy().setMinLength(12);
        parent.setFilenamePatterns(new ArrayList<>(List.of("*.log", "*.txt")));
        parent.setKeyPaths(new ArrayList<>(List.of(new KeyPathConfig("user.email"), new KeyPathConfig("token"))));

        ProfileConfig child = new ProfileConfig();
        child.setDescription("child description");
        child.getEntropy().setMinLength(30);
        child.setFilenamePatterns(new ArrayList<>(List.of("*.txt", "*.out")));
        child.setKeyPaths(new ArrayList<>(List.of(new KeyPathConfig("token", "mask"))));

        child.mergeWith(parent);

        assertEquals("parent", child.getName());
        assertEquals("child description", child.getDescription());
        assertEquals("[HIDDEN]", child.getRedactionMarkerOrDefault());
        assertEquals(3.0, child.getEntropy().getThresholdOrDefault());
        assertEquals(30, child.getEntropy().getMinLengthOrDefault());
        assertEquals(List.of("*.txt", "*.out", "*.log"), child.getFilenamePatterns());
        assertEquals(2, child.getKeyPaths().size());
        assertEquals("mask", child.getKeyPaths().get(0).getAction());
        assertEquals("user.email", child.getKeyPaths().get(1).getPath());
    }

    @Test
    public void testMergeWithNullParentIsNoop() {
        ProfileConfig config = new ProfileConfig();
        config.setPatterns(rules("x"));

        config.mergeWith(null);

        assertEquals(List.of("x"), names(config.getPatterns()));
    }

    @Test
    public void testDefaultMarker() {
        assertEquals(ProfileConfig.DEFAULT_REDACTION_MARKER, new ProfileConfig().getRedactionMarkerOrDefault());
    }

    @Test
    public void testCliOptionsOverrideEntropy() {
        ProfileConfig config = new ProfileConfig();
        config.getEntropy().setThreshold(4.5);

        ProfileConfig.CliOptions options = new ProfileConfig.CliOptions();
        options.setDisableEntropy(true);
        options.setEntropyThreshold(3.5);
        options.setEntropyMinLength(8);
        config.applyCliOptions(options);

        assertFalse(config.getEntropy().isEnabledOrDefault());
        assertEquals(3.5, config.getEntropy().getThresholdOrDefault());
        assertEquals(8, config.getEntropy().getMinLengthOrDefault());
    }

    @Test
    public void testCliRegexesGoFirst() {
        ProfileConfig config = new ProfileConfig();
        config.setPatterns(rules("email"));

        ProfileConfig.CliOptions options = new ProfileConfig.CliOptions();
        options.setRedactionRegexes(List.of("foo\\d+", "bar"));
        config.applyCliOptions(options);

        assertEquals(List.of("cli_pattern_0", "cli_pattern_1", "email"), names(config.getPatterns()));
        assertEquals("foo\\d+", config.getPatterns().get(0).getPattern());
    }

    @Test
    public void testCliKeysAreTrimmedAndDeduplicated() {
        ProfileConfig config = new ProfileConfig();
        config.setKeyPaths(new ArrayList<>(List.of(new KeyPathConfig("user.email"))));

        ProfileConfig.CliOptions options = new ProfileConfig.CliOptions();
        options.setKeysToRedact(List.of(" user.email ", "env.*.password", " "));
        config.applyCliOptions(options);

        assertEquals(List.of("user.email", "env.*.password"),
            config.getKeyPaths().stream().map(KeyPathConfig::getPath).collect(Collectors.toList()));
    }

    @Test
    public void testNullCliOptionsIsNoop() {
        ProfileConfig config = new ProfileConfig();
        config.applyCliOptions(null);

        assertTrue(config.getPatterns().isEmpty());
        assertTrue(config.getEntropy().isEnabledOrDefault());
    }
}
