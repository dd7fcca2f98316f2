package me.bechberger.logveil;

import me.bechberger.logveil.ConfigLoader.ConfigurationException;
import me.bechberger.logveil.config.PatternRuleConfig;
import me.bechberger.logveil.config.ProfileConfig;
import me.bechberger.logveil.engine.PatternRule;
import me.bechberger.logveil.engine.Profile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for profile loading, inheritance and error reporting.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static List<String> ruleNames(ProfileConfig config) {
        return config.getPatterns().stream().map(PatternRuleConfig::getName).toList();
    }

    @Test
    public void testLoadDefaultPreset() throws IOException {
        ProfileConfig config = new ConfigLoader().load("default");

        assertEquals("none", config.getParent(), "Default preset should have no parent");
        assertEquals(16, config.getPatterns().size());
        assertEquals("private_key", config.getPatterns().get(0).getName());
        assertEquals("api_key", config.getPatterns().get(15).getName());
        assertTrue(config.getEntropy().isEnabledOrDefault());
    }

    @Test
    public void testLoadNone() throws IOException {
        ProfileConfig config = new ConfigLoader().load("none");

        assertTrue(config.getPatterns().isEmpty());
        assertEquals("none", config.getParent());
    }

    @Test
    public void testChildRuleReplacesParentRuleOfSameName() throws IOException {
        ProfileConfig config = new ConfigLoader().load("nginx");

        List<String> names = ruleNames(config);
        assertEquals(17, names.size());
        assertEquals(List.of("quoted_email", "password", "private_key"), names.subList(0, 3));
        assertEquals(1, names.stream().filter("password"::equals).count());
        assertEquals(16, config.getEntropy().getMinLengthOrDefault());
        assertTrue(config.getEntropy().isEnabledOrDefault(), "enabled is inherited from default");
    }

    @Test
    public void testParentMarkerPlacesParentRules() throws IOException {
        ProfileConfig config = new ConfigLoader().load("application");

        List<String> names = ruleNames(config);
        assertEquals(18, names.size());
        assertEquals(List.of("session_id", "csrf_token", "private_key"), names.subList(0, 3));
        assertFalse(names.contains(ProfileConfig.PARENT_MARKER));
    }

    @ParameterizedTest
    @EnumSource(Preset.class)
    public void testEveryPresetCompiles(Preset preset) throws IOException {
        Profile profile = new ConfigLoader().loadProfile(preset.getName(), null);

        assertEquals(preset.getName(), profile.getName());
        assertTrue(profile.getRules().size() >= 16);
    }

    @Test
    public void testProfileFileWithParent() throws IOException {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, """
            name: custom
            parent: default
            patterns:
              - name: order_id
                pattern: 'ORD-\\d+'
                replacement: '[REDACTED_ORDER]'
            key_paths:
              - path: user.email
              - path: card
                action: mask
            entropy:
              enabled: false
            """);

        Profile profile = new ConfigLoader().loadProfile(file.toString(), null);

        assertEquals("custom", profile.getName());
        assertEquals(17, profile.getRules().size());
        assertEquals("order_id", profile.getRules().getRules().get(0).getName());
        assertEquals(2, profile.getKeyPaths().getRules().size());
        assertFalse(profile.getEntropy().isEnabled());
    }

    @Test
    public void testFileWithoutNameIsNamedAfterSource() throws IOException {
        Path file = tempDir.resolve("unnamed.yaml");
        Files.writeString(file, """
            patterns:
              - name: digits
                pattern: '\\d+'
            """);

        Profile profile = new ConfigLoader().loadProfile(file.toString(), null);

        assertEquals(file.toString(), profile.getName());
        assertEquals(1, profile.getRules().size());
    }

    @Test
    public void testCliOptionsOverrideProfile() throws IOException {
        ProfileConfig.CliOptions options = new ProfileConfig.CliOptions();
        options.setDisableEntropy(true);
        options.setRedactionRegexes(List.of("ticket-\\d+", "order-\\d+"));
        options.setKeysToRedact(List.of("user.email", " ", "user.email"));

        Profile profile = new ConfigLoader().loadProfile("default", options);

        assertFalse(profile.getEntropy().isEnabled());
        List<PatternRule> rules = profile.getRules().getRules();
        assertEquals(18, rules.size());
        assertEquals("cli_pattern_0", rules.get(0).getName());
        assertEquals("cli_pattern_1", rules.get(1).getName());
        assertEquals("[REDACTED_CLI_PATTERN_0]", rules.get(0).getReplacementTemplate());
        assertEquals(1, profile.getKeyPaths().getRules().size());
    }

    @Test
    public void testCliOverridesDoNotLeakIntoNextLoad() throws IOException {
        ConfigLoader loader = new ConfigLoader();
        ProfileConfig.CliOptions options = new ProfileConfig.CliOptions();
        options.setRedactionRegexes(List.of("x+"));

        loader.loadProfile("default", options);
        Profile plain = loader.loadProfile("default", null);

        assertEquals(16, plain.getRules().size());
    }

    @Test
    public void testEntropyOverrides() throws IOException {
        ProfileConfig.CliOptions options = new ProfileConfig.CliOptions();
        options.setEntropyThreshold(3.5);
        options.setEntropyMinLength(8);

        Profile profile = new ConfigLoader().loadProfile("default", options);

        assertEquals(3.5, profile.getEntropy().getThreshold());
        assertEquals(8, profile.getEntropy().getMinLength());
    }

    @ParameterizedTest
    @CsvSource({
        "site.access.log, NGINX",
        "nginx-proxy.log, NGINX",
        "app.log, DEFAULT",
        "my-docker-app.log, DOCKER",
        "container-42.log, DOCKER",
        "cloudtrail-2024.json, CLOUDTRAIL",
        "production.log, APPLICATION",
        "events.json, DEFAULT"
    })
    public void testSelectPreset(String fileName, Preset expected) throws IOException {
        assertEquals(expected, new ConfigLoader().selectPreset(tempDir.resolve(fileName)));
    }

    @Test
    public void testSummarizePresets() throws IOException {
        List<ConfigLoader.PresetSummary> summaries = new ConfigLoader().summarizePresets();

        assertThat(summaries).extracting(ConfigLoader.PresetSummary::preset).containsExactly(Preset.values());
        assertEquals(16, summaries.get(0).patternCount());
        ConfigLoader.PresetSummary docker = summaries.get(Preset.DOCKER.ordinal());
        assertEquals(4, docker.keyPathCount());
        assertThat(docker.filenamePatterns()).contains("*docker*.log");
    }

    @Test
    public void testLoadRawYaml() throws IOException {
        String yaml = new ConfigLoader().loadRawYaml("nginx");

        assertThat(yaml).contains("name: nginx").contains("parent: default");
    }

    @Test
    public void testMissingFile() {
        Path missing = tempDir.resolve("nonexistent.yaml");

        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> new ConfigLoader().load(missing.toString()));

        assertThat(exception.getMessage()).contains("Profile file not found").contains("generate-config");
    }

    @Test
    public void testEmptyFile() throws IOException {
        Path empty = Files.createFile(tempDir.resolve("empty.yaml"));

        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> new ConfigLoader().load(empty.toString()));

        assertThat(exception.getMessage()).contains("empty").contains("preset");
    }

    @Test
    public void testUnknownProperty() throws IOException {
        Path file = tempDir.resolve("typo.yaml");
        Files.writeString(file, """
            name: typo
            patterns: []
            entropie:
              enabled: false
            """);

        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> new ConfigLoader().load(file.toString()));

        assertThat(exception.getMessage())
            .contains("Unknown property: 'entropie'")
            .contains("generate-schema");
    }

    @Test
    public void testInvalidYamlSyntax() throws IOException {
        Path file = tempDir.resolve("invalid.yaml");
        Files.writeString(file, """
            name: broken
            patterns:
              - name: x
                pattern: '[a-z'
               bad
            """);

        assertThrows(ConfigurationException.class, () -> new ConfigLoader().load(file.toString()));
    }

    @Test
    public void testCircularParents() throws IOException {
        Path a = tempDir.resolve("a.yaml");
        Path b = tempDir.resolve("b.yaml");
        Files.writeString(a, "name: a\nparent: " + b + "\n");
        Files.writeString(b, "name: b\nparent: " + a + "\n");

        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> new ConfigLoader().load(a.toString()));

        assertThat(exception.getMessage()).startsWith("Circular dependency");
    }

    @Test
    public void testMissingParent() throws IOException {
        Path file = tempDir.resolve("orphan.yaml");
        Files.writeString(file, "name: orphan\nparent: " + tempDir.resolve("gone.yaml") + "\n");

        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> new ConfigLoader().load(file.toString()));

        assertThat(exception.getMessage()).contains("Failed to load parent profile").contains("Referenced from");
    }

    @Test
    public void testInvalidRegexIsReportedWhenCompiling() throws IOException {
        Path file = tempDir.resolve("regex.yaml");
        Files.writeString(file, """
            name: regex
            patterns:
              - name: broken
                pattern: '[a-z'
            """);

        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> new ConfigLoader().loadProfile(file.toString(), null));

        assertThat(exception.getMessage()).contains("Invalid regular expression in pattern rule 'broken'");
    }
}
