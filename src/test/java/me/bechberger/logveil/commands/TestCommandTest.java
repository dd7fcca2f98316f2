package me.bechberger.logveil.commands;

import me.bechberger.logveil.Main;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TestCommand (also used as validate command).
 */
class TestCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine cmd;
    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;

    @BeforeEach
    void setUp() {
        cmd = new CommandLine(new TestCommand());
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        cmd.setOut(new PrintWriter(outContent, true));
        cmd.setErr(new PrintWriter(errContent, true));
    }

    private String stdout() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testValidateDefaultProfile() {
        int exitCode = cmd.execute();

        assertEquals(0, exitCode);
        assertThat(stdout())
            .contains("Profile Validation")
            .contains("Profile: default")
            .contains("✓ Profile is valid")
            .contains("Pattern rules: 16 (16 enabled)")
            .contains("Key paths: 0");
    }

    @Test
    void testValueIsRedacted() {
        int exitCode = cmd.execute("--value", "login bob@example.com from 10.0.0.1");

        assertEquals(0, exitCode);
        assertThat(stdout())
            .contains("Profile Test Results")
            .contains("Will be REDACTED to: \"login [REDACTED_EMAIL] from [REDACTED_IP]\"")
            .contains("Redactions:")
            .contains("email")
            .contains("ip_address");
    }

    @Test
    void testValueIsKept() {
        int exitCode = cmd.execute("--value", "GET /health 200");

        assertEquals(0, exitCode);
        assertThat(stdout()).contains("Will be KEPT as-is");
    }

    @Test
    void testStructuredValueWithKeyPath() {
        int exitCode = cmd.execute("--value", "{\"user\":{\"email\":\"bob\"}}", "--structured", "json",
            "--keys-to-redact", "user.email");

        assertEquals(0, exitCode);
        assertThat(stdout())
            .contains("{\"user\":{\"email\":\"[REDACTED]\"}}")
            .contains("user.email")
            .contains("Key paths: 1");
    }

    @Test
    void testMalformedStructuredValueShowsNote() {
        int exitCode = cmd.execute("--value", "{\"user\": bob@example.com", "--structured", "json");

        assertEquals(0, exitCode);
        assertThat(stdout()).contains("Note: Malformed json");
    }

    @Test
    void testListRules() {
        int exitCode = cmd.execute("--profile", "nginx", "--list-rules");

        assertEquals(0, exitCode);
        assertThat(stdout())
            .contains("Profile: nginx")
            .contains("Pattern rules (in precedence order):")
            .contains(" 1. quoted_email")
            .contains(" 2. password")
            .contains("Filename patterns: *.access.log");
    }

    @Test
    void testListRulesWithKeyPaths() {
        int exitCode = cmd.execute("--profile", "cloudtrail", "--list-rules");

        assertEquals(0, exitCode);
        assertThat(stdout()).contains("Key paths:").contains("userIdentity.accountId").contains("mask");
    }

    @Test
    void testConfigFile() throws IOException {
        Path config = tempDir.resolve("custom.yaml");
        Files.writeString(config, """
            name: custom
            parent: none
            patterns:
              - name: ticket
                pattern: 'TICKET-\\d+'
            """);

        int exitCode = cmd.execute("--config", config.toString(), "--value", "see TICKET-42");

        assertEquals(0, exitCode);
        assertThat(stdout())
            .contains("Config: " + config)
            .contains("see [REDACTED_TICKET]")
            .contains("Pattern rules: 1 (1 enabled)");
    }

    @Test
    void testInvalidConfigFile() throws IOException {
        Path config = tempDir.resolve("typo.yaml");
        Files.writeString(config, "name: typo\npaterns: []\n");

        int exitCode = cmd.execute("--config", config.toString());

        assertEquals(1, exitCode);
        assertThat(errContent.toString(StandardCharsets.UTF_8))
            .contains("Configuration Error")
            .contains("Unknown property: 'paterns'");
    }

    @Test
    void testUnknownStructuredFormat() {
        int exitCode = cmd.execute("--value", "x", "--structured", "xml");

        assertEquals(2, exitCode);
    }

    @Test
    void testValidateAlias() {
        CommandLine main = new CommandLine(new Main());
        main.setOut(new PrintWriter(outContent, true));
        main.setErr(new PrintWriter(errContent, true));

        int exitCode = main.execute("validate", "--profile", "docker");

        assertEquals(0, exitCode);
        assertThat(stdout()).contains("Profile: docker").contains("✓ Profile is valid").contains("Key paths: 4");
    }
}
