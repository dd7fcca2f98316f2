package me.bechberger.logveil.commands;

import me.bechberger.logveil.ConfigLoader;
import me.bechberger.logveil.Version;
import me.bechberger.logveil.engine.KeyPathRule;
import me.bechberger.logveil.engine.PatternRule;
import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionEngine;
import me.bechberger.logveil.engine.RedactionUnit;
import me.bechberger.logveil.engine.SanitizedResult;
import me.bechberger.logveil.engine.StructuredFormat;
import me.bechberger.logveil.trace.TraceAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;

/**
 * Test command - compiles a profile and shows how specific values would be redacted.
 * Also functions as a validate command when run without test values.
 */
@Command(
    name = "test",
    aliases = {"validate"},
    description = {
        "Test a profile by showing how specific values would be redacted",
        "Also validates the profile when run without test values"
    },
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION,
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Validate a profile:",
        "    logveil test --config my-profile.yaml",
        "    logveil validate --config my-profile.yaml",
        "",
        "  Test a log line:",
        "    logveil test --value 'login bob@example.com from 10.0.0.12'",
        "",
        "  Test a JSON record with a key path:",
        "    logveil test --value '{\"user\":{\"email\":\"a@b.com\"}}' --structured json --keys-to-redact user.email",
        "",
        "  Show the rules of a preset:",
        "    logveil test --profile nginx --list-rules",
        ""
    }
)
public class TestCommand extends BaseProfileCommand {

    private static final Logger logger = LoggerFactory.getLogger(TestCommand.class);

    @Option(
        names = {"--value"},
        description = "Value to test redaction on",
        paramLabel = "<value>"
    )
    private String value;

    @Option(
        names = {"--structured"},
        description = "Interpret the value as none, json, yaml or xml (default: ${DEFAULT-VALUE})",
        paramLabel = "<format>",
        defaultValue = "none"
    )
    private String structured;

    @Option(
        names = {"--list-rules"},
        description = "List the compiled rules of the profile in precedence order"
    )
    private boolean listRules;

    @Override
    protected Logger getLogger() {
        return logger;
    }

    @Override
    protected int run() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        StructuredFormat format = StructuredFormat.fromString(structured);
        Profile profile = loadProfile(new ConfigLoader());

        out.println("\n" + "=".repeat(70));
        boolean isValidationMode = value == null;
        out.println(isValidationMode ? "Profile Validation" : "Profile Test Results");
        out.println("=".repeat(70));
        out.println();
        out.println((configFile != null ? "Config: " + configFile : "Profile: " + profileName) +
            (profile.getName().equals(profileName) ? "" : " (" + profile.getName() + ")"));
        out.println();

        if (isValidationMode) {
            out.println("✓ Profile is valid");
            out.println();
        } else {
            testValue(out, profile, format);
        }

        out.println("Profile Summary:");
        out.println("  Pattern rules: " + profile.getRules().size() +
            " (" + profile.getRules().enabledCount() + " enabled)");
        out.println("  Key paths: " + profile.getKeyPaths().getRules().size());
        out.println("  Entropy detection: " + profile.getEntropy());
        if (!profile.getFilenamePatterns().isEmpty()) {
            out.println("  Filename patterns: " + String.join(", ", profile.getFilenamePatterns()));
        }

        if (listRules) {
            out.println();
            out.println("Pattern rules (in precedence order):");
            for (PatternRule rule : profile.getRules().getRules()) {
                out.printf("  %2d. %-20s %s%s%n", rule.getPriority() + 1, rule.getName(), rule.getPattern().pattern(),
                    rule.isEnabled() ? "" : " (disabled)");
            }
            if (!profile.getKeyPaths().isEmpty()) {
                out.println("Key paths:");
                for (KeyPathRule rule : profile.getKeyPaths().getRules()) {
                    out.printf("  %-30s %s%n", rule.getPath(), rule.getAction().name().toLowerCase(Locale.ROOT));
                }
            }
        }

        out.println();
        out.println("=".repeat(70));
        out.flush();
        return 0;
    }

    private void testValue(PrintWriter out, Profile profile, StructuredFormat format) throws IOException {
        SanitizedResult result = new RedactionEngine(profile).redact(new RedactionUnit("value", 1, value, format));

        out.println("Value: \"" + value + "\"");
        if (result.isRedacted()) {
            out.println("  → Will be REDACTED to: \"" + result.text() + "\"");
            out.println();
            out.println("Redactions:");
            TraceAggregator traces = new TraceAggregator();
            traces.add(result);
            traces.print(out);
        } else {
            out.println("  → Will be KEPT as-is (no matching rules)");
        }
        for (String note : result.notes()) {
            out.println("  Note: " + note);
        }
        out.println();
    }
}
