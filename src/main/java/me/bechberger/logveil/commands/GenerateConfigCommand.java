package me.bechberger.logveil.commands;

import me.bechberger.logveil.ConfigLoader;
import me.bechberger.logveil.Preset;
import me.bechberger.logveil.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Config generation command - generates profile templates.
 */
@Command(
    name = "generate-config",
    description = "Generate a profile template for log redaction",
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION,
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Generate a template that extends the default profile:",
        "    logveil generate-config",
        "",
        "  Generate template to file:",
        "    logveil generate-config -o my-profile.yaml",
        "",
        "  Print a preset in full, as a starting point:",
        "    logveil generate-config --preset nginx -o my-nginx.yaml",
        ""
    }
)
public class GenerateConfigCommand extends BaseCommand {

    private static final Logger logger = LoggerFactory.getLogger(GenerateConfigCommand.class);

    @Parameters(
        index = "0",
        description = "Output file for the profile (default: stdout)",
        paramLabel = "<output.yaml>",
        arity = "0..1"
    )
    private String outputFile;

    @Option(
        names = {"-o", "--output"},
        description = "Output file for the profile",
        paramLabel = "<file>"
    )
    private String outputFileOption;

    @Option(
        names = {"--preset"},
        description = "Print this preset instead of a template. Valid values: ${COMPLETION-CANDIDATES}",
        paramLabel = "<preset>"
    )
    private Preset preset;

    @Override
    protected Logger getLogger() {
        return logger;
    }

    @Override
    protected int run() throws IOException {
        String config = preset != null ? generateFromPreset(err()) : generateTemplate();

        String output = outputFileOption != null ? outputFileOption : outputFile;
        if (output != null) {
            Path path = Paths.get(output);
            Files.writeString(path, config);
            err().println("Profile written to: " + path.toAbsolutePath());
        } else {
            out().println(config);
        }
        return 0;
    }

    private String generateFromPreset(PrintWriter err) throws IOException {
        String presetYaml = new ConfigLoader().loadRawYaml(preset.getName());

        err.println("Generated profile based on preset: " + preset.getName());
        err.println("Change 'name' and adapt the rules to your needs.");

        return presetYaml;
    }

    static String generateTemplate() {
        return """
                # logveil profile
                # Validate with: logveil validate --config <this file>

                name: my-profile
                description: Default rules plus my own

                # Inherit all rules of a preset (default, nginx, docker, cloudtrail, application) or 'none'
                parent: default

                # Files this profile is chosen for with --profile auto
                #filename_patterns:
                #  - "*.myapp.log"

                # Marker written for key paths without their own replacement
                #redaction_marker: "[REDACTED]"

                # Pattern rules run before the inherited ones, in this order.
                # Use single quotes for regexes. Replacements may use $1, ${name} and \\1.
                patterns: []
                #  - name: order_id
                #    pattern: '\\bORD-[0-9]{8}\\b'
                #    replacement: '[REDACTED_ORDER]'
                #  - name: customer
                #    pattern: '(customer=)[^\\s&]+'
                #    replacement: '$1[REDACTED]'
                #    ignore_case: true
                #  - name: $PARENT        # place the inherited rules here instead of at the end
                #  - name: uuid           # same name as an inherited rule: replaces it
                #    enabled: false

                # Entropy based detection of unknown secrets; unset fields are inherited
                #entropy:
                #  enabled: true
                #  threshold: 4.5
                #  min_length: 20

                # Key paths in JSON and YAML data; '*' matches any single key
                key_paths: []
                #  - path: user.email
                #  - path: user.phone
                #    action: mask        # redact (default), mask or remove
                #  - path: env.*.password
                #    action: remove
                """;
    }
}
