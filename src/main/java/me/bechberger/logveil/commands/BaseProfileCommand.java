package me.bechberger.logveil.commands;

import me.bechberger.logveil.ConfigLoader;
import me.bechberger.logveil.Preset;
import me.bechberger.logveil.config.ProfileConfig;
import me.bechberger.logveil.engine.Profile;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for commands that redact with a profile: profile selection, profile overrides
 * and the logging flags.
 */
public abstract class BaseProfileCommand extends BaseCommand {

    @Option(
        names = {"--profile"},
        description = "Built-in profile: default, nginx, docker, cloudtrail, application, " +
                     "or 'auto' to choose one per file by file name (default: ${DEFAULT-VALUE})",
        paramLabel = "<preset|auto>",
        defaultValue = "default"
    )
    protected String profileName;

    @Option(
        names = {"--config"},
        description = "Load the profile from a YAML file instead of a preset. " +
                     "The file can inherit from a preset using 'parent: <preset-name>'.",
        paramLabel = "<file>"
    )
    protected String configFile;

    @Option(
        names = {"--entropy-threshold"},
        description = "Override the entropy threshold in bits per character",
        paramLabel = "<bits>"
    )
    protected Double entropyThreshold;

    @Option(
        names = {"--entropy-min-length"},
        description = "Override the minimum token length for entropy detection",
        paramLabel = "<chars>"
    )
    protected Integer entropyMinLength;

    @Option(
        names = {"--disable-entropy"},
        description = "Disable entropy based secret detection"
    )
    protected boolean disableEntropy;

    @Option(
        names = {"--add-redaction-regex"},
        description = "Add a custom regular expression pattern that is applied before the profile's rules. " +
                     "This option can be specified multiple times to add multiple patterns.",
        paramLabel = "<pattern>"
    )
    protected List<String> redactionRegexes = new ArrayList<>();

    @Option(
        names = {"--keys-to-redact"},
        description = "Additional key paths to redact in structured input (e.g. user.email, env.*.password), " +
                     "comma separated or repeated",
        paramLabel = "<path>",
        split = ","
    )
    protected List<String> keysToRedact = new ArrayList<>();

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (INFO level logging)"
    )
    protected boolean verbose;

    @Option(
        names = {"--debug"},
        description = "Enable debug output (DEBUG level logging)"
    )
    protected boolean debug;

    @Option(
        names = {"-q", "--quiet"},
        description = "Minimize output (only show errors and completion message)"
    )
    protected boolean quiet;

    @Override
    protected boolean isDebug() {
        return debug;
    }

    /**
     * {@code --profile auto} without {@code --config}.
     */
    protected boolean isAutoProfile() {
        return configFile == null && Preset.AUTO.equalsIgnoreCase(profileName);
    }

    /**
     * The preset name or file the profile is loaded from; {@code auto} resolves to the default preset.
     */
    protected String profileSource() throws ConfigLoader.ConfigurationException {
        if (configFile != null) {
            return configFile;
        }
        if (isAutoProfile()) {
            return Preset.DEFAULT.getName();
        }
        Preset preset = Preset.fromName(profileName);
        if (preset == null) {
            throw new ConfigLoader.ConfigurationException(
                "Unknown profile: " + profileName + "\n" +
                "Available profiles: " + Preset.names() + ", " + Preset.AUTO + "\n" +
                "Use --config <file> to load a profile from a file."
            );
        }
        return preset.getName();
    }

    /**
     * Load and compile the selected profile with the command line overrides applied.
     */
    protected Profile loadProfile(ConfigLoader loader) throws IOException {
        return loader.loadProfile(profileSource(), createCliOptions());
    }

    protected ProfileConfig.CliOptions createCliOptions() {
        ProfileConfig.CliOptions cliOptions = new ProfileConfig.CliOptions();
        cliOptions.setDisableEntropy(disableEntropy);
        cliOptions.setEntropyThreshold(entropyThreshold);
        cliOptions.setEntropyMinLength(entropyMinLength);
        cliOptions.setRedactionRegexes(redactionRegexes);
        cliOptions.setKeysToRedact(keysToRedact);
        return cliOptions;
    }

    /**
     * Human readable description of the profile selection, for logs and reports.
     */
    protected String describeProfileSelection() {
        return configFile != null ? "config " + configFile : "profile " + profileName;
    }
}
