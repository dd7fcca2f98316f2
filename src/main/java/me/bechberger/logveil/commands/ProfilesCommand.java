package me.bechberger.logveil.commands;

import me.bechberger.logveil.ConfigLoader;
import me.bechberger.logveil.Preset;
import me.bechberger.logveil.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Lists the built-in profiles.
 */
@Command(
    name = "profiles",
    description = "List the built-in profiles with their rule counts and file name patterns",
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION
)
public class ProfilesCommand extends BaseCommand {

    private static final Logger logger = LoggerFactory.getLogger(ProfilesCommand.class);

    @Override
    protected Logger getLogger() {
        return logger;
    }

    @Override
    protected int run() throws IOException {
        PrintWriter out = out();
        out.printf("%-12s %8s %9s  %s%n", "PROFILE", "PATTERNS", "KEY PATHS", "DESCRIPTION");
        for (ConfigLoader.PresetSummary summary : new ConfigLoader().summarizePresets()) {
            Preset preset = summary.preset();
            out.printf("%-12s %8d %9d  %s%n", preset.getName(), summary.patternCount(), summary.keyPathCount(),
                preset.getDescription());
            if (!summary.filenamePatterns().isEmpty()) {
                out.printf("%-12s %8s %9s  files: %s%n", "", "", "", String.join(", ", summary.filenamePatterns()));
            }
        }
        out.println();
        out.println("Use --profile " + Preset.AUTO + " to choose a profile per file by these file name patterns.");
        return 0;
    }
}
