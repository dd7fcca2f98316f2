package me.bechberger.logveil;

import me.bechberger.logveil.commands.GenerateConfigCommand;
import me.bechberger.logveil.commands.GenerateSchemaCommand;
import me.bechberger.logveil.commands.ProfilesCommand;
import me.bechberger.logveil.commands.RedactCommand;
import me.bechberger.logveil.commands.RedactUnitCommand;
import me.bechberger.logveil.commands.TestCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IExecutionStrategy;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point with subcommands.
 */
@Command(
    name = "logveil",
    version = Version.FULL_VERSION,
    description = "Redact secrets and personal data from log files before they are shared",
    mixinStandardHelpOptions = true,
    subcommands = {
        RedactCommand.class,
        RedactUnitCommand.class,
        TestCommand.class,
        ProfilesCommand.class,
        GenerateConfigCommand.class,
        GenerateSchemaCommand.class
    },
    commandListHeading = "%nCommands:%n",
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Redact a log file:",
        "    logveil redact application.log",
        "",
        "  Redact a directory, choosing the profile per file:",
        "    logveil redact logs/ -r --profile auto --output redacted/",
        "",
        "  Generate a profile template:",
        "    logveil generate-config -o my-profile.yaml",
        "",
        "  Validate a profile:",
        "    logveil validate --config my-profile.yaml",
        "",
        "  List the built-in profiles:",
        "    logveil profiles",
        ""
    }
)
public class Main {

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * The root command line with the logging aware execution strategy installed.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new Main());
        // Configure logging before executing commands
        cmd.setExecutionStrategy(new LoggingAwareExecutionStrategy());
        return cmd;
    }

    /**
     * Applies --debug, --verbose and --quiet before the command runs, so every logger uses
     * the chosen level from its first message on.
     */
    private static class LoggingAwareExecutionStrategy implements IExecutionStrategy {
        @Override
        public int execute(ParseResult parseResult) {
            configureLogging(parseResult);
            return new CommandLine.RunLast().execute(parseResult);
        }

        private void configureLogging(ParseResult parseResult) {
            // Find the actual command being executed (not the parent)
            ParseResult commandResult = parseResult;
            while (commandResult.hasSubcommand()) {
                commandResult = commandResult.subcommand();
            }

            boolean debug = commandResult.hasMatchedOption("--debug");
            boolean verbose = commandResult.hasMatchedOption("--verbose");
            boolean quiet = commandResult.hasMatchedOption("--quiet");

            LoggingConfig.configure(LoggingConfig.Verbosity.fromFlags(debug, verbose, quiet));
        }
    }
}
