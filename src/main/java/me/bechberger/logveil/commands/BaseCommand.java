package me.bechberger.logveil.commands;

import me.bechberger.logveil.ConfigLoader;
import org.slf4j.Logger;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Base class of all subcommands. Maps errors to exit codes: 1 for configuration, I/O and
 * unexpected errors, 2 for invalid arguments.
 */
public abstract class BaseCommand implements Callable<Integer> {

    @Spec
    protected CommandSpec spec;

    protected abstract Logger getLogger();

    /**
     * Run the command.
     *
     * @return Exit code
     */
    protected abstract int run() throws IOException;

    /**
     * Log the stack trace of I/O errors, not only their message.
     */
    protected boolean isDebug() {
        return false;
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    @Override
    public Integer call() {
        // Logging is configured in Main.LoggingAwareExecutionStrategy before this runs
        PrintWriter err = err();
        try {
            int exitCode = run();
            out().flush();
            err.flush();
            return exitCode;
        } catch (ConfigLoader.ConfigurationException e) {
            err.println("\n" + "=".repeat(70));
            err.println("Configuration Error");
            err.println("=".repeat(70));
            err.println(e.getMessage());
            err.println("=".repeat(70));
            err.println("\nFor help, see:");
            err.println("  - logveil generate-config (prints a profile template)");
            err.println("  - logveil generate-schema (JSON schema of profile files)");
            err.flush();
            getLogger().debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            getLogger().error("I/O Error: {}", e.getMessage());
            err.println("I/O Error: " + e.getMessage());
            err.flush();
            if (isDebug()) {
                getLogger().error("Details:", e);
            }
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            getLogger().debug("Invalid argument", e);
            return 2;
        } catch (Exception e) {
            getLogger().error("Unexpected error: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
