package me.bechberger.logveil;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sets the Logback levels chosen by {@code --debug}, {@code --verbose} and {@code --quiet}.
 * All output goes to stderr (see logback.xml), so stdout keeps only redacted text.
 */
public class LoggingConfig {

    static final String APP_LOGGER_NAME = "me.bechberger.logveil";

    /**
     * How much the application logs; {@code null} levels keep what logback.xml sets.
     */
    public enum Verbosity {
        QUIET(Level.WARN, Level.WARN),
        DEFAULT(null, null),
        VERBOSE(Level.INFO, Level.WARN),
        /** Per-unit redaction details; libraries log at INFO */
        DEBUG(Level.DEBUG, Level.INFO);

        private final Level appLevel;
        private final Level rootLevel;

        Verbosity(Level appLevel, Level rootLevel) {
            this.appLevel = appLevel;
            this.rootLevel = rootLevel;
        }

        /**
         * Debug wins over verbose, verbose over quiet.
         */
        public static Verbosity fromFlags(boolean debug, boolean verbose, boolean quiet) {
            if (debug) {
                return DEBUG;
            }
            if (verbose) {
                return VERBOSE;
            }
            return quiet ? QUIET : DEFAULT;
        }
    }

    private LoggingConfig() {
    }

    public static void configure(Verbosity verbosity) {
        if (verbosity.rootLevel != null) {
            ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(verbosity.rootLevel);
        }
        if (verbosity.appLevel != null) {
            ((Logger) LoggerFactory.getLogger(APP_LOGGER_NAME)).setLevel(verbosity.appLevel);
        }
    }

    public static Level getAppLevel() {
        return ((Logger) LoggerFactory.getLogger(APP_LOGGER_NAME)).getEffectiveLevel();
    }
}
