package me.bechberger.logveil.backend;

import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionEngine;
import me.bechberger.logveil.engine.RedactionUnit;
import me.bechberger.logveil.engine.SanitizedResult;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Chooses the backend for a run.
 * <p>
 * {@code java} always runs the engine in process. {@code process} requires an engine command.
 * {@code auto} uses the engine command when one is configured and falls back to the in-process
 * engine for good once the external engine fails; without a command it is the same as {@code java}.
 */
public class BackendDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(BackendDispatcher.class);

    public enum Mode {
        AUTO, JAVA, PROCESS;

        public static Mode fromString(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown engine: " + value + " (expected auto, java or process)", e);
            }
        }
    }

    private BackendDispatcher() {
    }

    /**
     * Create the backend for the given mode.
     *
     * @param engine        The in-process engine
     * @param engineCommand Command of an external engine, may be null
     * @param timeout       Per-unit timeout of the external engine
     * @throws IllegalArgumentException if {@code process} is requested without a command
     */
    public static RedactionBackend select(Mode mode, RedactionEngine engine, @Nullable String engineCommand,
                                          Duration timeout) {
        boolean hasCommand = engineCommand != null && !engineCommand.isBlank();
        RedactionBackend backend = switch (mode) {
            case JAVA -> new LocalBackend(engine);
            case PROCESS -> {
                if (!hasCommand) {
                    throw new IllegalArgumentException(
                        "--engine process needs an engine command (--engine-command)");
                }
                yield ProcessBackend.fromCommandLine(engineCommand, timeout);
            }
            case AUTO -> hasCommand
                ? new FallbackBackend(ProcessBackend.fromCommandLine(engineCommand, timeout), new LocalBackend(engine))
                : new LocalBackend(engine);
        };
        logger.debug("Using {} backend", backend.getName());
        return backend;
    }

    /**
     * Uses the primary backend until it fails once, then only the fallback.
     */
    static class FallbackBackend implements RedactionBackend {
        private final RedactionBackend primary;
        private final RedactionBackend fallback;
        private final AtomicBoolean primaryFailed = new AtomicBoolean(false);

        FallbackBackend(RedactionBackend primary, RedactionBackend fallback) {
            this.primary = primary;
            this.fallback = fallback;
        }

        @Override
        public SanitizedResult redact(RedactionUnit unit, Profile profile) {
            if (!primaryFailed.get()) {
                try {
                    return primary.redact(unit, profile);
                } catch (BackendException e) {
                    if (primaryFailed.compareAndSet(false, true)) {
                        logger.warn("The {} engine failed, continuing with the {} engine: {}", primary.getName(),
                            fallback.getName(), e.getMessage());
                    }
                }
            }
            return fallback.redact(unit, profile);
        }

        boolean hasFailedOver() {
            return primaryFailed.get();
        }

        @Override
        public String getName() {
            return primaryFailed.get() ? fallback.getName() : primary.getName();
        }

        @Override
        public void close() {
            primary.close();
            fallback.close();
        }
    }
}
