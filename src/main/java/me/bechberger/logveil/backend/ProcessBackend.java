package me.bechberger.logveil.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionUnit;
import me.bechberger.logveil.engine.SanitizedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Adapter for an external redaction engine that speaks the {@code redact-unit} protocol:
 * one JSON {@link UnitRequest} on stdin, one JSON {@link SanitizedResult} on stdout, exit code 0.
 *
 * <p>One process is started per unit. The request carries the resolved profile, so the external
 * engine applies the same rules, overrides included, as the local one; {@code logveil redact-unit}
 * makes logveil its own external backend. The placeholder {@code {profile}} in the command is
 * replaced by the profile name for engines that select a profile by name.</p>
 *
 * <p>Every failure becomes a {@link BackendException}: the process does not start, runs into the
 * timeout, exits with an error or writes no valid result. The timeout covers reading the output.</p>
 */
public class ProcessBackend implements RedactionBackend {

    private static final Logger logger = LoggerFactory.getLogger(ProcessBackend.class);

    public static final String NAME = "process";

    public static final String PROFILE_PLACEHOLDER = "{profile}";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private static final int MAX_STDERR_IN_MESSAGE = 500;

    /** Drains stdout and stderr of engine processes; reads block, so not the common pool */
    private static final ExecutorService PIPE_READERS = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "logveil-engine-pipe");
        thread.setDaemon(true);
        return thread;
    });

    private final List<String> command;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    public ProcessBackend(List<String> command, Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Engine command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    /**
     * Create a backend from a command line string; double quotes group arguments.
     */
    public static ProcessBackend fromCommandLine(String commandLine, Duration timeout) {
        return new ProcessBackend(splitCommand(commandLine), timeout);
    }

    @Override
    public SanitizedResult redact(RedactionUnit unit, Profile profile) {
        List<String> resolved = resolveCommand(profile);
        byte[] request;
        try {
            request = mapper.writeValueAsBytes(UnitRequest.of(unit, profile));
        } catch (JsonProcessingException e) {
            throw new BackendException("Could not encode unit " + unit.source() + ":" + unit.lineNumber(), e);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        Process process;
        try {
            process = new ProcessBuilder(resolved).start();
        } catch (IOException e) {
            throw new BackendException("Could not start engine command " + resolved + ": " + e.getMessage(), e);
        }

        try {
            CompletableFuture<byte[]> stdout = readAsync(process.getInputStream());
            CompletableFuture<byte[]> stderr = readAsync(process.getErrorStream());
            try (OutputStream in = process.getOutputStream()) {
                in.write(request);
            } catch (IOException e) {
                // The process may exit before reading its input; its exit code tells what happened
                logger.debug("Could not write request to engine process: {}", e.getMessage());
            }

            if (!process.waitFor(remainingNanos(deadline), TimeUnit.NANOSECONDS)) {
                process.destroyForcibly();
                throw timedOut(resolved);
            }

            int exitCode = process.exitValue();
            // Processes started by the engine may keep the pipes open after it exited
            String errors = new String(stderr.get(remainingNanos(deadline), TimeUnit.NANOSECONDS),
                StandardCharsets.UTF_8).strip();
            if (exitCode != 0) {
                throw new BackendException("Engine command exited with code " + exitCode + ": " + resolved +
                    (errors.isEmpty() ? "" : "\n" + abbreviate(errors)));
            }
            byte[] response = stdout.get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
            try {
                return mapper.readValue(response, SanitizedResult.class);
            } catch (IOException e) {
                throw new BackendException("Engine command wrote no valid result: " + resolved + "\n" +
                    e.getMessage(), e);
            }
        } catch (TimeoutException e) {
            process.destroyForcibly();
            throw timedOut(resolved);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while waiting for engine command " + resolved, e);
        } catch (ExecutionException e) {
            process.destroyForcibly();
            throw new BackendException("Could not read output of engine command " + resolved, e.getCause());
        }
    }

    private static long remainingNanos(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private BackendException timedOut(List<String> resolved) {
        return new BackendException("Engine command timed out after " + timeout.toMillis() + " ms: " + resolved);
    }

    List<String> resolveCommand(Profile profile) {
        List<String> resolved = new ArrayList<>(command.size());
        for (String arg : command) {
            resolved.add(arg.replace(PROFILE_PLACEHOLDER, profile.getName()));
        }
        return resolved;
    }

    private static CompletableFuture<byte[]> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                in.transferTo(out);
                return out.toByteArray();
            } catch (IOException e) {
                throw new BackendException("Could not read engine output: " + e.getMessage(), e);
            }
        }, PIPE_READERS);
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_STDERR_IN_MESSAGE ? text : text.substring(0, MAX_STDERR_IN_MESSAGE) + "...";
    }

    /**
     * Split a command line at whitespace; double quotes group words into one argument.
     */
    static List<String> splitCommand(String commandLine) {
        List<String> out = new ArrayList<>();
        boolean inQuote = false;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (Character.isWhitespace(c) && !inQuote) {
                if (current.length() > 0) {
                    out.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            out.add(current.toString());
        }
        return out;
    }

    public List<String> getCommand() {
        return command;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
