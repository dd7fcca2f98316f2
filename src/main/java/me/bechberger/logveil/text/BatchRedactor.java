package me.bechberger.logveil.text;

import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.util.GlobMatcher;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Redacts many files on a pool of worker threads, one file per task.
 * <p>
 * Files are independent: a file that fails is reported and counted while the others continue.
 * Every output is written through {@link TextFileRedactor}, so a failed or cancelled file never
 * leaves a partial output behind.
 */
public class BatchRedactor {

    private static final Logger logger = LoggerFactory.getLogger(BatchRedactor.class);

    /** Extensions picked from directories when no include globs are given */
    static final Set<String> LOG_EXTENSIONS = Set.of("log", "txt", "out", "err", "json", "jsonl", "yaml", "yml", "xml");

    /**
     * Chooses the profile of a file; called on the submitting thread.
     */
    @FunctionalInterface
    public interface ProfileResolver {
        Profile resolve(Path file) throws IOException;
    }

    /**
     * Where the output of a file goes.
     */
    public enum OutputMode {
        /** {@code name.redacted.ext} next to the input, or below an output directory */
        SIBLING,
        /** Replace the input */
        IN_PLACE,
        /** Process and report, write nothing */
        DRY_RUN
    }

    private final TextFileRedactor redactor;
    private final ProfileResolver profiles;
    private final int threads;
    private final OutputMode outputMode;
    private final @Nullable Path outputDirectory;
    private final List<String> includeGlobs;

    private volatile @Nullable ExecutorService executor;

    public BatchRedactor(TextFileRedactor redactor, ProfileResolver profiles, int threads, OutputMode outputMode,
                         @Nullable Path outputDirectory, List<String> includeGlobs) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, got " + threads);
        }
        this.redactor = redactor;
        this.profiles = profiles;
        this.threads = threads;
        this.outputMode = outputMode;
        this.outputDirectory = outputDirectory;
        this.includeGlobs = List.copyOf(includeGlobs);
    }

    /**
     * Find the files to redact below a directory.
     *
     * @param recursive Descend into subdirectories
     */
    public List<Path> collectFiles(Path directory, boolean recursive) throws IOException {
        try (Stream<Path> paths = recursive ? Files.walk(directory) : Files.list(directory)) {
            return paths.filter(Files::isRegularFile)
                .filter(this::isCandidate)
                .sorted()
                .collect(Collectors.toList());
        }
    }

    boolean isCandidate(Path file) {
        String name = file.getFileName().toString();
        if (name.contains(".redacted") || name.startsWith(".")) {
            return false;
        }
        if (!includeGlobs.isEmpty()) {
            return GlobMatcher.matches(name, includeGlobs);
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return LOG_EXTENSIONS.contains(TextFileRedactor.extension(lower)) || lower.contains("log");
    }

    /**
     * Output path of a file, null for dry runs.
     *
     * @param root Directory the file was collected from, used to mirror the layout below the output directory
     */
    @Nullable Path outputFor(Path file, @Nullable Path root) {
        return switch (outputMode) {
            case DRY_RUN -> null;
            case IN_PLACE -> file;
            case SIBLING -> {
                if (outputDirectory == null) {
                    yield TextFileRedactor.defaultOutputPath(file);
                }
                Path relative = root == null ? file.getFileName() : root.relativize(file);
                yield outputDirectory.resolve(relative.toString());
            }
        };
    }

    /**
     * Redact all files and wait for them.
     *
     * @param files Files to redact
     * @param root  Directory the files were collected from, may be null
     */
    public BatchResult run(List<Path> files, @Nullable Path root) throws IOException {
        List<Task> tasks = new ArrayList<>(files.size());
        for (Path file : files) {
            tasks.add(new Task(file, outputFor(file, root), profiles.resolve(file)));
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, tasks.size())),
            new WorkerThreadFactory());
        executor = pool;
        List<Future<FileResult>> futures = new ArrayList<>(tasks.size());
        try {
            for (Task task : tasks) {
                futures.add(pool.submit(() -> redactor.redactFile(task.input(), task.output(), task.profile())));
            }

            List<FileResult> results = new ArrayList<>();
            List<Failure> failures = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                Task task = tasks.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    logger.error("Failed to redact {}: {}", task.input(), cause.getMessage());
                    logger.debug("Stack trace", cause);
                    redactor.getStats().recordFailedFile();
                    failures.add(new Failure(task.input(), String.valueOf(cause.getMessage())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancel();
                    throw new IOException("Interrupted while redacting " + task.input(), e);
                }
            }
            return new BatchResult(results, failures);
        } finally {
            pool.shutdown();
            executor = null;
        }
    }

    /**
     * Abandon the running batch: workers are interrupted and their files are not written.
     */
    public void cancel() {
        ExecutorService pool = executor;
        if (pool != null) {
            logger.info("Cancelling batch");
            pool.shutdownNow();
            try {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warn("Workers did not stop within 5 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private record Task(Path input, @Nullable Path output, Profile profile) {
    }

    public record Failure(Path file, String message) {
    }

    public record BatchResult(List<FileResult> results, List<Failure> failures) {
        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "logveil-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
