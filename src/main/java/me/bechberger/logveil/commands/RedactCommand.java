package me.bechberger.logveil.commands;

import me.bechberger.logveil.ConfigLoader;
import me.bechberger.logveil.Preset;
import me.bechberger.logveil.Version;
import me.bechberger.logveil.backend.BackendDispatcher;
import me.bechberger.logveil.backend.RedactionBackend;
import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionEngine;
import me.bechberger.logveil.engine.RedactionStats;
import me.bechberger.logveil.engine.RedactionUnit;
import me.bechberger.logveil.engine.SanitizedResult;
import me.bechberger.logveil.text.BatchRedactor;
import me.bechberger.logveil.text.FileResult;
import me.bechberger.logveil.text.StructuredMode;
import me.bechberger.logveil.text.TextFileRedactor;
import me.bechberger.logveil.trace.TraceAggregator;
import me.bechberger.logveil.util.AtomicFiles;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Redact command - redacts log files, directories of log files, or stdin.
 */
@Command(
    name = "redact",
    description = "Redact secrets and personal data from log files, directories or stdin",
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION,
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Redact a log file with the default profile:",
        "    logveil redact application.log",
        "    (creates application.redacted.log)",
        "",
        "  Choose the profile by file name and write an audit log:",
        "    logveil redact access.log --profile auto --trace audit.json",
        "",
        "  Redact all logs below a directory with 8 threads:",
        "    logveil redact logs/ -r --output redacted/ --threads 8",
        "",
        "  Read from stdin, write to stdout:",
        "    kubectl logs my-pod | logveil redact - --profile docker",
        "",
        "  Preview the first lines without writing anything:",
        "    logveil redact app.log --preview",
        "",
        "  Add a custom pattern and redact a key path in JSON logs:",
        "    logveil redact app.jsonl --add-redaction-regex 'ORD-\\d{8}' --keys-to-redact customer.name",
        ""
    }
)
public class RedactCommand extends BaseProfileCommand {

    private static final Logger logger = LoggerFactory.getLogger(RedactCommand.class);

    static final int PREVIEW_LINES = 10;

    @Parameters(
        index = "0",
        description = "Input file or directory to redact, '-' for stdin",
        paramLabel = "<input>"
    )
    private String input;

    @Parameters(
        index = "1",
        description = "Output file, '-' for stdout (default: <input>.redacted.<ext>)",
        paramLabel = "<output>",
        arity = "0..1"
    )
    private String output;

    @Option(
        names = {"-o", "--output"},
        description = "Directory for redacted files; the input layout is mirrored below it",
        paramLabel = "<dir>"
    )
    private Path outputDirectory;

    @Option(
        names = {"-r", "--recursive"},
        description = "Descend into subdirectories of a directory input"
    )
    private boolean recursive;

    @Option(
        names = {"--include"},
        description = "Only redact files of a directory whose names match these globs (e.g. '*.log'), " +
                     "comma separated or repeated",
        paramLabel = "<glob>",
        split = ","
    )
    private List<String> includeGlobs = new ArrayList<>();

    @Option(
        names = {"--inplace"},
        description = "Replace the input files with their redacted version"
    )
    private boolean inPlace;

    @Option(
        names = {"--dry-run"},
        description = "Redact and report, but write no output files"
    )
    private boolean dryRun;

    @Option(
        names = {"--preview"},
        description = "Show the first " + PREVIEW_LINES + " lines of a file before and after redaction, write nothing"
    )
    private boolean preview;

    @Option(
        names = {"--threads"},
        description = "Number of files redacted in parallel (default: ${DEFAULT-VALUE})",
        paramLabel = "<n>",
        defaultValue = "4"
    )
    private int threads;

    @Option(
        names = {"--structured"},
        description = "How to find structured data: auto (by extension, and JSON objects on log lines), " +
                     "json, yaml, xml or none (default: ${DEFAULT-VALUE})",
        paramLabel = "<mode>",
        defaultValue = "auto"
    )
    private String structured;

    @Option(
        names = {"--trace"},
        description = "Write an audit log of all redactions to this file",
        paramLabel = "<file>"
    )
    private Path traceFile;

    @Option(
        names = {"--trace-format"},
        description = "Format of the audit log: json (one array) or jsonl (one trace per line) (default: ${DEFAULT-VALUE})",
        paramLabel = "<format>",
        defaultValue = "json"
    )
    private String traceFormat;

    @Option(
        names = {"--engine"},
        description = "Redaction engine: java (in process), process (external command) or auto " +
                     "(the external command if given, java otherwise and after it failed) (default: ${DEFAULT-VALUE})",
        paramLabel = "<engine>",
        defaultValue = "auto"
    )
    private String engineMode;

    @Option(
        names = {"--engine-command"},
        description = "Command of an external engine speaking the redact-unit protocol; " +
                     "{profile} is replaced by the profile name",
        paramLabel = "<command>"
    )
    private String engineCommand;

    @Option(
        names = {"--engine-timeout"},
        description = "Timeout of the external engine per unit in milliseconds (default: ${DEFAULT-VALUE})",
        paramLabel = "<ms>",
        defaultValue = "10000"
    )
    private long engineTimeoutMillis;

    @Option(
        names = {"--stats"},
        description = "Show statistics after redaction"
    )
    private boolean showStats;

    @Override
    protected Logger getLogger() {
        return logger;
    }

    @Override
    protected int run() throws IOException {
        validateOptions();

        StructuredMode structuredMode = StructuredMode.fromString(structured);
        TraceAggregator.Format format = TraceAggregator.Format.fromString(traceFormat);
        BackendDispatcher.Mode mode = BackendDispatcher.Mode.fromString(engineMode);

        logConfiguration();

        ConfigLoader loader = new ConfigLoader();
        Map<String, Profile> profiles = new HashMap<>();
        BatchRedactor.ProfileResolver resolver = file -> resolveProfile(loader, profiles, file);
        // Fail on configuration errors before touching any file
        Profile firstProfile = resolveProfile(loader, profiles, isStdin() ? null : Paths.get(input));

        RedactionEngine engine = new RedactionEngine(firstProfile);
        RedactionStats stats = new RedactionStats();
        TraceAggregator traces = traceFile != null ? new TraceAggregator() : null;

        int exitCode;
        try (RedactionBackend backend = BackendDispatcher.select(mode, engine, engineCommand,
                Duration.ofMillis(engineTimeoutMillis))) {
            TextFileRedactor redactor = new TextFileRedactor(backend, structuredMode, stats, traces);
            if (preview) {
                exitCode = preview(backend, firstProfile);
            } else if (isStdin()) {
                exitCode = redactStdin(redactor, firstProfile);
            } else if (Files.isDirectory(Paths.get(input))) {
                exitCode = redactDirectory(redactor, resolver);
            } else {
                exitCode = redactSingleFile(redactor, firstProfile);
            }
        }

        if (traces != null) {
            traces.writeTo(traceFile, format);
        }
        if (showStats) {
            stats.print();
        }
        return exitCode;
    }

    private void validateOptions() {
        if (inPlace && dryRun) {
            throw new IllegalArgumentException("--inplace and --dry-run cannot be combined");
        }
        if (inPlace && output != null) {
            throw new IllegalArgumentException("--inplace cannot be combined with an output file");
        }
        if (output != null && outputDirectory != null) {
            throw new IllegalArgumentException("Give either an output file or --output <dir>, not both");
        }
        if (isStdin() && (inPlace || outputDirectory != null || preview)) {
            throw new IllegalArgumentException("--inplace, --output and --preview need a file input, not stdin");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("--threads must be at least 1");
        }
        if (engineTimeoutMillis < 1) {
            throw new IllegalArgumentException("--engine-timeout must be positive");
        }
    }

    private void logConfiguration() {
        logger.info("{} v{}", Version.APP_NAME, Version.VERSION);
        logger.info("================");
        logger.info("");
        logger.info("Input:   {}", isStdin() ? "<stdin>" : Paths.get(input).toAbsolutePath());
        logger.info("Output:  {}", describeOutput());
        logger.info("Profile: {}", describeProfileSelection());
        if (!redactionRegexes.isEmpty()) {
            logger.info("Custom regexes: {}", redactionRegexes);
        }
        if (!keysToRedact.isEmpty()) {
            logger.info("Extra key paths: {}", keysToRedact);
        }
        logger.info("");
    }

    private String describeOutput() {
        if (dryRun || preview) {
            return "<none>";
        }
        if (inPlace) {
            return "<in place>";
        }
        if (outputDirectory != null) {
            return outputDirectory.toAbsolutePath().toString();
        }
        if (output != null) {
            return "-".equals(output) ? "<stdout>" : Paths.get(output).toAbsolutePath().toString();
        }
        return isStdin() ? "<stdout>" : "<auto>";
    }

    /**
     * Profile of a file; with {@code --profile auto} chosen by the file name. Compiled profiles are reused.
     */
    private Profile resolveProfile(ConfigLoader loader, Map<String, Profile> cache, @Nullable Path file)
            throws IOException {
        String source = profileSource();
        if (isAutoProfile() && file != null && !Files.isDirectory(file)) {
            Preset preset = loader.selectPreset(file);
            source = preset.getName();
        }
        Profile profile = cache.get(source);
        if (profile == null) {
            profile = loadProfile(loader, source);
            cache.put(source, profile);
        }
        return profile;
    }

    private Profile loadProfile(ConfigLoader loader, String source) throws IOException {
        return loader.loadProfile(source, createCliOptions());
    }

    private boolean isStdin() {
        return "-".equals(input);
    }

    private int redactStdin(TextFileRedactor redactor, Profile profile) throws IOException {
        InputStream in = System.in;
        if (output == null || "-".equals(output)) {
            redactor.redactStream(in, System.out, "<stdin>", profile);
        } else {
            Path target = Paths.get(output);
            Path temp = AtomicFiles.createSibling(target);
            try {
                try (OutputStream out = Files.newOutputStream(temp)) {
                    redactor.redactStream(in, out, "<stdin>", profile);
                }
                AtomicFiles.moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        }
        return 0;
    }

    private int redactSingleFile(TextFileRedactor redactor, Profile profile) throws IOException {
        Path inputPath = Paths.get(input);
        if (!Files.exists(inputPath)) {
            throw new FileNotFoundException("Input file not found: " + inputPath.toAbsolutePath());
        }
        if ("-".equals(output)) {
            try (InputStream in = Files.newInputStream(inputPath)) {
                redactor.redactStream(in, System.out, inputPath.toString(), profile);
            }
            return 0;
        }

        Path target = singleFileOutput(inputPath);
        FileResult result = redactor.redactFile(inputPath, target, profile);
        report(result);
        return 0;
    }

    private @Nullable Path singleFileOutput(Path inputPath) {
        if (dryRun) {
            return null;
        }
        if (inPlace) {
            return inputPath;
        }
        if (output != null) {
            return Paths.get(output);
        }
        if (outputDirectory != null) {
            return outputDirectory.resolve(inputPath.getFileName().toString());
        }
        return TextFileRedactor.defaultOutputPath(inputPath);
    }

    private int redactDirectory(TextFileRedactor redactor, BatchRedactor.ProfileResolver resolver)
            throws IOException {
        if (output != null) {
            throw new IllegalArgumentException("A directory input needs --output <dir>, --inplace or --dry-run " +
                "instead of an output file");
        }
        Path root = Paths.get(input);
        BatchRedactor.OutputMode outputMode = dryRun ? BatchRedactor.OutputMode.DRY_RUN
            : inPlace ? BatchRedactor.OutputMode.IN_PLACE
            : BatchRedactor.OutputMode.SIBLING;
        BatchRedactor batch = new BatchRedactor(redactor, resolver, threads, outputMode, outputDirectory, includeGlobs);

        List<Path> files = batch.collectFiles(root, recursive);
        if (files.isEmpty()) {
            logger.warn("No log files found in {}", root.toAbsolutePath());
            return 0;
        }
        logger.info("Redacting {} files with {} threads", files.size(), Math.min(threads, files.size()));

        Thread cancelOnShutdown = new Thread(batch::cancel, "logveil-shutdown");
        Runtime.getRuntime().addShutdownHook(cancelOnShutdown);
        BatchRedactor.BatchResult result;
        try {
            result = batch.run(files, root);
        } finally {
            removeShutdownHook(cancelOnShutdown);
        }

        for (FileResult fileResult : result.results()) {
            report(fileResult);
        }
        PrintWriter err = spec.commandLine().getErr();
        if (result.hasFailures()) {
            err.println("Failed to redact " + result.failures().size() + " of " + files.size() + " files:");
            for (BatchRedactor.Failure failure : result.failures()) {
                err.println("  " + failure.file() + ": " + failure.message());
            }
            err.flush();
            return 1;
        }
        logger.info("✓ Redacted {} files", result.results().size());
        return 0;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // The JVM is already shutting down and runs the hook
            logger.debug("Shutdown in progress, keeping cancel hook");
        }
    }

    private void report(FileResult result) {
        if (result.output() == null) {
            logger.info("{}: {} of {} lines would change ({} redactions, profile {})", result.source(),
                result.changedUnits(), result.units(), result.redactions(), result.profileName());
            if (dryRun) {
                PrintWriter out = spec.commandLine().getOut();
                out.printf("%s: %d of %d lines would change (%d redactions, profile %s)%n", result.source(),
                    result.changedUnits(), result.units(), result.redactions(), result.profileName());
                out.flush();
            }
        } else {
            logger.info("✓ {} -> {} ({} redactions, profile {})", result.source(), result.output(),
                result.redactions(), result.profileName());
        }
    }

    /**
     * Print the first lines of the input before and after redaction.
     */
    private int preview(RedactionBackend backend, Profile profile) throws IOException {
        Path inputPath = Paths.get(input);
        if (!Files.isRegularFile(inputPath)) {
            throw new FileNotFoundException("--preview needs an existing file: " + inputPath.toAbsolutePath());
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println("Preview of " + inputPath + " (profile " + profile.getName() + ")");
        out.println("=".repeat(70));
        try (BufferedReader reader = Files.newBufferedReader(inputPath, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while (lineNumber < PREVIEW_LINES && (line = reader.readLine()) != null) {
                lineNumber++;
                SanitizedResult result = backend.redact(
                    new RedactionUnit(inputPath.toString(), lineNumber, line, TextFileRedactor.detectLineFormat(line)),
                    profile);
                out.printf("%4d   %s%n", lineNumber, line);
                out.printf("%4s %s %s%n", "", result.isRedacted() ? "->" : "  ", result.text());
            }
        }
        out.println("=".repeat(70));
        out.flush();
        return 0;
    }
}
