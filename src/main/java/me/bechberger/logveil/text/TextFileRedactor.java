package me.bechberger.logveil.text;

import me.bechberger.logveil.backend.RedactionBackend;
import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionStats;
import me.bechberger.logveil.engine.RedactionTrace;
import me.bechberger.logveil.engine.RedactionUnit;
import me.bechberger.logveil.engine.SanitizedResult;
import me.bechberger.logveil.engine.StructuredFormat;
import me.bechberger.logveil.engine.TraceReason;
import me.bechberger.logveil.trace.TraceAggregator;
import me.bechberger.logveil.util.AtomicFiles;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Redacts one text file or stream, unit by unit.
 * <p>
 * Plain files are redacted line by line; single-line JSON objects in them are handled as
 * structured units. {@code .json}, {@code .yaml}, {@code .yml} and {@code .xml} files are redacted as whole
 * documents (JSON Lines files line by line). Input is decoded as strict UTF-8 first; a file
 * with invalid byte sequences is redone with replacement characters and gets a note.
 * <p>
 * File output goes to a temporary sibling that is moved into place only after the whole file
 * succeeded; traces and statistics of a file are committed at the same time.
 */
public class TextFileRedactor {

    private static final Logger logger = LoggerFactory.getLogger(TextFileRedactor.class);

    private static final int PROGRESS_INTERVAL = 1000;

    private final RedactionBackend backend;
    private final StructuredMode structuredMode;
    private final RedactionStats stats;
    private final @Nullable TraceAggregator traces;

    public TextFileRedactor(RedactionBackend backend) {
        this(backend, StructuredMode.AUTO, new RedactionStats(), null);
    }

    public TextFileRedactor(RedactionBackend backend, StructuredMode structuredMode, RedactionStats stats,
                            @Nullable TraceAggregator traces) {
        this.backend = backend;
        this.structuredMode = structuredMode;
        this.stats = stats;
        this.traces = traces;
    }

    /**
     * Redact a file.
     *
     * @param inputPath  The file to redact
     * @param outputPath Where to write the result; null for a dry run
     * @param profile    Profile to redact with
     * @throws IOException If reading or writing fails; the output is then left untouched
     */
    public FileResult redactFile(Path inputPath, @Nullable Path outputPath, Profile profile) throws IOException {
        logger.debug("Input:  {}", inputPath);
        logger.debug("Output: {}", outputPath);
        String source = inputPath.toString();
        String fileName = inputPath.getFileName() == null ? source : inputPath.getFileName().toString();

        Attempt attempt;
        try {
            attempt = redactFileOnce(inputPath, outputPath, profile, source, fileName, strictDecoder());
        } catch (CharacterCodingException e) {
            logger.warn("{} is not valid UTF-8, decoding with replacement characters", source);
            attempt = redactFileOnce(inputPath, outputPath, profile, source, fileName, replacingDecoder());
            attempt.notes.add(0, "Invalid UTF-8 in " + source + ", undecodable bytes were replaced with U+FFFD");
        }
        return commit(attempt, source, outputPath, profile);
    }

    private Attempt redactFileOnce(Path inputPath, @Nullable Path outputPath, Profile profile, String source,
                                   String fileName, CharsetDecoder decoder) throws IOException {
        Attempt attempt = new Attempt(source, profile);
        Path temp = outputPath == null ? null : AtomicFiles.createSibling(outputPath);
        try {
            try (BufferedReader reader = new BufferedReader(
                     new InputStreamReader(Files.newInputStream(inputPath), decoder));
                 BufferedWriter writer = temp == null
                     ? new BufferedWriter(Writer.nullWriter())
                     : Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                redact(reader, writer, fileName, attempt);
            }
            if (temp != null) {
                AtomicFiles.moveIntoPlace(temp, outputPath);
            }
            return attempt;
        } finally {
            if (temp != null) {
                Files.deleteIfExists(temp);
            }
        }
    }

    /**
     * Redact a stream line by line, e.g. stdin to stdout. Undecodable bytes are replaced.
     *
     * @param source Identifier used in the traces
     */
    public FileResult redactStream(InputStream input, OutputStream output, String source, Profile profile)
            throws IOException {
        Attempt attempt = new Attempt(source, profile);
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, replacingDecoder()));
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        redact(reader, writer, source, attempt);
        return commit(attempt, source, null, profile);
    }

    private FileResult commit(Attempt attempt, String source, @Nullable Path outputPath, Profile profile) {
        attempt.stats.recordFile();
        stats.mergeFrom(attempt.stats);
        if (traces != null) {
            traces.addAll(attempt.traces, attempt.notes);
        }
        if (!attempt.notes.isEmpty()) {
            logger.warn("{}: {} input problem(s), e.g. {}", source, attempt.notes.size(), attempt.notes.get(0));
        }
        logger.info("Redacted {}: {} units processed, {} contained redactions", source,
            attempt.stats.getProcessedUnits(), attempt.stats.getChangedUnits());
        return new FileResult(source, outputPath, profile.getName(), attempt.stats.getProcessedUnits(),
            attempt.stats.getChangedUnits(), attempt.stats.getTotalRedactions(), attempt.notes);
    }

    private void redact(BufferedReader reader, BufferedWriter writer, String fileName, Attempt attempt)
            throws IOException {
        String extension = extension(fileName);
        boolean yamlDocument = structuredMode == StructuredMode.YAML ||
            (structuredMode == StructuredMode.AUTO && (extension.equals("yaml") || extension.equals("yml")));
        boolean jsonFile = structuredMode == StructuredMode.JSON ||
            (structuredMode == StructuredMode.AUTO && extension.equals("json"));
        boolean jsonLinesFile = structuredMode == StructuredMode.AUTO &&
            (extension.equals("jsonl") || extension.equals("ndjson"));
        boolean xmlDocument = structuredMode == StructuredMode.XML ||
            (structuredMode == StructuredMode.AUTO && extension.equals("xml"));

        if (yamlDocument) {
            redactDocument(readAll(reader), StructuredFormat.YAML, writer, attempt);
        } else if (xmlDocument) {
            redactDocument(readAll(reader), StructuredFormat.XML, writer, attempt);
        } else if (jsonFile) {
            String content = readAll(reader);
            if (looksLikeJsonLines(content)) {
                redactLines(new BufferedReader(new StringReader(content)), writer, attempt, StructuredFormat.JSON);
            } else {
                redactDocument(content, StructuredFormat.JSON, writer, attempt);
            }
        } else if (jsonLinesFile) {
            redactLines(reader, writer, attempt, StructuredFormat.JSON);
        } else {
            redactLines(reader, writer, attempt, structuredMode == StructuredMode.NONE ? StructuredFormat.NONE : null);
        }
        writer.flush();
    }

    /**
     * @param lineFormat Format of every line, null to detect single-line JSON objects
     */
    private void redactLines(BufferedReader reader, BufferedWriter writer, Attempt attempt,
                             @Nullable StructuredFormat lineFormat) throws IOException {
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Redaction of " + attempt.source + " was cancelled");
            }
            lineNumber++;
            StructuredFormat format = lineFormat != null ? lineFormat : detectLineFormat(line);
            if (format == StructuredFormat.JSON && line.isBlank()) {
                format = StructuredFormat.NONE;
            }
            SanitizedResult result = attempt.redact(
                new RedactionUnit(attempt.source, lineNumber, line, format));
            writer.write(result.text());
            writer.newLine();

            if (result.isRedacted()) {
                logger.debug("Redacted line {}", lineNumber);
            }
            if (lineNumber % PROGRESS_INTERVAL == 0) {
                logger.info("Processed {} lines ({} redacted)", lineNumber, attempt.stats.getChangedUnits());
            }
        }
    }

    private void redactDocument(String content, StructuredFormat format, BufferedWriter writer, Attempt attempt)
            throws IOException {
        if (content.isBlank()) {
            writer.write(content);
            return;
        }
        SanitizedResult document = backend.redact(new RedactionUnit(attempt.source, 1, content, format), attempt.profile);
        if (document.isDegraded() && !hasKeyPathTraces(document)) {
            // Not a valid document: redact it as plain lines and keep the parser's note
            attempt.notes.addAll(document.notes());
            attempt.stats.recordDegradedUnit();
            redactLines(new BufferedReader(new StringReader(content)), writer, attempt, StructuredFormat.NONE);
            return;
        }
        attempt.record(document);
        writer.write(document.text());
        if (content.endsWith("\n") && !document.text().endsWith("\n")) {
            writer.newLine();
        }
    }

    /**
     * Lines that look like a complete JSON object are structured, everything else is plain text.
     */
    public static StructuredFormat detectLineFormat(String line) {
        String trimmed = line.trim();
        return trimmed.length() >= 2 && trimmed.startsWith("{") && trimmed.endsWith("}")
            ? StructuredFormat.JSON
            : StructuredFormat.NONE;
    }

    /**
     * More than one non-blank line, each a complete single-line object.
     */
    static boolean looksLikeJsonLines(String content) {
        int objects = 0;
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            if (detectLineFormat(line) != StructuredFormat.JSON) {
                return false;
            }
            objects++;
        }
        return objects > 1;
    }

    static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * A degraded result with key path traces was parsed but could not be written back;
     * its text already has the key path values replaced.
     */
    private static boolean hasKeyPathTraces(SanitizedResult result) {
        return result.traces().stream().anyMatch(trace -> trace.reason() == TraceReason.KEY_PATH);
    }

    /**
     * Default output file name: {@code app.log} becomes {@code app.redacted.log}.
     */
    public static Path defaultOutputPath(Path input) {
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String outputName = dot > 0
            ? fileName.substring(0, dot) + ".redacted" + fileName.substring(dot)
            : fileName + ".redacted";
        return input.resolveSibling(outputName);
    }

    private static String readAll(BufferedReader reader) throws IOException {
        StringWriter content = new StringWriter();
        reader.transferTo(content);
        return content.toString();
    }

    private static CharsetDecoder strictDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static CharsetDecoder replacingDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    public RedactionStats getStats() {
        return stats;
    }

    /**
     * Results of one pass over a file, committed only when the pass succeeded.
     */
    private final class Attempt {
        final String source;
        final Profile profile;
        final RedactionStats stats = new RedactionStats();
        final List<RedactionTrace> traces = new ArrayList<>();
        final List<String> notes = new ArrayList<>();

        Attempt(String source, Profile profile) {
            this.source = source;
            this.profile = profile;
        }

        SanitizedResult redact(RedactionUnit unit) {
            SanitizedResult result = backend.redact(unit, profile);
            record(result);
            return result;
        }

        void record(SanitizedResult result) {
            stats.record(result);
            traces.addAll(result.traces());
            notes.addAll(result.notes());
        }
    }
}
