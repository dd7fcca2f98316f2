package me.bechberger.logveil.trace;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.bechberger.logveil.engine.RedactionTrace;
import me.bechberger.logveil.engine.SanitizedResult;
import me.bechberger.logveil.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered audit log of the traces of a whole run.
 * <p>
 * Workers append in whatever order they finish; {@link #snapshot()} and the exports always
 * sort by source, line and detection order, so two runs over the same input produce
 * byte-identical audit output however the work was scheduled.
 */
public class TraceAggregator {

    private static final Logger logger = LoggerFactory.getLogger(TraceAggregator.class);

    /**
     * Export formats of the audit log.
     */
    public enum Format {
        /** One JSON array */
        JSON,
        /** One JSON object per line */
        JSONL;

        public static Format fromString(String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "json" -> JSON;
                case "jsonl", "json-lines", "ndjson" -> JSONL;
                default -> throw new IllegalArgumentException(
                    "Unknown trace format: " + value + " (expected json or jsonl)");
            };
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final List<RedactionTrace> traces = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();
    private final ObjectMapper mapper = new ObjectMapper()
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    /**
     * Copy the traces and notes of one result into the log.
     */
    public void add(SanitizedResult result) {
        if (result.traces().isEmpty() && result.notes().isEmpty()) {
            return;
        }
        lock.lock();
        try {
            traces.addAll(result.traces());
            notes.addAll(result.notes());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append a batch of traces and notes, e.g. the buffer of one completed file.
     */
    public void addAll(List<RedactionTrace> batch, List<String> batchNotes) {
        if (batch.isEmpty() && batchNotes.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            traces.addAll(batch);
            notes.addAll(batchNotes);
        } finally {
            lock.unlock();
        }
    }

    /**
     * All traces in audit order.
     */
    public List<RedactionTrace> snapshot() {
        List<RedactionTrace> copy;
        lock.lock();
        try {
            copy = new ArrayList<>(traces);
        } finally {
            lock.unlock();
        }
        copy.sort(RedactionTrace.AUDIT_ORDER);
        return copy;
    }

    /**
     * Notes about degraded input, in the order they were added.
     */
    public List<String> getNotes() {
        lock.lock();
        try {
            return List.copyOf(notes);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return traces.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            traces.clear();
            notes.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write the log as a pretty-printed JSON array.
     */
    public void writeJson(OutputStream out) throws IOException {
        ObjectWriter writer = mapper.writer().with(SerializationFeature.INDENT_OUTPUT);
        writer.writeValue(out, snapshot());
        out.write('\n');
        out.flush();
    }

    /**
     * Write the log as JSON Lines, one trace per line.
     */
    public void writeJsonLines(OutputStream out) throws IOException {
        ObjectWriter writer = mapper.writer();
        for (RedactionTrace trace : snapshot()) {
            out.write(writer.writeValueAsBytes(trace));
            out.write('\n');
        }
        out.flush();
    }

    public void write(OutputStream out, Format format) throws IOException {
        if (format == Format.JSONL) {
            writeJsonLines(out);
        } else {
            writeJson(out);
        }
    }

    /**
     * Write the log to a file, replacing it only once the export is complete.
     */
    public void writeTo(Path file, Format format) throws IOException {
        Path temp = AtomicFiles.createSibling(file);
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                write(out, format);
            }
            AtomicFiles.moveIntoPlace(temp, file);
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.info("Wrote {} trace entries to {}", size(), file);
    }

    /**
     * Human readable listing, used by the test command.
     */
    public void print(Writer out) throws IOException {
        for (RedactionTrace trace : snapshot()) {
            out.write(String.format("  %s:%s  %-20s %s -> %s%n", trace.source(), trace.location(), trace.rule(),
                quote(trace.originalValue()), quote(trace.redactedValue())));
        }
        out.flush();
    }

    private static String quote(String value) {
        return "'" + value + "'";
    }
}
