package me.bechberger.logveil.engine;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Statistics tracking for redaction runs. Safe to share between worker threads.
 */
public class RedactionStats {

    private final AtomicLong processedUnits = new AtomicLong(0);
    private final AtomicLong changedUnits = new AtomicLong(0);
    private final AtomicLong degradedUnits = new AtomicLong(0);
    private final AtomicLong totalRedactions = new AtomicLong(0);
    private final AtomicLong entropyDetections = new AtomicLong(0);
    private final AtomicLong processedFiles = new AtomicLong(0);
    private final AtomicLong failedFiles = new AtomicLong(0);
    private final Map<String, AtomicLong> redactionsByRule = new ConcurrentHashMap<>();

    /**
     * Record the outcome of one unit.
     */
    public void record(SanitizedResult result) {
        processedUnits.incrementAndGet();
        if (result.isRedacted()) {
            changedUnits.incrementAndGet();
        }
        if (result.isDegraded()) {
            degradedUnits.incrementAndGet();
        }
        for (RedactionTrace trace : result.traces()) {
            totalRedactions.incrementAndGet();
            if (trace.reason() == TraceReason.ENTROPY_DETECTION) {
                entropyDetections.incrementAndGet();
            }
            redactionsByRule.computeIfAbsent(trace.rule(), k -> new AtomicLong(0)).incrementAndGet();
        }
    }

    /**
     * Add the counters of another instance, e.g. the stats of one completed file.
     */
    public void mergeFrom(RedactionStats other) {
        processedUnits.addAndGet(other.getProcessedUnits());
        changedUnits.addAndGet(other.getChangedUnits());
        degradedUnits.addAndGet(other.getDegradedUnits());
        totalRedactions.addAndGet(other.getTotalRedactions());
        entropyDetections.addAndGet(other.getEntropyDetections());
        processedFiles.addAndGet(other.getProcessedFiles());
        failedFiles.addAndGet(other.getFailedFiles());
        other.redactionsByRule.forEach((rule, count) ->
            redactionsByRule.computeIfAbsent(rule, k -> new AtomicLong(0)).addAndGet(count.get()));
    }

    /**
     * Count a unit that was handled in a degraded way without producing a result of its own.
     */
    public void recordDegradedUnit() {
        degradedUnits.incrementAndGet();
    }

    public void recordFile() {
        processedFiles.incrementAndGet();
    }

    public void recordFailedFile() {
        failedFiles.incrementAndGet();
    }

    public long getProcessedUnits() {
        return processedUnits.get();
    }

    public long getChangedUnits() {
        return changedUnits.get();
    }

    public long getDegradedUnits() {
        return degradedUnits.get();
    }

    public long getTotalRedactions() {
        return totalRedactions.get();
    }

    public long getEntropyDetections() {
        return entropyDetections.get();
    }

    public long getProcessedFiles() {
        return processedFiles.get();
    }

    public long getFailedFiles() {
        return failedFiles.get();
    }

    public long getRedactions(String rule) {
        AtomicLong count = redactionsByRule.get(rule);
        return count == null ? 0 : count.get();
    }

    public Map<String, AtomicLong> getRedactionsByRule() {
        return redactionsByRule;
    }

    /**
     * Print statistics to stderr; stdout may carry redacted output.
     */
    public void print() {
        print(System.err);
    }

    public void print(PrintStream out) {
        out.println("\n" + "=".repeat(70));
        out.println("Redaction Statistics");
        out.println("=".repeat(70));
        out.println();

        out.println("Input:");
        out.println("  Files processed:          " + processedFiles.get());
        if (failedFiles.get() > 0) {
            out.println("  Files failed:             " + failedFiles.get());
        }
        out.println("  Lines processed:          " + processedUnits.get());
        out.println("  Lines changed:            " + changedUnits.get());
        out.println("  Degraded units:           " + degradedUnits.get());
        out.println();

        out.println("Redactions:");
        out.println("  Total redactions:         " + totalRedactions.get());
        out.println("  Entropy detections:       " + entropyDetections.get());
        out.println();

        if (!redactionsByRule.isEmpty()) {
            out.println("Redactions by rule:");
            redactionsByRule.entrySet().stream()
                .sorted((a, b) -> Long.compare(b.getValue().get(), a.getValue().get()))
                .forEach(entry ->
                    out.printf("  %-30s %,d%n", entry.getKey(), entry.getValue().get())
                );
            out.println();
        }

        out.println("=".repeat(70));
    }
}
