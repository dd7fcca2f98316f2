package me.bechberger.logveil.text;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of one redacted file or stream.
 *
 * @param source        Source identifier used in the traces
 * @param output        Written file, null for streams and dry runs
 * @param profileName   Profile the file was redacted with
 * @param units         Number of units (lines or documents)
 * @param changedUnits  Units with at least one redaction
 * @param redactions    Number of traces
 * @param notes         Recovered input problems
 */
public record FileResult(String source, Path output, String profileName, long units, long changedUnits,
                         long redactions, List<String> notes) {

    public FileResult {
        notes = List.copyOf(notes);
    }
}
