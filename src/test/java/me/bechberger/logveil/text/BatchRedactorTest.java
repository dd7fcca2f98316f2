package me.bechberger.logveil.text;

import me.bechberger.logveil.backend.LocalBackend;
import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionEngine;
import me.bechberger.logveil.engine.RedactionStats;
import me.bechberger.logveil.engine.RedactionTrace;
import me.bechberger.logveil.testutil.ProfileBuilder;
import me.bechberger.logveil.testutil.LogFileBuilder;
import me.bechberger.logveil.text.BatchRedactor.BatchResult;
import me.bechberger.logveil.text.BatchRedactor.OutputMode;
import me.bechberger.logveil.trace.TraceAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for redacting directories on a worker pool.
 */
public class BatchRedactorTest {

    @TempDir
    Path tempDir;

    private Profile emailProfile;
    private Profile digitProfile;
    private RedactionStats stats;
    private TraceAggregator traces;
    private TextFileRedactor fileRedactor;

    @BeforeEach
    void setUp() throws IOException {
        emailProfile = ProfileBuilder.create("email")
            .withRule("email", "[a-z]+@[a-z]+\\.[a-z]+", "[REDACTED_EMAIL]")
            .build();
        digitProfile = ProfileBuilder.create("digits")
            .withRule("digits", "\\d+", "[N]")
            .build();
        stats = new RedactionStats();
        traces = new TraceAggregator();
        fileRedactor = new TextFileRedactor(new LocalBackend(new RedactionEngine(emailProfile)),
            StructuredMode.AUTO, stats, traces);
    }

    private BatchRedactor batch(OutputMode mode, Path outputDirectory, List<String> includes) {
        return new BatchRedactor(fileRedactor, file -> emailProfile, 4, mode, outputDirectory, includes);
    }

    private Path logFile(String relative, String... lines) throws IOException {
        return LogFileBuilder.create().outputTo(tempDir.resolve(relative)).withLines(lines).build();
    }

    @Test
    public void testCollectFiles() throws IOException {
        Path a = logFile("in/a.log", "x");
        Path b = logFile("in/b.json", "{}");
        Path nested = logFile("in/sub/c.log", "x");
        Path syslog = logFile("in/syslog", "x");
        logFile("in/a.redacted.log", "x");
        logFile("in/.hidden.log", "x");
        logFile("in/image.png", "x");
        BatchRedactor redactor = batch(OutputMode.SIBLING, null, List.of());

        assertEquals(List.of(a, b, syslog), redactor.collectFiles(tempDir.resolve("in"), false));
        assertEquals(List.of(a, b, nested, syslog), redactor.collectFiles(tempDir.resolve("in"), true));
    }

    @Test
    public void testIncludeGlobsReplaceExtensionFilter() throws IOException {
        logFile("in/a.log", "x");
        Path png = logFile("in/image.png", "x");
        BatchRedactor redactor = batch(OutputMode.SIBLING, null, List.of("*.png"));

        assertEquals(List.of(png), redactor.collectFiles(tempDir.resolve("in"), true));
    }

    @Test
    public void testSiblingOutput() throws IOException {
        Path a = logFile("in/a.log", "mail bob@example.com");
        Path b = logFile("in/b.log", "clean");
        BatchRedactor redactor = batch(OutputMode.SIBLING, null, List.of());

        BatchResult result = redactor.run(List.of(a, b), tempDir.resolve("in"));

        assertFalse(result.hasFailures());
        assertEquals(2, result.results().size());
        assertEquals("mail [REDACTED_EMAIL]\n", Files.readString(tempDir.resolve("in/a.redacted.log")));
        assertEquals("clean\n", Files.readString(tempDir.resolve("in/b.redacted.log")));
        assertEquals(2, stats.getProcessedFiles());
    }

    @Test
    public void testOutputDirectoryMirrorsLayout() throws IOException {
        Path root = tempDir.resolve("in");
        Path a = logFile("in/a.log", "mail bob@example.com");
        Path c = logFile("in/sub/c.log", "mail carol@example.com");
        Path out = tempDir.resolve("out");
        BatchRedactor redactor = batch(OutputMode.SIBLING, out, List.of());

        redactor.run(redactor.collectFiles(root, true), root);

        assertEquals("mail [REDACTED_EMAIL]\n", Files.readString(out.resolve("a.log")));
        assertEquals("mail [REDACTED_EMAIL]\n", Files.readString(out.resolve("sub").resolve("c.log")));
        assertEquals("mail bob@example.com\n", Files.readString(a), "inputs stay untouched");
        assertEquals("mail carol@example.com\n", Files.readString(c));
    }

    @Test
    public void testInPlaceAndDryRun() throws IOException {
        Path a = logFile("a.log", "mail bob@example.com");
        Path b = logFile("b.log", "mail bob@example.com");

        batch(OutputMode.IN_PLACE, null, List.of()).run(List.of(a), null);
        BatchResult dryRun = batch(OutputMode.DRY_RUN, null, List.of()).run(List.of(b), null);

        assertEquals("mail [REDACTED_EMAIL]\n", Files.readString(a));
        assertEquals("mail bob@example.com\n", Files.readString(b));
        assertNull(dryRun.results().get(0).output());
        assertEquals(1, dryRun.results().get(0).redactions());
    }

    @Test
    public void testFailingFileDoesNotStopOthers() throws IOException {
        Path a = logFile("a.log", "mail bob@example.com");
        Path missing = tempDir.resolve("missing.log");
        Path c = logFile("c.log", "mail carol@example.com");

        BatchResult result = batch(OutputMode.SIBLING, null, List.of()).run(List.of(a, missing, c), tempDir);

        assertTrue(result.hasFailures());
        assertEquals(1, result.failures().size());
        assertEquals(missing, result.failures().get(0).file());
        assertEquals(2, result.results().size());
        assertTrue(Files.exists(tempDir.resolve("a.redacted.log")));
        assertTrue(Files.exists(tempDir.resolve("c.redacted.log")));
        assertFalse(Files.exists(tempDir.resolve("missing.redacted.log")));
        assertEquals(1, stats.getFailedFiles());
        assertEquals(2, stats.getProcessedFiles());
        assertEquals(2, traces.size());
    }

    @Test
    public void testProfilePerFile() throws IOException {
        Path mail = logFile("mail.log", "bob@example.com 42");
        Path numbers = logFile("numbers.log", "bob@example.com 42");
        BatchRedactor redactor = new BatchRedactor(fileRedactor,
            file -> file.getFileName().toString().startsWith("numbers") ? digitProfile : emailProfile,
            2, OutputMode.SIBLING, null, List.of());

        BatchResult result = redactor.run(List.of(mail, numbers), tempDir);

        assertEquals("[REDACTED_EMAIL] 42\n", Files.readString(tempDir.resolve("mail.redacted.log")));
        assertEquals("bob@example.com [N]\n", Files.readString(tempDir.resolve("numbers.redacted.log")));
        assertThat(result.results()).extracting(FileResult::profileName).containsExactly("email", "digits");
    }

    @Test
    public void testTraceOrderDoesNotDependOnScheduling() throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String[] lines = new String[50];
            for (int line = 0; line < lines.length; line++) {
                lines[line] = "user" + (char) ('a' + line % 26) + "@example.com";
            }
            files.add(logFile("f" + (char) ('a' + i) + ".log", lines));
        }

        batch(OutputMode.DRY_RUN, null, List.of()).run(files, tempDir);

        List<RedactionTrace> snapshot = traces.snapshot();
        assertEquals(600, snapshot.size());
        assertEquals(files.get(0).toString(), snapshot.get(0).source());
        assertEquals(1, snapshot.get(0).lineNumber());
        assertEquals(files.get(11).toString(), snapshot.get(599).source());
        assertEquals(50, snapshot.get(599).lineNumber());
    }

    @Test
    public void testInvalidThreadCount() {
        assertThrows(IllegalArgumentException.class,
            () -> new BatchRedactor(fileRedactor, file -> emailProfile, 0, OutputMode.SIBLING, null, List.of()));
    }

    @Test
    public void testCancelWithoutRunningBatch() {
        batch(OutputMode.SIBLING, null, List.of()).cancel();
    }
}
