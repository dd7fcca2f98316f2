package me.bechberger.logveil.backend;

import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionEngine;
import me.bechberger.logveil.engine.RedactionUnit;
import me.bechberger.logveil.engine.SanitizedResult;
import me.bechberger.logveil.testutil.ProfileBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class BackendDispatcherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private Profile profile;
    private RedactionEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        profile = ProfileBuilder.create("digits").withRule("digits", "\\d+", "[N]").build();
        engine = new RedactionEngine(profile);
    }

    @Test
    public void testJavaMode() {
        RedactionBackend backend = BackendDispatcher.select(BackendDispatcher.Mode.JAVA, engine, "ignored", TIMEOUT);

        assertInstanceOf(LocalBackend.class, backend);
        assertEquals("order [N]", backend.redact(RedactionUnit.line("a", 1, "order 42"), profile).text());
    }

    @Test
    public void testProcessModeNeedsCommand() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> BackendDispatcher.select(BackendDispatcher.Mode.PROCESS, engine, " ", TIMEOUT));

        assertThat(e.getMessage()).contains("--engine-command");
    }

    @Test
    public void testProcessMode() {
        RedactionBackend backend = BackendDispatcher.select(BackendDispatcher.Mode.PROCESS, engine,
            "logveil redact-unit --profile {profile}", TIMEOUT);

        ProcessBackend process = assertInstanceOf(ProcessBackend.class, backend);
        assertEquals(List.of("logveil", "redact-unit", "--profile", "{profile}"), process.getCommand());
        assertEquals(TIMEOUT, process.getTimeout());
    }

    @Test
    public void testAutoWithoutCommandIsLocal() {
        assertInstanceOf(LocalBackend.class, BackendDispatcher.select(BackendDispatcher.Mode.AUTO, engine, null, TIMEOUT));
    }

    @Test
    public void testAutoFallsBackWhenEngineCannotStart() {
        RedactionBackend backend = BackendDispatcher.select(BackendDispatcher.Mode.AUTO, engine,
            "/nonexistent/logveil-engine", TIMEOUT);
        BackendDispatcher.FallbackBackend fallback = assertInstanceOf(BackendDispatcher.FallbackBackend.class, backend);
        assertEquals(ProcessBackend.NAME, backend.getName());

        SanitizedResult result = backend.redact(RedactionUnit.line("a", 1, "order 42"), profile);

        assertEquals("order [N]", result.text());
        assertTrue(fallback.hasFailedOver());
        assertEquals(LocalBackend.NAME, backend.getName());
    }

    @Test
    public void testFallbackIsPermanent() {
        AtomicInteger primaryCalls = new AtomicInteger();
        RedactionBackend primary = new RedactionBackend() {
            @Override
            public SanitizedResult redact(RedactionUnit unit, Profile p) {
                primaryCalls.incrementAndGet();
                throw new BackendException("down");
            }

            @Override
            public String getName() {
                return "primary";
            }
        };
        BackendDispatcher.FallbackBackend backend =
            new BackendDispatcher.FallbackBackend(primary, new LocalBackend(engine));

        for (int i = 0; i < 5; i++) {
            assertEquals("[N]", backend.redact(RedactionUnit.line("a", i + 1, "7"), profile).text());
        }

        assertEquals(1, primaryCalls.get());
    }

    @Test
    public void testPrimaryResultIsUsedWhileItWorks() {
        RedactionBackend primary = new RedactionBackend() {
            @Override
            public SanitizedResult redact(RedactionUnit unit, Profile p) {
                return new SanitizedResult("from primary", List.of());
            }

            @Override
            public String getName() {
                return "primary";
            }
        };
        BackendDispatcher.FallbackBackend backend =
            new BackendDispatcher.FallbackBackend(primary, new LocalBackend(engine));

        assertEquals("from primary", backend.redact(RedactionUnit.line("a", 1, "7"), profile).text());
        assertFalse(backend.hasFailedOver());
    }

    @Test
    public void testModeFromString() {
        assertEquals(BackendDispatcher.Mode.PROCESS, BackendDispatcher.Mode.fromString(" Process "));
        assertThrows(IllegalArgumentException.class, () -> BackendDispatcher.Mode.fromString("python"));
    }
}
