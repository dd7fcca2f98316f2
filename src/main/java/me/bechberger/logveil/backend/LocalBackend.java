package me.bechberger.logveil.backend;

import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionEngine;
import me.bechberger.logveil.engine.RedactionUnit;
import me.bechberger.logveil.engine.SanitizedResult;

/**
 * Runs the engine in this JVM.
 */
public class LocalBackend implements RedactionBackend {

    public static final String NAME = "java";

    private final RedactionEngine engine;

    public LocalBackend(RedactionEngine engine) {
        this.engine = engine;
    }

    @Override
    public SanitizedResult redact(RedactionUnit unit, Profile profile) {
        return engine.redact(unit, profile);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
