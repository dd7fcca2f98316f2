package me.bechberger.logveil.backend;

import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionUnit;
import me.bechberger.logveil.engine.SanitizedResult;

/**
 * Something that redacts a unit with a profile: the in-process engine, or an adapter for an
 * external implementation of the same contract (same rule precedence, same entropy formula,
 * same trace shape).
 */
public interface RedactionBackend extends AutoCloseable {

    /**
     * Redact one unit.
     *
     * @throws BackendException if the backend itself failed; never for malformed input
     */
    SanitizedResult redact(RedactionUnit unit, Profile profile);

    /** Short name for logs and statistics */
    String getName();

    @Override
    default void close() {
    }
}
