package me.bechberger.logveil.backend;

/**
 * A backend could not produce a result for a unit: the external process did not start,
 * timed out, exited with an error or wrote something that is not a result.
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
