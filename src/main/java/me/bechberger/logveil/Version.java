package me.bechberger.logveil;

/**
 * Version shown by {@code --version}; compile time constants so picocli annotations can use them.
 */
public final class Version {

    public static final String APP_NAME = "logveil";

    public static final String VERSION = "0.1.0";

    public static final String FULL_VERSION = APP_NAME + " " + VERSION;

    private Version() {
    }
}
