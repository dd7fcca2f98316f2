package me.bechberger.logveil.engine;

import me.bechberger.logveil.ConfigLoader.ConfigurationException;
import me.bechberger.logveil.config.ProfileConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The current profile of an engine, swapped atomically on reload.
 * <p>
 * Readers call {@link #current()} once per unit and keep using that instance, so a unit is
 * always redacted by exactly one profile even if a reload happens concurrently.
 */
public class ProfileHolder {

    private static final Logger logger = LoggerFactory.getLogger(ProfileHolder.class);

    private final AtomicLong revisions = new AtomicLong(0);
    private final AtomicReference<Profile> current;

    public ProfileHolder(Profile initial) {
        this.current = new AtomicReference<>(initial.withRevision(revisions.incrementAndGet()));
    }

    public Profile current() {
        return current.get();
    }

    /**
     * Install an already compiled profile.
     *
     * @return The installed profile with its new revision
     */
    public Profile install(Profile profile) {
        Profile installed = profile.withRevision(revisions.incrementAndGet());
        Profile previous = current.getAndSet(installed);
        logger.debug("Profile '{}' rev {} replaced by '{}' rev {}", previous.getName(), previous.getRevision(),
            installed.getName(), installed.getRevision());
        return installed;
    }

    /**
     * Compile and install a profile configuration. On failure the current profile stays in place.
     *
     * @throws ConfigurationException if the configuration does not compile
     */
    public Profile reload(ProfileConfig config) throws ConfigurationException {
        return install(Profile.compile(config));
    }
}
