package me.bechberger.logveil.testutil;

import me.bechberger.logveil.ConfigLoader.ConfigurationException;
import me.bechberger.logveil.config.KeyPathConfig;
import me.bechberger.logveil.config.PatternRuleConfig;
import me.bechberger.logveil.config.ProfileConfig;
import me.bechberger.logveil.engine.Profile;

/**
 * Builder for small profiles in tests. Entropy detection is off unless enabled explicitly.
 */
public class ProfileBuilder {

    private final ProfileConfig config = new ProfileConfig();

    private ProfileBuilder(String name) {
        config.setName(name);
        config.getEntropy().setEnabled(false);
    }

    public static ProfileBuilder create(String name) {
        return new ProfileBuilder(name);
    }

    public ProfileBuilder withRule(String name, String pattern, String replacement) {
        config.getPatterns().add(new PatternRuleConfig(name, pattern, replacement));
        return this;
    }

    public ProfileBuilder withKeyPath(String path) {
        config.getKeyPaths().add(new KeyPathConfig(path));
        return this;
    }

    public ProfileBuilder withKeyPath(String path, String action) {
        config.getKeyPaths().add(new KeyPathConfig(path, action));
        return this;
    }

    public ProfileBuilder withEntropy(double threshold, int minLength) {
        config.getEntropy().setEnabled(true);
        config.getEntropy().setThreshold(threshold);
        config.getEntropy().setMinLength(minLength);
        return this;
    }

    public ProfileConfig config() {
        return config;
    }

    public Profile build() throws ConfigurationException {
        return Profile.compile(config);
    }
}
