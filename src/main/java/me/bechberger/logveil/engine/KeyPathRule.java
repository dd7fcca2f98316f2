package me.bechberger.logveil.engine;

import me.bechberger.logveil.ConfigLoader.ConfigurationException;
import me.bechberger.logveil.config.KeyPathConfig;

import java.util.List;
import java.util.Locale;

/**
 * Compiled key-path rule for structured input.
 * <p>
 * A rule matches a node when the node's key path has the same number of segments and every
 * segment is equal, or the rule's segment is {@code *}. Array indices are not part of a key
 * path, so {@code users.email} matches the email of every element of a {@code users} array.
 */
public final class KeyPathRule {

    public static final String WILDCARD = "*";

    public enum Action {
        /** Replace the value with the marker */
        REDACT,
        /** Keep the outer characters, star the rest */
        MASK,
        /** Drop the field */
        REMOVE;

        static Action fromString(String value, String path) throws ConfigurationException {
            if (value == null || value.isBlank()) {
                return REDACT;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(
                    "Unknown action '" + value + "' for key path '" + path + "'\n" +
                    "Valid actions: redact, mask, remove"
                );
            }
        }
    }

    private final String path;
    private final List<String> segments;
    private final Action action;
    private final String replacement;

    private KeyPathRule(String path, List<String> segments, Action action, String replacement) {
        this.path = path;
        this.segments = segments;
        this.action = action;
        this.replacement = replacement;
    }

    /**
     * Compile a key-path rule.
     *
     * @param config        Rule definition
     * @param defaultMarker Marker used when the rule has no replacement of its own
     */
    public static KeyPathRule compile(KeyPathConfig config, String defaultMarker) throws ConfigurationException {
        String path = config.getPath() == null ? "" : config.getPath().trim();
        if (path.isEmpty()) {
            throw new ConfigurationException(
                "Key path rule without a path.\n" +
                "Please give every entry of 'key_paths' a dotted 'path' such as user.email"
            );
        }
        List<String> segments = List.of(path.split("\\.", -1));
        if (segments.stream().anyMatch(String::isEmpty)) {
            throw new ConfigurationException(
                "Invalid key path '" + path + "': empty segment.\n" +
                "Key paths are dot-separated keys without leading, trailing or doubled dots."
            );
        }
        Action action = Action.fromString(config.getAction(), path);
        String replacement = config.getReplacement() != null ? config.getReplacement() : defaultMarker;
        return new KeyPathRule(path, segments, action, replacement);
    }

    /**
     * Exact match of a key path, segment by segment.
     */
    public boolean matches(List<String> keyPath) {
        if (keyPath.size() != segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (!segment.equals(WILDCARD) && !segment.equals(keyPath.get(i))) {
                return false;
            }
        }
        return true;
    }

    public String getPath() { return path; }

    public Action getAction() { return action; }

    public String getReplacement() { return replacement; }

    /** Rule identifier used in traces */
    public String getRuleName() {
        return "key_path:" + path;
    }

    /**
     * Mask a value by showing only its first and last characters.
     */
    static String mask(String value) {
        int length = value.length();
        if (length <= 2) {
            return "*".repeat(length);
        }
        if (length <= 4) {
            return value.charAt(0) + "*".repeat(length - 2) + value.charAt(length - 1);
        }
        return value.substring(0, 2) + "*".repeat(length - 4) + value.substring(length - 2);
    }

    @Override
    public String toString() {
        return "KeyPathRule{" + path + " -> " + action.name().toLowerCase(Locale.ROOT) + "}";
    }
}
