package me.bechberger.logveil.engine;

import me.bechberger.logveil.ConfigLoader.ConfigurationException;
import me.bechberger.logveil.config.EntropyConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shannon entropy scoring for tokens that no pattern rule recognized.
 * <p>
 * Immutable; validated once when the profile is compiled.
 */
public final class EntropyAnalyzer {

    /** Replacement written for tokens classified as secrets */
    public static final String SECRET_MARKER = "[REDACTED_SECRET]";

    /** Rule identifier used in traces of entropy detections */
    public static final String RULE_NAME = "entropy";

    public static final EntropyAnalyzer DISABLED = new EntropyAnalyzer(false, EntropyConfig.DEFAULT_THRESHOLD,
        EntropyConfig.DEFAULT_MIN_LENGTH);

    private final boolean enabled;
    private final double threshold;
    private final int minLength;

    private EntropyAnalyzer(boolean enabled, double threshold, int minLength) {
        this.enabled = enabled;
        this.threshold = threshold;
        this.minLength = minLength;
    }

    /**
     * Create an analyzer, rejecting non-positive thresholds and lengths.
     */
    public static EntropyAnalyzer create(boolean enabled, double threshold, int minLength)
            throws ConfigurationException {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new ConfigurationException(
                "Invalid entropy threshold: " + threshold + "\n" +
                "The threshold is measured in bits per symbol and must be a positive number (e.g. 4.5)."
            );
        }
        if (minLength <= 0) {
            throw new ConfigurationException(
                "Invalid entropy min_length: " + minLength + "\n" +
                "The minimum token length must be a positive integer (e.g. 20)."
            );
        }
        return new EntropyAnalyzer(enabled, threshold, minLength);
    }

    public static EntropyAnalyzer fromConfig(EntropyConfig config) throws ConfigurationException {
        if (config == null) {
            config = new EntropyConfig();
        }
        return create(config.isEnabledOrDefault(), config.getThresholdOrDefault(), config.getMinLengthOrDefault());
    }

    /**
     * Shannon entropy in bits per symbol over the code points of the token.
     */
    public static double score(String token) {
        if (token == null || token.isEmpty()) {
            return 0.0;
        }
        Map<Integer, Integer> counts = new HashMap<>();
        int[] codePoints = token.codePoints().toArray();
        for (int cp : codePoints) {
            counts.merge(cp, 1, Integer::sum);
        }
        double length = codePoints.length;
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    /**
     * A token is a secret if it is long enough and random enough.
     */
    public boolean isSecret(String token) {
        return token.codePointCount(0, token.length()) >= minLength && score(token) >= threshold;
    }

    /**
     * Split a line into maximal runs of letters and digits. Markers like {@code [REDACTED_EMAIL]}
     * fall apart into short words that never reach the threshold.
     */
    static List<Token> tokenize(String line) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = line.length();
        while (i < n) {
            int cp = line.codePointAt(i);
            if (!Character.isLetterOrDigit(cp)) {
                i += Character.charCount(cp);
                continue;
            }
            int start = i;
            while (i < n) {
                cp = line.codePointAt(i);
                if (!Character.isLetterOrDigit(cp)) {
                    break;
                }
                i += Character.charCount(cp);
            }
            tokens.add(new Token(start, i, line.substring(start, i)));
        }
        return tokens;
    }

    /**
     * Replace every secret-looking token of the line. Returns the line unchanged and no
     * detections when the analyzer is disabled.
     */
    Result apply(String line) {
        if (!enabled || line.isEmpty()) {
            return new Result(line, List.of());
        }
        List<Detection> detections = new ArrayList<>();
        StringBuilder sb = null;
        int last = 0;
        for (Token token : tokenize(line)) {
            if (token.end() - token.start() < minLength || !isSecret(token.text())) {
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(line.length());
            }
            sb.append(line, last, token.start()).append(SECRET_MARKER);
            last = token.end();
            detections.add(new Detection(token.text(), score(token.text())));
        }
        if (sb == null) {
            return new Result(line, List.of());
        }
        sb.append(line, last, line.length());
        return new Result(sb.toString(), detections);
    }

    public boolean isEnabled() { return enabled; }

    public double getThreshold() { return threshold; }

    public int getMinLength() { return minLength; }

    record Token(int start, int end, String text) {
    }

    record Detection(String token, double score) {
    }

    record Result(String line, List<Detection> detections) {
    }

    @Override
    public String toString() {
        return "EntropyAnalyzer{enabled=" + enabled + ", threshold=" + threshold + ", minLength=" + minLength + "}";
    }
}
