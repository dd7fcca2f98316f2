package me.bechberger.logveil.engine;

import me.bechberger.logveil.ConfigLoader.ConfigurationException;
import me.bechberger.logveil.config.PatternRuleConfig;
import me.bechberger.logveil.config.ProfileConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, immutable collection of compiled pattern rules.
 *
 * <p>Rules run strictly in profile order and each one scans the line as left by the rules
 * before it. A span consumed by an earlier rule has already been replaced when a later,
 * broader rule looks at the line, so overlapping rules never redact the same text twice.</p>
 */
public final class PatternRuleSet {

    public static final PatternRuleSet EMPTY = new PatternRuleSet(List.of());

    private final List<PatternRule> rules;
    private final List<PatternRule> activeRules;

    private PatternRuleSet(List<PatternRule> rules) {
        this.rules = List.copyOf(rules);
        this.activeRules = rules.stream().filter(PatternRule::isEnabled).toList();
    }

    /**
     * Compile rule definitions in order.
     *
     * @throws ConfigurationException on invalid patterns, templates, or duplicate names
     */
    public static PatternRuleSet compile(List<PatternRuleConfig> configs) throws ConfigurationException {
        List<PatternRule> compiled = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (PatternRuleConfig config : configs) {
            if (ProfileConfig.PARENT_MARKER.equals(config.getName()) && config.getPattern() == null) {
                continue;
            }
            PatternRule rule = PatternRule.compile(config, compiled.size());
            Integer previous = seen.putIfAbsent(rule.getName(), rule.getPriority());
            if (previous != null) {
                throw new ConfigurationException(
                    "Duplicate pattern rule name: '" + rule.getName() + "' (rules #" + (previous + 1) +
                        " and #" + (rule.getPriority() + 1) + ")\n" +
                        "Rule names identify rules in the audit trace and must be unique within a profile."
                );
            }
            compiled.add(rule);
        }
        return new PatternRuleSet(compiled);
    }

    /**
     * Apply every enabled rule to the line, in priority order.
     *
     * @return The rewritten line and one match per substitution, in detection order
     */
    public Outcome matchAndReplace(String line) {
        if (activeRules.isEmpty() || line.isEmpty()) {
            return new Outcome(line, List.of());
        }
        List<Match> matches = new ArrayList<>();
        List<PatternRule.Detection> detections = new ArrayList<>();
        String current = line;
        for (PatternRule rule : activeRules) {
            current = rule.apply(current, detections);
            for (PatternRule.Detection detection : detections) {
                matches.add(new Match(rule.getName(), detection.original(), detection.replacement()));
            }
            detections.clear();
        }
        return new Outcome(current, matches);
    }

    public List<PatternRule> getRules() { return rules; }

    public int size() { return rules.size(); }

    public int enabledCount() { return activeRules.size(); }

    /**
     * One substitution made by a rule.
     */
    public record Match(String rule, String original, String replacement) {
    }

    public record Outcome(String line, List<Match> matches) {
    }
}
