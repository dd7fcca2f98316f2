package me.bechberger.logveil.engine;

import me.bechberger.logveil.ConfigLoader.ConfigurationException;
import me.bechberger.logveil.config.PatternRuleConfig;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled, immutable detection rule: a matcher plus a replacement template.
 * <p>
 * Compiled once when the profile is loaded; {@link #apply} creates its own {@link Matcher}
 * per call so a rule can be shared by any number of threads.
 */
public final class PatternRule {

    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final String name;
    private final Pattern pattern;
    private final String replacementTemplate;
    private final List<TemplatePart> template;
    private final boolean enabled;
    private final int priority;
    private final @Nullable String description;

    private PatternRule(String name, Pattern pattern, String replacementTemplate, List<TemplatePart> template,
                        boolean enabled, int priority, @Nullable String description) {
        this.name = name;
        this.pattern = pattern;
        this.replacementTemplate = replacementTemplate;
        this.template = template;
        this.enabled = enabled;
        this.priority = priority;
        this.description = description;
    }

    /**
     * Compile a rule definition.
     *
     * @param config   The rule as read from the profile
     * @param priority Position of the rule in the profile, 0 is the highest priority
     * @throws ConfigurationException if the pattern or the replacement template is invalid
     */
    public static PatternRule compile(PatternRuleConfig config, int priority) throws ConfigurationException {
        String name = config.getName();
        if (name == null || name.isBlank()) {
            throw new ConfigurationException(
                "Pattern rule #" + (priority + 1) + " has no name.\n" +
                "Every rule needs a unique 'name'; it is reported in the audit trace."
            );
        }
        if (config.getPattern() == null || config.getPattern().isEmpty()) {
            throw new ConfigurationException(
                "Pattern rule '" + name + "' has no pattern.\n" +
                "Please add a 'pattern' with a Java regular expression."
            );
        }

        Pattern pattern;
        try {
            pattern = Pattern.compile(config.getPattern(), config.isIgnoreCase() ? Pattern.CASE_INSENSITIVE : 0);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException(
                "Invalid regular expression in pattern rule '" + name + "':\n" +
                e.getMessage() + "\n" +
                "Note: patterns use Java regex syntax.",
                e
            );
        }

        String replacement = config.getReplacement();
        if (replacement == null || replacement.isEmpty()) {
            replacement = defaultReplacement(name);
        }
        List<TemplatePart> template = parseTemplate(name, replacement, pattern);

        return new PatternRule(name, pattern, replacement, template, config.isEnabled(), priority,
            config.getDescription());
    }

    /**
     * Default marker for a rule, e.g. {@code [REDACTED_EMAIL]} for a rule named "email".
     */
    public static String defaultReplacement(String ruleName) {
        return "[REDACTED_" + ruleName.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_") + "]";
    }

    /**
     * Replace all non-overlapping matches in one left-to-right pass.
     * A match whose expansion equals the matched text is left alone and not reported.
     *
     * @param line       Current state of the line
     * @param detections Receives one entry per substitution, in match order
     * @return The line after substitution
     */
    String apply(String line, List<Detection> detections) {
        Matcher matcher = pattern.matcher(line);
        StringBuilder sb = null;
        int last = 0;
        while (matcher.find()) {
            if (matcher.end() == matcher.start()) {
                continue;
            }
            String matched = matcher.group();
            String replacement = expand(matcher);
            if (replacement.equals(matched)) {
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(line.length());
            }
            sb.append(line, last, matcher.start()).append(replacement);
            last = matcher.end();
            detections.add(new Detection(matched, replacement));
        }
        if (sb == null) {
            return line;
        }
        sb.append(line, last, line.length());
        return sb.toString();
    }

    private String expand(Matcher matcher) {
        if (template.size() == 1 && template.get(0) instanceof Literal literal) {
            return literal.text();
        }
        StringBuilder sb = new StringBuilder();
        for (TemplatePart part : template) {
            if (part instanceof Literal literal) {
                sb.append(literal.text());
            } else if (part instanceof GroupRef ref) {
                String value = ref.groupName() != null ? matcher.group(ref.groupName()) : matcher.group(ref.groupIndex());
                if (value != null) {
                    sb.append(value);
                }
            }
        }
        return sb.toString();
    }

    /**
     * Split a replacement template into literal text and capture group references.
     * Supports {@code $1}, {@code ${name}} and {@code \1}; {@code \} escapes the next character.
     */
    static List<TemplatePart> parseTemplate(String ruleName, String template, Pattern pattern)
            throws ConfigurationException {
        int groupCount = pattern.matcher("").groupCount();
        Set<String> groupNames = namedGroups(pattern);
        List<TemplatePart> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            boolean dollar = c == '$';
            if ((dollar || c == '\\') && i + 1 < template.length()) {
                char next = template.charAt(i + 1);
                if (Character.isDigit(next)) {
                    int end = i + 1;
                    while (end < template.length() && Character.isDigit(template.charAt(end))) {
                        end++;
                    }
                    // Take the longest prefix that still names an existing group
                    int group = Integer.parseInt(template.substring(i + 1, i + 2));
                    int consumed = i + 2;
                    for (int j = i + 3; j <= end; j++) {
                        int candidate = Integer.parseInt(template.substring(i + 1, j));
                        if (candidate > groupCount) break;
                        group = candidate;
                        consumed = j;
                    }
                    checkGroup(ruleName, template, group, groupCount);
                    flush(literal, parts);
                    parts.add(new GroupRef(group, null));
                    i = consumed;
                    continue;
                }
                if (dollar && next == '{') {
                    int close = template.indexOf('}', i + 2);
                    if (close < 0) {
                        throw new ConfigurationException(
                            "Unterminated group reference in replacement of rule '" + ruleName + "': " + template);
                    }
                    String ref = template.substring(i + 2, close);
                    flush(literal, parts);
                    if (!ref.isEmpty() && ref.chars().allMatch(Character::isDigit)) {
                        int group = Integer.parseInt(ref);
                        checkGroup(ruleName, template, group, groupCount);
                        parts.add(new GroupRef(group, null));
                    } else {
                        if (!groupNames.contains(ref)) {
                            throw new ConfigurationException(
                                "Replacement of rule '" + ruleName + "' references unknown group '" + ref + "': "
                                    + template);
                        }
                        parts.add(new GroupRef(-1, ref));
                    }
                    i = close + 1;
                    continue;
                }
                if (c == '\\') {
                    literal.append(next);
                    i += 2;
                    continue;
                }
            }
            literal.append(c);
            i++;
        }
        flush(literal, parts);
        return List.copyOf(parts);
    }

    private static void checkGroup(String ruleName, String template, int group, int groupCount)
            throws ConfigurationException {
        if (group == 0) {
            throw new ConfigurationException(
                "Replacement of rule '" + ruleName + "' references the whole match (group 0): " + template + "\n" +
                "A replacement must never reproduce the matched value. Reference only capture groups " +
                "that hold non-sensitive context (e.g. a 'Bearer ' prefix)."
            );
        }
        if (group > groupCount) {
            throw new ConfigurationException(
                "Replacement of rule '" + ruleName + "' references group " + group +
                    " but the pattern only has " + groupCount + " group(s): " + template
            );
        }
    }

    private static void flush(StringBuilder literal, List<TemplatePart> parts) {
        if (literal.length() > 0) {
            parts.add(new Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private static Set<String> namedGroups(Pattern pattern) {
        Set<String> names = new HashSet<>();
        Matcher m = NAMED_GROUP.matcher(pattern.pattern());
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    public String getName() { return name; }

    public Pattern getPattern() { return pattern; }

    public String getReplacementTemplate() { return replacementTemplate; }

    public boolean isEnabled() { return enabled; }

    public int getPriority() { return priority; }

    public @Nullable String getDescription() { return description; }

    @Override
    public String toString() {
        return "PatternRule{" + name + " #" + priority + (enabled ? "" : " disabled") + ": " + pattern.pattern() + "}";
    }

    sealed interface TemplatePart permits Literal, GroupRef {
    }

    record Literal(String text) implements TemplatePart {
    }

    record GroupRef(int groupIndex, @Nullable String groupName) implements TemplatePart {
    }

    record Detection(String original, String replacement) {
    }
}
