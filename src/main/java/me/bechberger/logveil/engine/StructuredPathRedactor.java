package me.bechberger.logveil.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Applies key-path rules to a parsed document, in place.
 * <p>
 * Fields are visited in document order. A field whose key path matches a rule is redacted,
 * masked or removed as a whole, whatever its type; the first matching rule wins. String
 * values that no rule covers are handed to a {@link Visitor} so free text inside structured
 * documents can still go through the pattern and entropy passes.
 */
public final class StructuredPathRedactor {

    /** Display path of a scalar document root */
    public static final String ROOT_PATH = "$";

    /**
     * Receives every change made to the document, in traversal order.
     */
    public interface Visitor {

        /**
         * Called after a key-path rule changed or removed a value.
         *
         * @param displayPath Path including array indices, e.g. {@code users[1].email}
         */
        void keyPathRedacted(String displayPath, KeyPathRule rule, String original, String replacement);

        /**
         * Called for every string value no rule covers.
         *
         * @return The new value; the argument itself if nothing changed
         */
        String freeText(String displayPath, String value);
    }

    private final List<KeyPathRule> rules;

    public StructuredPathRedactor(List<KeyPathRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Redact the document.
     *
     * @return The (possibly replaced) root node
     */
    public JsonNode redact(JsonNode root, Visitor visitor) {
        if (root.isObject()) {
            walkObject((ObjectNode) root, new ArrayList<>(), "", visitor);
            return root;
        }
        if (root.isArray()) {
            walkArray((ArrayNode) root, new ArrayList<>(), "", visitor);
            return root;
        }
        if (root.isTextual()) {
            String value = root.asText();
            String redacted = visitor.freeText(ROOT_PATH, value);
            return redacted.equals(value) ? root : TextNode.valueOf(redacted);
        }
        return root;
    }

    private void walkObject(ObjectNode node, List<String> keyPath, String displayPath, Visitor visitor) {
        List<String> fieldNames = new ArrayList<>();
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            fieldNames.add(names.next());
        }
        for (String field : fieldNames) {
            JsonNode value = node.get(field);
            keyPath.add(field);
            String childDisplay = displayPath.isEmpty() ? field : displayPath + "." + field;
            KeyPathRule rule = findRule(keyPath);
            if (rule != null) {
                applyRule(node, field, value, rule, childDisplay, visitor);
            } else if (value.isObject()) {
                walkObject((ObjectNode) value, keyPath, childDisplay, visitor);
            } else if (value.isArray()) {
                walkArray((ArrayNode) value, keyPath, childDisplay, visitor);
            } else if (value.isTextual()) {
                String text = value.asText();
                String redacted = visitor.freeText(childDisplay, text);
                if (!redacted.equals(text)) {
                    node.set(field, TextNode.valueOf(redacted));
                }
            }
            keyPath.remove(keyPath.size() - 1);
        }
    }

    private void walkArray(ArrayNode node, List<String> keyPath, String displayPath, Visitor visitor) {
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            String elementDisplay = displayPath + "[" + i + "]";
            if (element.isObject()) {
                walkObject((ObjectNode) element, keyPath, elementDisplay, visitor);
            } else if (element.isArray()) {
                walkArray((ArrayNode) element, keyPath, elementDisplay, visitor);
            } else if (element.isTextual()) {
                String text = element.asText();
                String redacted = visitor.freeText(elementDisplay, text);
                if (!redacted.equals(text)) {
                    node.set(i, TextNode.valueOf(redacted));
                }
            }
        }
    }

    private void applyRule(ObjectNode parent, String field, JsonNode value, KeyPathRule rule, String displayPath,
                           Visitor visitor) {
        String original = value.isTextual() ? value.asText() : value.toString();
        switch (rule.getAction()) {
            case REMOVE -> {
                parent.remove(field);
                visitor.keyPathRedacted(displayPath, rule, original, "");
            }
            case MASK -> {
                String masked = KeyPathRule.mask(original);
                if (!masked.equals(original) || !value.isTextual()) {
                    parent.set(field, TextNode.valueOf(masked));
                    visitor.keyPathRedacted(displayPath, rule, original, masked);
                }
            }
            case REDACT -> {
                String marker = rule.getReplacement();
                if (!value.isTextual() || !marker.equals(original)) {
                    parent.set(field, TextNode.valueOf(marker));
                    visitor.keyPathRedacted(displayPath, rule, original, marker);
                }
            }
        }
    }

    private KeyPathRule findRule(List<String> keyPath) {
        for (KeyPathRule rule : rules) {
            if (rule.matches(keyPath)) {
                return rule;
            }
        }
        return null;
    }

    public List<KeyPathRule> getRules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
