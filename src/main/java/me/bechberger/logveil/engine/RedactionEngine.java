package me.bechberger.logveil.engine;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Redacts one unit of input against a compiled {@link Profile}.
 *
 * <p>Line-oriented units go through the pattern rules first and the entropy analyzer second,
 * so entropy only ever sees text no rule recognized. Structured units are parsed; key-path
 * rules are applied to the tree and every remaining string value goes through the same line
 * pipeline. A unit that does not parse is redacted as plain text and the result carries a note.
 * XML documents are read into the same trees, below a single field named after the root element,
 * so their key paths start with the root element's name.</p>
 *
 * <p>The engine keeps no state between calls. It reads the current profile once per call, so
 * any number of threads may share one engine while the profile is being reloaded.</p>
 *
 * Usage:
 * <pre>
 * RedactionEngine engine = new RedactionEngine(new ProfileHolder(profile));
 * SanitizedResult result = engine.redact(RedactionUnit.line("app.log", 1, "mail admin@example.com"));
 * result.text();   // "mail [REDACTED_EMAIL]"
 * result.traces(); // one trace, rule "email"
 * </pre>
 */
public class RedactionEngine {

    private static final Logger logger = LoggerFactory.getLogger(RedactionEngine.class);

    private static final int MAX_LOGGED_VALUE_LENGTH = 100;

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .build();

    private static final YAMLMapper YAML_MAPPER = YAMLMapper.builder(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build())
        .build();

    private static final XmlMapper XML_MAPPER = new XmlMapper();

    private final ProfileHolder profiles;

    public RedactionEngine(ProfileHolder profiles) {
        this.profiles = profiles;
    }

    public RedactionEngine(Profile profile) {
        this(new ProfileHolder(profile));
    }

    /**
     * Redact a unit with the current profile.
     */
    public SanitizedResult redact(RedactionUnit unit) {
        return redact(unit, profiles.current());
    }

    /**
     * Redact a unit with an explicit profile. A pure function of its arguments.
     */
    public SanitizedResult redact(RedactionUnit unit, Profile profile) {
        if (unit.isStructured()) {
            return redactStructured(unit, profile);
        }
        TraceCollector collector = new TraceCollector(unit, profile);
        String text = collector.redactText(unit.text(), null);
        return new SanitizedResult(text, collector.traces);
    }

    public ProfileHolder getProfiles() {
        return profiles;
    }

    private SanitizedResult redactStructured(RedactionUnit unit, Profile profile) {
        List<JsonNode> documents;
        try {
            documents = parse(unit);
        } catch (JsonProcessingException e) {
            String note = degradeNote(unit, e.getLocation());
            logger.debug(note);
            TraceCollector collector = new TraceCollector(unit, profile);
            String text = collector.redactText(unit.text(), null);
            return new SanitizedResult(text, collector.traces, List.of(note));
        } catch (IOException e) {
            // Parsing a String performs no real I/O
            throw new IllegalStateException("Unexpected I/O error while parsing " + unit.source(), e);
        }
        if (documents.isEmpty()) {
            TraceCollector collector = new TraceCollector(unit, profile);
            return new SanitizedResult(collector.redactText(unit.text(), null), collector.traces);
        }

        TraceCollector collector = new TraceCollector(unit, profile);
        List<JsonNode> redacted = new ArrayList<>(documents.size());
        for (JsonNode document : documents) {
            redacted.add(profile.getKeyPaths().redact(document, collector));
        }
        if (collector.traces.isEmpty()) {
            // Keep the original formatting when nothing changed
            return new SanitizedResult(unit.text(), List.of());
        }
        try {
            return new SanitizedResult(serialize(unit, redacted), collector.traces);
        } catch (JsonProcessingException e) {
            // XML elements that mix attributes and text have no element form to write back
            String note = "Could not write redacted " + unit.format().getName() + " in " + unit.source() + " line " +
                unit.lineNumber() + ", redacted as plain text";
            logger.debug("{}: {}", note, e.getOriginalMessage());
            TraceCollector fallback = new TraceCollector(unit, profile);
            String text = fallback.redactText(unit.text(), null);
            text = fallback.replaceKeyPathValues(text, collector.traces);
            return new SanitizedResult(text, fallback.traces, List.of(note));
        }
    }

    private static List<JsonNode> parse(RedactionUnit unit) throws IOException {
        return switch (unit.format()) {
            case JSON -> {
                JsonNode node = JSON_MAPPER.readTree(unit.text());
                yield node == null || node.isMissingNode() ? List.of() : List.of(node);
            }
            case YAML -> {
                try (MappingIterator<JsonNode> it = YAML_MAPPER.readerFor(JsonNode.class).readValues(unit.text())) {
                    List<JsonNode> docs = new ArrayList<>();
                    while (it.hasNextValue()) {
                        JsonNode node = it.nextValue();
                        if (node != null && !node.isMissingNode()) {
                            docs.add(node);
                        }
                    }
                    yield docs;
                }
            }
            case XML -> {
                JsonNode node = XML_MAPPER.readTree(unit.text());
                if (node == null || node.isMissingNode()) {
                    yield List.of();
                }
                ObjectNode document = JsonNodeFactory.instance.objectNode();
                document.set(rootElementName(unit.text()), node);
                yield List.of(document);
            }
            case NONE -> throw new IllegalArgumentException("Not a structured unit");
        };
    }

    private static String rootElementName(String xml) throws IOException {
        try {
            XMLStreamReader reader = XML_MAPPER.getFactory().getXMLInputFactory()
                .createXMLStreamReader(new StringReader(xml));
            try {
                while (reader.hasNext()) {
                    if (reader.next() == XMLStreamConstants.START_ELEMENT) {
                        return reader.getLocalName();
                    }
                }
            } finally {
                reader.close();
            }
        } catch (XMLStreamException e) {
            throw new JsonParseException((JsonParser) null, "Invalid XML: " + e.getMessage());
        }
        throw new JsonParseException((JsonParser) null, "XML document without root element");
    }

    private static String serializeXml(RedactionUnit unit, JsonNode document) throws JsonProcessingException {
        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        String rootName;
        JsonNode root;
        if (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            rootName = entry.getKey();
            root = entry.getValue();
        } else {
            // The root element itself was removed
            return "";
        }
        ObjectWriter writer = XML_MAPPER.writer().withRootName(rootName);
        if (unit.text().stripLeading().startsWith("<?xml")) {
            writer = writer.with(ToXmlGenerator.Feature.WRITE_XML_DECLARATION);
        }
        if (unit.text().strip().contains("\n")) {
            writer = writer.withDefaultPrettyPrinter();
        }
        String xml = writer.writeValueAsString(root).stripTrailing();
        return unit.text().endsWith("\n") ? xml + "\n" : xml;
    }

    private static String serialize(RedactionUnit unit, List<JsonNode> documents) throws JsonProcessingException {
        if (unit.format() == StructuredFormat.XML) {
            return serializeXml(unit, documents.get(0));
        }
        if (unit.format() == StructuredFormat.JSON) {
            JsonNode document = documents.get(0);
            return unit.text().contains("\n")
                ? JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                : JSON_MAPPER.writeValueAsString(document);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < documents.size(); i++) {
            if (i > 0) {
                sb.append("---\n");
            }
            sb.append(YAML_MAPPER.writeValueAsString(documents.get(i)));
        }
        String yaml = sb.toString();
        return unit.text().endsWith("\n") ? yaml : yaml.stripTrailing();
    }

    /**
     * Only the position goes into the note; parser messages quote the offending input.
     */
    private static String degradeNote(RedactionUnit unit, @Nullable JsonLocation location) {
        String where = location == null ? "" :
            " (parse error at line " + location.getLineNr() + ", column " + location.getColumnNr() + ")";
        return "Malformed " + unit.format().getName() + " in " + unit.source() + " line " + unit.lineNumber() +
            where + ", redacted as plain text";
    }

    static String truncate(String value) {
        return value.length() <= MAX_LOGGED_VALUE_LENGTH ? value : value.substring(0, MAX_LOGGED_VALUE_LENGTH) + "...";
    }

    /**
     * Working state of a single call: numbers traces in detection order.
     */
    private static final class TraceCollector implements StructuredPathRedactor.Visitor {
        private final RedactionUnit unit;
        private final Profile profile;
        private final List<RedactionTrace> traces = new ArrayList<>();

        TraceCollector(RedactionUnit unit, Profile profile) {
            this.unit = unit;
            this.profile = profile;
        }

        String redactText(String text, @Nullable String path) {
            PatternRuleSet.Outcome outcome = profile.getRules().matchAndReplace(text);
            for (PatternRuleSet.Match match : outcome.matches()) {
                add(path, match.original(), match.replacement(), match.rule(), TraceReason.PATTERN_MATCH, null);
            }
            EntropyAnalyzer.Result entropy = profile.getEntropy().apply(outcome.line());
            for (EntropyAnalyzer.Detection detection : entropy.detections()) {
                add(path, detection.token(), EntropyAnalyzer.SECRET_MARKER, EntropyAnalyzer.RULE_NAME,
                    TraceReason.ENTROPY_DETECTION, detection.score());
            }
            return entropy.line();
        }

        /**
         * Replace the values key-path rules matched in the tree wherever they still occur in the raw text.
         */
        String replaceKeyPathValues(String text, List<RedactionTrace> treeTraces) {
            for (RedactionTrace trace : treeTraces) {
                String original = trace.originalValue();
                if (trace.reason() == TraceReason.KEY_PATH && !original.isEmpty() && text.contains(original)) {
                    text = text.replace(original, trace.redactedValue());
                    add(trace.path(), original, trace.redactedValue(), trace.rule(), TraceReason.KEY_PATH, null);
                }
            }
            return text;
        }

        @Override
        public void keyPathRedacted(String displayPath, KeyPathRule rule, String original, String replacement) {
            add(displayPath, original, replacement, rule.getRuleName(), TraceReason.KEY_PATH, null);
        }

        @Override
        public String freeText(String displayPath, String value) {
            return redactText(value, displayPath);
        }

        private void add(@Nullable String path, String original, String replacement, String rule, TraceReason reason,
                         @Nullable Double score) {
            if (logger.isDebugEnabled()) {
                logger.debug("{}:{}{} {} redacted '{}'", unit.source(), unit.lineNumber(),
                    path != null ? " " + path : "", rule, truncate(original));
            }
            traces.add(new RedactionTrace(unit.source(), unit.lineNumber(), path, traces.size(), original,
                replacement, rule, reason, score));
        }
    }
}
