package me.bechberger.logveil.engine;

import me.bechberger.logveil.ConfigLoader.ConfigurationException;
import me.bechberger.logveil.config.PatternRuleConfig;
import me.bechberger.logveil.config.ProfileConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rule precedence within a rule set.
 */
class PatternRuleSetTest {

    @Test
    void testEarlierRuleWinsOverlappingSpan() throws ConfigurationException {
        PatternRuleSet rules = PatternRuleSet.compile(List.of(
            new PatternRuleConfig("specific", "secret-[0-9]+", "[SPECIFIC]"),
            new PatternRuleConfig("generic", "[a-z]+-[0-9]+", "[GENERIC]")
        ));

        PatternRuleSet.Outcome outcome = rules.matchAndReplace("id secret-42 and abc-7");

        assertEquals("id [SPECIFIC] and [GENERIC]", outcome.line());
        assertEquals(List.of(
            new PatternRuleSet.Match("specific", "secret-42", "[SPECIFIC]"),
            new PatternRuleSet.Match("generic", "abc-7", "[GENERIC]")
        ), outcome.matches());
    }

    @Test
    void testReversedOrderChangesAttribution() throws ConfigurationException {
        PatternRuleSet rules = PatternRuleSet.compile(List.of(
            new PatternRuleConfig("generic", "[a-z]+-[0-9]+", "[GENERIC]"),
            new PatternRuleConfig("specific", "secret-[0-9]+", "[SPECIFIC]")
        ));

        PatternRuleSet.Outcome outcome = rules.matchAndReplace("id secret-42");

        assertEquals("id [GENERIC]", outcome.line());
        assertEquals(1, outcome.matches().size());
        assertEquals("generic", outcome.matches().get(0).rule());
    }

    @Test
    void testDisabledRulesAreSkipped() throws ConfigurationException {
        PatternRuleConfig disabled = new PatternRuleConfig("digits", "\\d+", "[N]");
        disabled.setEnabled(false);
        PatternRuleSet rules = PatternRuleSet.compile(List.of(disabled));

        assertEquals(1, rules.size());
        assertEquals(0, rules.enabledCount());
        assertEquals("call 123", rules.matchAndReplace("call 123").line());
    }

    @Test
    void testDisablingEarlierRuleHandsSpanToLaterRule() throws ConfigurationException {
        PatternRuleConfig specific = new PatternRuleConfig("specific", "secret-[0-9]+", "[SPECIFIC]");
        PatternRuleConfig generic = new PatternRuleConfig("generic", "[a-z]+-[0-9]+", "[GENERIC]");

        PatternRuleSet.Outcome both = PatternRuleSet.compile(List.of(specific, generic)).matchAndReplace("id secret-42");
        assertEquals("id [SPECIFIC]", both.line());
        assertEquals(List.of(new PatternRuleSet.Match("specific", "secret-42", "[SPECIFIC]")), both.matches());

        specific.setEnabled(false);
        PatternRuleSet.Outcome withoutSpecific = PatternRuleSet.compile(List.of(specific, generic))
            .matchAndReplace("id secret-42");
        assertEquals("id [GENERIC]", withoutSpecific.line());
        assertEquals(List.of(new PatternRuleSet.Match("generic", "secret-42", "[GENERIC]")), withoutSpecific.matches());
    }

    @Test
    void testDuplicateNamesAreRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> PatternRuleSet.compile(List.of(
            new PatternRuleConfig("dup", "a", "x"),
            new PatternRuleConfig("dup", "b", "y")
        )));
        assertTrue(e.getMessage().contains("Duplicate pattern rule name"));
    }

    @Test
    void testUnresolvedParentMarkerIsIgnored() throws ConfigurationException {
        PatternRuleConfig marker = new PatternRuleConfig();
        marker.setName(ProfileConfig.PARENT_MARKER);

        PatternRuleSet rules = PatternRuleSet.compile(List.of(marker, new PatternRuleConfig("a", "a", "b")));

        assertEquals(1, rules.size());
        assertEquals(0, rules.getRules().get(0).getPriority());
    }

    @Test
    void testEmptyLine() {
        PatternRuleSet.Outcome outcome = PatternRuleSet.EMPTY.matchAndReplace("");
        assertEquals("", outcome.line());
        assertTrue(outcome.matches().isEmpty());
    }
}
