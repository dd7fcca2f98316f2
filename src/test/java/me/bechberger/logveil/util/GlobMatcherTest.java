package me.bechberger.logveil.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobMatcherTest {

    @ParameterizedTest
    @CsvSource({
        "app.log, *.log, true",
        "app.log.1, *.log, false",
        "site.access.log, *.access.log, true",
        "siteXaccess.log, *.access.log, false",
        "app1.log, app?.log, true",
        "app12.log, app?.log, false",
        "production.log, production.log, true",
        "production.log.gz, production.log, false",
        "my-docker-app.log, *docker*.log, true",
        "a+b.log, a+b.log, true",
        "a(1).log, a(*).log, true"
    })
    void testMatches(String fileName, String glob, boolean expected) {
        assertEquals(expected, GlobMatcher.matches(fileName, glob));
    }

    @Test
    void testAnyGlobMatches() {
        assertTrue(GlobMatcher.matches("x.json", List.of("*.log", "*.json")));
        assertFalse(GlobMatcher.matches("x.yaml", List.of("*.log", "*.json")));
    }

    @Test
    void testCommaSeparatedEntries() {
        assertTrue(GlobMatcher.matches("x.json", List.of("*.log, *.json")));
        assertFalse(GlobMatcher.matches("x.json", List.of(" , ")));
    }

    @Test
    void testNullAndEmpty() {
        assertFalse(GlobMatcher.matches("x.log", (List<String>) null));
        assertFalse(GlobMatcher.matches("x.log", List.of()));
        assertFalse(GlobMatcher.matches(null, List.of("*")));
    }

    @Test
    void testRegexCharactersAreLiteral() {
        assertEquals("^\\Qa.b\\E.*$", GlobMatcher.globToRegex("a.b*"));
        assertFalse(GlobMatcher.matches("aXb.log", "a.b*"));
    }
}
