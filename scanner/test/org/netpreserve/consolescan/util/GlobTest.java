package org.netpreserve.consolescan.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GlobTest {
    @Test
    void starMatchesAnyRunIncludingNone() {
        var glob = Glob.compile("*AppInsights*");
        assertTrue(glob.matches("AppInsights"));
        assertTrue(glob.matches("Failed to send telemetry: appinsights endpoint down"));
        assertFalse(glob.matches("App Insights"));
    }

    @Test
    void caseIsIgnored() {
        var glob = Glob.compile("*AppInsights*");
        assertTrue(glob.matches("APPINSIGHTS ERROR"));
        assertTrue(Glob.compile("*APPINSIGHTS*").matches("appInsights error"));
    }

    @Test
    void matchesTheWholeMessage() {
        var glob = Glob.compile("ResizeObserver loop*");
        assertTrue(glob.matches("ResizeObserver loop limit exceeded"));
        assertFalse(glob.matches("Uncaught ResizeObserver loop limit exceeded"));
    }

    @Test
    void questionMarkMatchesExactlyOneCharacter() {
        var glob = Glob.compile("HTTP 40?: *");
        assertTrue(glob.matches("HTTP 404: https://example.org/x.png"));
        assertFalse(glob.matches("HTTP 4040: https://example.org/x.png"));
    }

    @Test
    void regexCharactersAreLiteral() {
        var glob = Glob.compile("Error (code [1]).*");
        assertTrue(glob.matches("Error (code [1]).js failed"));
        assertFalse(glob.matches("Error code 1 failed"));
    }

    @Test
    void starSpansLineBreaks() {
        assertTrue(Glob.compile("first*last").matches("first\nsecond\nlast"));
    }

    @Test
    void rejectsEmptyPatternsAndNeverMatchesNull() {
        assertThrows(IllegalArgumentException.class, () -> Glob.compile(" "));
        assertFalse(Glob.compile("*").matches(null));
    }
}
