package org.netpreserve.consolescan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WhitelistTest {
    @TempDir
    Path tempDir;

    @Test
    void loadsPatternsAndSkipsUnusableOnes() throws Exception {
        Path file = tempDir.resolve("whitelist.json");
        Files.writeString(file, """
                {
                  "description": "Third-party noise",
                  "patterns": ["*AppInsights*", "", "   ", 42, null, "ResizeObserver loop*"]
                }
                """);

        Whitelist whitelist = Whitelist.load(file);

        assertEquals("Third-party noise", whitelist.description());
        assertEquals(2, whitelist.size());
        assertTrue(whitelist.matches("appinsights: failed to flush"));
        assertTrue(whitelist.matches("ResizeObserver loop completed with undelivered notifications."));
        assertFalse(whitelist.matches("TypeError: x is undefined"));
    }

    @Test
    void rejectsFilesWithoutAPatternsArray() throws Exception {
        Path noPatterns = tempDir.resolve("no-patterns.json");
        Files.writeString(noPatterns, "{\"description\": \"oops\"}");
        assertThrows(WhitelistException.class, () -> Whitelist.load(noPatterns));

        Path array = tempDir.resolve("array.json");
        Files.writeString(array, "[\"*x*\"]");
        assertThrows(WhitelistException.class, () -> Whitelist.load(array));

        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"patterns\": [");
        assertThrows(WhitelistException.class, () -> Whitelist.load(broken));

        assertThrows(WhitelistException.class, () -> Whitelist.load(tempDir.resolve("missing.json")));
    }

    @Test
    void emptyWhitelistMatchesNothing() {
        assertFalse(Whitelist.EMPTY.matches("anything"));
        assertEquals(0, Whitelist.EMPTY.size());
    }
}
