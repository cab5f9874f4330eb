package org.netpreserve.consolescan;

import org.junit.jupiter.api.Test;
import org.netpreserve.consolescan.config.ConsoleLevel;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorCollectorTest {
    @Test
    void foldsRepeatsOfTheSameKindAndMessage() {
        var collector = new ErrorCollector(ConsoleLevel.WARN, Whitelist.EMPTY);

        PageError first = collector.add(PageError.of(ErrorKind.CONSOLE_ERROR, "boom", "a.js", 1));
        assertNotNull(first);
        assertNull(collector.add(PageError.of(ErrorKind.CONSOLE_ERROR, "  boom ", "b.js", 9)));
        assertNotNull(collector.add(PageError.of(ErrorKind.PAGE_ERROR, "boom")));

        List<PageError> errors = collector.errors();
        assertEquals(2, errors.size());
        assertEquals(2, errors.get(0).occurrences());
        assertEquals("a.js", errors.get(0).sourceUrl(), "first occurrence keeps its source");
        assertEquals(ErrorKind.PAGE_ERROR, errors.get(1).kind());
    }

    @Test
    void dropsKindsBelowTheConsoleLevel() {
        var errorsOnly = new ErrorCollector(ConsoleLevel.ERROR, Whitelist.EMPTY);
        assertNull(errorsOnly.add(PageError.of(ErrorKind.CONSOLE_WARN, "careful")));
        assertNull(errorsOnly.add(PageError.of(ErrorKind.CONSOLE_LOG, "hello")));
        assertNotNull(errorsOnly.add(PageError.of(ErrorKind.REQUEST_FAILED, "Request failed: x")));
        assertNotNull(errorsOnly.add(PageError.of(ErrorKind.HTTP_ERROR, "HTTP 404: x")));

        var warn = new ErrorCollector(ConsoleLevel.WARN, Whitelist.EMPTY);
        assertNotNull(warn.add(PageError.of(ErrorKind.CONSOLE_WARN, "careful")));
        assertNull(warn.add(PageError.of(ErrorKind.CONSOLE_DEBUG, "tick")));

        var all = new ErrorCollector(ConsoleLevel.ALL, Whitelist.EMPTY);
        assertNotNull(all.add(PageError.of(ErrorKind.CONSOLE_INFO, "ready")));
        assertNotNull(all.add(PageError.of(ErrorKind.CONSOLE_LOG, "hello")));
        assertEquals(2, all.size());
    }

    @Test
    void tagsWhitelistedMessagesAndDerivesStatus() {
        var collector = new ErrorCollector(ConsoleLevel.WARN, Whitelist.of("*AppInsights*"));
        PageError stored = collector.add(PageError.of(ErrorKind.CONSOLE_ERROR, "AppInsights: flush failed"));

        assertTrue(stored.whitelisted());
        assertEquals(PageStatus.IGNORED, collector.status());

        collector.add(PageError.of(ErrorKind.CONSOLE_WARN, "deprecated"));
        assertEquals(PageStatus.WARN, collector.status());
    }
}
