package org.netpreserve.consolescan.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.consolescan.util.DurationDeserializer;

import java.time.Duration;
import java.util.List;

/**
 * How each page is scanned.
 *
 * @param concurrency       number of pages loaded at once
 * @param timeout           limit on a single attempt at loading a page
 * @param consoleLevel      lowest console severity to record
 * @param waitUntil         when a page counts as loaded
 * @param settle            how long to keep listening after the page has loaded
 * @param cancelGrace       how long in-flight pages may run on after the scan is cancelled
 * @param userAgent         User-Agent header and navigator.userAgent, or null for the browser's own
 * @param cookies           cookies to set on each page's host
 * @param filter            only scan URLs containing this text (case-insensitive)
 * @param whitelist         JSON file of message patterns to ignore
 * @param ignoreHttpsErrors load pages despite certificate errors
 */
public record ScanSettings(
        int concurrency,
        @JsonDeserialize(using = DurationDeserializer.class) Duration timeout,
        ConsoleLevel consoleLevel,
        WaitUntil waitUntil,
        @JsonDeserialize(using = DurationDeserializer.class) Duration settle,
        @JsonDeserialize(using = DurationDeserializer.class) Duration cancelGrace,
        @Nullable String userAgent,
        List<Cookie> cookies,
        @Nullable String filter,
        @Nullable String whitelist,
        boolean ignoreHttpsErrors
) {
    public ScanSettings {
        if (concurrency < 1) throw new IllegalArgumentException("scan.concurrency must be at least 1");
        if (cookies == null) cookies = List.of();
    }
}
