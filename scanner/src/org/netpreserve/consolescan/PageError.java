package org.netpreserve.consolescan;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * A diagnostic observed on a page. Repeats of the same message are folded into one record by bumping
 * {@code occurrences}.
 *
 * @param message     message with surrounding whitespace trimmed and internal runs collapsed
 * @param sourceUrl   script or resource the diagnostic is attributed to, if known
 * @param line        one-based line in {@code sourceUrl}, if known
 * @param timestamp   when it was first seen
 * @param whitelisted whether the message matched a whitelist pattern
 */
public record PageError(
        @NotNull ErrorKind kind,
        @NotNull String message,
        @Nullable String sourceUrl,
        @Nullable Integer line,
        @NotNull Instant timestamp,
        int occurrences,
        boolean whitelisted
) {
    public PageError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        message = normalize(message);
        if (occurrences < 1) throw new IllegalArgumentException("occurrences must be at least 1");
    }

    public static PageError of(ErrorKind kind, String message, @Nullable String sourceUrl, @Nullable Integer line) {
        return new PageError(kind, message, sourceUrl, line, Instant.now(), 1, false);
    }

    public static PageError of(ErrorKind kind, String message) {
        return of(kind, message, null, null);
    }

    static String normalize(String message) {
        return message == null ? "" : StringUtils.normalizeSpace(message);
    }

    /**
     * Two diagnostics on the same page are duplicates when their keys are equal.
     */
    public Key key() {
        return new Key(kind, message);
    }

    public Severity severity() {
        return kind.severity();
    }

    PageError withAnotherOccurrence() {
        return new PageError(kind, message, sourceUrl, line, timestamp, occurrences + 1, whitelisted);
    }

    PageError withWhitelisted(boolean whitelisted) {
        return new PageError(kind, message, sourceUrl, line, timestamp, occurrences, whitelisted);
    }

    /**
     * "url:line", "url" or null.
     */
    public @Nullable String source() {
        if (sourceUrl == null || sourceUrl.isEmpty()) return null;
        return line == null ? sourceUrl : sourceUrl + ":" + line;
    }

    public record Key(ErrorKind kind, String message) {
    }
}
