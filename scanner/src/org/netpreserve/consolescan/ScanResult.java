package org.netpreserve.consolescan;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.consolescan.util.Url;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Final outcome for one URL.
 *
 * @param errors     diagnostics from the last attempt in the order first observed, duplicates collapsed
 * @param attempts   how many times the page was loaded
 * @param duration   wall time across all attempts including backoff
 * @param httpStatus status of the main document on the last attempt, if one arrived
 * @param loadTime   time the last successful attempt took to load the page
 * @param failure    why the page could not be scanned, only when status is {@link PageStatus#FAILED}
 */
public record ScanResult(
        Url url,
        PageStatus status,
        List<PageError> errors,
        int attempts,
        Duration duration,
        @Nullable Integer httpStatus,
        @Nullable Duration loadTime,
        @Nullable AttemptOutcome.Failed failure,
        Instant finishedAt
) {
    public ScanResult {
        errors = List.copyOf(errors);
        if ((status == PageStatus.FAILED) != (failure != null)) {
            throw new IllegalArgumentException("failure must be given exactly when status is FAILED");
        }
    }

    /**
     * Distinct diagnostics of a kind, each counted once however often it repeated.
     */
    public long distinctCount(ErrorKind kind) {
        return errors.stream().filter(error -> error.kind() == kind).count();
    }

    /**
     * Distinct non-whitelisted diagnostics of a severity.
     */
    public long distinctCount(Severity severity) {
        return errors.stream().filter(error -> error.severity() == severity && !error.whitelisted()).count();
    }

    public long whitelistedCount() {
        return errors.stream().filter(PageError::whitelisted).count();
    }
}
