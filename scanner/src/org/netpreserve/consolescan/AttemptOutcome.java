package org.netpreserve.consolescan;

import java.time.Duration;

/**
 * Result of one attempt at loading a page.
 */
public sealed interface AttemptOutcome {
    /**
     * @param httpStatus status of the main document, 0 if there was no HTTP response
     * @param loadTime   time from starting navigation until the page counted as loaded
     */
    record Loaded(int httpStatus, Duration loadTime) implements AttemptOutcome {
    }

    record Failed(FailureKind kind, String message) implements AttemptOutcome {
        @Override
        public String toString() {
            return kind + ": " + message;
        }
    }
}
