package org.netpreserve.consolescan;

import org.netpreserve.consolescan.util.Url;

import java.time.Duration;

/**
 * Progress callbacks. Called from worker threads, so implementations must be thread-safe. Events for one URL
 * arrive in order; events for different URLs may interleave.
 */
public interface ScanListener {
    default void started(Url url) {
    }

    /**
     * A diagnostic seen for the first time on the current attempt at a page.
     *
     * @param pageStatus the page's status with this diagnostic counted
     */
    default void errorObserved(Url url, PageError error, PageStatus pageStatus) {
    }

    /**
     * @param attempt the one-based attempt that failed
     * @param delay   how long until the next attempt
     */
    default void retrying(Url url, int attempt, AttemptOutcome.Failed failure, Duration delay) {
    }

    /**
     * Called exactly once for every URL that was {@link #started}.
     */
    default void finished(Url url, ScanResult result) {
    }

    /**
     * The scan can't go on. Called at most once; pages already started still get {@link #finished}.
     */
    default void fatal(ScanFault fault, String message) {
    }

    default void scanComplete(ScanSummary summary) {
    }
}
