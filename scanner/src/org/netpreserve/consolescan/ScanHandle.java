package org.netpreserve.consolescan;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * A running scan.
 */
public class ScanHandle {
    private final CompletableFuture<ScanSummary> completion = new CompletableFuture<>();

    void complete(ScanSummary summary) {
        completion.complete(summary);
    }

    /**
     * Blocks until every worker has finished.
     */
    public ScanSummary awaitCompletion() throws InterruptedException {
        try {
            return completion.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scan completion failed", e.getCause());
        }
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public CompletableFuture<ScanSummary> completion() {
        return completion.copy();
    }
}
