package org.netpreserve.consolescan;

import org.netpreserve.consolescan.browser.BrowserHandle;
import org.netpreserve.consolescan.browser.BrowserPool;
import org.netpreserve.consolescan.browser.BrowserPoolException;
import org.netpreserve.consolescan.browser.PageOptions;
import org.netpreserve.consolescan.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Takes URLs off the queue one at a time and scans each, retrying failed attempts.
 */
class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    private final ScanOrchestrator scan;
    private final ScanListener listener;

    Worker(ScanOrchestrator scan, ScanListener listener) {
        this.scan = scan;
        this.listener = listener;
    }

    void run() {
        while (!scan.shouldStop()) {
            ScanTask task = scan.queue.poll();
            if (task == null) break;
            if (scan.shouldStop()) {
                log.debug("Dropping {}, scan is stopping", task.url());
                break;
            }
            scan.finished(scanPage(task));
        }
        log.debug("Worker exiting");
    }

    private ScanResult scanPage(ScanTask task) {
        Url url = task.url();
        var settings = task.config().scan();
        listener.started(url);
        log.atInfo().addKeyValue("url", url).log("Scanning page");
        long start = System.nanoTime();
        int attempt = 0;
        ErrorCollector collector = null;
        PageSession session = null;
        AttemptOutcome outcome;
        try {
            while (true) {
                attempt++;
                collector = new ErrorCollector(settings.consoleLevel(), scan.whitelist);
                session = new PageSession(url, settings, scan.consentHandler, scan.token);
                outcome = attempt(task, session, collector);
                if (!(outcome instanceof AttemptOutcome.Failed failed)) break;

                log.atWarn().addKeyValue("url", url).addKeyValue("attempt", attempt)
                        .log("Attempt failed: {}", failed);
                if (!scan.retryPolicy.shouldRetry(attempt, failed.kind()) || scan.shouldStop()) break;

                Duration delay = scan.retryPolicy.backoffAfter(attempt);
                listener.retrying(url, attempt, failed, delay);
                if (!scan.token.sleep(delay)) {
                    outcome = new AttemptOutcome.Failed(FailureKind.CANCELLED, "Scan cancelled");
                    break;
                }
                boolean reachable = scan.probe.isReachable(url, scan.token);
                log.atInfo().addKeyValue("url", url).addKeyValue("reachable", reachable)
                        .log("Retrying (attempt {})", attempt + 1);
            }
        } catch (BrowserPoolException e) {
            scan.fatal(e.isInitialLaunch() ? ScanFault.BROWSER_LAUNCH_FAILED : ScanFault.BROWSER_RESTART_FAILED,
                    e.getMessage());
            outcome = new AttemptOutcome.Failed(FailureKind.BROWSER_DISCONNECTED, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = new AttemptOutcome.Failed(FailureKind.CANCELLED, "Interrupted");
        } catch (CancellationException e) {
            outcome = new AttemptOutcome.Failed(FailureKind.CANCELLED, "Scan cancelled");
        } catch (RuntimeException e) {
            log.error("Unexpected error scanning {}", url, e);
            outcome = new AttemptOutcome.Failed(FailureKind.NAVIGATION_ERROR, "Internal error: " + e);
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        List<PageError> errors = collector == null ? List.of() : collector.errors();
        if (outcome instanceof AttemptOutcome.Loaded loaded) {
            return new ScanResult(url, PageStatus.of(errors), errors, attempt, duration,
                    loaded.httpStatus() == 0 ? null : loaded.httpStatus(), loaded.loadTime(), null, Instant.now());
        }
        return new ScanResult(url, PageStatus.FAILED, errors, attempt, duration,
                session == null ? null : session.httpStatus(), null, (AttemptOutcome.Failed) outcome,
                Instant.now());
    }

    private AttemptOutcome attempt(ScanTask task, PageSession session, ErrorCollector collector)
            throws BrowserPoolException, InterruptedException {
        Url url = task.url();
        BrowserHandle handle;
        try {
            handle = scan.pool.lease(PageOptions.forUrl(task.config().scan(), url), session::offer, scan.token);
        } catch (CancellationException e) {
            return new AttemptOutcome.Failed(FailureKind.CANCELLED, "Scan cancelled");
        } catch (RuntimeException e) {
            FailureKind kind = BrowserPool.isBrowserGone(e) ? FailureKind.BROWSER_DISCONNECTED
                    : FailureKind.NAVIGATION_ERROR;
            return new AttemptOutcome.Failed(kind, "Unable to open a tab: " + e.getMessage());
        }
        AttemptOutcome outcome = null;
        try {
            outcome = session.run(handle.driver(), collector,
                    error -> listener.errorObserved(url, error, collector.status()));
            return outcome;
        } finally {
            boolean healthy = !(outcome instanceof AttemptOutcome.Failed failed
                                && scan.retryPolicy.needsRecovery(failed.kind()));
            scan.pool.release(handle, healthy);
        }
    }
}
