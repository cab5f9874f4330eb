package org.netpreserve.consolescan;

import org.netpreserve.consolescan.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reports progress through the log: a line per finished page and a summary at the end.
 */
public class LoggingScanListener implements ScanListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingScanListener.class);
    private final int total;
    private final AtomicInteger finished = new AtomicInteger();

    public LoggingScanListener(int total) {
        this.total = total;
    }

    @Override
    public void errorObserved(Url url, PageError error, PageStatus pageStatus) {
        if (error.whitelisted()) return;
        log.atDebug().addKeyValue("url", url).addKeyValue("kind", error.kind().id())
                .addKeyValue("status", pageStatus).log(error.message());
    }

    @Override
    public void retrying(Url url, int attempt, AttemptOutcome.Failed failure, Duration delay) {
        log.atWarn().addKeyValue("url", url).addKeyValue("attempt", attempt)
                .log("{}, retrying in {}s", failure, delay.toSeconds());
    }

    @Override
    public void finished(Url url, ScanResult result) {
        int n = finished.incrementAndGet();
        var event = result.status() == PageStatus.FAILED || result.status() == PageStatus.ERROR
                ? log.atWarn() : log.atInfo();
        event = event.addKeyValue("url", url).addKeyValue("status", result.status().id());
        if (result.failure() != null) {
            event.log("[{}/{}] {} failed after {} attempts: {}", n, total, url, result.attempts(), result.failure());
        } else {
            event.log("[{}/{}] {} {} HTTP {} in {}ms, {} errors, {} warnings", n, total, result.status().id(), url,
                    result.httpStatus() == null ? "-" : result.httpStatus(),
                    result.loadTime() == null ? "-" : result.loadTime().toMillis(),
                    result.distinctCount(Severity.ERROR), result.distinctCount(Severity.WARNING));
        }
    }

    @Override
    public void fatal(ScanFault fault, String message) {
        log.error("Scan aborted ({}): {}", fault, message);
    }

    @Override
    public void scanComplete(ScanSummary summary) {
        log.info("Scanned {} of {} URLs in {}s: {} ok, {} warn, {} error, {} ignored, {} failed{}",
                summary.scanned() + summary.failed(), summary.totalUrls(), summary.duration().toSeconds(),
                summary.count(PageStatus.OK), summary.count(PageStatus.WARN), summary.count(PageStatus.ERROR),
                summary.count(PageStatus.IGNORED), summary.failed(), summary.cancelled() ? " (cancelled)" : "");
        if (summary.browserRestarts() > 0) log.info("Browser was restarted {} times", summary.browserRestarts());
        int rank = 0;
        for (var top : summary.topErrors()) {
            log.info("  {}. [{}] {} ({} pages, {} times)", ++rank, top.kind().id(), top.message(), top.pages(),
                    top.occurrences());
        }
    }
}
