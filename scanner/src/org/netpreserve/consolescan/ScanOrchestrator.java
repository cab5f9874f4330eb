package org.netpreserve.consolescan;

import org.netpreserve.consolescan.browser.BrowserPool;
import org.netpreserve.consolescan.config.ScanConfig;
import org.netpreserve.consolescan.consent.ConsentHandler;
import org.netpreserve.consolescan.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scans a list of pages with a fixed number of workers sharing one browser.
 * <pre>{@code
 * var scan = new ScanOrchestrator(config, pool, whitelist, probe);
 * ScanSummary summary = scan.start(urls, new LoggingScanListener()).awaitCompletion();
 * }</pre>
 * An orchestrator runs a single scan.
 */
public class ScanOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);
    final ScanConfig config;
    final BrowserPool pool;
    final Whitelist whitelist;
    final ReachabilityProbe probe;
    final RetryPolicy retryPolicy;
    final ConsentHandler consentHandler;
    final CancellationToken token = new CancellationToken();
    final BlockingQueue<ScanTask> queue = new LinkedBlockingQueue<>();
    private final Map<Url, ScanResult> results = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean fatalReported = new AtomicBoolean();
    private final AtomicInteger runningWorkers = new AtomicInteger();
    private final ScanHandle handle = new ScanHandle();
    private volatile List<Url> urls = List.of();
    private volatile ScanFault fault;
    private volatile boolean halted;
    private ScanListener listener;
    private Instant startedAt;
    private long startedAtNanos;

    public ScanOrchestrator(ScanConfig config, BrowserPool pool, Whitelist whitelist, ReachabilityProbe probe) {
        this.config = config;
        this.pool = pool;
        this.whitelist = whitelist;
        this.probe = config.retry().probe() ? probe : ReachabilityProbe.NONE;
        this.retryPolicy = RetryPolicy.of(config.retry());
        this.consentHandler = config.consent().enabled() ? ConsentHandler.of(config.consent()) : null;
    }

    /**
     * Queues the URLs and starts the workers.
     *
     * @throws ScanException if there is nothing (valid) to scan
     */
    public ScanHandle start(List<Url> urls, ScanListener listener) throws ScanException {
        if (urls == null || urls.isEmpty()) throw new ScanException("No URLs to scan");
        for (Url url : urls) {
            if (!url.isHttp()) throw new ScanException("Not an http(s) URL: " + url);
        }
        List<Url> queued = new ArrayList<>(new LinkedHashSet<>(urls));
        if (queued.size() < urls.size()) {
            log.info("Ignoring {} duplicate URLs", urls.size() - queued.size());
        }
        String filter = config.scan().filter();
        if (filter != null && !filter.isBlank()) {
            String needle = filter.toLowerCase(Locale.ROOT);
            queued.removeIf(url -> !url.toString().toLowerCase(Locale.ROOT).contains(needle));
            if (queued.isEmpty()) throw new ScanException("No URLs contain '" + filter + "'");
            log.info("Filter '{}' matched {} URLs", filter, queued.size());
        }
        if (!started.compareAndSet(false, true)) throw new IllegalStateException("Scan already started");

        this.listener = new GuardedListener(listener);
        this.urls = List.copyOf(queued);
        this.startedAt = Instant.now();
        this.startedAtNanos = System.nanoTime();
        for (int i = 0; i < queued.size(); i++) {
            queue.add(new ScanTask(queued.get(i), config, i));
        }

        int workerCount = Math.min(config.scan().concurrency(), queued.size());
        log.info("Scanning {} URLs with {} workers", queued.size(), workerCount);
        runningWorkers.set(workerCount);
        for (int i = 1; i <= workerCount; i++) {
            var worker = new Worker(this, this.listener);
            var thread = new Thread(() -> {
                try {
                    worker.run();
                } finally {
                    workerExited();
                }
            }, "Worker-" + i);
            thread.start();
        }
        return handle;
    }

    /**
     * Stops the scan. Pages not yet started are skipped, pages in progress get a short grace period to finish.
     */
    public void cancel() {
        if (token.isCancelled()) return;
        log.info("Cancelling scan");
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * Results finished so far, in input order.
     */
    public List<ScanResult> currentResults() {
        var list = new ArrayList<ScanResult>();
        for (Url url : urls) {
            ScanResult result = results.get(url);
            if (result != null) list.add(result);
        }
        return list;
    }

    public Instant startedAt() {
        return startedAt;
    }

    boolean shouldStop() {
        return halted || token.isCancelled();
    }

    void finished(ScanResult result) {
        results.put(result.url(), result);
        listener.finished(result.url(), result);
    }

    /**
     * Stops handing out further URLs and reports the fault unless one was already reported.
     */
    void fatal(ScanFault fault, String message) {
        halted = true;
        if (!fatalReported.compareAndSet(false, true)) return;
        this.fault = fault;
        log.error("Scan stopped: {} {}", fault, message);
        listener.fatal(fault, message);
    }

    private void workerExited() {
        if (runningWorkers.decrementAndGet() != 0) return;
        var summary = ScanSummary.of(currentResults(), urls.size(), startedAt,
                Duration.ofNanos(System.nanoTime() - startedAtNanos), config.report().topErrors(),
                token.isCancelled(), fault, pool.restarts());
        listener.scanComplete(summary);
        handle.complete(summary);
    }

    /**
     * Keeps a misbehaving listener from killing a worker.
     */
    private static class GuardedListener implements ScanListener {
        private final ScanListener delegate;

        GuardedListener(ScanListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void started(Url url) {
            try {
                delegate.started(url);
            } catch (RuntimeException e) {
                log.error("Listener failed on started({})", url, e);
            }
        }

        @Override
        public void errorObserved(Url url, PageError error, PageStatus pageStatus) {
            try {
                delegate.errorObserved(url, error, pageStatus);
            } catch (RuntimeException e) {
                log.error("Listener failed on errorObserved({})", url, e);
            }
        }

        @Override
        public void retrying(Url url, int attempt, AttemptOutcome.Failed failure, Duration delay) {
            try {
                delegate.retrying(url, attempt, failure, delay);
            } catch (RuntimeException e) {
                log.error("Listener failed on retrying({})", url, e);
            }
        }

        @Override
        public void finished(Url url, ScanResult result) {
            try {
                delegate.finished(url, result);
            } catch (RuntimeException e) {
                log.error("Listener failed on finished({})", url, e);
            }
        }

        @Override
        public void fatal(ScanFault fault, String message) {
            try {
                delegate.fatal(fault, message);
            } catch (RuntimeException e) {
                log.error("Listener failed on fatal({})", fault, e);
            }
        }

        @Override
        public void scanComplete(ScanSummary summary) {
            try {
                delegate.scanComplete(summary);
            } catch (RuntimeException e) {
                log.error("Listener failed on scanComplete", e);
            }
        }
    }
}
