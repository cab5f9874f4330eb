package org.netpreserve.consolescan.browser;

import org.netpreserve.consolescan.CancellationToken;
import org.netpreserve.consolescan.cdp.PageEvent;
import org.netpreserve.consolescan.cdp.protocol.CDPClosedException;
import org.netpreserve.consolescan.cdp.protocol.CDPTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * Hands out tabs from a single shared browser, at most {@code capacity} at a time, and replaces the browser
 * when it crashes.
 * <p>
 * Every tab remembers the generation of the browser it was opened on. When several sessions report the same
 * crash only the first one to release its tab triggers a restart.
 */
public class BrowserPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserPool.class);
    private final BrowserLauncher launcher;
    private final Semaphore permits;
    private BrowserConnection browser;
    private int generation;
    private int restarts;
    private BrowserPoolException deathCause;
    private boolean closed;

    public BrowserPool(BrowserLauncher launcher, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be at least 1");
        this.launcher = launcher;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Launches the browser now rather than on the first lease.
     */
    public synchronized void start() throws BrowserPoolException {
        if (browser == null) launch();
    }

    /**
     * Opens a tab, waiting for a free slot first. If the tab can't be opened because the browser has gone away,
     * the browser is replaced and the tab opened on the new one.
     *
     * @throws java.util.concurrent.CancellationException if the token was cancelled while waiting
     * @throws BrowserPoolException                       if there's no browser and one can't be started
     * @throws RuntimeException                           if the browser is up but refused to open the tab
     */
    public BrowserHandle lease(PageOptions options, Consumer<PageEvent> eventHandler, CancellationToken token)
            throws BrowserPoolException, InterruptedException {
        token.acquire(permits);
        try {
            BrowserConnection connection;
            int leasedGeneration;
            synchronized (this) {
                ensureRunning();
                connection = browser;
                leasedGeneration = generation;
            }
            try {
                return new BrowserHandle(connection.openPage(options, eventHandler), leasedGeneration);
            } catch (RuntimeException e) {
                if (!isBrowserGone(e) && connection.isConnected()) throw e;
                log.warn("Browser generation {} went away while opening a tab: {}", leasedGeneration, e.toString());
                synchronized (this) {
                    restartIfCurrent(leasedGeneration, e);
                    connection = browser;
                    leasedGeneration = generation;
                }
                return new BrowserHandle(connection.openPage(options, eventHandler), leasedGeneration);
            }
        } catch (BrowserPoolException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * Whether an exception from the browser means the connection to it is lost, rather than that one command
     * failed.
     */
    public static boolean isBrowserGone(Throwable e) {
        return e instanceof CDPClosedException || e instanceof CDPTimeoutException
               || e instanceof UncheckedIOException;
    }

    /**
     * Closes the tab and frees its slot. An unhealthy tab means its browser is presumed dead: if nobody has
     * replaced that browser yet, it is replaced before the slot is handed to anyone else.
     *
     * @throws BrowserPoolException if the browser needed replacing and couldn't be
     */
    public void release(BrowserHandle handle, boolean healthy) throws BrowserPoolException {
        try {
            try {
                handle.driver().close();
            } catch (RuntimeException e) {
                log.debug("Error closing tab: {}", e.toString());
            }
            if (!healthy) {
                synchronized (this) {
                    restartIfCurrent(handle.generation(), null);
                }
            }
        } finally {
            permits.release();
        }
    }

    private void ensureRunning() throws BrowserPoolException {
        if (closed) throw new BrowserPoolException("Browser pool is closed", null, false);
        if (deathCause != null) throw deathCause;
        if (browser == null) {
            launch();
        } else if (!browser.isConnected()) {
            restartIfCurrent(generation, null);
        }
    }

    private void restartIfCurrent(int deadGeneration, Throwable reason) throws BrowserPoolException {
        if (deathCause != null) throw deathCause;
        if (closed || deadGeneration != generation) return;
        log.warn("Restarting browser (generation {})", generation, reason);
        if (browser != null) {
            try {
                browser.close();
            } catch (RuntimeException e) {
                log.warn("Error shutting down crashed browser", e);
            }
        }
        browser = null;
        restarts++;
        launch();
    }

    private void launch() throws BrowserPoolException {
        boolean initial = generation == 0;
        try {
            browser = launcher.launch();
            generation++;
        } catch (IOException | RuntimeException e) {
            deathCause = new BrowserPoolException((initial ? "Unable to launch browser: " : "Unable to restart browser: ")
                                                  + e.getMessage(), e, initial);
            throw deathCause;
        }
    }

    public synchronized int generation() {
        return generation;
    }

    /**
     * How many times the browser has been replaced after a crash.
     */
    public synchronized int restarts() {
        return restarts;
    }

    public synchronized String version() {
        return browser == null ? null : browser.version();
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (browser != null) {
            try {
                browser.close();
            } catch (RuntimeException e) {
                log.warn("Error shutting down browser", e);
            }
            browser = null;
        }
    }
}
