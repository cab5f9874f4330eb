package org.netpreserve.consolescan;

import org.netpreserve.consolescan.browser.BrowserConnection;
import org.netpreserve.consolescan.browser.BrowserLauncher;
import org.netpreserve.consolescan.browser.PageDriver;
import org.netpreserve.consolescan.browser.PageOptions;
import org.netpreserve.consolescan.cdp.PageEvent;
import org.netpreserve.consolescan.cdp.protocol.CDPClosedException;
import org.netpreserve.consolescan.cdp.protocol.CDPException;
import org.netpreserve.consolescan.config.WaitUntil;
import org.netpreserve.consolescan.util.Url;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Stands in for Chromium. Each URL is given a script per attempt; the last script repeats for any further
 * attempts. Unscripted URLs load with status 200 and no events.
 */
class FakeBrowser implements BrowserLauncher {
    private final Map<String, List<PageScript>> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> navigations = new ConcurrentHashMap<>();
    private final Set<String> loading = ConcurrentHashMap.newKeySet();
    final AtomicInteger launches = new AtomicInteger();
    final AtomicInteger openTabs = new AtomicInteger();
    final AtomicInteger maxOpenTabs = new AtomicInteger();
    final AtomicBoolean sameUrlTwiceAtOnce = new AtomicBoolean();
    final List<PageOptions> openedWith = new CopyOnWriteArrayList<>();
    /** URLs the browser won't open a tab for, while staying up */
    final Set<String> refusedTabs = ConcurrentHashMap.newKeySet();
    /** launches after this many succeed fail, -1 for never */
    volatile int failLaunchesAfter = -1;
    private volatile Connection current;

    record PageScript(int status, List<PageEvent> events, Throwable failure, Duration delay, boolean crashes,
                      boolean hangs) {
        static PageScript ok(PageEvent... events) {
            return new PageScript(200, List.of(events), null, Duration.ZERO, false, false);
        }

        static PageScript status(int status, PageEvent... events) {
            return new PageScript(status, List.of(events), null, Duration.ZERO, false, false);
        }

        static PageScript fail(Throwable failure) {
            return new PageScript(0, List.of(), failure, Duration.ZERO, false, false);
        }

        static PageScript crash() {
            return new PageScript(0, List.of(), null, Duration.ZERO, true, false);
        }

        static PageScript hang() {
            return new PageScript(0, List.of(), null, Duration.ZERO, false, true);
        }

        PageScript after(Duration delay) {
            return new PageScript(status, events, failure, delay, crashes, hangs);
        }
    }

    void script(String url, PageScript... attempts) {
        scripts.put(url, List.of(attempts));
    }

    int navigations(String url) {
        var count = navigations.get(url);
        return count == null ? 0 : count.get();
    }

    Connection current() {
        return current;
    }

    @Override
    public BrowserConnection launch() throws IOException {
        if (failLaunchesAfter >= 0 && launches.get() >= failLaunchesAfter) {
            throw new IOException("Browser binary vanished");
        }
        launches.incrementAndGet();
        current = new Connection();
        return current;
    }

    class Connection implements BrowserConnection {
        volatile boolean connected = true;

        @Override
        public PageDriver openPage(PageOptions options, Consumer<PageEvent> eventHandler) {
            if (!connected) throw new CDPClosedException();
            if (options.cookieUrl() != null && refusedTabs.contains(options.cookieUrl().toString())) {
                throw new CDPException(-32000, "Invalid cookie fields");
            }
            openedWith.add(options);
            int open = openTabs.incrementAndGet();
            maxOpenTabs.accumulateAndGet(open, Math::max);
            return new Driver(this, eventHandler);
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public String version() {
            return "FakeChrome/1.0";
        }

        @Override
        public void close() {
            connected = false;
        }
    }

    class Driver implements PageDriver {
        private final Connection connection;
        private final Consumer<PageEvent> eventHandler;
        private String url;
        private boolean closed;

        Driver(Connection connection, Consumer<PageEvent> eventHandler) {
            this.connection = connection;
            this.eventHandler = eventHandler;
        }

        @Override
        public CompletableFuture<Integer> navigate(Url url, WaitUntil waitUntil) {
            this.url = url.toString();
            if (!loading.add(this.url)) sameUrlTwiceAtOnce.set(true);
            int attempt = navigations.computeIfAbsent(this.url, key -> new AtomicInteger()).incrementAndGet();
            List<PageScript> attempts = scripts.getOrDefault(this.url, List.of(PageScript.ok()));
            PageScript script = attempts.get(Math.min(attempt, attempts.size()) - 1);
            var future = new CompletableFuture<Integer>();
            var thread = new Thread(() -> {
                try {
                    Thread.sleep(script.delay().toMillis());
                } catch (InterruptedException e) {
                    future.completeExceptionally(e);
                    return;
                }
                script.events().forEach(eventHandler);
                if (script.crashes()) {
                    connection.connected = false;
                    future.completeExceptionally(new CDPClosedException("Browser crashed"));
                } else if (script.failure() != null) {
                    future.completeExceptionally(script.failure());
                } else if (!script.hangs()) {
                    future.complete(script.status());
                }
            }, "FakeBrowser-" + this.url);
            thread.setDaemon(true);
            thread.start();
            return future;
        }

        @Override
        public Object eval(String script) {
            if (!connection.connected) throw new CDPClosedException();
            return null;
        }

        @Override
        public synchronized void close() {
            if (closed) return;
            closed = true;
            if (url != null) loading.remove(url);
            openTabs.decrementAndGet();
        }
    }
}
