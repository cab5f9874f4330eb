package org.netpreserve.consolescan.browser;

import org.junit.jupiter.api.Test;
import org.netpreserve.consolescan.CancellationToken;
import org.netpreserve.consolescan.cdp.PageEvent;
import org.netpreserve.consolescan.cdp.protocol.CDPClosedException;
import org.netpreserve.consolescan.cdp.protocol.CDPException;
import org.netpreserve.consolescan.config.WaitUntil;
import org.netpreserve.consolescan.util.Url;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class BrowserPoolTest {
    private static final PageOptions OPTIONS = new PageOptions(null, List.of(), null, false);
    private final CancellationToken token = new CancellationToken();
    private final StubLauncher launcher = new StubLauncher();

    @Test
    void launchesLazilyAndSharesOneBrowser() throws Exception {
        try (var pool = new BrowserPool(launcher, 2)) {
            assertEquals(0, launcher.launched.size());
            BrowserHandle first = pool.lease(OPTIONS, event -> {}, token);
            BrowserHandle second = pool.lease(OPTIONS, event -> {}, token);

            assertEquals(1, launcher.launched.size());
            assertEquals(1, first.generation());
            assertEquals("Stub/1", pool.version());
            pool.release(first, true);
            pool.release(second, true);
            assertEquals(2, launcher.launched.get(0).closedTabs.get());
        }
        assertFalse(launcher.launched.get(0).connected, "closing the pool closes the browser");
    }

    @Test
    void restartsOncePerCrashNoMatterHowManyTabsReportIt() throws Exception {
        try (var pool = new BrowserPool(launcher, 3)) {
            var handles = List.of(pool.lease(OPTIONS, event -> {}, token), pool.lease(OPTIONS, event -> {}, token),
                    pool.lease(OPTIONS, event -> {}, token));
            launcher.launched.get(0).connected = false;

            for (BrowserHandle handle : handles) pool.release(handle, false);

            assertEquals(2, launcher.launched.size());
            assertEquals(2, pool.generation());
            assertEquals(1, pool.restarts());
            assertEquals(2, pool.lease(OPTIONS, event -> {}, token).generation());
        }
    }

    @Test
    void replacesADisconnectedBrowserBeforeOpeningATab() throws Exception {
        try (var pool = new BrowserPool(launcher, 1)) {
            pool.start();
            launcher.launched.get(0).connected = false;

            BrowserHandle handle = pool.lease(OPTIONS, event -> {}, token);

            assertEquals(2, handle.generation());
            assertEquals(1, pool.restarts());
        }
    }

    @Test
    void aBrowserThatCannotOpenTabsIsRestartedOnce() throws Exception {
        launcher.tabFailuresOnFirstBrowser = 1;
        try (var pool = new BrowserPool(launcher, 1)) {
            BrowserHandle handle = pool.lease(OPTIONS, event -> {}, token);
            assertEquals(2, handle.generation());
            pool.release(handle, true);
        }
    }

    @Test
    void aTabRefusedByAHealthyBrowserLeavesTheBrowserAlone() throws Exception {
        launcher.refuseTabs = true;
        try (var pool = new BrowserPool(launcher, 1)) {
            var e = assertThrows(CDPException.class, () -> pool.lease(OPTIONS, event -> {}, token));
            assertTrue(e.getMessage().startsWith("Invalid cookie fields"), e.getMessage());
            assertEquals(1, launcher.launched.size());
            assertEquals(0, pool.restarts());

            launcher.refuseTabs = false;
            BrowserHandle handle = pool.lease(OPTIONS, event -> {}, token);
            assertEquals(1, handle.generation(), "the slot was given back");
            pool.release(handle, true);
        }
    }

    @Test
    void aTabRefusedAfterASuccessfulRestartIsNotAPoolFailure() throws Exception {
        launcher.tabFailuresOnFirstBrowser = 1;
        launcher.refuseTabsAfterFirstBrowser = true;
        try (var pool = new BrowserPool(launcher, 1)) {
            assertThrows(CDPException.class, () -> pool.lease(OPTIONS, event -> {}, token));
            assertEquals(2, launcher.launched.size());
            assertEquals(1, pool.restarts());

            launcher.refuseTabsAfterFirstBrowser = false;
            BrowserHandle handle = pool.lease(OPTIONS, event -> {}, token);
            assertEquals(2, handle.generation());
            pool.release(handle, true);
        }
    }

    @Test
    void aFailedRestartIsPermanent() throws Exception {
        try (var pool = new BrowserPool(launcher, 2)) {
            BrowserHandle handle = pool.lease(OPTIONS, event -> {}, token);
            launcher.failNextLaunch = true;

            var e = assertThrows(BrowserPoolException.class, () -> pool.release(handle, false));
            assertFalse(e.isInitialLaunch());
            var again = assertThrows(BrowserPoolException.class, () -> pool.lease(OPTIONS, event -> {}, token));
            assertSame(e, again);
        }
    }

    @Test
    void aBrowserThatNeverStartsIsAnInitialLaunchFailure() {
        launcher.failNextLaunch = true;
        try (var pool = new BrowserPool(launcher, 1)) {
            var e = assertThrows(BrowserPoolException.class, () -> pool.lease(OPTIONS, event -> {}, token));
            assertTrue(e.isInitialLaunch());
            assertTrue(e.getMessage().contains("no browser here"), e.getMessage());
        }
    }

    @Test
    void waitingForASlotStopsWhenCancelled() throws Exception {
        try (var pool = new BrowserPool(launcher, 1)) {
            pool.lease(OPTIONS, event -> {}, token);
            token.cancel();
            assertThrows(CancellationException.class, () -> pool.lease(OPTIONS, event -> {}, token));
        }
    }

    static class StubLauncher implements BrowserLauncher {
        final List<StubBrowser> launched = new CopyOnWriteArrayList<>();
        volatile boolean failNextLaunch;
        volatile int tabFailuresOnFirstBrowser;
        volatile boolean refuseTabs;
        volatile boolean refuseTabsAfterFirstBrowser;

        @Override
        public BrowserConnection launch() throws IOException {
            if (failNextLaunch) {
                failNextLaunch = false;
                throw new IOException("no browser here");
            }
            var browser = new StubBrowser(this, launched.isEmpty());
            launched.add(browser);
            return browser;
        }
    }

    static class StubBrowser implements BrowserConnection {
        final AtomicInteger closedTabs = new AtomicInteger();
        final AtomicInteger tabFailures;
        private final StubLauncher launcher;
        private final boolean first;
        volatile boolean connected = true;

        StubBrowser(StubLauncher launcher, boolean first) {
            this.launcher = launcher;
            this.first = first;
            this.tabFailures = new AtomicInteger(first ? launcher.tabFailuresOnFirstBrowser : 0);
        }

        @Override
        public PageDriver openPage(PageOptions options, Consumer<PageEvent> eventHandler) {
            if (!connected || tabFailures.getAndDecrement() > 0) throw new CDPClosedException("Target.createTarget");
            if (launcher.refuseTabs || (!first && launcher.refuseTabsAfterFirstBrowser)) {
                throw new CDPException(-32000, "Invalid cookie fields");
            }
            return new PageDriver() {
                @Override
                public CompletableFuture<Integer> navigate(Url url, WaitUntil waitUntil) {
                    return CompletableFuture.completedFuture(200);
                }

                @Override
                public Object eval(String script) {
                    return null;
                }

                @Override
                public void close() {
                    closedTabs.incrementAndGet();
                }
            };
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public String version() {
            return "Stub/" + (connected ? 1 : 0);
        }

        @Override
        public void close() {
            connected = false;
        }
    }
}
