package org.netpreserve.consolescan.browser;

import org.netpreserve.consolescan.cdp.BrowserProcess;
import org.netpreserve.consolescan.cdp.Navigator;
import org.netpreserve.consolescan.cdp.PageEvent;
import org.netpreserve.consolescan.config.BrowserConfig;
import org.netpreserve.consolescan.config.Cookie;
import org.netpreserve.consolescan.config.WaitUntil;
import org.netpreserve.consolescan.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Launches a local (or shell-wrapped) Chromium and drives it over the DevTools protocol.
 */
public class CdpBrowserLauncher implements BrowserLauncher {
    private static final Logger log = LoggerFactory.getLogger(CdpBrowserLauncher.class);
    private final BrowserConfig config;

    public CdpBrowserLauncher(BrowserConfig config) {
        this.config = config;
    }

    @Override
    public BrowserConnection launch() throws IOException {
        var process = BrowserProcess.start(config.executable(), config.options(), config.headless(), config.shell());
        var connection = new CdpConnection(process);
        log.info("Browser started: {}", connection.version());
        return connection;
    }

    static class CdpConnection implements BrowserConnection {
        private final BrowserProcess process;

        CdpConnection(BrowserProcess process) {
            this.process = process;
        }

        @Override
        public PageDriver openPage(PageOptions options, Consumer<PageEvent> eventHandler) {
            Navigator navigator = process.newTab(eventHandler);
            try {
                if (options.userAgent() != null) navigator.setUserAgent(options.userAgent());
                if (options.ignoreHttpsErrors()) navigator.ignoreCertificateErrors();
                if (options.cookieUrl() != null && options.cookieUrl().isHttp()) {
                    for (Cookie cookie : options.cookies()) {
                        navigator.setCookie(options.cookieUrl(), cookie.name(), cookie.value());
                    }
                }
            } catch (RuntimeException e) {
                navigator.close();
                throw e;
            }
            return new CdpPageDriver(navigator);
        }

        @Override
        public boolean isConnected() {
            return process.isConnected();
        }

        @Override
        public String version() {
            var version = process.version();
            return version.product() + " (protocol " + version.protocolVersion() + ")";
        }

        @Override
        public void close() {
            process.close();
        }
    }

    static class CdpPageDriver implements PageDriver {
        private final Navigator navigator;

        CdpPageDriver(Navigator navigator) {
            this.navigator = navigator;
        }

        @Override
        public CompletableFuture<Integer> navigate(Url url, WaitUntil waitUntil) {
            var navigation = navigator.navigate(url);
            return waitUntil == WaitUntil.LOAD ? navigation.loaded() : navigation.networkIdle();
        }

        @Override
        public Object eval(String script) {
            return navigator.eval(script);
        }

        @Override
        public void close() {
            navigator.close();
        }
    }
}
