package org.netpreserve.consolescan.cdp;

import org.intellij.lang.annotations.Language;
import org.netpreserve.consolescan.cdp.domains.*;
import org.netpreserve.consolescan.cdp.domains.Runtime;
import org.netpreserve.consolescan.cdp.protocol.CDPClosedException;
import org.netpreserve.consolescan.cdp.protocol.CDPException;
import org.netpreserve.consolescan.cdp.protocol.CDPSession;
import org.netpreserve.consolescan.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Drives a single tab: navigates it, evaluates scripts in it and translates what the tab reports into
 * {@link PageEvent}s.
 */
public class Navigator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Navigator.class);
    private static final int SCRIPT_TIMEOUT_MILLIS = 5000;
    private final CDPSession cdpSession;
    private final String browserContextId;
    private final Consumer<PageEvent> eventHandler;
    private final Page page;
    private final Runtime runtime;
    private final Network network;
    private final Emulation emulation;
    private final Map<String, String> requestUrls = new ConcurrentHashMap<>();
    private final Map<String, Integer> documentStatus = new HashMap<>();
    private final Map<String, Set<String>> lifecycleSeen = new HashMap<>();
    private Navigation currentNavigation;
    private volatile boolean crashed;

    Navigator(CDPSession cdpSession, String browserContextId, Consumer<PageEvent> eventHandler) {
        this.cdpSession = cdpSession;
        this.browserContextId = browserContextId;
        this.eventHandler = eventHandler;
        this.page = cdpSession.domain(Page.class);
        this.runtime = cdpSession.domain(Runtime.class);
        this.network = cdpSession.domain(Network.class);
        this.emulation = cdpSession.domain(Emulation.class);
        var browserLog = cdpSession.domain(Log.class);
        var audits = cdpSession.domain(Audits.class);
        var inspector = cdpSession.domain(Inspector.class);

        page.onLifecycleEvent(this::handleLifecycleEvent);
        runtime.onConsoleAPICalled(this::handleConsoleAPICalled);
        runtime.onExceptionThrown(this::handleExceptionThrown);
        browserLog.onEntryAdded(this::handleLogEntry);
        audits.onIssueAdded(this::handleIssue);
        network.onRequestWillBeSent(event -> requestUrls.put(event.requestId().value(), event.request().url()));
        network.onResponseReceived(this::handleResponse);
        network.onLoadingFailed(this::handleLoadingFailed);
        inspector.onTargetCrashed(event -> {
            crashed = true;
            failCurrentNavigation(new CDPClosedException("Tab crashed"));
        });
        cdpSession.onClose(() -> failCurrentNavigation(new CDPClosedException()));

        page.enable();
        page.setLifecycleEventsEnabled(true);
        runtime.enable();
        network.enable();
        browserLog.enable();
        audits.enable();
        inspector.enable();
    }

    /**
     * A navigation in progress. Both futures complete with the HTTP status of the main document (0 when there
     * was no HTTP response, e.g. for a file: URL) or exceptionally with a {@link NavigationException} or
     * {@link CDPException}.
     */
    public static class Navigation {
        private final Url url;
        private final CompletableFuture<Integer> loaded = new CompletableFuture<>();
        private final CompletableFuture<Integer> networkIdle = new CompletableFuture<>();
        private Network.LoaderId loaderId;

        Navigation(Url url) {
            this.url = url;
        }

        public Url url() {
            return url;
        }

        /**
         * Completes on the page's load event.
         */
        public CompletableFuture<Integer> loaded() {
            return loaded;
        }

        /**
         * Completes once the network has been quiet for a while after loading.
         */
        public CompletableFuture<Integer> networkIdle() {
            return networkIdle;
        }

        void lifecycle(String name, int status) {
            switch (name) {
                case "load":
                    loaded.complete(status);
                    break;
                case "networkIdle":
                    loaded.complete(status);
                    networkIdle.complete(status);
                    break;
                default:
                    break;
            }
        }

        void fail(Throwable cause) {
            loaded.completeExceptionally(cause);
            networkIdle.completeExceptionally(cause);
        }
    }

    /**
     * Starts loading a URL without waiting for it.
     */
    public Navigation navigate(Url url) {
        var navigation = new Navigation(url);
        synchronized (this) {
            if (currentNavigation != null) {
                currentNavigation.fail(new NavigationException(url, "Superseded by another navigation"));
            }
            currentNavigation = navigation;
        }
        if (crashed || cdpSession.isClosed()) {
            navigation.fail(new CDPClosedException(crashed ? "Tab crashed" : "Connection closed"));
            return navigation;
        }
        page.navigateAsync(url.toString()).whenComplete((result, error) -> navigationStarted(navigation, result, error));
        return navigation;
    }

    private synchronized void navigationStarted(Navigation navigation, Page.Navigate result, Throwable error) {
        if (error != null) {
            navigation.fail(error instanceof CompletionException && error.getCause() != null ? error.getCause() : error);
        } else if (result.errorText() != null && !result.errorText().isEmpty()) {
            navigation.fail(new NavigationFailedException(navigation.url(), result.errorText()));
        } else if (result.loaderId() == null) {
            // same-document navigation, nothing to wait for
            navigation.lifecycle("networkIdle", 0);
        } else {
            navigation.loaderId = result.loaderId();
            int status = documentStatus.getOrDefault(result.loaderId().value(), 0);
            for (String name : lifecycleSeen.getOrDefault(result.loaderId().value(), Set.of())) {
                navigation.lifecycle(name, status);
            }
        }
    }

    private synchronized void handleLifecycleEvent(Page.LifecycleEvent event) {
        if (!event.frameId().value().equals(cdpSession.targetId())) return;
        String loaderId = event.loaderId().value();
        lifecycleSeen.computeIfAbsent(loaderId, key -> new HashSet<>()).add(event.name());
        if (currentNavigation != null && currentNavigation.loaderId != null
            && currentNavigation.loaderId.value().equals(loaderId)) {
            currentNavigation.lifecycle(event.name(), documentStatus.getOrDefault(loaderId, 0));
        }
    }

    private synchronized void failCurrentNavigation(Throwable cause) {
        if (currentNavigation != null) currentNavigation.fail(cause);
    }

    private void handleConsoleAPICalled(Runtime.ConsoleAPICalled event) {
        var text = new StringBuilder();
        if (event.args() != null) {
            for (var arg : event.args()) {
                if (text.length() > 0) text.append(' ');
                text.append(arg.toDisplayString());
            }
        }
        Runtime.CallFrame frame = topFrame(event.stackTrace());
        emit(new PageEvent.ConsoleMessage(event.type(), text.toString(),
                frame == null ? null : frame.url(), frame == null ? null : frame.lineNumber() + 1));
    }

    private void handleExceptionThrown(Runtime.ExceptionThrown event) {
        var details = event.exceptionDetails();
        String message = details.text();
        if (details.exception() != null) {
            message = details.exception().toDisplayString().lines().findFirst().orElse(message);
        }
        emit(new PageEvent.UncaughtException(message, details.url(), details.lineNumber() + 1));
    }

    private void handleLogEntry(Log.EntryAdded event) {
        var entry = event.entry();
        emit(new PageEvent.BrowserLog(entry.source(), entry.level(), entry.text(), entry.url(),
                entry.lineNumber() == null ? null : entry.lineNumber() + 1));
    }

    private void handleIssue(Audits.IssueAdded event) {
        var issue = event.issue();
        if (!"ContentSecurityPolicyIssue".equals(issue.code()) || issue.details() == null) return;
        var csp = issue.details().contentSecurityPolicyIssueDetails();
        if (csp == null) return;
        var location = csp.sourceCodeLocation();
        emit(new PageEvent.CspViolation(csp.violatedDirective(), csp.blockedURL(), csp.isReportOnly(),
                location == null ? null : location.url(), location == null ? null : location.lineNumber() + 1));
    }

    private void handleResponse(Network.ResponseReceived event) {
        boolean mainDocument = "Document".equals(event.type()) && event.frameId() != null
                               && event.frameId().value().equals(cdpSession.targetId());
        if (mainDocument) {
            synchronized (this) {
                documentStatus.put(event.requestId().value(), event.response().status());
            }
        }
        emit(new PageEvent.Response(event.response().url(), event.response().status(), event.type(), mainDocument));
    }

    private void handleLoadingFailed(Network.LoadingFailed event) {
        String url = requestUrls.remove(event.requestId().value());
        emit(new PageEvent.RequestFailed(url, event.errorText(), event.canceled(), event.blockedReason(),
                event.type()));
    }

    private static Runtime.CallFrame topFrame(Runtime.StackTrace stackTrace) {
        if (stackTrace == null) return null;
        List<Runtime.CallFrame> frames = stackTrace.callFrames();
        if (frames == null || frames.isEmpty()) return null;
        return frames.get(0);
    }

    private void emit(PageEvent event) {
        try {
            eventHandler.accept(event);
        } catch (RuntimeException e) {
            log.error("Page event handler failed on {}", event, e);
        }
    }

    public void setUserAgent(String userAgent) {
        emulation.setUserAgentOverride(userAgent);
    }

    /**
     * Sets a cookie that will be sent to the given URL's host on every path.
     */
    public void setCookie(Url url, String name, String value) {
        if (!network.setCookie(name, value, url.toString(), null, "/")) {
            log.warn("Browser rejected cookie {} for {}", name, url.host());
        }
    }

    public void ignoreCertificateErrors() {
        cdpSession.domain(Security.class).setIgnoreCertificateErrors(true);
    }

    /**
     * Evaluates a script in the page's main world and returns its value. Promises are awaited.
     *
     * @throws JavaScriptException if the script throws
     */
    public Object eval(@Language("JavaScript") String script) {
        var result = runtime.evaluate(script, SCRIPT_TIMEOUT_MILLIS, true, true);
        if (result.exceptionDetails() != null) {
            var details = result.exceptionDetails();
            String description = details.exception() == null ? details.text() : details.exception().toDisplayString();
            throw new JavaScriptException(description);
        }
        return result.result().toJavaObject();
    }

    public boolean isCrashed() {
        return crashed;
    }

    @Override
    public void close() {
        failCurrentNavigation(new NavigationException(currentUrl(), "Tab closed"));
        cdpSession.close();
        BrowserProcess.disposeContext(cdpSession.client(), browserContextId);
    }

    private synchronized Url currentUrl() {
        return currentNavigation == null ? null : currentNavigation.url();
    }
}
