package org.netpreserve.consolescan;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.consolescan.cdp.PageEvent;

/**
 * Classifies what a tab reported. Events that aren't worth reporting map to null.
 */
public final class DiagnosticMapper {
    static final String FAILED_TO_LOAD_RESOURCE = "Failed to load resource:";

    private DiagnosticMapper() {
    }

    public static @Nullable PageError map(PageEvent event) {
        if (event instanceof PageEvent.ConsoleMessage console) {
            if (console.text() != null && console.text().startsWith(FAILED_TO_LOAD_RESOURCE)) return null;
            return PageError.of(consoleKind(console.type()), console.text(), console.url(), console.line());
        } else if (event instanceof PageEvent.UncaughtException exception) {
            return PageError.of(ErrorKind.PAGE_ERROR, exception.message(), exception.url(), exception.line());
        } else if (event instanceof PageEvent.CspViolation csp) {
            String prefix = csp.reportOnly() ? "CSP report-only: '" : "CSP violation: '";
            String blocked = csp.blockedUrl() == null || csp.blockedUrl().isEmpty() ? "inline" : csp.blockedUrl();
            return PageError.of(ErrorKind.CSP_VIOLATION, prefix + csp.directive() + "' blocked " + blocked,
                    csp.sourceUrl(), csp.line());
        } else if (event instanceof PageEvent.BrowserLog entry) {
            return mapBrowserLog(entry);
        } else if (event instanceof PageEvent.Response response) {
            if (response.status() < 400) return null;
            return PageError.of(ErrorKind.HTTP_ERROR, "HTTP " + response.status() + ": " + response.url(),
                    response.url(), null);
        } else if (event instanceof PageEvent.RequestFailed failed) {
            if (failed.canceled() || "net::ERR_ABORTED".equals(failed.errorText())) return null;
            return PageError.of(ErrorKind.REQUEST_FAILED,
                    "Request failed: " + failed.errorText() + " - " + failed.url(), failed.url(), null);
        }
        return null;
    }

    private static @Nullable PageError mapBrowserLog(PageEvent.BrowserLog entry) {
        if (entry.source() == null) return null;
        switch (entry.source()) {
            case "security":
            case "violation":
                return PageError.of(ErrorKind.CSP_VIOLATION, "CSP violation: " + entry.text(), entry.url(), entry.line());
            case "intervention":
                return PageError.of(ErrorKind.CONSOLE_WARN, "Intervention: " + entry.text(), entry.url(), entry.line());
            case "deprecation":
                return PageError.of(ErrorKind.CONSOLE_INFO, "Deprecation: " + entry.text(), entry.url(), entry.line());
            default:
                // network entries duplicate the response and loadingFailed events
                return null;
        }
    }

    static ErrorKind consoleKind(String type) {
        if (type == null) return ErrorKind.CONSOLE_LOG;
        return switch (type) {
            case "error", "assert" -> ErrorKind.CONSOLE_ERROR;
            case "warning", "warn" -> ErrorKind.CONSOLE_WARN;
            case "info" -> ErrorKind.CONSOLE_INFO;
            case "debug" -> ErrorKind.CONSOLE_DEBUG;
            default -> ErrorKind.CONSOLE_LOG;
        };
    }
}
