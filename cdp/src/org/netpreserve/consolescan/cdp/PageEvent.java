package org.netpreserve.consolescan.cdp;

/**
 * Something a tab reported while loading or running a page, reduced to the fields needed to classify it.
 * Line numbers are one-based and null when unknown.
 */
public sealed interface PageEvent {

    /**
     * A page script called one of the {@code console} methods.
     *
     * @param type console API name as reported by the browser: log, info, warning, error, debug, assert...
     */
    record ConsoleMessage(String type, String text, String url, Integer line) implements PageEvent {
    }

    /**
     * An exception escaped to the top level of a page script.
     */
    record UncaughtException(String message, String url, Integer line) implements PageEvent {
    }

    /**
     * A message generated by the browser itself rather than page script.
     *
     * @param source violation, security, intervention, deprecation, network...
     */
    record BrowserLog(String source, String level, String text, String url, Integer line) implements PageEvent {
    }

    record CspViolation(String directive, String blockedUrl, boolean reportOnly, String sourceUrl,
                        Integer line) implements PageEvent {
    }

    /**
     * @param mainDocument whether this is the top-level document of the tab (after any redirects)
     */
    record Response(String url, int status, String resourceType, boolean mainDocument) implements PageEvent {
    }

    record RequestFailed(String url, String errorText, boolean canceled, String blockedReason,
                         String resourceType) implements PageEvent {
    }
}
