package org.netpreserve.consolescan;

/**
 * Why an attempt at loading a page failed.
 */
public enum FailureKind {
    /** no load within the page timeout */
    TIMEOUT,
    /** DNS, connection or TLS failure and the like */
    NAVIGATION_ERROR,
    /** the browser or tab went away */
    BROWSER_DISCONNECTED,
    /** the page itself answered with a 5xx status */
    HTTP_ERROR,
    CANCELLED
}
