package org.netpreserve.consolescan.browser;

/**
 * The pool has no usable browser and can't get one.
 */
public class BrowserPoolException extends Exception {
    private final boolean initialLaunch;

    public BrowserPoolException(String message, Throwable cause, boolean initialLaunch) {
        super(message, cause);
        this.initialLaunch = initialLaunch;
    }

    /**
     * True if the browser never started at all, as opposed to failing to come back after a crash.
     */
    public boolean isInitialLaunch() {
        return initialLaunch;
    }
}
