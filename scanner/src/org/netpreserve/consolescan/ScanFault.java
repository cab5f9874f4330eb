package org.netpreserve.consolescan;

/**
 * Something that stops the whole scan rather than just one page.
 */
public enum ScanFault {
    /** the browser couldn't be started in the first place */
    BROWSER_LAUNCH_FAILED,
    /** the browser crashed and couldn't be started again */
    BROWSER_RESTART_FAILED
}
