package org.netpreserve.consolescan.cdp.protocol;

/**
 * The connection to the browser (or the tab) went away before the command completed.
 */
public class CDPClosedException extends CDPException {
    public CDPClosedException() {
        this("Connection closed");
    }

    public CDPClosedException(String message) {
        super(0, message);
    }
}
