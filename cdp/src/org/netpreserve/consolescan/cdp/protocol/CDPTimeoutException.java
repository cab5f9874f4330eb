package org.netpreserve.consolescan.cdp.protocol;

/**
 * The browser did not reply to a command in time. Usually means it has hung or crashed.
 */
public class CDPTimeoutException extends CDPException {
    public CDPTimeoutException(String message) {
        super(0, message);
        captureStackTrace();
    }
}
