package org.netpreserve.consolescan.cdp.protocol;

/**
 * Error reported by the browser in reply to a command, or raised locally while talking to it.
 */
public class CDPException extends RuntimeException {
    private final int code;

    public CDPException(int code, String message) {
        super(code == 0 ? message : message + " [" + code + "]");
        this.code = code;
    }

    /**
     * Stack traces are captured lazily since most errors are created on the connection thread where the trace
     * tells us nothing. {@link #captureStackTrace()} records the trace of the caller that receives the error.
     */
    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    public void captureStackTrace() {
        super.fillInStackTrace();
    }

    public int code() {
        return code;
    }
}
