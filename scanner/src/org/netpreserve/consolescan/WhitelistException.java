package org.netpreserve.consolescan;

public class WhitelistException extends Exception {
    public WhitelistException(String message) {
        super(message);
    }

    public WhitelistException(String message, Throwable cause) {
        super(message, cause);
    }
}
