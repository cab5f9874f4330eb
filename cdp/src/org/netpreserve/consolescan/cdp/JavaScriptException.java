package org.netpreserve.consolescan.cdp;

/**
 * A script evaluated with {@link Navigator#eval(String)} threw.
 */
public class JavaScriptException extends RuntimeException {
    public JavaScriptException(String message) {
        super(message);
    }
}
