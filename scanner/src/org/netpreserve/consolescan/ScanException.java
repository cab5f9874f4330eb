package org.netpreserve.consolescan;

/**
 * The scan can't start, e.g. because there are no URLs to scan.
 */
public class ScanException extends Exception {
    public ScanException(String message) {
        super(message);
    }
}
