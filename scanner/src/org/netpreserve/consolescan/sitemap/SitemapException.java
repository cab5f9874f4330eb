package org.netpreserve.consolescan.sitemap;

/**
 * No sitemap could be found, fetched or parsed.
 */
public class SitemapException extends Exception {
    public SitemapException(String message) {
        super(message);
    }

    public SitemapException(String message, Throwable cause) {
        super(message, cause);
    }
}
