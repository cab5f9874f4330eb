package org.netpreserve.consolescan.cdp;

import org.netpreserve.consolescan.util.Url;

/**
 * The browser gave up on loading the page, e.g. DNS failure or connection refused.
 */
public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(Url url, String errorText) {
        super(url, errorText);
        this.errorText = errorText;
    }

    /**
     * Chromium's net error name, e.g. {@code net::ERR_NAME_NOT_RESOLVED}.
     */
    public String errorText() {
        return errorText;
    }
}
