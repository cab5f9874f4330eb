package org.netpreserve.consolescan.cdp;

import org.netpreserve.consolescan.util.Url;

public class NavigationException extends Exception {
    private final Url url;

    public NavigationException(Url url, String message) {
        super(message + " for " + url);
        this.url = url;
    }

    public Url url() {
        return url;
    }
}
