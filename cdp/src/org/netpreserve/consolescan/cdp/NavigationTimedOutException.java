package org.netpreserve.consolescan.cdp;

import org.netpreserve.consolescan.util.Url;

public class NavigationTimedOutException extends NavigationException {
    public NavigationTimedOutException(Url url, String message) {
        super(url, message);
    }
}
