package org.netpreserve.consolescan.browser;

import java.io.IOException;

/**
 * Starts browsers. The pool calls this once at startup and again each time the browser has to be replaced.
 */
public interface BrowserLauncher {
    BrowserConnection launch() throws IOException;
}
