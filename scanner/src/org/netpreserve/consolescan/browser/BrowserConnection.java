package org.netpreserve.consolescan.browser;

import org.netpreserve.consolescan.cdp.PageEvent;

import java.util.function.Consumer;

/**
 * A running browser.
 */
public interface BrowserConnection extends AutoCloseable {
    /**
     * Opens a blank tab in a fresh browser context.
     *
     * @param eventHandler receives the tab's diagnostics, possibly on a thread that must not block
     * @throws RuntimeException (usually a {@code CDPException}) if the browser fails to open the tab
     */
    PageDriver openPage(PageOptions options, Consumer<PageEvent> eventHandler);

    boolean isConnected();

    String version();

    @Override
    void close();
}
