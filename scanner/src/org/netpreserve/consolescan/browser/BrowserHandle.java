package org.netpreserve.consolescan.browser;

/**
 * A leased tab.
 *
 * @param generation which browser instance the tab belongs to, so a crash is only acted on once
 */
public record BrowserHandle(PageDriver driver, int generation) {
}
