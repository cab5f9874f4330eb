package org.netpreserve.consolescan.browser;

import org.intellij.lang.annotations.Language;
import org.netpreserve.consolescan.config.WaitUntil;
import org.netpreserve.consolescan.util.Url;

import java.util.concurrent.CompletableFuture;

/**
 * One tab, exclusively owned by whoever leased it.
 */
public interface PageDriver extends AutoCloseable {
    /**
     * Starts loading a page.
     *
     * @return completes with the HTTP status of the main document (0 if none) once the page counts as loaded,
     * or exceptionally with a {@code NavigationException} or {@code CDPException}
     */
    CompletableFuture<Integer> navigate(Url url, WaitUntil waitUntil);

    /**
     * Runs a script in the page and returns its value converted to plain Java objects.
     *
     * @throws org.netpreserve.consolescan.cdp.JavaScriptException if the script throws
     */
    Object eval(@Language("JavaScript") String script);

    @Override
    void close();
}
