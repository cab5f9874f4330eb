package org.netpreserve.consolescan.cdp.domains;

import org.netpreserve.consolescan.cdp.protocol.Unwrap;

public interface Target {
    /**
     * Creates an isolated, incognito-like context so tabs don't share cookies or storage.
     */
    @Unwrap("browserContextId")
    String createBrowserContext(Boolean disposeOnDetach);

    void disposeBrowserContext(String browserContextId);

    @Unwrap("targetId")
    String createTarget(String url, String browserContextId, Integer width, Integer height);

    @Unwrap("sessionId")
    String attachToTarget(String targetId, boolean flatten);

    void closeTarget(String targetId);
}
