package org.netpreserve.consolescan.consent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.intellij.lang.annotations.Language;
import org.netpreserve.consolescan.CancellationToken;
import org.netpreserve.consolescan.browser.PageDriver;
import org.netpreserve.consolescan.cdp.JavaScriptException;
import org.netpreserve.consolescan.cdp.protocol.CDPClosedException;
import org.netpreserve.consolescan.cdp.protocol.CDPException;
import org.netpreserve.consolescan.cdp.protocol.CDPTimeoutException;
import org.netpreserve.consolescan.config.ConsentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Gets cookie banners out of the way so the page behaves as it would for a visitor who dealt with them.
 * <p>
 * In {@link ConsentMode#ACCEPT} mode it first tries the consent platform's script API, then clicks the first
 * visible "accept" button, and if neither works hides the banner. In {@link ConsentMode#HIDE_ONLY} mode it only
 * hides banners. Failures are logged and otherwise ignored, except that a lost browser connection is
 * rethrown.
 */
public class ConsentHandler {
    private static final Logger log = LoggerFactory.getLogger(ConsentHandler.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final ConsentMode mode;
    private final Duration settle;
    private final String clickScript;
    private final String hideScript;

    public ConsentHandler(ConsentMode mode, Duration settle) {
        this.mode = mode;
        this.settle = settle;
        var acceptSelectors = new ArrayList<String>();
        var bannerSelectors = new ArrayList<String>();
        for (var vendor : ConsentVendor.values()) {
            acceptSelectors.addAll(vendor.acceptSelectors());
            bannerSelectors.addAll(vendor.bannerSelectors());
        }
        this.clickScript = clickScript(acceptSelectors);
        this.hideScript = hideScript(bannerSelectors);
    }

    public static ConsentHandler of(ConsentConfig config) {
        return new ConsentHandler(config.mode(), config.settle());
    }

    public ConsentMode mode() {
        return mode;
    }

    /**
     * @param budget upper bound on how long to wait for the page to react after accepting
     */
    public ConsentOutcome handle(PageDriver page, CancellationToken token, Duration budget)
            throws InterruptedException {
        if (mode == ConsentMode.ACCEPT) {
            ConsentVendor vendor = acceptViaApi(page);
            if (vendor != null) {
                log.info("Consent accepted via {} API", vendor.id());
                token.sleep(min(settle, budget));
                return new ConsentOutcome(ConsentOutcome.Phase.API, vendor);
            }
            String selector = clickAcceptButton(page);
            if (selector != null) {
                ConsentVendor clicked = ConsentVendor.forAcceptSelector(selector);
                log.info("Consent button clicked: {}", selector);
                token.sleep(min(settle, budget));
                return new ConsentOutcome(ConsentOutcome.Phase.CLICK, clicked);
            }
        }
        int hidden = hideBanners(page);
        if (hidden > 0) {
            log.debug("Hid {} consent banner elements", hidden);
            return new ConsentOutcome(ConsentOutcome.Phase.HIDE, null);
        }
        return ConsentOutcome.NONE;
    }

    private ConsentVendor acceptViaApi(PageDriver page) {
        for (var vendor : ConsentVendor.values()) {
            if (!vendor.hasApi()) continue;
            try {
                if (!Boolean.TRUE.equals(page.eval(vendor.detectScript()))) continue;
            } catch (CDPClosedException | CDPTimeoutException e) {
                throw e;
            } catch (CDPException | JavaScriptException e) {
                log.info("Detecting consent API {} failed: {}", vendor.id(), e.getMessage());
                continue;
            }
            try {
                page.eval(vendor.acceptScript());
                return vendor;
            } catch (CDPClosedException | CDPTimeoutException e) {
                throw e;
            } catch (CDPException | JavaScriptException e) {
                log.info("Consent API {} failed: {}", vendor.id(), e.getMessage());
                return null;
            }
        }
        return null;
    }

    private String clickAcceptButton(PageDriver page) {
        try {
            Object result = page.eval(clickScript);
            return result instanceof String selector ? selector : null;
        } catch (CDPClosedException | CDPTimeoutException e) {
            throw e;
        } catch (CDPException | JavaScriptException e) {
            log.info("Clicking consent button failed: {}", e.getMessage());
            return null;
        }
    }

    private int hideBanners(PageDriver page) {
        try {
            Object result = page.eval(hideScript);
            return result instanceof Number count ? count.intValue() : 0;
        } catch (CDPClosedException | CDPTimeoutException e) {
            throw e;
        } catch (CDPException | JavaScriptException e) {
            log.info("Hiding consent banners failed: {}", e.getMessage());
            return 0;
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Language("JavaScript")
    static String clickScript(List<String> selectors) {
        return "(() => {\n" +
               "  const selectors = " + toJson(selectors) + ";\n" +
               "  for (const selector of selectors) {\n" +
               "    let element;\n" +
               "    try { element = document.querySelector(selector); } catch (e) { continue; }\n" +
               "    if (!element) continue;\n" +
               "    const style = getComputedStyle(element);\n" +
               "    if (style.display === 'none' || style.visibility === 'hidden') continue;\n" +
               "    if (element.getClientRects().length === 0) continue;\n" +
               "    element.click();\n" +
               "    return selector;\n" +
               "  }\n" +
               "  return null;\n" +
               "})()";
    }

    @Language("JavaScript")
    static String hideScript(List<String> selectors) {
        return "(() => {\n" +
               "  let hidden = 0;\n" +
               "  for (const selector of " + toJson(selectors) + ") {\n" +
               "    try {\n" +
               "      document.querySelectorAll(selector).forEach(el => { el.style.display = 'none'; hidden++; });\n" +
               "    } catch (e) {}\n" +
               "  }\n" +
               "  const ucRoot = document.getElementById('usercentrics-root');\n" +
               "  if (ucRoot && ucRoot.shadowRoot) {\n" +
               "    ucRoot.shadowRoot.querySelectorAll('[class*=\"banner\"]')\n" +
               "        .forEach(el => { el.style.display = 'none'; hidden++; });\n" +
               "  }\n" +
               "  if (document.body) document.body.style.overflow = '';\n" +
               "  document.documentElement.style.overflow = '';\n" +
               "  return hidden;\n" +
               "})()";
    }

    private static String toJson(List<String> selectors) {
        try {
            return JSON.writeValueAsString(selectors);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
