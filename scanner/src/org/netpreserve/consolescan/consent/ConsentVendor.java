package org.netpreserve.consolescan.consent;

import org.intellij.lang.annotations.Language;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Consent management platforms we know how to deal with. {@link #GENERIC} covers hand-rolled banners and has
 * no script API.
 */
public enum ConsentVendor {
    USERCENTRICS("usercentrics",
            "!!(window.UC_UI && typeof window.UC_UI.acceptAllConsents === 'function')",
            "window.UC_UI.acceptAllConsents()",
            List.of("[data-testid=\"uc-accept-all-button\"]", "#uc-btn-accept-banner", ".uc-btn-accept"),
            List.of("#usercentrics-root", "#uc-banner", ".uc-banner")),
    ONETRUST("onetrust",
            "!!(window.OneTrust && typeof window.OneTrust.AllowAll === 'function')",
            "window.OneTrust.AllowAll()",
            List.of("#onetrust-accept-btn-handler", ".onetrust-close-btn-handler"),
            List.of("#onetrust-banner-sdk", "#onetrust-consent-sdk")),
    COOKIEBOT("cookiebot",
            "!!(window.Cookiebot && typeof window.Cookiebot.submitCustomConsent === 'function')",
            "window.Cookiebot.submitCustomConsent(true, true, true)",
            List.of("#CybotCookiebotDialogBodyLevelButtonLevelOptinAllowAll", "#CybotCookiebotDialogBodyButtonAccept"),
            List.of("#CybotCookiebotDialog", "#CybotCookiebotDialogBodyUnderlay")),
    GENERIC("generic", null, null,
            List.of("[data-cookie-accept]", "[data-consent-accept]", "button[class*=\"accept\"]",
                    "button[class*=\"consent\"]", "a[class*=\"accept\"]", ".cookie-accept", ".cookie-consent-accept",
                    "#cookie-accept", "#accept-cookies", ".cc-accept", ".cc-btn.cc-allow"),
            List.of(".cookie-banner", ".cookie-consent", ".cookie-notice", "[class*=\"cookie-banner\"]",
                    "[class*=\"cookie-consent\"]", "[id*=\"cookie-banner\"]", "[id*=\"cookie-consent\"]",
                    "[class*=\"consent-banner\"]", "[class*=\"CookieConsent\"]"));

    private final String id;
    private final String detectScript;
    private final String acceptScript;
    private final List<String> acceptSelectors;
    private final List<String> bannerSelectors;

    ConsentVendor(String id, @Language("JavaScript") String detectScript,
                  @Language("JavaScript") String acceptScript,
                  List<String> acceptSelectors, List<String> bannerSelectors) {
        this.id = id;
        this.detectScript = detectScript;
        this.acceptScript = acceptScript;
        this.acceptSelectors = acceptSelectors;
        this.bannerSelectors = bannerSelectors;
    }

    public String id() {
        return id;
    }

    /**
     * Expression that evaluates to true when the vendor's script API is loaded on the page.
     */
    public @Nullable String detectScript() {
        return detectScript;
    }

    /**
     * Expression that accepts all consent categories through the vendor's API.
     */
    public @Nullable String acceptScript() {
        return acceptScript;
    }

    public boolean hasApi() {
        return detectScript != null;
    }

    /**
     * "Accept all" buttons, most specific first.
     */
    public List<String> acceptSelectors() {
        return acceptSelectors;
    }

    public List<String> bannerSelectors() {
        return bannerSelectors;
    }

    /**
     * The vendor whose accept button matches this selector.
     */
    public static @Nullable ConsentVendor forAcceptSelector(String selector) {
        for (var vendor : values()) {
            if (vendor.acceptSelectors.contains(selector)) return vendor;
        }
        return null;
    }
}
