package org.netpreserve.consolescan.consent;

import org.jetbrains.annotations.Nullable;

/**
 * What the consent handler managed to do on a page.
 *
 * @param vendor whose API or button was used, null when nothing was found or only banners were hidden
 */
public record ConsentOutcome(Phase phase, @Nullable ConsentVendor vendor) {
    public static final ConsentOutcome NONE = new ConsentOutcome(Phase.NONE, null);

    public enum Phase {
        /** no banner found */
        NONE,
        /** accepted through the vendor's script API */
        API,
        /** accepted by clicking a button */
        CLICK,
        /** banner hidden without giving consent */
        HIDE
    }

    public boolean accepted() {
        return phase == Phase.API || phase == Phase.CLICK;
    }
}
