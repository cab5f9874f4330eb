package org.netpreserve.consolescan.browser;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.consolescan.config.Cookie;
import org.netpreserve.consolescan.config.ScanSettings;
import org.netpreserve.consolescan.util.Url;

import java.util.List;

/**
 * How to set up a tab before navigating it.
 *
 * @param cookieUrl cookies are set for this URL's host, path /
 */
public record PageOptions(@Nullable String userAgent, List<Cookie> cookies, @Nullable Url cookieUrl,
                          boolean ignoreHttpsErrors) {
    public PageOptions {
        cookies = List.copyOf(cookies);
    }

    public static PageOptions forUrl(ScanSettings settings, Url url) {
        return new PageOptions(settings.userAgent(), settings.cookies(), url, settings.ignoreHttpsErrors());
    }
}
