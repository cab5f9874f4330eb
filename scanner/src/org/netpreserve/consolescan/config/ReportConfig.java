package org.netpreserve.consolescan.config;

import org.jetbrains.annotations.Nullable;

/**
 * @param json      where to write the JSON report
 * @param html      where to write the HTML report
 * @param topErrors how many of the most common messages to list in the summary
 */
public record ReportConfig(@Nullable String json, @Nullable String html, int topErrors) {
}
