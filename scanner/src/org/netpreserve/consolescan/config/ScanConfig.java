package org.netpreserve.consolescan.config;

/**
 * Root configuration.
 */
public record ScanConfig(
        ScanSettings scan,
        BrowserConfig browser,
        ConsentConfig consent,
        RetryConfig retry,
        ReportConfig report
) {
}
