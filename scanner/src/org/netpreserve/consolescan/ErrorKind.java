package org.netpreserve.consolescan;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where a diagnostic came from.
 */
public enum ErrorKind {
    CONSOLE_ERROR(Severity.ERROR),
    CONSOLE_WARN(Severity.WARNING),
    CONSOLE_INFO(Severity.INFO),
    CONSOLE_LOG(Severity.INFO),
    CONSOLE_DEBUG(Severity.INFO),
    /** uncaught exception in page script */
    PAGE_ERROR(Severity.ERROR),
    CSP_VIOLATION(Severity.ERROR),
    /** a subresource request that got no response */
    REQUEST_FAILED(Severity.WARNING),
    /** a response with status 400 or above */
    HTTP_ERROR(Severity.ERROR);

    private final Severity severity;

    ErrorKind(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
