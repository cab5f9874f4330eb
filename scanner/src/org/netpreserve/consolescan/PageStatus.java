package org.netpreserve.consolescan;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

/**
 * Overall verdict for a page.
 */
public enum PageStatus {
    /** nothing observed */
    OK,
    /** non-whitelisted diagnostics, none of error severity */
    WARN,
    /** at least one non-whitelisted error-severity diagnostic */
    ERROR,
    /** only whitelisted diagnostics */
    IGNORED,
    /** the page could not be loaded */
    FAILED;

    /**
     * Derives the status of a page that loaded from what was observed on it.
     */
    public static PageStatus of(Collection<PageError> errors) {
        boolean anyRelevant = false;
        for (PageError error : errors) {
            if (error.whitelisted()) continue;
            if (error.severity() == Severity.ERROR) return ERROR;
            anyRelevant = true;
        }
        if (anyRelevant) return WARN;
        return errors.isEmpty() ? OK : IGNORED;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
