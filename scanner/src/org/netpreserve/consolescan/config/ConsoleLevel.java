package org.netpreserve.consolescan.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.netpreserve.consolescan.ErrorKind;
import org.netpreserve.consolescan.Severity;

import java.util.Locale;

/**
 * Which console messages are worth recording.
 */
public enum ConsoleLevel {
    /** console.error and other error-severity diagnostics */
    ERROR,
    /** also console.warn */
    WARN,
    /** everything including console.log, info and debug */
    ALL;

    public boolean accepts(ErrorKind kind) {
        if (kind.severity() == Severity.INFO) return this == ALL;
        if (kind == ErrorKind.CONSOLE_WARN) return this != ERROR;
        return true;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConsoleLevel of(String id) {
        for (var level : values()) {
            if (level.id().equalsIgnoreCase(id.trim())) return level;
        }
        throw new IllegalArgumentException("Unknown console level '" + id + "' (expected error, warn or all)");
    }
}
