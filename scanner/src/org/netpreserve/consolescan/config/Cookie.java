package org.netpreserve.consolescan.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Objects;

/**
 * A cookie set on the host of every scanned URL.
 */
public record Cookie(String name, String value) {
    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public Cookie {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (name.isBlank()) throw new IllegalArgumentException("Cookie name must not be blank");
    }

    /**
     * Parses {@code NAME=VALUE}. The value may itself contain '='.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Cookie parse(String text) {
        int equals = text.indexOf('=');
        if (equals <= 0) throw new IllegalArgumentException("Expected NAME=VALUE but got: " + text);
        return new Cookie(text.substring(0, equals).trim(), text.substring(equals + 1).trim());
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
