package org.netpreserve.consolescan.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When a page counts as loaded.
 */
public enum WaitUntil {
    LOAD("load"),
    NETWORK_IDLE("networkidle");

    private final String id;

    WaitUntil(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static WaitUntil of(String id) {
        for (var value : values()) {
            if (value.id.equalsIgnoreCase(id.trim())) return value;
        }
        throw new IllegalArgumentException("Unknown wait condition '" + id + "' (expected load or networkidle)");
    }
}
