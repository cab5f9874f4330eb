package org.netpreserve.consolescan.consent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConsentMode {
    /** click or call "accept all" so the page runs as a consenting visitor would see it */
    ACCEPT("accept"),
    /** leave consent ungiven and just hide the banner */
    HIDE_ONLY("hide-only");

    private final String id;

    ConsentMode(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ConsentMode of(String id) {
        for (var mode : values()) {
            if (mode.id.equalsIgnoreCase(id.trim())) return mode;
        }
        throw new IllegalArgumentException("Unknown consent mode '" + id + "' (expected accept or hide-only)");
    }
}
