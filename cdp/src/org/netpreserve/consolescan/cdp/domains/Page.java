package org.netpreserve.consolescan.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

public interface Page {
    void enable();

    /**
     * Starts a navigation. Completes once the browser has committed to (or given up on) the new document, not
     * when it has finished loading.
     */
    CompletableFuture<Navigate> navigateAsync(String url);

    void setLifecycleEventsEnabled(boolean enabled);

    void onLifecycleEvent(Consumer<LifecycleEvent> handler);

    record Navigate(FrameId frameId, Network.LoaderId loaderId, String errorText) {
    }

    /**
     * Fired for each loading milestone of a frame, e.g. {@code DOMContentLoaded}, {@code load},
     * {@code networkIdle}.
     */
    record LifecycleEvent(FrameId frameId, Network.LoaderId loaderId, String name, double timestamp) {
    }

    record FrameId(@JsonValue String value) {
        @JsonCreator
        public FrameId {
            Objects.requireNonNull(value);
        }
    }
}
