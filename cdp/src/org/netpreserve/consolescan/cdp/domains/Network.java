package org.netpreserve.consolescan.cdp.domains;

import org.netpreserve.consolescan.cdp.protocol.Unwrap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.function.Consumer;

public interface Network {
    void enable();

    @Unwrap("success")
    boolean setCookie(String name, String value, String url, String domain, String path);

    void onRequestWillBeSent(Consumer<RequestWillBeSent> handler);

    void onResponseReceived(Consumer<ResponseReceived> handler);

    void onLoadingFailed(Consumer<LoadingFailed> handler);

    record RequestWillBeSent(RequestId requestId, LoaderId loaderId, Request request, String type,
                             Page.FrameId frameId) {
    }

    record ResponseReceived(RequestId requestId, LoaderId loaderId, String type, Response response,
                            Page.FrameId frameId) {
    }

    record LoadingFailed(RequestId requestId, String type, String errorText, boolean canceled,
                         String blockedReason) {
    }

    record Request(String url, String method) {
    }

    record Response(String url, int status, String statusText, String mimeType) {
    }

    record RequestId(@JsonValue String value) {
        @JsonCreator
        public RequestId {
            Objects.requireNonNull(value);
        }
    }

    record LoaderId(@JsonValue String value) {
        @JsonCreator
        public LoaderId {
            Objects.requireNonNull(value);
        }
    }
}
