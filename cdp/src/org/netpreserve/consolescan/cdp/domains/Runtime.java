package org.netpreserve.consolescan.cdp.domains;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.netpreserve.consolescan.cdp.protocol.RPC;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.function.Consumer;

public interface Runtime {
    void enable();

    /**
     * @param timeout milliseconds the script may run before being terminated
     */
    Evaluate evaluate(String expression, Integer timeout, boolean returnByValue, boolean awaitPromise);

    void onConsoleAPICalled(Consumer<ConsoleAPICalled> handler);

    void onExceptionThrown(Consumer<ExceptionThrown> handler);

    record ConsoleAPICalled(String type, List<RemoteObject> args, double timestamp, StackTrace stackTrace) {
    }

    record ExceptionThrown(double timestamp, ExceptionDetails exceptionDetails) {
    }

    record Evaluate(RemoteObject result, ExceptionDetails exceptionDetails) {
    }

    record ExceptionDetails(int exceptionId, String text, int lineNumber, int columnNumber, String url,
                            StackTrace stackTrace, RemoteObject exception) {
    }

    record StackTrace(String description, List<CallFrame> callFrames) {
    }

    record CallFrame(String functionName, String scriptId, String url, int lineNumber, int columnNumber) {
    }

    record RemoteObject(String type, String subtype, String className, JsonNode value, String description) {
        public Object toJavaObject() {
            if (value == null || value.isNull()) return null;
            switch (type) {
                case "string":
                    return value.asText();
                case "boolean":
                    return value.asBoolean();
                case "number":
                    return value.numberValue();
                case "undefined":
                    return null;
                default:
                    try {
                        return RPC.JSON.treeToValue(value, Object.class);
                    } catch (JsonProcessingException e) {
                        throw new UncheckedIOException(e);
                    }
            }
        }

        /**
         * Renders the object the way the devtools console would show it in a single line.
         */
        public String toDisplayString() {
            if (value != null && !value.isNull() && !value.isContainerNode()) return value.asText();
            if (description != null) return description;
            if (value != null && value.isNull()) return "null";
            if (value != null) return value.toString();
            return type;
        }
    }
}
