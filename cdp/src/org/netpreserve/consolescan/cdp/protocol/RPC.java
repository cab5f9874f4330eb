package org.netpreserve.consolescan.cdp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static org.netpreserve.consolescan.util.LogUtils.ellipses;

/**
 * Message transport between us and the browser. Chromium speaks the same JSON messages over either a
 * websocket or a pair of pipes delimited by null bytes.
 */
public interface RPC {
    ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    void send(Command command) throws IOException;

    void close();

    boolean isOpen();

    record Command(long id, String method, Map<String, Object> params, String sessionId) {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
    @JsonSubTypes({@JsonSubTypes.Type(Event.class), @JsonSubTypes.Type(Response.class)})
    interface ServerMessage {
        String sessionId();
    }

    record Event(String method, ObjectNode params, String sessionId) implements ServerMessage {
    }

    record Response(long id, ObjectNode result, Error error, String sessionId) implements ServerMessage {
    }

    record Error(int code, String message) {
    }

    /**
     * Callbacks from the transport to the protocol layer.
     */
    interface Handler {
        void onMessage(ServerMessage message);

        /**
         * Called once when the transport stops delivering messages, whether we closed it or the browser died.
         */
        void onClose();
    }

    class Socket implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Socket.class);
        private static final HttpClient httpClient = HttpClient.newHttpClient();
        private final WebSocket webSocket;
        private final Handler handler;
        private final AtomicBoolean open = new AtomicBoolean(true);

        public Socket(URI devtoolsUrl, Handler handler) throws IOException {
            this.handler = handler;
            try {
                this.webSocket = httpClient.newWebSocketBuilder()
                        .buildAsync(devtoolsUrl, new Listener())
                        .get(10, TimeUnit.SECONDS);
            } catch (ExecutionException | TimeoutException e) {
                throw new IOException("Unable to connect to " + devtoolsUrl, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted connecting to " + devtoolsUrl, e);
            }
        }

        @Override
        public void send(Command command) throws IOException {
            if (!open.get()) throw new CDPClosedException();
            String json = JSON.writeValueAsString(command);
            if (log.isTraceEnabled()) log.trace("-> {}", ellipses(json));
            webSocket.sendText(json, true);
        }

        @Override
        public void close() {
            if (!webSocket.isOutputClosed()) webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "");
            webSocket.abort();
            closed();
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        private void closed() {
            if (open.compareAndSet(true, false)) handler.onClose();
        }

        private class Listener implements WebSocket.Listener {
            private final StringBuilder buffer = new StringBuilder();

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                buffer.append(data);
                if (last) {
                    String text = buffer.toString();
                    buffer.setLength(0);
                    if (log.isTraceEnabled()) log.trace("<- {}", ellipses(text));
                    try {
                        handler.onMessage(JSON.readValue(text, ServerMessage.class));
                    } catch (IOException e) {
                        log.error("Unparseable message from browser: {}", ellipses(text), e);
                    }
                }
                webSocket.request(1);
                return null;
            }

            @Override
            public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                log.debug("Websocket closed by browser: {} {}", statusCode, reason);
                closed();
                return null;
            }

            @Override
            public void onError(WebSocket webSocket, Throwable error) {
                log.warn("Websocket error", error);
                closed();
            }
        }
    }

    class Pipe implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Pipe.class);
        private static final int READ_BUFFER_SIZE = 256 * 1024;
        private final InputStream inputStream;
        private final OutputStream outputStream;
        private final Handler handler;
        private final AtomicBoolean open = new AtomicBoolean(true);

        public Pipe(InputStream inputStream, OutputStream outputStream, Handler handler) {
            this.inputStream = inputStream;
            this.outputStream = outputStream;
            this.handler = handler;
            var thread = new Thread(this::readLoop, "CDP.Pipe");
            thread.setDaemon(true);
            thread.start();
        }

        private void readLoop() {
            var pending = new ByteArrayOutputStream();
            byte[] buffer = new byte[READ_BUFFER_SIZE];
            try {
                int n;
                while ((n = inputStream.read(buffer)) >= 0) {
                    int start = 0;
                    for (int i = 0; i < n; i++) {
                        if (buffer[i] != 0) continue;
                        if (pending.size() == 0) {
                            dispatch(buffer, start, i - start);
                        } else {
                            pending.write(buffer, start, i - start);
                            dispatch(pending.toByteArray(), 0, pending.size());
                            pending.reset();
                        }
                        start = i + 1;
                    }
                    pending.write(buffer, start, n - start);
                }
                log.debug("Browser closed the pipe");
            } catch (IOException e) {
                if (open.get()) log.warn("Error reading from browser pipe", e);
            } finally {
                close();
            }
        }

        private void dispatch(byte[] data, int offset, int length) {
            if (log.isTraceEnabled()) log.trace("<- {}", ellipses(new String(data, offset, length)));
            try {
                handler.onMessage(JSON.readValue(data, offset, length, ServerMessage.class));
            } catch (IOException e) {
                log.error("Unparseable message from browser: {}", ellipses(new String(data, offset, length)), e);
            }
        }

        @Override
        public void send(Command command) throws IOException {
            if (!open.get()) throw new CDPClosedException();
            byte[] json = JSON.writeValueAsBytes(command);
            if (log.isTraceEnabled()) log.trace("-> {}", ellipses(new String(json)));
            synchronized (outputStream) {
                outputStream.write(json);
                outputStream.write(0);
                outputStream.flush();
            }
        }

        @Override
        public void close() {
            if (!open.compareAndSet(true, false)) return;
            try {
                outputStream.close();
            } catch (IOException e) {
                log.debug("Error closing browser pipe output", e);
            }
            try {
                inputStream.close();
            } catch (IOException e) {
                log.debug("Error closing browser pipe input", e);
            }
            handler.onClose();
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }
    }
}
