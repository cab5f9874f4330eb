package org.netpreserve.consolescan.cdp.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Browser-level connection. Messages carrying a session id are routed to the matching {@link CDPSession}.
 */
public class CDPClient extends CDPBase implements AutoCloseable, RPC.Handler {
    private static final Logger log = LoggerFactory.getLogger(CDPClient.class);
    private final AtomicLong commandIds = new AtomicLong();
    final Map<String, CDPSession> sessions = new ConcurrentHashMap<>();
    final RPC rpc;

    public CDPClient(URI devtoolsUrl) throws IOException {
        this.rpc = new RPC.Socket(devtoolsUrl, this);
    }

    public CDPClient(InputStream inputStream, OutputStream outputStream) {
        this.rpc = new RPC.Pipe(inputStream, outputStream, this);
    }

    @Override
    public void onMessage(RPC.ServerMessage message) {
        if (message.sessionId() == null) {
            handleMessage(message);
            return;
        }
        var session = sessions.get(message.sessionId());
        if (session == null) {
            log.debug("Message for unknown session {}", message.sessionId());
        } else {
            session.handleMessage(message);
        }
    }

    @Override
    public void onClose() {
        sessions.values().forEach(CDPSession::handleRpcClose);
        handleRpcClose();
    }

    public boolean isConnected() {
        return rpc.isOpen() && !isClosed();
    }

    @Override
    public void close() {
        rpc.close();
        super.close();
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        rpc.send(new RPC.Command(commandId, method, params, null));
    }

    @Override
    protected long nextCommandId() {
        return commandIds.incrementAndGet();
    }
}
