package org.netpreserve.consolescan.cdp.protocol;

import org.netpreserve.consolescan.cdp.domains.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Flattened session attached to a single target (tab). Closing the session closes the target.
 */
public class CDPSession extends CDPBase {
    private static final Logger log = LoggerFactory.getLogger(CDPSession.class);
    private final CDPClient client;
    private final String sessionId;
    private final String targetId;

    public CDPSession(CDPClient client, String sessionId, String targetId) {
        this.client = client;
        this.sessionId = sessionId;
        this.targetId = targetId;
        client.sessions.put(sessionId, this);
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        client.rpc.send(new RPC.Command(commandId, method, params, sessionId));
    }

    @Override
    protected long nextCommandId() {
        return client.nextCommandId();
    }

    /**
     * Closes the target and detaches. Errors are logged rather than thrown since the tab is being thrown away
     * either way.
     */
    @Override
    public void close() {
        if (client.isConnected()) {
            try {
                client.domain(Target.class).closeTarget(targetId);
            } catch (CDPException e) {
                log.debug("Error closing target {}: {}", targetId, e.getMessage());
            }
        }
        client.sessions.remove(sessionId);
        super.close();
    }

    public String targetId() {
        return targetId;
    }

    public CDPClient client() {
        return client;
    }
}
