package org.netpreserve.consolescan.cdp.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.consolescan.cdp.domains.Log;
import org.netpreserve.consolescan.cdp.domains.Page;
import org.netpreserve.consolescan.cdp.domains.Runtime;
import org.netpreserve.consolescan.cdp.domains.Target;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class CDPBaseTest {
    private final FakeConnection connection = new FakeConnection();

    @AfterEach
    void tearDown() {
        connection.close();
    }

    @Test
    void commandParametersAreNamedAfterMethodParameters() {
        connection.replyWith = command -> RPC.JSON.createObjectNode().put("targetId", "T1");

        String targetId = connection.domain(Target.class).createTarget("about:blank", "CTX", 800, null);

        assertEquals("T1", targetId);
        var command = connection.sent.get(0);
        assertEquals("Target.createTarget", command.method());
        assertEquals(Map.of("url", "about:blank", "browserContextId", "CTX", "width", 800), command.params());
    }

    @Test
    void errorResponsesBecomeExceptions() {
        connection.replyError = new RPC.Error(-32000, "Cannot navigate to invalid URL");

        var e = assertThrows(CDPException.class,
                () -> connection.domain(Runtime.class).evaluate("1", null, true, false));
        assertEquals(-32000, e.code());
        assertTrue(e.getMessage().contains("Cannot navigate"));
    }

    @Test
    void asyncSuffixIsDroppedFromTheCommandName() throws Exception {
        connection.replyWith = command -> RPC.JSON.createObjectNode().put("frameId", "F").put("loaderId", "L");

        Page.Navigate result = connection.domain(Page.class).navigateAsync("http://example.org/")
                .get(5, TimeUnit.SECONDS);

        assertEquals("Page.navigate", connection.sent.get(0).method());
        assertEquals("L", result.loaderId().value());
    }

    @Test
    void eventsAreDeliveredToEveryListener() throws Exception {
        var first = new CompletableFuture<Log.EntryAdded>();
        var second = new CompletableFuture<Log.EntryAdded>();
        var log = connection.domain(Log.class);
        log.onEntryAdded(first::complete);
        log.onEntryAdded(second::complete);

        ObjectNode params = RPC.JSON.createObjectNode();
        params.putObject("entry").put("source", "intervention").put("level", "warning").put("text", "Blocked");
        connection.deliver(new RPC.Event("Log.entryAdded", params, null));

        assertEquals("Blocked", first.get(5, TimeUnit.SECONDS).entry().text());
        assertEquals("intervention", second.get(5, TimeUnit.SECONDS).entry().source());
    }

    @Test
    void pendingCommandsFailWhenTheConnectionCloses() {
        CompletableFuture<Page.Navigate> navigate = connection.domain(Page.class).navigateAsync("http://example.org/");
        var closed = new CompletableFuture<Void>();
        connection.onClose(() -> closed.complete(null));

        connection.handleRpcClose();

        var e = assertThrows(ExecutionException.class, () -> navigate.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CDPClosedException.class, e.getCause());
        assertTrue(closed.isDone());
        assertTrue(connection.isClosed());
        assertThrows(CDPClosedException.class, () -> connection.domain(Page.class).enable());
    }

    @Test
    void eventNamesComeFromTheEnclosingDomain() {
        assertEquals("Runtime.consoleAPICalled", CDPBase.eventName(Runtime.ConsoleAPICalled.class));
        assertEquals("Log.entryAdded", CDPBase.eventName(Log.EntryAdded.class));
    }

    @Test
    void objectMethodsAreNotSentAsCommands() {
        var page = connection.domain(Page.class);
        assertTrue(page.toString().startsWith("Page@"));
        assertEquals(page, page);
        assertTrue(connection.sent.isEmpty());
    }

    /**
     * Replies to each command immediately, as if the browser were instantaneous.
     */
    private static class FakeConnection extends CDPBase {
        final List<RPC.Command> sent = new CopyOnWriteArrayList<>();
        final AtomicLong ids = new AtomicLong();
        Function<RPC.Command, ObjectNode> replyWith;
        RPC.Error replyError;

        @Override
        protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
            var command = new RPC.Command(commandId, method, params, null);
            sent.add(command);
            if (replyError != null) {
                handleMessage(new RPC.Response(commandId, null, replyError, null));
            } else if (replyWith != null) {
                handleMessage(new RPC.Response(commandId, replyWith.apply(command), null, null));
            }
        }

        void deliver(RPC.ServerMessage message) {
            handleMessage(message);
        }

        @Override
        protected long nextCommandId() {
            return ids.incrementAndGet();
        }
    }
}
