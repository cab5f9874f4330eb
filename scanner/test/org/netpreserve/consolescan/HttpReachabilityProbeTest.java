package org.netpreserve.consolescan;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.consolescan.util.Url;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpReachabilityProbeTest {
    private final List<String> userAgents = new CopyOnWriteArrayList<>();
    private final HttpReachabilityProbe probe = new HttpReachabilityProbe(Duration.ofSeconds(2), "TestAgent/1.0");
    private HttpServer httpServer;

    @BeforeEach
    void setUp() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            userAgents.add(exchange.getRequestHeaders().getFirst("User-Agent"));
            int status = switch (exchange.getRequestURI().getPath()) {
                case "/gone" -> 404;
                case "/broken" -> 502;
                default -> 200;
            };
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        httpServer.start();
    }

    @AfterEach
    void tearDown() {
        httpServer.stop(0);
    }

    private Url url(String path) {
        return new Url("http://127.0.0.1:" + httpServer.getAddress().getPort() + path);
    }

    @Test
    void anyAnswerBelow500MeansReachable() throws Exception {
        var token = new CancellationToken();
        assertTrue(probe.isReachable(url("/"), token));
        assertTrue(probe.isReachable(url("/gone"), token));
        assertFalse(probe.isReachable(url("/broken"), token));
        assertEquals("TestAgent/1.0", userAgents.get(0));
    }

    @Test
    void refusedConnectionsAreUnreachable() throws Exception {
        assertFalse(probe.isReachable(new Url("http://127.0.0.1:1/"), new CancellationToken()));
    }

    @Test
    void aCancelledScanDoesNotWaitForTheProbe() {
        var token = new CancellationToken();
        token.cancel();
        assertThrows(CancellationException.class, () -> probe.isReachable(url("/"), token));
    }
}
