package org.netpreserve.consolescan.cdp;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.netpreserve.consolescan.util.Url;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a real Chrome or Chromium, so only when CONSOLESCAN_BROWSER_TESTS=true.
 */
@EnabledIfEnvironmentVariable(named = "CONSOLESCAN_BROWSER_TESTS", matches = "true")
class NavigatorTest {
    private static BrowserProcess browserProcess;
    private static HttpServer httpServer;

    @BeforeAll
    static void setUp() throws IOException {
        browserProcess = BrowserProcess.start(System.getenv("CONSOLESCAN_BROWSER"), List.of("--no-sandbox"), true, null);
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            String body;
            int status = 200;
            switch (exchange.getRequestURI().getPath()) {
                case "/errors":
                    body = "<script>console.error('boom', 42); console.warn('careful');</script>" +
                           "<script>undefinedFunction();</script>" +
                           "<img src='/missing.png'>";
                    break;
                case "/server-error":
                    status = 503;
                    body = "down";
                    break;
                default:
                    status = 404;
                    body = "not found";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/html");
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        httpServer.start();
    }

    @AfterAll
    static void tearDown() {
        if (httpServer != null) httpServer.stop(0);
        if (browserProcess != null) browserProcess.close();
    }

    private Url url(String path) {
        return new Url("http://127.0.0.1:" + httpServer.getAddress().getPort() + path);
    }

    @Test
    void reportsConsoleMessagesExceptionsAndHttpErrors() throws Exception {
        var events = new CopyOnWriteArrayList<PageEvent>();
        try (var navigator = browserProcess.newTab(events::add)) {
            int status = navigator.navigate(url("/errors")).networkIdle().get(30, TimeUnit.SECONDS);
            assertEquals(200, status);
        }

        assertTrue(events.contains(new PageEvent.ConsoleMessage("error", "boom 42", url("/errors").toString(), 1)),
                events::toString);
        assertTrue(events.stream().anyMatch(e -> e instanceof PageEvent.ConsoleMessage message
                                                  && message.type().equals("warning")), events::toString);
        assertTrue(events.stream().anyMatch(e -> e instanceof PageEvent.UncaughtException exception
                                                  && exception.message().contains("undefinedFunction")),
                events::toString);
        assertTrue(events.stream().anyMatch(e -> e instanceof PageEvent.Response response
                                                  && response.status() == 404 && !response.mainDocument()),
                events::toString);
    }

    @Test
    void loadedCompletesWithTheMainDocumentStatus() throws Exception {
        try (var navigator = browserProcess.newTab(event -> {})) {
            assertEquals(503, navigator.navigate(url("/server-error")).loaded().get(30, TimeUnit.SECONDS));
        }
    }

    @Test
    void unreachableHostFailsTheNavigation() {
        try (var navigator = browserProcess.newTab(event -> {})) {
            var navigation = navigator.navigate(new Url("http://127.0.0.1:1/"));
            var e = assertThrows(ExecutionException.class, () -> navigation.loaded().get(30, TimeUnit.SECONDS));
            var failure = assertInstanceOf(NavigationFailedException.class, e.getCause());
            assertTrue(failure.errorText().startsWith("net::ERR_"), failure.errorText());
        }
    }

    @Test
    void evalReturnsPlainValues() {
        try (var navigator = browserProcess.newTab(event -> {})) {
            assertEquals(true, navigator.eval("typeof window === 'object'"));
            assertEquals("abc", navigator.eval("['a', 'b', 'c'].join('')"));
            assertThrows(JavaScriptException.class, () -> navigator.eval("throw new Error('nope')"));
        }
    }
}
