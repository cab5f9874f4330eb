package org.netpreserve.consolescan;

import org.netpreserve.consolescan.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Sends a HEAD request. Anything below 500 counts as reachable: the server is up even if it doesn't like
 * HEAD or the page is gone.
 */
public class HttpReachabilityProbe implements ReachabilityProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpReachabilityProbe.class);
    private final HttpClient httpClient;
    private final Duration timeout;
    private final String userAgent;

    public HttpReachabilityProbe(Duration timeout, String userAgent) {
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public boolean isReachable(Url url, CancellationToken token) throws InterruptedException {
        HttpRequest request;
        try {
            var builder = HttpRequest.newBuilder(url.toURI())
                    .method("HEAD", HttpRequest.BodyPublishers.noBody())
                    .timeout(timeout);
            if (userAgent != null) builder.header("User-Agent", userAgent);
            request = builder.build();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Can't probe malformed URL {}", url);
            return false;
        }
        CompletableFuture<HttpResponse<Void>> future = httpClient.sendAsync(request,
                HttpResponse.BodyHandlers.discarding());
        try {
            int status = token.await(future, timeout.plusSeconds(1)).statusCode();
            log.debug("Probe {} -> {}", url, status);
            return status < 500;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.debug("Probe {} failed: {}", url, cause instanceof IOException ? cause.toString() : cause);
            return false;
        } catch (TimeoutException e) {
            log.debug("Probe {} timed out", url);
            return false;
        } finally {
            if (!future.isDone()) future.cancel(true);
        }
    }
}
