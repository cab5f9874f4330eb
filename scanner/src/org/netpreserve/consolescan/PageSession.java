package org.netpreserve.consolescan;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.consolescan.browser.PageDriver;
import org.netpreserve.consolescan.cdp.NavigationException;
import org.netpreserve.consolescan.cdp.NavigationTimedOutException;
import org.netpreserve.consolescan.cdp.PageEvent;
import org.netpreserve.consolescan.cdp.protocol.CDPClosedException;
import org.netpreserve.consolescan.cdp.protocol.CDPException;
import org.netpreserve.consolescan.cdp.protocol.CDPTimeoutException;
import org.netpreserve.consolescan.config.ScanSettings;
import org.netpreserve.consolescan.consent.ConsentHandler;
import org.netpreserve.consolescan.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One attempt at loading one page: navigate, wait for it to load, deal with any consent banner, then keep
 * listening for a moment.
 * <p>
 * The tab's listener only queues events via {@link #offer(PageEvent)}. Classifying and recording them happens
 * on the thread calling {@link #run}.
 */
public class PageSession {
    private static final Logger log = LoggerFactory.getLogger(PageSession.class);
    static final int QUEUE_CAPACITY = 10_000;
    private final Url url;
    private final ScanSettings settings;
    private final ConsentHandler consentHandler;
    private final CancellationToken token;
    private final BlockingQueue<PageEvent> events = new ArrayBlockingQueue<>(QUEUE_CAPACITY);
    private final AtomicLong dropped = new AtomicLong();
    private ErrorCollector collector;
    private Consumer<PageError> onNewError;
    private volatile Integer httpStatus;

    /**
     * @param consentHandler null to leave cookie banners alone
     */
    public PageSession(Url url, ScanSettings settings, @Nullable ConsentHandler consentHandler,
                       CancellationToken token) {
        this.url = url;
        this.settings = settings;
        this.consentHandler = consentHandler;
        this.token = token;
    }

    /**
     * Queues an event from the tab. Never blocks; events beyond the queue's capacity are counted and dropped.
     */
    public void offer(PageEvent event) {
        if (!events.offer(event) && dropped.getAndIncrement() == 0) {
            log.warn("Event queue full for {}, dropping events", url);
        }
    }

    /**
     * Status of the main document once the page has loaded, null before then or if there was no HTTP response.
     */
    public @Nullable Integer httpStatus() {
        return httpStatus;
    }

    public long droppedEvents() {
        return dropped.get();
    }

    /**
     * Runs the attempt. Never throws: every way the attempt can go wrong is reported as a
     * {@link AttemptOutcome.Failed}.
     *
     * @param onNewError called with each diagnostic the first time it is seen
     */
    public AttemptOutcome run(PageDriver driver, ErrorCollector collector, Consumer<PageError> onNewError) {
        this.collector = collector;
        this.onNewError = onNewError;
        long start = System.nanoTime();
        long deadline = start + settings.timeout().toNanos();
        try {
            int status = awaitLoad(driver.navigate(url, settings.waitUntil()), deadline);
            Duration loadTime = Duration.ofNanos(System.nanoTime() - start);
            httpStatus = status == 0 ? null : status;
            if (status >= 500) {
                drain();
                return new AttemptOutcome.Failed(FailureKind.HTTP_ERROR, "HTTP " + status);
            }
            if (consentHandler != null) {
                consentHandler.handle(driver, token, remaining(deadline));
                drain();
            }
            settle(Math.min(System.nanoTime() + settings.settle().toNanos(), deadline));
            drain();
            return new AttemptOutcome.Loaded(status, loadTime);
        } catch (NavigationTimedOutException e) {
            return failed(FailureKind.TIMEOUT, e.getMessage());
        } catch (NavigationException e) {
            return failed(FailureKind.NAVIGATION_ERROR, e.getMessage());
        } catch (CDPClosedException | CDPTimeoutException | UncheckedIOException e) {
            return failed(FailureKind.BROWSER_DISCONNECTED, e.getMessage());
        } catch (CDPException e) {
            return failed(FailureKind.NAVIGATION_ERROR, e.getMessage());
        } catch (CancellationException e) {
            return failed(FailureKind.CANCELLED, "Scan cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(FailureKind.CANCELLED, "Interrupted");
        } finally {
            if (dropped.get() > 0) log.warn("Dropped {} events for {}", dropped.get(), url);
        }
    }

    private AttemptOutcome.Failed failed(FailureKind kind, String message) {
        drain();
        return new AttemptOutcome.Failed(kind, message);
    }

    private int awaitLoad(CompletableFuture<Integer> navigation, long deadline) throws InterruptedException,
            NavigationException {
        while (true) {
            drain();
            if (navigation.isDone()) return statusOf(navigation);
            long now = System.nanoTime();
            checkGrace(now);
            if (now - deadline >= 0) {
                navigation.cancel(false);
                throw new NavigationTimedOutException(url, "Not loaded within " + settings.timeout().toSeconds() + "s");
            }
            PageEvent event = events.poll(Math.min(deadline - now, CancellationToken.SLICE.toNanos()),
                    TimeUnit.NANOSECONDS);
            if (event != null) record(event);
        }
    }

    private static int statusOf(CompletableFuture<Integer> navigation) throws NavigationException,
            InterruptedException {
        try {
            Integer status = navigation.get();
            return status == null ? 0 : status;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NavigationException navigationException) throw navigationException;
            if (cause instanceof RuntimeException runtimeException) throw runtimeException;
            throw new CDPException(0, "Navigation failed: " + cause);
        }
    }

    /**
     * Listens passively until the deadline, or until the cancellation grace period runs out.
     */
    private void settle(long until) throws InterruptedException {
        while (true) {
            drain();
            long now = System.nanoTime();
            if (token.isCancelled()) {
                until = Math.min(until, token.cancelledAtNanos() + settings.cancelGrace().toNanos());
            }
            if (now - until >= 0) return;
            PageEvent event = events.poll(Math.min(until - now, CancellationToken.SLICE.toNanos()),
                    TimeUnit.NANOSECONDS);
            if (event != null) record(event);
        }
    }

    private void checkGrace(long now) {
        if (token.isCancelled() && now - (token.cancelledAtNanos() + settings.cancelGrace().toNanos()) >= 0) {
            throw new CancellationException("Scan cancelled");
        }
    }

    private Duration remaining(long deadline) {
        long nanos = deadline - System.nanoTime();
        return nanos <= 0 ? Duration.ZERO : Duration.ofNanos(nanos);
    }

    private void drain() {
        PageEvent event;
        while ((event = events.poll()) != null) {
            record(event);
        }
    }

    private void record(PageEvent event) {
        PageError error = DiagnosticMapper.map(event);
        if (error == null) return;
        PageError stored = collector.add(error);
        if (stored != null) onNewError.accept(stored);
    }
}
