package org.netpreserve.consolescan;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {
    private final CancellationToken token = new CancellationToken();

    @Test
    void sleepRunsToTheEndUnlessCancelled() throws Exception {
        assertTrue(token.sleep(Duration.ofMillis(20)));
        token.cancel();
        long start = System.nanoTime();
        assertFalse(token.sleep(Duration.ofSeconds(30)));
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
    }

    @Test
    void cancellingWakesAWaitingSleeper() throws Exception {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        try {
            executor.schedule(token::cancel, 100, TimeUnit.MILLISECONDS);
            assertFalse(token.sleep(Duration.ofSeconds(30)));
            assertTrue(token.isCancelled());
            assertTrue(token.cancelledAtNanos() != 0);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void acquireGivesUpOnceCancelled() throws Exception {
        var semaphore = new Semaphore(1);
        token.acquire(semaphore);
        assertEquals(0, semaphore.availablePermits());

        token.cancel();
        assertThrows(CancellationException.class, () -> token.acquire(semaphore));
        semaphore.release();
        assertThrows(CancellationException.class, () -> token.acquire(semaphore));
        assertEquals(1, semaphore.availablePermits(), "permit handed back");
    }

    @Test
    void awaitReturnsTheValueOrTimesOut() throws Exception {
        assertEquals("done", token.await(CompletableFuture.completedFuture("done"), Duration.ofSeconds(1)));
        assertThrows(TimeoutException.class, () -> token.await(new CompletableFuture<String>(),
                Duration.ofMillis(250)));
        token.cancel();
        assertThrows(CancellationException.class, () -> token.await(new CompletableFuture<String>(),
                Duration.ofSeconds(30)));
    }
}
