package org.netpreserve.consolescan;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared flag that stops a scan. Every wait in the scanner goes through here so it wakes up promptly (within
 * {@link #SLICE}) once the scan is cancelled.
 */
public class CancellationToken {
    static final Duration SLICE = Duration.ofMillis(100);
    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile long cancelledAtNanos;

    public void cancel() {
        if (latch.getCount() == 0) return;
        cancelledAtNanos = System.nanoTime();
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * {@link System#nanoTime()} when {@link #cancel()} was first called.
     */
    public long cancelledAtNanos() {
        return cancelledAtNanos;
    }

    public void throwIfCancelled() {
        if (isCancelled()) throw new CancellationException("Scan cancelled");
    }

    /**
     * Sleeps unless cancelled first.
     *
     * @return true if the full duration elapsed, false if cancelled
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) return !isCancelled();
        return !latch.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Takes a permit, giving up if the scan is cancelled.
     *
     * @throws CancellationException if cancelled before a permit became available
     */
    public void acquire(Semaphore semaphore) throws InterruptedException {
        while (!semaphore.tryAcquire(SLICE.toMillis(), TimeUnit.MILLISECONDS)) {
            throwIfCancelled();
        }
        if (isCancelled()) {
            semaphore.release();
            throwIfCancelled();
        }
    }

    /**
     * Waits for a future, checking for cancellation between slices.
     *
     * @throws CancellationException if cancelled first (the future is left running)
     */
    public <T> T await(Future<T> future, Duration timeout) throws InterruptedException, ExecutionException,
            TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            throwIfCancelled();
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) throw new TimeoutException("Timed out after " + timeout.toMillis() + "ms");
            try {
                return future.get(Math.min(remaining, SLICE.toNanos()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                // next slice
            }
        }
    }
}
