package quest.gekko.streamstats.util;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Spaces the starts of consecutive calls at least {@code minInterval} apart. Single fair permit:
 * one call at a time, in arrival order.
 */
public class RateLimiter {
    private final Semaphore sem = new Semaphore(1, true);
    private final long minIntervalNanos;
    private long lastCallNanos;
    private boolean called;

    public RateLimiter(Duration minInterval) {
        this.minIntervalNanos = minInterval == null ? 0L : Math.max(0L, minInterval.toNanos());
    }

    public <T> T call(Callable<T> c) {
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limiter", e);
        }
        try {
            awaitSlot();
            lastCallNanos = System.nanoTime();
            called = true;
            return c.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        } finally {
            sem.release();
        }
    }

    private void awaitSlot() throws InterruptedException {
        if (!called) return;
        long waitNanos = lastCallNanos + minIntervalNanos - System.nanoTime();
        if (waitNanos > 0) {
            Thread.sleep(waitNanos / 1_000_000L, (int) (waitNanos % 1_000_000L));
        }
    }
}
