package com.psl.indexer.run;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-scoped cancellation signal. Cancelled explicitly or once the optional deadline passes; backoff sleeps taken
 * through {@link #sleep(long)} wake up as soon as the run is cancelled.
 */
public class RunCancellation {
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final long deadlineNanos;

    public RunCancellation() {
        this(0);
    }

    public RunCancellation(long timeoutMs) {
        this.deadlineNanos = timeoutMs > 0 ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs) : 0;
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why);
        cancelled.countDown();
    }

    public boolean isCancelled() {
        if (cancelled.getCount() == 0) {
            return true;
        }
        if (deadlineNanos != 0 && System.nanoTime() - deadlineNanos >= 0) {
            cancel("run timeout");
            return true;
        }
        return false;
    }

    public String reason() {
        return reason.get();
    }

    /**
     * Sleeps up to {@code millis}, returning false when the run was cancelled before or during the sleep.
     */
    public boolean sleep(long millis) {
        if (isCancelled()) {
            return false;
        }
        long waitNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, millis));
        if (deadlineNanos != 0) {
            waitNanos = Math.min(waitNanos, Math.max(0, deadlineNanos - System.nanoTime()));
        }
        try {
            if (waitNanos > 0 && cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
                return false;
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancel("interrupted");
            return false;
        }
        return !isCancelled();
    }
}
