package com.example.clipper.service.polling;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop signal for a poll loop. A poller waiting in {@link #await(Duration)} wakes up as soon as
 * {@link #cancel()} is called.
 */
public final class PollCancellation {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code duration} for cancellation. Thread interruption counts as cancellation and
     * leaves the interrupt flag set.
     *
     * @return true when cancelled.
     */
    public boolean await(Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            return isCancelled();
        }
        try {
            return latch.await(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }
}
