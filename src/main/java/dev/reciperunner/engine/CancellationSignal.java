package dev.reciperunner.engine;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag for a single run. Waiting on it doubles as the
 * retry backoff sleep, so a cancel request cuts the sleep short.
 */
final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    void cancel() {
        latch.countDown();
    }

    boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Sleep for {@code delay} unless cancelled first.
     *
     * @return true if the run was cancelled before or during the wait
     */
    boolean awaitCancellation(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return isCancelled();
        }
        return latch.await(delay.toNanos(), TimeUnit.NANOSECONDS);
    }
}
