package hooks.engine;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag shared between the caller and a running operation.
 *
 * <p>Cancelling wakes any readiness poll that is waiting between two polls; the
 * hook being polled fails with {@link hooks.result.FailureReason#CANCELLED} and
 * its phase aborts.
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    /** A signal for callers that never cancel. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits until cancelled or the duration elapses.
     *
     * @param duration how long to wait
     * @return true if cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean await(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        return latch.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }
}
