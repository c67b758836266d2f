package hooks.engine;

import hooks.apply.ApplyMechanism;
import hooks.apply.ResourceHandle;
import hooks.config.HookConfig;
import hooks.exceptions.ReadinessTimeoutException;
import hooks.plan.Hook;
import hooks.readiness.ObservedState;
import hooks.readiness.ReadinessEvaluator;
import hooks.readiness.ReadinessState;
import hooks.result.FailureReason;
import hooks.result.HookReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Blocks until a submitted run-to-completion hook reaches a terminal state.
 *
 * <p>The resource is polled, evaluated, and polled again after the configured
 * interval. The loop ends when:
 * <ul>
 *   <li>the hook is ready or failed,</li>
 *   <li>the readiness timeout elapses ({@link FailureReason#READINESS_TIMEOUT}),</li>
 *   <li>the {@link CancellationSignal} fires or the thread is interrupted
 *       ({@link FailureReason#CANCELLED}; the interrupt flag is restored).</li>
 * </ul>
 * Every poll is evaluated before the deadline is checked, so a hook that turns
 * terminal on the last poll is not reported as timed out.
 */
final class ReadinessPoller {

    private static final Logger log = LoggerFactory.getLogger(ReadinessPoller.class);

    private final ApplyMechanism apply;
    private final ReadinessEvaluator evaluator;
    private final Duration timeout;
    private final Duration interval;

    ReadinessPoller(ApplyMechanism apply, ReadinessEvaluator evaluator, Duration timeout, Duration interval) {
        this.apply = Objects.requireNonNull(apply, "apply");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.timeout = timeout;
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    /**
     * Polls until the hook is terminal.
     *
     * @param hook the submitted hook
     * @param handle its handle
     * @param cancel cancellation signal
     * @param startNanos {@link System#nanoTime()} at submission
     * @return the hook's terminal report
     */
    HookReport await(Hook hook, ResourceHandle handle, CancellationSignal cancel, long startNanos) {
        boolean bounded = HookConfig.isEnabled(timeout);
        long timeoutNanos = bounded ? saturatedNanos(timeout) : Long.MAX_VALUE;
        long intervalNanos = saturatedNanos(interval);
        int polls = 0;

        while (true) {
            if (cancel.isCancelled() || Thread.currentThread().isInterrupted()) {
                return cancelled(hook, startNanos);
            }

            ObservedState observed;
            try {
                observed = apply.poll(handle);
                polls++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(hook, startNanos);
            } catch (Exception e) {
                return HookReport.failed(hook, FailureReason.HOOK_FAILED,
                        "status poll failed: " + e.getMessage(), e, elapsedMs(startNanos));
            }
            if (observed == null) {
                observed = ObservedState.of(ObservedState.Condition.UNKNOWN);
            }

            ReadinessState state = evaluator.evaluate(hook.kind(), observed);
            if (state == ReadinessState.READY) {
                log.debug("{} ready after {} polls", hook.name(), polls);
                return HookReport.ready(hook, elapsedMs(startNanos));
            }
            if (state == ReadinessState.FAILED) {
                String message = observed.message() != null ? observed.message() : "reported " + observed.condition();
                return HookReport.failed(hook, FailureReason.HOOK_FAILED, message, null, elapsedMs(startNanos));
            }

            long remaining = timeoutNanos - (System.nanoTime() - startNanos);
            if (bounded && remaining <= 0) {
                ReadinessTimeoutException e = new ReadinessTimeoutException(hook.name(), timeout);
                return HookReport.failed(hook, FailureReason.READINESS_TIMEOUT, e.getMessage(), e, elapsedMs(startNanos));
            }

            Duration pause = Duration.ofNanos(bounded ? Math.min(remaining, intervalNanos) : intervalNanos);
            try {
                if (cancel.await(pause)) {
                    return cancelled(hook, startNanos);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(hook, startNanos);
            }
        }
    }

    private static HookReport cancelled(Hook hook, long startNanos) {
        return HookReport.failed(hook, FailureReason.CANCELLED, "readiness wait cancelled", null, elapsedMs(startNanos));
    }

    // durations beyond ~292 years do not fit in nanos
    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
