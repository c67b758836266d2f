package hooks.result;

import hooks.plan.Hook;
import hooks.readiness.ReadinessState;

/**
 * Immutable outcome of applying a single hook.
 *
 * <p>Use {@link #ready(Hook, long)} and
 * {@link #failed(Hook, FailureReason, String, Throwable, long)} to create instances.
 *
 * @param name {@code Kind/name} of the hook
 * @param source template path of the hook
 * @param state terminal readiness state
 * @param reason failure reason, null when ready
 * @param message failure message, null when ready
 * @param error exception behind the failure, may be null
 * @param durationMs time from submission to terminal state
 */
public record HookReport(
        String name,
        String source,
        ReadinessState state,
        FailureReason reason,
        String message,
        Throwable error,
        long durationMs
) {
    public static HookReport ready(Hook hook, long durationMs) {
        return new HookReport(hook.name(), hook.source(), ReadinessState.READY, null, null, null, durationMs);
    }

    public static HookReport failed(Hook hook, FailureReason reason, String message, Throwable error, long durationMs) {
        return new HookReport(hook.name(), hook.source(), ReadinessState.FAILED, reason, message, error, durationMs);
    }

    public boolean isReady() {
        return state == ReadinessState.READY;
    }
}
