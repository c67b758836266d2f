package hooks.result;

import hooks.exceptions.HookException;
import hooks.phase.Operation;
import hooks.phase.PhaseIdentifier;

import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of a whole release operation.
 *
 * <p>On failure the result names the phase and hook that caused it. Failures
 * outside a phase (hook assembly, the caller's main step) leave
 * {@link #failedPhase()} null.
 *
 * @see hooks.engine.LifecycleCoordinator
 */
public final class OperationResult {

    private final Operation operation;
    private final boolean success;
    private final List<PhaseResult> phases;
    private final PhaseIdentifier failedPhase;
    private final String failedHook;
    private final FailureReason reason;
    private final String message;
    private final Throwable cause;
    private final long durationMs;

    private OperationResult(Operation operation,
                            boolean success,
                            List<PhaseResult> phases,
                            PhaseIdentifier failedPhase,
                            String failedHook,
                            FailureReason reason,
                            String message,
                            Throwable cause,
                            long durationMs) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.success = success;
        this.phases = List.copyOf(phases);
        this.failedPhase = failedPhase;
        this.failedHook = failedHook;
        this.reason = reason;
        this.message = message;
        this.cause = cause;
        this.durationMs = durationMs;
    }

    public static OperationResult success(Operation operation, List<PhaseResult> phases, long durationMs) {
        return new OperationResult(operation, true, phases, null, null, null, null, null, durationMs);
    }

    /**
     * Failure caused by a phase.
     *
     * @param operation the operation
     * @param phases phase results so far, the failed phase last
     * @param failed the failed phase
     * @param durationMs operation duration
     * @return a failed result
     */
    public static OperationResult phaseFailed(Operation operation, List<PhaseResult> phases,
                                              PhaseResult failed, long durationMs) {
        HookReport hook = failed.failedHook();
        return new OperationResult(operation, false, phases, failed.phase(),
                hook != null ? hook.name() : null,
                hook != null ? hook.reason() : null,
                hook != null ? hook.message() : "phase failed",
                hook != null ? hook.error() : null,
                durationMs);
    }

    /**
     * Failure outside any phase.
     *
     * @param operation the operation
     * @param phases phase results so far
     * @param reason the failure reason
     * @param hook the offending manifest, if any
     * @param message failure message
     * @param cause underlying exception, may be null
     * @param durationMs operation duration
     * @return a failed result
     */
    public static OperationResult failed(Operation operation, List<PhaseResult> phases, FailureReason reason,
                                         String hook, String message, Throwable cause, long durationMs) {
        return new OperationResult(operation, false, phases, null, hook, reason, message, cause, durationMs);
    }

    public Operation operation() { return operation; }

    public boolean success() { return success; }

    /** Results of the phases that ran, in order. */
    public List<PhaseResult> phases() { return phases; }

    /** The phase that failed, or null. */
    public PhaseIdentifier failedPhase() { return failedPhase; }

    /** The hook that failed, or null. */
    public String failedHook() { return failedHook; }

    public FailureReason reason() { return reason; }

    public String message() { return message; }

    public Throwable cause() { return cause; }

    public long durationMs() { return durationMs; }

    /**
     * Returns this result if successful, otherwise throws.
     *
     * @return this result
     * @throws HookException describing operation, phase and hook of the failure
     */
    public OperationResult orThrow() throws HookException {
        if (success) return this;
        throw new HookException(message != null ? message : "Release operation failed",
                operation, failedPhase, failedHook, reason, cause);
    }

    @Override
    public String toString() {
        return "OperationResult{" +
                "operation=" + operation.displayName() +
                ", success=" + success +
                (failedPhase != null ? ", failedPhase=" + failedPhase : "") +
                (failedHook != null ? ", failedHook=" + failedHook : "") +
                (reason != null ? ", reason=" + reason : "") +
                ", durationMs=" + durationMs +
                '}';
    }
}
