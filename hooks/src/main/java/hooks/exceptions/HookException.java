package hooks.exceptions;

import hooks.phase.Operation;
import hooks.phase.PhaseIdentifier;
import hooks.result.FailureReason;

/**
 * Exception thrown when a release operation fails because of its hooks.
 *
 * <p>This exception carries diagnostic context:
 * <ul>
 *   <li>The operation being performed</li>
 *   <li>The phase in which the failure occurred</li>
 *   <li>The hook (manifest name) that failed</li>
 *   <li>The failure reason</li>
 * </ul>
 *
 * <p>Any of the context fields may be null when the failure happened outside a
 * phase, for example while assembling hooks or in the caller's main step.
 *
 * @see hooks.result.OperationResult#orThrow()
 */
public class HookException extends Exception {

    private final Operation operation;
    private final PhaseIdentifier phase;
    private final String hookName;
    private final FailureReason reason;

    // ---------------- constructors ----------------

    /**
     * Creates a new hook exception with a message.
     *
     * @param message the error message
     */
    public HookException(String message) {
        this(message, null, null, null, null, null);
    }

    /**
     * Creates a new hook exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public HookException(String message, Throwable cause) {
        this(message, null, null, null, null, cause);
    }

    /**
     * Creates a new hook exception with full diagnostic context.
     *
     * @param message the error message
     * @param operation the operation being performed (may be null)
     * @param phase the phase where the failure occurred (may be null)
     * @param hookName the failing hook (may be null)
     * @param reason the failure reason (may be null)
     * @param cause the underlying cause (may be null)
     */
    public HookException(String message,
                         Operation operation,
                         PhaseIdentifier phase,
                         String hookName,
                         FailureReason reason,
                         Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.phase = phase;
        this.hookName = hookName;
        this.reason = reason;
    }

    // ---------------- getters ----------------

    /** Returns the operation, or null if not set. */
    public Operation getOperation() {
        return operation;
    }

    /** Returns the phase where the failure occurred, or null if not set. */
    public PhaseIdentifier getPhase() {
        return phase;
    }

    /** Returns the name of the failing hook, or null if not set. */
    public String getHookName() {
        return hookName;
    }

    /** Returns the failure reason, or null if not set. */
    public FailureReason getReason() {
        return reason;
    }

    // ---------------- diagnostics ----------------

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));

        if (operation != null) sb.append(" [operation=").append(operation.displayName()).append("]");
        if (phase != null) sb.append(" [phase=").append(phase.wireName()).append("]");
        if (hookName != null) sb.append(" [hook=").append(hookName).append("]");
        if (reason != null) sb.append(" [reason=").append(reason).append("]");

        return sb.toString();
    }
}
