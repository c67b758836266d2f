package hooks.result;

/**
 * Why a hook, phase or operation failed.
 */
public enum FailureReason {
    /** A hook annotation named a phase outside the closed set (strict policy only). */
    UNRECOGNIZED_PHASE,
    /** The apply mechanism rejected a hook resource. */
    SUBMISSION_FAILED,
    /** A run-to-completion hook did not finish before its deadline. */
    READINESS_TIMEOUT,
    /** A run-to-completion hook finished unsuccessfully, or its state could not be read. */
    HOOK_FAILED,
    /** Readiness polling was cancelled or the thread was interrupted. */
    CANCELLED,
    /** The caller's main step threw. */
    MAIN_STEP_FAILED
}
