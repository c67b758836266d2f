package hooks.readiness;

import java.util.Objects;

/**
 * What the target system reports about a submitted resource.
 *
 * @param condition the reported condition
 * @param message optional detail, e.g. a failure reason from the target system
 */
public record ObservedState(Condition condition, String message) {

    /**
     * Conditions a resource can be observed in.
     */
    public enum Condition {
        /** The create/update call succeeded; nothing more is known yet. */
        ACCEPTED,
        /** A run-to-completion workload is still running. */
        ACTIVE,
        /** A run-to-completion workload finished successfully. */
        SUCCEEDED,
        /** A run-to-completion workload finished unsuccessfully. */
        FAILED,
        /** The target system refused the resource. */
        REJECTED,
        /** The target system gave no usable status. */
        UNKNOWN
    }

    public ObservedState {
        Objects.requireNonNull(condition, "condition");
    }

    public static ObservedState of(Condition condition) {
        return new ObservedState(condition, null);
    }

    public static ObservedState accepted() {
        return of(Condition.ACCEPTED);
    }

    public static ObservedState active() {
        return of(Condition.ACTIVE);
    }

    public static ObservedState succeeded() {
        return of(Condition.SUCCEEDED);
    }

    public static ObservedState failed(String message) {
        return new ObservedState(Condition.FAILED, message);
    }

    public static ObservedState rejected(String message) {
        return new ObservedState(Condition.REJECTED, message);
    }
}
