package hooks.readiness;

import hooks.readiness.ObservedState.Condition;

import java.util.Objects;

/**
 * Decides whether a hook resource is ready, given what the target system reports.
 *
 * <p>A rejected submission is {@link ReadinessState#FAILED} for every kind.
 * Otherwise the decision is delegated to the {@link ResourceKind}.
 */
public final class ReadinessEvaluator {

    /**
     * Evaluates readiness.
     *
     * @param kind the hook's resource kind
     * @param observed the latest observed state
     * @return the readiness state
     */
    public ReadinessState evaluate(ResourceKind kind, ObservedState observed) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(observed, "observed");

        if (observed.condition() == Condition.REJECTED) {
            return ReadinessState.FAILED;
        }
        return kind.readinessOf(observed.condition());
    }
}
