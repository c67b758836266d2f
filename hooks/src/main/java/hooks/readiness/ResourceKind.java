package hooks.readiness;

import hooks.readiness.ObservedState.Condition;

import java.util.function.Function;

/**
 * Readiness behaviour per resource kind.
 *
 * <p>A closed set: {@link #JOB} is the run-to-completion kind and must be polled
 * until it succeeds or fails; every other kind maps to {@link #OTHER} and is ready
 * as soon as the apply call is accepted. Supporting another kind means adding a
 * constant with its own predicate.
 */
public enum ResourceKind {

    /** Run-to-completion workload. */
    JOB("Job", true, condition -> {
        switch (condition) {
            case SUCCEEDED:
                return ReadinessState.READY;
            case FAILED:
            case REJECTED:
                return ReadinessState.FAILED;
            default:
                return ReadinessState.PENDING;
        }
    }),

    /** Any kind without a completion state. */
    OTHER(null, false, condition ->
            condition == Condition.REJECTED || condition == Condition.FAILED
                    ? ReadinessState.FAILED
                    : ReadinessState.READY);

    private final String kindName;
    private final boolean polled;
    private final Function<Condition, ReadinessState> predicate;

    ResourceKind(String kindName, boolean polled, Function<Condition, ReadinessState> predicate) {
        this.kindName = kindName;
        this.polled = polled;
        this.predicate = predicate;
    }

    /**
     * Maps a manifest kind to its readiness behaviour.
     *
     * @param kind the manifest's {@code kind} field
     * @return the matching constant, or {@link #OTHER}
     */
    public static ResourceKind of(String kind) {
        for (ResourceKind k : values()) {
            if (k.kindName != null && k.kindName.equals(kind)) {
                return k;
            }
        }
        return OTHER;
    }

    /** True if readiness requires polling after submission. */
    public boolean requiresPolling() {
        return polled;
    }

    ReadinessState readinessOf(Condition condition) {
        return predicate.apply(condition);
    }
}
