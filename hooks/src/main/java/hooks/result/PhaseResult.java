package hooks.result;

import hooks.phase.PhaseIdentifier;

import java.util.List;
import java.util.Objects;

/**
 * Immutable result of running all hooks of one phase.
 *
 * <p>A phase succeeds only if every hook reached {@link hooks.readiness.ReadinessState#READY}.
 * On failure, {@link #failedHook()} is the first hook that failed and
 * {@link #skipped()} counts the hooks that were never submitted.
 *
 * @see hooks.engine.PhaseExecutor
 */
public final class PhaseResult {

    private final PhaseIdentifier phase;
    private final List<HookReport> reports;
    private final int skipped;
    private final long durationMs;

    public PhaseResult(PhaseIdentifier phase, List<HookReport> reports, int skipped, long durationMs) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.reports = List.copyOf(reports);
        this.skipped = skipped;
        this.durationMs = durationMs;
    }

    /**
     * Result of a phase with no hooks.
     *
     * @param phase the phase
     * @return a successful, empty result
     */
    public static PhaseResult empty(PhaseIdentifier phase) {
        return new PhaseResult(phase, List.of(), 0, 0L);
    }

    public PhaseIdentifier phase() { return phase; }

    /** Reports of every submitted hook, in execution order. */
    public List<HookReport> reports() { return reports; }

    /** Number of hooks not submitted because an earlier hook failed. */
    public int skipped() { return skipped; }

    public long durationMs() { return durationMs; }

    /** True if every hook of the phase is ready. */
    public boolean success() {
        return reports.stream().allMatch(HookReport::isReady);
    }

    /** True if a hook failed and the remaining hooks were skipped. */
    public boolean aborted() {
        return !success();
    }

    /** The first failed hook, or null on success. */
    public HookReport failedHook() {
        return reports.stream().filter(r -> !r.isReady()).findFirst().orElse(null);
    }

    /** The failure reason of the first failed hook, or null on success. */
    public FailureReason failureReason() {
        HookReport failed = failedHook();
        return failed != null ? failed.reason() : null;
    }

    @Override
    public String toString() {
        HookReport failed = failedHook();
        return "PhaseResult{" +
                "phase=" + phase +
                ", hooks=" + reports.size() +
                ", success=" + (failed == null) +
                (failed != null ? ", failedHook=" + failed.name() + ", reason=" + failed.reason() : "") +
                ", skipped=" + skipped +
                ", durationMs=" + durationMs +
                '}';
    }
}
