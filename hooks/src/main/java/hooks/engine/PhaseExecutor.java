package hooks.engine;

import hooks.alert.HookAlertLogger;
import hooks.apply.ApplyMechanism;
import hooks.apply.SubmitResult;
import hooks.config.HookConfig;
import hooks.phase.Operation;
import hooks.phase.PhaseIdentifier;
import hooks.plan.Hook;
import hooks.plan.HookSet;
import hooks.readiness.ObservedState;
import hooks.readiness.ReadinessEvaluator;
import hooks.readiness.ReadinessState;
import hooks.result.FailureReason;
import hooks.result.HookReport;
import hooks.result.PhaseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the hooks of one phase.
 *
 * <p>Hooks are applied one at a time, never concurrently, in the order of the
 * phase's bucket in the {@link HookSet}. That order is whatever order the manifests
 * were discovered in; callers must not rely on it. For each hook:
 * <ol>
 *   <li>submit the manifest through the {@link ApplyMechanism},</li>
 *   <li>evaluate readiness; kinds that need polling are waited on by
 *       {@link ReadinessPoller}.</li>
 * </ol>
 * The phase stops at the first failed hook; later hooks are not submitted.
 * Resources of hooks already submitted stay in the target system.
 *
 * <p>Hook state lives only for the duration of {@link #run}; nothing is retained
 * between calls.
 */
public final class PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private final ApplyMechanism apply;
    private final ReadinessEvaluator evaluator;
    private final ReadinessPoller poller;
    private final HookConfig config;

    public PhaseExecutor(ApplyMechanism apply, ReadinessEvaluator evaluator, HookConfig config) {
        this.apply = Objects.requireNonNull(apply, "apply");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.config = Objects.requireNonNull(config, "config");
        this.poller = new ReadinessPoller(apply, evaluator, config.readinessTimeout(), config.pollInterval());
    }

    public PhaseExecutor(ApplyMechanism apply, HookConfig config) {
        this(apply, new ReadinessEvaluator(), config);
    }

    public HookConfig config() {
        return config;
    }

    /**
     * Runs a phase without a cancellation signal.
     *
     * @param phase the phase to run
     * @param hooks the assembled hooks
     * @return the phase result
     */
    public PhaseResult run(PhaseIdentifier phase, HookSet hooks) {
        return run(null, phase, hooks, CancellationSignal.none());
    }

    /**
     * Runs a phase.
     *
     * @param phase the phase to run
     * @param hooks the assembled hooks
     * @param cancel signal that aborts a readiness wait
     * @return the phase result
     */
    public PhaseResult run(PhaseIdentifier phase, HookSet hooks, CancellationSignal cancel) {
        return run(null, phase, hooks, cancel);
    }

    PhaseResult run(Operation operation, PhaseIdentifier phase, HookSet hooks, CancellationSignal cancel) {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(hooks, "hooks");
        Objects.requireNonNull(cancel, "cancel");

        List<Hook> bucket = hooks.hooksFor(phase);
        if (bucket.isEmpty()) {
            log.debug("No hooks for {}", phase);
            return PhaseResult.empty(phase);
        }

        HookAlertLogger.phaseStarted(operation, phase, bucket.size());
        long phaseStart = System.nanoTime();
        List<HookReport> reports = new ArrayList<>(bucket.size());

        for (int i = 0; i < bucket.size(); i++) {
            Hook hook = bucket.get(i);
            HookReport report = execute(hook, cancel);
            reports.add(report);

            if (!report.isReady()) {
                if (report.reason() == FailureReason.READINESS_TIMEOUT) {
                    HookAlertLogger.readinessTimeout(phase, hook.name(), config.readinessTimeout().toMillis());
                }
                HookAlertLogger.hookFailed(phase, report);
                PhaseResult result = new PhaseResult(phase, reports, bucket.size() - i - 1,
                        ReadinessPoller.elapsedMs(phaseStart));
                HookAlertLogger.phaseAborted(operation, result);
                return result;
            }
            HookAlertLogger.hookReady(phase, report);
        }

        PhaseResult result = new PhaseResult(phase, reports, 0, ReadinessPoller.elapsedMs(phaseStart));
        HookAlertLogger.phaseCompleted(operation, result);
        return result;
    }

    private HookReport execute(Hook hook, CancellationSignal cancel) {
        long start = System.nanoTime();
        log.debug("Submitting hook {} from {}", hook.name(), hook.source());

        SubmitResult submitted;
        try {
            submitted = apply.submit(hook.manifest());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HookReport.failed(hook, FailureReason.CANCELLED, "submission interrupted", e,
                    ReadinessPoller.elapsedMs(start));
        } catch (Exception e) {
            return HookReport.failed(hook, FailureReason.SUBMISSION_FAILED, e.getMessage(), e,
                    ReadinessPoller.elapsedMs(start));
        }

        if (submitted == null || !submitted.accepted()) {
            String error = submitted != null && submitted.error() != null ? submitted.error() : "rejected";
            return HookReport.failed(hook, FailureReason.SUBMISSION_FAILED, error, null,
                    ReadinessPoller.elapsedMs(start));
        }

        ReadinessState state = evaluator.evaluate(hook.kind(), ObservedState.accepted());
        if (state == ReadinessState.READY) {
            return HookReport.ready(hook, ReadinessPoller.elapsedMs(start));
        }
        if (state == ReadinessState.FAILED) {
            return HookReport.failed(hook, FailureReason.HOOK_FAILED, "failed on acceptance", null,
                    ReadinessPoller.elapsedMs(start));
        }
        return poller.await(hook, submitted.handle(), cancel, start);
    }
}
