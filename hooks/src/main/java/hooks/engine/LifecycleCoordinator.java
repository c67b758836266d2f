package hooks.engine;

import hooks.alert.HookAlertLogger;
import hooks.apply.ApplyMechanism;
import hooks.config.HookConfig;
import hooks.config.HookConfigLoader;
import hooks.exceptions.UnrecognizedPhaseException;
import hooks.manifest.AnnotationExtractor;
import hooks.manifest.Manifest;
import hooks.phase.Operation;
import hooks.phase.PhaseIdentifier;
import hooks.phase.PhasePair;
import hooks.phase.PhaseRegistry;
import hooks.plan.HookSet;
import hooks.result.FailureReason;
import hooks.result.OperationResult;
import hooks.result.PhaseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives a release operation through its hook phases.
 *
 * <p>Every operation runs as:
 * <pre>
 * pre-phase hooks -&gt; main step -&gt; post-phase hooks
 * </pre>
 * A failed pre-phase skips the main step and the post-phase. A failed main step
 * skips the post-phase. Nothing is retried and nothing already applied is
 * cleaned up.
 *
 * <p>One coordinator may be reused, but operations on the same release must be
 * serialized by the caller.
 *
 * <h2>Usage:</h2>
 * <pre>
 * LifecycleCoordinator coordinator = LifecycleCoordinator.create(applyMechanism);
 * OperationResult result = coordinator.perform(Operation.INSTALL, manifests,
 *         resources -&gt; tracker.apply(resources));
 * result.orThrow();
 * </pre>
 *
 * @see PhaseExecutor
 * @see PhaseRegistry
 */
public final class LifecycleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LifecycleCoordinator.class);

    /**
     * Runs one phase's hooks.
     */
    @FunctionalInterface
    public interface PhaseStep {
        PhaseResult run(PhaseIdentifier phase);
    }

    /**
     * The caller's non-hook step, e.g. applying or removing release resources.
     */
    @FunctionalInterface
    public interface MainStep {
        void run() throws Exception;
    }

    /**
     * The caller's non-hook step, receiving the release's ordinary resources.
     */
    @FunctionalInterface
    public interface ReleaseStep {
        void apply(List<Manifest> releaseResources) throws Exception;
    }

    private final PhaseExecutor executor;
    private final AnnotationExtractor extractor;

    public LifecycleCoordinator(PhaseExecutor executor, AnnotationExtractor extractor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /**
     * Creates a coordinator from configuration and applies its alert level.
     *
     * @param apply the apply mechanism
     * @param config the hook configuration
     * @return a new coordinator
     */
    public static LifecycleCoordinator create(ApplyMechanism apply, HookConfig config) {
        HookAlertLogger.setAlertLevel(config.alertLevel());
        log.debug("Applied config: {}", config);
        return new LifecycleCoordinator(new PhaseExecutor(apply, config), AnnotationExtractor.fromConfig(config));
    }

    /**
     * Creates a coordinator with configuration loaded from the classpath.
     *
     * @param apply the apply mechanism
     * @return a new coordinator
     * @see HookConfigLoader#load()
     */
    public static LifecycleCoordinator create(ApplyMechanism apply) {
        return create(apply, HookConfigLoader.load());
    }

    /**
     * Performs an operation on rendered manifests.
     *
     * @param operation the release operation
     * @param manifests flattened manifests of the package and all sub-packages
     * @param step receives the non-hook manifests between the two phases
     * @return the operation result
     */
    public OperationResult perform(Operation operation, List<Manifest> manifests, ReleaseStep step) {
        return perform(operation, manifests, step, CancellationSignal.none());
    }

    /**
     * Performs an operation on rendered manifests.
     *
     * @param operation the release operation
     * @param manifests flattened manifests of the package and all sub-packages
     * @param step receives the non-hook manifests between the two phases
     * @param cancel aborts a readiness wait in either phase
     * @return the operation result
     */
    public OperationResult perform(Operation operation, List<Manifest> manifests,
                                   ReleaseStep step, CancellationSignal cancel) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(cancel, "cancel");
        PhaseRegistry.phasesFor(operation);

        HookSet hooks;
        try {
            hooks = HookSet.assemble(manifests, extractor);
        } catch (UnrecognizedPhaseException e) {
            HookAlertLogger.operationStarted(operation);
            OperationResult result = OperationResult.failed(operation, List.of(),
                    FailureReason.UNRECOGNIZED_PHASE, e.getManifest(),
                    "Unrecognized hook phase '" + e.getValue() + "'", e, 0L);
            HookAlertLogger.operationFailed(result);
            return result;
        }

        return perform(operation,
                phase -> executor.run(operation, phase, hooks, cancel),
                () -> step.apply(hooks.releaseResources()),
                phase -> executor.run(operation, phase, hooks, cancel));
    }

    /**
     * Performs an operation with caller-supplied phase and main steps.
     *
     * @param operation the release operation
     * @param pre runs the pre-phase
     * @param main the non-hook step
     * @param post runs the post-phase
     * @return the operation result
     * @throws hooks.exceptions.UnknownOperationException if the operation has no phases
     */
    public OperationResult perform(Operation operation, PhaseStep pre, MainStep main, PhaseStep post) {
        PhasePair phases = PhaseRegistry.phasesFor(operation);
        Objects.requireNonNull(pre, "pre");
        Objects.requireNonNull(main, "main");
        Objects.requireNonNull(post, "post");

        HookAlertLogger.operationStarted(operation);
        long start = System.nanoTime();
        List<PhaseResult> results = new ArrayList<>(2);

        PhaseResult preResult = Objects.requireNonNull(pre.run(phases.pre()), "pre-phase result");
        results.add(preResult);
        if (!preResult.success()) {
            return fail(OperationResult.phaseFailed(operation, results, preResult, ReadinessPoller.elapsedMs(start)));
        }

        try {
            main.run();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.debug("Main step of {} failed", operation.displayName(), e);
            return fail(OperationResult.failed(operation, results, FailureReason.MAIN_STEP_FAILED,
                    null, e.getMessage() != null ? e.getMessage() : e.toString(), e, ReadinessPoller.elapsedMs(start)));
        }

        PhaseResult postResult = Objects.requireNonNull(post.run(phases.post()), "post-phase result");
        results.add(postResult);
        if (!postResult.success()) {
            return fail(OperationResult.phaseFailed(operation, results, postResult, ReadinessPoller.elapsedMs(start)));
        }

        OperationResult result = OperationResult.success(operation, results, ReadinessPoller.elapsedMs(start));
        HookAlertLogger.operationCompleted(result);
        return result;
    }

    private static OperationResult fail(OperationResult result) {
        HookAlertLogger.operationFailed(result);
        return result;
    }
}
