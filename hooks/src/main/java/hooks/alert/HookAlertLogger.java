package hooks.alert;

import hooks.config.AlertLevel;
import hooks.phase.Operation;
import hooks.phase.PhaseIdentifier;
import hooks.result.HookReport;
import hooks.result.OperationResult;
import hooks.result.PhaseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for hook lifecycle events.
 *
 * <p>Entries use markers like OPERATION_STARTED, HOOK_FAILED, PHASE_ABORTED with
 * key=value pairs so log aggregators can parse and alert on them.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs aborted phases and errors</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  release.hooks - OPERATION_STARTED operation=install
 * 12:00:00.010 INFO  release.hooks - PHASE_STARTED operation=install phase=pre-install hooks=2
 * 12:00:03.400 INFO  release.hooks - HOOK_READY phase=pre-install hook=Job/db-init duration_ms=3390
 * 12:00:03.900 ERROR release.hooks - HOOK_FAILED phase=pre-install hook=Job/seed reason=HOOK_FAILED error="BackoffLimitExceeded"
 * 12:00:03.900 WARN  release.hooks - PHASE_ABORTED operation=install phase=pre-install failed_hook=Job/seed skipped=0
 * </pre>
 */
public final class HookAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("release.hooks");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private HookAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level, null resets to WARNING
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void operationStarted(Operation operation) {
        if (shouldLogInfo()) {
            log.info("OPERATION_STARTED operation={}", operation.displayName());
        }
    }

    public static void phaseStarted(Operation operation, PhaseIdentifier phase, int hooks) {
        if (shouldLogInfo()) {
            log.info("PHASE_STARTED operation={} phase={} hooks={}",
                    operation != null ? operation.displayName() : "none", phase.wireName(), hooks);
        }
    }

    public static void hookReady(PhaseIdentifier phase, HookReport report) {
        if (shouldLogInfo()) {
            log.info("HOOK_READY phase={} hook={} duration_ms={}", phase.wireName(), report.name(), report.durationMs());
        }
    }

    /**
     * Log a failed hook. Always logged.
     *
     * @param phase the phase
     * @param report the failed hook's report
     */
    public static void hookFailed(PhaseIdentifier phase, HookReport report) {
        log.error("HOOK_FAILED phase={} hook={} reason={} error=\"{}\"",
                phase.wireName(), report.name(), report.reason(), report.message());
    }

    /**
     * Log a readiness timeout. Always logged.
     *
     * @param phase the phase
     * @param hook the hook name
     * @param timeoutMs the configured timeout
     */
    public static void readinessTimeout(PhaseIdentifier phase, String hook, long timeoutMs) {
        log.error("READINESS_TIMEOUT phase={} hook={} timeout_ms={}", phase.wireName(), hook, timeoutMs);
    }

    public static void phaseCompleted(Operation operation, PhaseResult result) {
        if (shouldLogInfo()) {
            log.info("PHASE_COMPLETED operation={} phase={} hooks={} duration_ms={}",
                    operation != null ? operation.displayName() : "none",
                    result.phase().wireName(), result.reports().size(), result.durationMs());
        }
    }

    public static void phaseAborted(Operation operation, PhaseResult result) {
        if (shouldLogWarn()) {
            HookReport failed = result.failedHook();
            log.warn("PHASE_ABORTED operation={} phase={} failed_hook={} skipped={}",
                    operation != null ? operation.displayName() : "none",
                    result.phase().wireName(),
                    failed != null ? failed.name() : "none",
                    result.skipped());
        }
    }

    public static void operationCompleted(OperationResult result) {
        if (shouldLogInfo()) {
            log.info("OPERATION_COMPLETED operation={} phases={} duration_ms={}",
                    result.operation().displayName(), result.phases().size(), result.durationMs());
        }
    }

    /**
     * Log a failed operation. Always logged.
     *
     * @param result the failed result
     */
    public static void operationFailed(OperationResult result) {
        log.error("OPERATION_FAILED operation={} phase={} hook={} reason={} error=\"{}\" duration_ms={}",
                result.operation().displayName(),
                result.failedPhase() != null ? result.failedPhase().wireName() : "none",
                result.failedHook() != null ? result.failedHook() : "none",
                result.reason(),
                result.message(),
                result.durationMs());
    }
}
