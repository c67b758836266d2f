package hooks.exceptions;

import java.time.Duration;

/**
 * Exception recorded when a run-to-completion hook does not reach a terminal
 * state within its readiness timeout.
 *
 * <p>The hook is treated as failed and its phase aborts. The exception is attached
 * as the cause of the failed {@link hooks.result.HookReport}.
 *
 * @see hooks.engine.ReadinessPoller
 */
public class ReadinessTimeoutException extends RuntimeException {

    private final String hookName;
    private final Duration timeout;

    /**
     * Creates a new timeout exception.
     *
     * @param hookName the hook that timed out
     * @param timeout the configured timeout that was exceeded
     */
    public ReadinessTimeoutException(String hookName, Duration timeout) {
        super(formatMessage(hookName, timeout));
        this.hookName = hookName;
        this.timeout = timeout;
    }

    /** Returns the hook that timed out. */
    public String getHookName() {
        return hookName;
    }

    /** Returns the configured timeout that was exceeded. */
    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String hookName, Duration timeout) {
        return String.format("Hook '%s' not ready after %d ms", hookName, timeout.toMillis());
    }
}
