package hooks.config;

/**
 * Alert level for hook lifecycle logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link hooks.alert.HookAlertLogger}. Configured via the
 * {@code hooks.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - every event: operation and phase transitions, each hook</li>
 *   <li>{@link #WARNING} - aborted phases, ignored annotations and errors</li>
 *   <li>{@link #ERROR} - failed hooks and failed operations only</li>
 * </ul>
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}
