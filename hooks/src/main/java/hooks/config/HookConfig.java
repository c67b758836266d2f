package hooks.config;

import hooks.manifest.AnnotationExtractor;
import hooks.manifest.UnrecognizedPhasePolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Central configuration for hook orchestration.
 *
 * <p>Covers:
 * <ul>
 *   <li>The annotation key that marks a manifest as a hook</li>
 *   <li>The policy for unrecognized phase names</li>
 *   <li>Readiness timeout and poll interval for run-to-completion hooks</li>
 *   <li>Alert level</li>
 * </ul>
 *
 * <p>Load from {@code release-hooks.properties} or {@code release-hooks.yml}
 * with {@link HookConfigLoader}.
 */
public final class HookConfig {

    /** Special value disabling the readiness timeout. */
    public static final Duration NO_TIMEOUT = Duration.ZERO;

    public static final HookConfig DEFAULTS = builder().build();

    private final String annotationKey;
    private final UnrecognizedPhasePolicy unrecognizedPhasePolicy;
    private final Duration readinessTimeout;
    private final Duration pollInterval;
    private final AlertLevel alertLevel;

    private HookConfig(Builder b) {
        this.annotationKey = b.annotationKey;
        this.unrecognizedPhasePolicy = b.unrecognizedPhasePolicy;
        this.readinessTimeout = b.readinessTimeout;
        this.pollInterval = b.pollInterval;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the annotation key holding the phase list. */
    public String annotationKey() { return annotationKey; }

    /** Returns the policy applied to unrecognized phase names. */
    public UnrecognizedPhasePolicy unrecognizedPhasePolicy() { return unrecognizedPhasePolicy; }

    /** Returns the per-hook readiness timeout, {@link #NO_TIMEOUT} if disabled. */
    public Duration readinessTimeout() { return readinessTimeout; }

    /** Returns the pause between two readiness polls. */
    public Duration pollInterval() { return pollInterval; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    /**
     * Checks if a timeout is enabled.
     *
     * @param timeout the timeout to check
     * @return true if timeout is positive
     */
    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    @Override
    public String toString() {
        return "HookConfig{" +
                "annotationKey=" + annotationKey +
                ", unrecognizedPhasePolicy=" + unrecognizedPhasePolicy +
                ", readinessTimeout=" + (isEnabled(readinessTimeout) ? readinessTimeout.toSeconds() + "s" : "disabled") +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for {@link HookConfig}.
     */
    public static final class Builder {
        private String annotationKey = AnnotationExtractor.DEFAULT_ANNOTATION_KEY;
        private UnrecognizedPhasePolicy unrecognizedPhasePolicy = UnrecognizedPhasePolicy.IGNORE;
        private Duration readinessTimeout = Duration.ofSeconds(300);
        private Duration pollInterval = Duration.ofSeconds(1);
        private AlertLevel alertLevel = AlertLevel.WARNING;

        private Builder() {}

        public Builder annotationKey(String key) {
            if (key == null || key.isBlank()) {
                throw new HookConfigException("annotation key must not be blank");
            }
            this.annotationKey = key.trim();
            return this;
        }

        public Builder unrecognizedPhasePolicy(UnrecognizedPhasePolicy policy) {
            this.unrecognizedPhasePolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder readinessTimeout(Duration timeout) {
            this.readinessTimeout = timeout == null ? NO_TIMEOUT : timeout;
            return this;
        }

        public Builder readinessTimeoutSeconds(long seconds) {
            return readinessTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : NO_TIMEOUT);
        }

        public Builder pollInterval(Duration interval) {
            if (!isEnabled(interval)) {
                throw new HookConfigException("poll interval must be positive: " + interval);
            }
            this.pollInterval = interval;
            return this;
        }

        public Builder pollIntervalMillis(long millis) {
            return pollInterval(Duration.ofMillis(millis));
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = Objects.requireNonNull(level, "level");
            return this;
        }

        public HookConfig build() {
            return new HookConfig(this);
        }
    }
}
