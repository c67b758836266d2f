package hooks.phase;

import java.util.Objects;

/**
 * The ordered pair of phases surrounding an operation's main step.
 *
 * @param pre the phase run before the main step
 * @param post the phase run after the main step
 */
public record PhasePair(PhaseIdentifier pre, PhaseIdentifier post) {

    public PhasePair {
        Objects.requireNonNull(pre, "pre");
        Objects.requireNonNull(post, "post");
    }
}
