package hooks.phase;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The closed set of lifecycle moments a hook manifest can be bound to.
 *
 * <p>Each constant has a wire name (for example {@code pre-install}) which is the
 * exact, case-sensitive token used in the hook annotation. Values outside this set
 * never create a new phase; see {@link hooks.manifest.UnrecognizedPhasePolicy}.
 *
 * @see PhaseRegistry
 */
public enum PhaseIdentifier {
    PRE_INSTALL("pre-install"),
    POST_INSTALL("post-install"),
    PRE_DELETE("pre-delete"),
    POST_DELETE("post-delete"),
    PRE_UPGRADE("pre-upgrade"),
    POST_UPGRADE("post-upgrade"),
    PRE_ROLLBACK("pre-rollback"),
    POST_ROLLBACK("post-rollback");

    private static final Map<String, PhaseIdentifier> BY_WIRE_NAME = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(PhaseIdentifier::wireName, Function.identity()));

    private final String wireName;

    PhaseIdentifier(String wireName) {
        this.wireName = wireName;
    }

    /** Returns the annotation token for this phase. */
    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a phase by its annotation token.
     *
     * @param token the token, already trimmed; matched case-sensitively
     * @return the phase, or empty if the token is not one of the eight phases
     */
    public static Optional<PhaseIdentifier> fromWireName(String token) {
        if (token == null) return Optional.empty();
        return Optional.ofNullable(BY_WIRE_NAME.get(token));
    }

    /**
     * Returns true if the token names a known phase.
     *
     * @param token the token to check
     * @return true if recognized
     */
    public static boolean isRecognized(String token) {
        return fromWireName(token).isPresent();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
