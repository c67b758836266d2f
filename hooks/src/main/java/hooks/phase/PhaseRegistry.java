package hooks.phase;

import hooks.exceptions.UnknownOperationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed mapping from {@link Operation} to its {@link PhasePair}.
 *
 * <p>The table is built once and never extended at runtime.
 */
public final class PhaseRegistry {

    private static final Map<Operation, PhasePair> PHASES;

    static {
        Map<Operation, PhasePair> m = new EnumMap<>(Operation.class);
        m.put(Operation.INSTALL, new PhasePair(PhaseIdentifier.PRE_INSTALL, PhaseIdentifier.POST_INSTALL));
        m.put(Operation.UPGRADE, new PhasePair(PhaseIdentifier.PRE_UPGRADE, PhaseIdentifier.POST_UPGRADE));
        m.put(Operation.DELETE, new PhasePair(PhaseIdentifier.PRE_DELETE, PhaseIdentifier.POST_DELETE));
        m.put(Operation.ROLLBACK, new PhasePair(PhaseIdentifier.PRE_ROLLBACK, PhaseIdentifier.POST_ROLLBACK));
        PHASES = Collections.unmodifiableMap(m);
    }

    private PhaseRegistry() {}

    /**
     * Returns the pre/post phases for an operation.
     *
     * @param operation the release operation
     * @return the phase pair
     * @throws UnknownOperationException if the operation is null or unmapped
     */
    public static PhasePair phasesFor(Operation operation) {
        PhasePair pair = operation == null ? null : PHASES.get(operation);
        if (pair == null) {
            throw new UnknownOperationException(String.valueOf(operation));
        }
        return pair;
    }

    /**
     * Returns true if the token names one of the eight phases.
     *
     * @param token the annotation token
     * @return true if recognized
     */
    public static boolean isRecognized(String token) {
        return PhaseIdentifier.isRecognized(token);
    }
}
