package hooks.phase;

import hooks.exceptions.UnknownOperationException;

import java.util.Locale;

/**
 * A caller-initiated release action. Each operation triggers exactly one
 * pre/post phase pair, see {@link PhaseRegistry#phasesFor(Operation)}.
 */
public enum Operation {
    INSTALL,
    UPGRADE,
    DELETE,
    ROLLBACK;

    /**
     * Parses an operation name such as {@code install} or {@code ROLLBACK}.
     *
     * @param name the operation name, case-insensitive
     * @return the operation
     * @throws UnknownOperationException if the name is not one of the four operations
     */
    public static Operation fromName(String name) {
        if (name == null) {
            throw new UnknownOperationException(null);
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownOperationException(name);
        }
    }

    /** Lower-case name as used in logs and annotation tokens. */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
