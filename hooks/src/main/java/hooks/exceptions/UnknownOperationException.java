package hooks.exceptions;

/**
 * Thrown when an operation name or value has no phase mapping.
 *
 * <p>This is an unchecked exception: {@link hooks.phase.Operation} is a closed
 * enumeration, so this only signals a programming or input error.
 *
 * @see hooks.phase.PhaseRegistry
 */
public class UnknownOperationException extends RuntimeException {

    private final String operation;

    /**
     * @param operation the offending operation name (may be null)
     */
    public UnknownOperationException(String operation) {
        super("Unknown release operation: " + operation);
        this.operation = operation;
    }

    /** Returns the offending operation name. */
    public String getOperation() {
        return operation;
    }
}
