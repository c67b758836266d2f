package hooks.readiness;

/**
 * Readiness of one hook resource.
 *
 * <p>A hook starts {@link #PENDING} once the apply mechanism accepts it and ends
 * in {@link #READY} or {@link #FAILED}; both are terminal.
 */
public enum ReadinessState {
    PENDING,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
