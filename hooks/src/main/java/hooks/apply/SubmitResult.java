package hooks.apply;

/**
 * Outcome of submitting a manifest to the target system.
 *
 * @param accepted true if the create/update call succeeded
 * @param handle handle for polling, null when rejected
 * @param error rejection reason, null when accepted
 */
public record SubmitResult(boolean accepted, ResourceHandle handle, String error) {

    public static SubmitResult accepted(ResourceHandle handle) {
        return new SubmitResult(true, handle, null);
    }

    public static SubmitResult rejected(String error) {
        return new SubmitResult(false, null, error);
    }
}
