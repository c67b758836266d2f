package hooks.apply;

import hooks.manifest.Manifest;
import hooks.readiness.ObservedState;

/**
 * Capability that talks to the target control plane.
 *
 * <p>Implementations own protocol, idempotency and conflict handling. The hook
 * engine only submits manifests and polls the resulting resources; it never
 * deletes them.
 *
 * <h2>Example:</h2>
 * <pre>
 * ApplyMechanism apply = new ApplyMechanism() {
 *     public SubmitResult submit(Manifest m) {
 *         return SubmitResult.accepted(client.create(m.content()));
 *     }
 *     public ObservedState poll(ResourceHandle h) {
 *         return client.status(h);
 *     }
 * };
 * </pre>
 */
public interface ApplyMechanism {

    /**
     * Creates or updates the resource described by the manifest.
     *
     * @param manifest the manifest, content passed through unmodified
     * @return whether the target system accepted it
     * @throws Exception if the call could not be made; treated as a rejection
     */
    SubmitResult submit(Manifest manifest) throws Exception;

    /**
     * Reads the current state of a submitted resource.
     *
     * @param handle the handle returned by {@link #submit(Manifest)}
     * @return the observed state
     * @throws Exception if the state could not be read; fails the hook
     */
    ObservedState poll(ResourceHandle handle) throws Exception;
}
