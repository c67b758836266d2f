package hooks.exceptions;

import hooks.result.FailureReason;

/**
 * Thrown under {@link hooks.manifest.UnrecognizedPhasePolicy#REJECT} when a hook
 * annotation names a phase outside the closed set.
 *
 * <p>The whole manifest's hook binding is rejected; no partial set of phases is
 * taken from it.
 */
public class UnrecognizedPhaseException extends HookException {

    private final String manifest;
    private final String value;

    /**
     * @param manifest the manifest source or name carrying the annotation
     * @param value the unrecognized phase token
     */
    public UnrecognizedPhaseException(String manifest, String value) {
        super("Unrecognized hook phase '" + value + "' on manifest " + manifest,
                null, null, manifest, FailureReason.UNRECOGNIZED_PHASE, null);
        this.manifest = manifest;
        this.value = value;
    }

    /** Returns the manifest carrying the bad annotation. */
    public String getManifest() {
        return manifest;
    }

    /** Returns the unrecognized token. */
    public String getValue() {
        return value;
    }
}
