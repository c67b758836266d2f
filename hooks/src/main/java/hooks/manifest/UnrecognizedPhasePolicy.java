package hooks.manifest;

/**
 * What {@link AnnotationExtractor} does with a hook annotation entry that is not
 * one of the eight known phases.
 *
 * <p>Configured through {@code hooks.unrecognized.policy}.
 */
public enum UnrecognizedPhasePolicy {
    /**
     * Skip the entry, log a warning and keep the manifest's valid phases.
     *
     * <p>This is the default.
     */
    IGNORE,

    /**
     * Halt extraction with {@link hooks.exceptions.UnrecognizedPhaseException};
     * none of the manifest's phases take effect.
     */
    REJECT
}
