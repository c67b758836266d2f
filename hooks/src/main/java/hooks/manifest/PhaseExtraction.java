package hooks.manifest;

import hooks.phase.PhaseIdentifier;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Result of reading the hook annotation of one manifest.
 *
 * @param phases recognized phases, empty if the manifest is not a hook
 * @param unrecognized entries that matched no phase (only populated under
 *                     {@link UnrecognizedPhasePolicy#IGNORE})
 */
public record PhaseExtraction(Set<PhaseIdentifier> phases, List<String> unrecognized) {

    private static final PhaseExtraction NONE = new PhaseExtraction(Set.of(), List.of());

    public PhaseExtraction {
        phases = phases.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(phases));
        unrecognized = List.copyOf(unrecognized);
    }

    /** Extraction result of a manifest without a hook annotation. */
    public static PhaseExtraction none() {
        return NONE;
    }

    /** True if at least one phase was recognized. */
    public boolean isHook() {
        return !phases.isEmpty();
    }
}
