package hooks.plan;

import hooks.exceptions.UnrecognizedPhaseException;
import hooks.manifest.AnnotationExtractor;
import hooks.manifest.Manifest;
import hooks.manifest.PhaseExtraction;
import hooks.phase.PhaseIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable partition of a release's rendered manifests into per-phase hooks and
 * ordinary release resources.
 *
 * <p>Built with {@link #assemble(List, AnnotationExtractor)} from the already
 * flattened manifest list of a package and all its sub-packages. A manifest
 * bound to several phases appears in each of those buckets. Bucket order is the
 * order in which manifests were discovered; it is assembly order only and
 * carries no promise about execution order.
 *
 * @see Hook
 * @see hooks.engine.PhaseExecutor
 */
public final class HookSet {

    private static final Logger log = LoggerFactory.getLogger(HookSet.class);

    private static final HookSet EMPTY = new HookSet(new EnumMap<>(PhaseIdentifier.class), List.of());

    private final Map<PhaseIdentifier, List<Hook>> byPhase;
    private final List<Manifest> releaseResources;

    private HookSet(Map<PhaseIdentifier, List<Hook>> byPhase, List<Manifest> releaseResources) {
        this.byPhase = byPhase;
        this.releaseResources = releaseResources;
    }

    /** A hook set with no hooks and no resources. */
    public static HookSet empty() {
        return EMPTY;
    }

    // ===== factory =====

    /**
     * Partitions rendered manifests into hooks and release resources.
     *
     * <p>Sub-package manifests are included with no way for a parent package to
     * opt them out.
     *
     * @param manifests flattened manifests of the package and its sub-packages
     * @param extractor reads each manifest's phases
     * @return the assembled hook set
     * @throws UnrecognizedPhaseException if the extractor rejects an annotation
     */
    public static HookSet assemble(List<Manifest> manifests, AnnotationExtractor extractor)
            throws UnrecognizedPhaseException {

        Objects.requireNonNull(manifests, "manifests");
        Objects.requireNonNull(extractor, "extractor");

        Map<PhaseIdentifier, List<Hook>> buckets = new EnumMap<>(PhaseIdentifier.class);
        List<Manifest> resources = new ArrayList<>();

        for (Manifest m : manifests) {
            PhaseExtraction extraction = extractor.extract(m);
            if (!extraction.isHook()) {
                resources.add(m);
                continue;
            }

            Hook hook = Hook.of(m, extraction.phases());
            for (PhaseIdentifier phase : hook.phases()) {
                buckets.computeIfAbsent(phase, p -> new ArrayList<>()).add(hook);
            }
        }

        Map<PhaseIdentifier, List<Hook>> frozen = new EnumMap<>(PhaseIdentifier.class);
        buckets.forEach((phase, hooks) -> frozen.put(phase, List.copyOf(hooks)));

        HookSet set = new HookSet(frozen, List.copyOf(resources));
        log.debug("Assembled hooks {} and {} release resources", set.describe(), resources.size());
        return set;
    }

    // ===== public API =====

    /**
     * Returns the hooks bound to a phase, in discovery order.
     *
     * @param phase the phase
     * @return an immutable list, empty if no hook declares the phase
     */
    public List<Hook> hooksFor(PhaseIdentifier phase) {
        return byPhase.getOrDefault(phase, List.of());
    }

    public boolean hasHooks(PhaseIdentifier phase) {
        return !hooksFor(phase).isEmpty();
    }

    /** Manifests with no recognized phase, in discovery order. */
    public List<Manifest> releaseResources() {
        return releaseResources;
    }

    /** Phases with at least one hook. */
    public Map<PhaseIdentifier, List<Hook>> byPhase() {
        return Collections.unmodifiableMap(byPhase);
    }

    private String describe() {
        StringBuilder sb = new StringBuilder("{");
        byPhase.forEach((phase, hooks) -> {
            if (sb.length() > 1) sb.append(", ");
            sb.append(phase.wireName()).append('=').append(hooks.size());
        });
        return sb.append('}').toString();
    }

    @Override
    public String toString() {
        return "HookSet" + describe() + " resources=" + releaseResources.size();
    }
}
