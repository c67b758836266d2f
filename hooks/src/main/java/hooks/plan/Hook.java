package hooks.plan;

import hooks.manifest.Manifest;
import hooks.phase.PhaseIdentifier;
import hooks.readiness.ResourceKind;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A rendered manifest bound to one or more lifecycle phases.
 *
 * <p>Hooks are never part of the release's tracked resources. They exist only
 * while a {@link HookSet} is alive and are applied by
 * {@link hooks.engine.PhaseExecutor}.
 *
 * @param manifest the rendered manifest, passed to the apply mechanism untouched
 * @param kind the readiness kind derived from {@link Manifest#kind()}
 * @param phases the phases this hook is bound to, never empty
 */
public record Hook(Manifest manifest, ResourceKind kind, Set<PhaseIdentifier> phases) {

    public Hook {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(kind, "kind");
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("Hook " + manifest.displayName() + " has no phases");
        }
        phases = Set.copyOf(EnumSet.copyOf(phases));
    }

    /**
     * Creates a hook from a manifest and its recognized phases.
     *
     * @param manifest the manifest
     * @param phases its phases, must not be empty
     * @return a new hook
     */
    public static Hook of(Manifest manifest, Set<PhaseIdentifier> phases) {
        return new Hook(manifest, ResourceKind.of(manifest.kind()), phases);
    }

    /** {@code Kind/name} of the underlying manifest. */
    public String name() {
        return manifest.displayName();
    }

    /** Template path of the underlying manifest. */
    public String source() {
        return manifest.source();
    }

    public boolean boundTo(PhaseIdentifier phase) {
        return phases.contains(phase);
    }
}
