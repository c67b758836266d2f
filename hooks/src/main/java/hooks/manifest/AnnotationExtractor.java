package hooks.manifest;

import hooks.config.HookConfig;
import hooks.exceptions.UnrecognizedPhaseException;
import hooks.phase.PhaseIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the phases a manifest is bound to from its hook annotation.
 *
 * <p>The annotation value is a comma-separated list. Each entry is trimmed and
 * matched case-sensitively against {@link PhaseIdentifier#wireName()}; empty
 * entries are skipped. A missing or blank annotation yields no phases.
 *
 * <p>Entries outside the closed set are handled according to the configured
 * {@link UnrecognizedPhasePolicy}.
 *
 * <h2>Example:</h2>
 * <pre>
 * metadata:
 *   annotations:
 *     helm.sh/hook: post-install,post-upgrade
 * </pre>
 */
public final class AnnotationExtractor {

    private static final Logger log = LoggerFactory.getLogger(AnnotationExtractor.class);

    /** Annotation key used when none is configured. */
    public static final String DEFAULT_ANNOTATION_KEY = "helm.sh/hook";

    private final String annotationKey;
    private final UnrecognizedPhasePolicy policy;

    public AnnotationExtractor(String annotationKey, UnrecognizedPhasePolicy policy) {
        this.annotationKey = Objects.requireNonNull(annotationKey, "annotationKey");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /** Extractor using the default key and {@link UnrecognizedPhasePolicy#IGNORE}. */
    public AnnotationExtractor() {
        this(DEFAULT_ANNOTATION_KEY, UnrecognizedPhasePolicy.IGNORE);
    }

    /**
     * Creates an extractor from configuration.
     *
     * @param config the hook configuration
     * @return a new extractor
     */
    public static AnnotationExtractor fromConfig(HookConfig config) {
        return new AnnotationExtractor(config.annotationKey(), config.unrecognizedPhasePolicy());
    }

    public String annotationKey() {
        return annotationKey;
    }

    public UnrecognizedPhasePolicy policy() {
        return policy;
    }

    /**
     * Extracts the phases declared on a manifest.
     *
     * @param manifest the rendered manifest
     * @return the recognized phases plus any ignored entries
     * @throws UnrecognizedPhaseException under {@link UnrecognizedPhasePolicy#REJECT}
     *                                    if any entry is not a known phase
     */
    public PhaseExtraction extract(Manifest manifest) throws UnrecognizedPhaseException {
        return extractValue(manifest.source(), manifest.annotation(annotationKey));
    }

    /**
     * Extracts phases from a raw annotation value.
     *
     * @param owner manifest identifier used in diagnostics
     * @param value the annotation value, may be null
     * @return the recognized phases plus any ignored entries
     * @throws UnrecognizedPhaseException under {@link UnrecognizedPhasePolicy#REJECT}
     */
    public PhaseExtraction extractValue(String owner, String value) throws UnrecognizedPhaseException {
        if (value == null || value.isBlank()) {
            return PhaseExtraction.none();
        }

        Set<PhaseIdentifier> phases = EnumSet.noneOf(PhaseIdentifier.class);
        List<String> unrecognized = new ArrayList<>();

        for (String raw : value.split(",")) {
            String token = raw.trim();
            if (token.isEmpty()) continue;

            Optional<PhaseIdentifier> phase = PhaseIdentifier.fromWireName(token);
            if (phase.isPresent()) {
                phases.add(phase.get());
            } else if (policy == UnrecognizedPhasePolicy.REJECT) {
                throw new UnrecognizedPhaseException(owner, token);
            } else {
                log.warn("Ignoring unrecognized hook phase '{}' on {}", token, owner);
                unrecognized.add(token);
            }
        }

        return new PhaseExtraction(phases, unrecognized);
    }

    /**
     * Serializes a phase set into an annotation value, in declaration order of
     * {@link PhaseIdentifier}.
     *
     * @param phases the phases
     * @return comma-separated wire names, empty string for an empty set
     */
    public static String format(Set<PhaseIdentifier> phases) {
        if (phases.isEmpty()) return "";
        return EnumSet.copyOf(phases).stream()
                .map(PhaseIdentifier::wireName)
                .collect(Collectors.joining(","));
    }
}
