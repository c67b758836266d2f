package hooks.manifest;

import java.util.Map;
import java.util.Objects;

/**
 * One rendered resource document.
 *
 * <p>{@code content} is the raw document text and is handed to the apply mechanism
 * unmodified. {@code source} is the template path the document was rendered from;
 * manifests of sub-packages carry their nested path and are otherwise treated
 * exactly like the parent's.
 *
 * @param source template path, or a synthetic identifier if unknown
 * @param kind the resource kind, e.g. {@code Job} or {@code ConfigMap}
 * @param name the resource name from {@code metadata.name}
 * @param annotations {@code metadata.annotations}, never null
 * @param content the raw document
 */
public record Manifest(
        String source,
        String kind,
        String name,
        Map<String, String> annotations,
        String content
) {
    public Manifest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        content = content == null ? "" : content;
        source = source == null ? kind + "/" + name : source;
    }

    /**
     * Returns the value of an annotation.
     *
     * @param key the annotation key
     * @return the value, or null if absent
     */
    public String annotation(String key) {
        return annotations.get(key);
    }

    /** {@code Kind/name}, used in reports and logs. */
    public String displayName() {
        return kind + "/" + name;
    }
}
