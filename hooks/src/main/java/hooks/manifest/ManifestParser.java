package hooks.manifest;

import hooks.exceptions.HookException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a rendered multi-document YAML stream into {@link Manifest}s.
 *
 * <p>Documents are separated by {@code ---} lines; text following the marker on
 * the same line (e.g. {@code --- # Source: path}) belongs to the next document.
 * A {@code # Source: path} comment, as written by the renderer, becomes the
 * manifest's source; otherwise the stream name is used. Empty documents are
 * skipped. The raw text of each document is preserved as the manifest content.
 *
 * <p>Only {@code kind}, {@code metadata.name} and {@code metadata.annotations} are
 * interpreted.
 */
public final class ManifestParser {

    private static final Logger log = LoggerFactory.getLogger(ManifestParser.class);

    private static final Pattern DOCUMENT_SEPARATOR = Pattern.compile("(?m)^---(?:[ \\t]+(.*))?$");
    private static final Pattern SOURCE_COMMENT = Pattern.compile("(?m)^#\\s*Source:\\s*(\\S+)\\s*$");

    private ManifestParser() {}

    /**
     * Parses a rendered stream.
     *
     * @param streamName name used as source for documents without a source comment
     * @param rendered the rendered YAML text
     * @return the manifests in stream order
     * @throws HookException if a document is not valid YAML, not a mapping, or lacks kind/name
     */
    public static List<Manifest> parse(String streamName, String rendered) throws HookException {
        List<Manifest> manifests = new ArrayList<>();
        if (rendered == null || rendered.isBlank()) {
            return manifests;
        }

        List<String> documents = split(rendered);
        for (int i = 0; i < documents.size(); i++) {
            String doc = documents.get(i).strip();
            if (doc.isEmpty()) continue;

            Manifest m = parseDocument(sourceOf(doc, streamName + "#" + i), doc);
            if (m != null) {
                manifests.add(m);
            }
        }

        log.debug("Parsed {} manifests from {}", manifests.size(), streamName);
        return manifests;
    }

    private static List<String> split(String rendered) {
        List<String> documents = new ArrayList<>();
        Matcher m = DOCUMENT_SEPARATOR.matcher(rendered);
        String head = "";
        int from = 0;
        while (m.find()) {
            documents.add(head + rendered.substring(from, m.start()));
            head = m.group(1) != null ? m.group(1) + "\n" : "";
            from = m.end();
        }
        documents.add(head + rendered.substring(from));
        return documents;
    }

    private static String sourceOf(String doc, String fallback) {
        Matcher m = SOURCE_COMMENT.matcher(doc);
        return m.find() ? m.group(1) : fallback;
    }

    @SuppressWarnings("unchecked")
    private static Manifest parseDocument(String source, String doc) throws HookException {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(doc);
        } catch (YAMLException e) {
            throw new HookException("Invalid YAML in " + source, e);
        }

        // comment-only document
        if (root == null) return null;

        if (!(root instanceof Map)) {
            throw new HookException("Manifest " + source + " is not a mapping");
        }
        Map<String, Object> map = (Map<String, Object>) root;

        Object kind = map.get("kind");
        Object metadata = map.get("metadata");
        if (kind == null) {
            throw new HookException("Manifest " + source + " has no kind");
        }
        if (!(metadata instanceof Map) || ((Map<String, Object>) metadata).get("name") == null) {
            throw new HookException("Manifest " + source + " has no metadata.name");
        }

        Map<String, Object> meta = (Map<String, Object>) metadata;
        return new Manifest(
                source,
                kind.toString(),
                meta.get("name").toString(),
                annotationsOf(meta.get("annotations")),
                doc);
    }

    private static Map<String, String> annotationsOf(Object raw) {
        Map<String, String> annotations = new LinkedHashMap<>();
        if (raw instanceof Map) {
            for (var entry : ((Map<?, ?>) raw).entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    annotations.put(entry.getKey().toString(), entry.getValue().toString());
                }
            }
        }
        return annotations;
    }
}
