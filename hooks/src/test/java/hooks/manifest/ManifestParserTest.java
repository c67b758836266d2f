package hooks.manifest;

import hooks.exceptions.HookException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ManifestParser")
class ManifestParserTest {

    private static final String RENDERED = """
            ---
            # Source: app/templates/service.yaml
            apiVersion: v1
            kind: Service
            metadata:
              name: web
            ---
            # Source: app/charts/db/templates/migrate-job.yaml
            apiVersion: batch/v1
            kind: Job
            metadata:
              name: db-migrate
              annotations:
                "helm.sh/hook": pre-install,pre-upgrade
                replicas: 3
            spec:
              template:
                spec:
                  restartPolicy: Never
            ---
            # Source: app/templates/empty.yaml
            """;

    @Test
    @DisplayName("should split documents and read kind, name and annotations")
    void shouldSplitDocuments() throws Exception {
        List<Manifest> manifests = ManifestParser.parse("app", RENDERED);

        assertThat(manifests).hasSize(2);
        assertThat(manifests.get(0).kind()).isEqualTo("Service");
        assertThat(manifests.get(0).name()).isEqualTo("web");
        assertThat(manifests.get(0).annotations()).isEmpty();

        Manifest job = manifests.get(1);
        assertThat(job.source()).isEqualTo("app/charts/db/templates/migrate-job.yaml");
        assertThat(job.annotation("helm.sh/hook")).isEqualTo("pre-install,pre-upgrade");
        assertThat(job.annotation("replicas")).isEqualTo("3");
        assertThat(job.content()).contains("restartPolicy: Never");
    }

    @Test
    @DisplayName("should fall back to the stream name as source")
    void shouldFallBackToStreamName() throws Exception {
        List<Manifest> manifests = ManifestParser.parse("inline", "kind: ConfigMap\nmetadata:\n  name: cfg\n");

        assertThat(manifests).singleElement()
                .satisfies(m -> assertThat(m.source()).isEqualTo("inline#0"));
    }

    @Test
    @DisplayName("should return nothing for blank input")
    void shouldReturnNothingForBlankInput() throws Exception {
        assertThat(ManifestParser.parse("x", "  \n")).isEmpty();
        assertThat(ManifestParser.parse("x", null)).isEmpty();
    }

    @Test
    @DisplayName("should reject documents without metadata.name")
    void shouldRejectDocumentsWithoutName() {
        assertThatThrownBy(() -> ManifestParser.parse("x", "kind: Job\nmetadata: {}\n"))
                .isInstanceOf(HookException.class)
                .hasMessageContaining("metadata.name");
    }

    @Test
    @DisplayName("should reject non-mapping documents")
    void shouldRejectNonMappingDocuments() {
        assertThatThrownBy(() -> ManifestParser.parse("x", "- a\n- b\n"))
                .isInstanceOf(HookException.class)
                .hasMessageContaining("not a mapping");
    }

    @Test
    @DisplayName("should wrap YAML syntax errors")
    void shouldWrapSyntaxErrors() {
        assertThatThrownBy(() -> ManifestParser.parse("x", "kind: [Job\n"))
                .isInstanceOf(HookException.class)
                .hasMessageContaining("Invalid YAML")
                .hasCauseInstanceOf(org.yaml.snakeyaml.error.YAMLException.class);
    }

    @Test
    @DisplayName("should split on separators followed by a comment")
    void shouldSplitOnSeparatorWithTrailingComment() throws Exception {
        String rendered = """
                --- # Source: app/templates/job.yaml
                kind: Job
                metadata:
                  name: seed
                  annotations:
                    helm.sh/hook: post-install
                --- # Source: app/templates/service.yaml
                kind: Service
                metadata:
                  name: web
                """;

        List<Manifest> manifests = ManifestParser.parse("app", rendered);

        assertThat(manifests).extracting(Manifest::source)
                .containsExactly("app/templates/job.yaml", "app/templates/service.yaml");
        assertThat(manifests).extracting(Manifest::displayName)
                .containsExactly("Job/seed", "Service/web");
        assertThat(manifests.get(0).annotation("helm.sh/hook")).isEqualTo("post-install");
    }

    @Test
    @DisplayName("should keep content that starts on the separator line")
    void shouldKeepContentOnSeparatorLine() throws Exception {
        List<Manifest> manifests = ManifestParser.parse("s",
                "--- {kind: ConfigMap, metadata: {name: a}}\n--- {kind: Secret, metadata: {name: b}}\n");

        assertThat(manifests).extracting(Manifest::displayName).containsExactly("ConfigMap/a", "Secret/b");
        assertThat(manifests).extracting(Manifest::source).containsExactly("s#1", "s#2");
    }
}
