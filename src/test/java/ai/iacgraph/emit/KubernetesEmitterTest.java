package ai.iacgraph.emit;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;

import static ai.iacgraph.testutil.GraphAssertions.assertSameNodes;
import static ai.iacgraph.testutil.GraphAssertions.sources;
import static ai.iacgraph.testutil.TestGraphs.file;
import static ai.iacgraph.testutil.TestGraphs.normalize;
import static org.assertj.core.api.Assertions.assertThat;

class KubernetesEmitterTest {

    private final KubernetesEmitter emitter = new KubernetesEmitter();

    private static final String MANIFESTS = """
            apiVersion: v1
            kind: Namespace
            metadata:
              name: shop
            ---
            apiVersion: v1
            kind: ConfigMap
            metadata:
              name: settings
              namespace: shop
            data:
              mode: fast
            ---
            apiVersion: apps/v1
            kind: Deployment
            metadata:
              name: api
              namespace: shop
              labels:
                app: api
            spec:
              replicas: 2
              template:
                spec:
                  containers:
                    - name: api
                      image: shop/api:1.0
                      envFrom:
                        - configMapRef:
                            name: settings
            """;

    @Test
    void emit_sameDialect_roundTrips() {
        final ResourceGraph graph = normalize(Dialect.KUBERNETES, file("app.yaml", MANIFESTS)).graph();

        final EmissionResult result = emitter.emit(graph.copy(), EmitOptions.DEFAULT);

        assertThat(result.artifacts()).containsOnlyKeys("app.yaml");
        assertThat(result.warnings()).isEmpty();
        final ResourceGraph reparsed = normalize(Dialect.KUBERNETES, sources(result.artifacts())).graph();
        assertSameNodes(reparsed, graph);
        assertThat(reparsed.edges()).containsExactlyElementsOf(graph.edges());
    }

    @Test
    void emit_fromTerraform_oneFilePerObjectAndStubFile() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM, file("main.tf", """
                resource "kubernetes_namespace" "shop" {
                }
                resource "aws_s3_bucket" "logs" {
                  bucket = "app-logs"
                }
                """)).graph();

        final EmissionResult result = emitter.emit(graph, EmitOptions.DEFAULT);

        assertThat(result.artifacts()).containsOnlyKeys("namespace-shop.yaml", KubernetesEmitter.UNTRANSLATABLE_FILE);
        assertThat(result.artifacts().get(KubernetesEmitter.UNTRANSLATABLE_FILE))
                .contains("# untranslatable resource: aws_s3_bucket.logs (storage.bucket)");
        final ResourceGraph reparsed = normalize(Dialect.KUBERNETES,
                file("namespace-shop.yaml", result.artifacts().get("namespace-shop.yaml"))).graph();
        assertThat(reparsed.nodes()).extracting(ResourceNode::id).containsExactly("namespace/shop");
    }

    @Test
    void emit_bannerOnStubFileToo() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM, file("main.tf", """
                resource "aws_s3_bucket" "logs" {
                  bucket = "app-logs"
                }
                """)).graph();

        final EmissionResult result = emitter.emit(graph, new EmitOptions(1));

        assertThat(result.artifacts().get(KubernetesEmitter.UNTRANSLATABLE_FILE))
                .startsWith("# WARNING: generated from a graph with 1 unresolved error-level finding(s).");
    }
}
