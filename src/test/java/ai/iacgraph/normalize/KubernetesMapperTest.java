package ai.iacgraph.normalize;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;

import static ai.iacgraph.testutil.TestGraphs.file;
import static ai.iacgraph.testutil.TestGraphs.normalize;
import static ai.iacgraph.testutil.TestGraphs.ref;
import static org.assertj.core.api.Assertions.assertThat;

class KubernetesMapperTest {

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
    void normalize_manifests_idsByNamespaceKindAndName() {
        final ResourceGraph g = normalize(Dialect.KUBERNETES, file("app.yaml", MANIFESTS)).graph();

        assertThat(g.nodes()).extracting(ResourceNode::id)
                .containsExactly("namespace/shop", "shop/configmap/settings", "shop/deployment/api");
        assertThat(g.node("shop/deployment/api").orElseThrow().type()).isEqualTo("workload.deployment");
    }

    @Test
    void normalize_namespace_ownsObjects() {
        final ResourceGraph g = normalize(Dialect.KUBERNETES, file("app.yaml", MANIFESTS)).graph();

        final ResourceNode api = g.node("shop/deployment/api").orElseThrow();
        assertThat(api.property("namespace")).contains(ref("namespace/shop"));
        assertThat(g.edge("namespace/shop", EdgeKind.CONTAINS, "shop/deployment/api")).isPresent();
        assertThat(g.edge("namespace/shop", EdgeKind.CONTAINS, "shop/configmap/settings")).isPresent();
    }

    @Test
    void normalize_configMapRef_resolvedToDeclaredObject() {
        final ResourceGraph g = normalize(Dialect.KUBERNETES, file("app.yaml", MANIFESTS)).graph();

        assertThat(g.edge("shop/deployment/api", EdgeKind.DEPENDS_ON, "shop/configmap/settings")).isPresent();
    }

    @Test
    void normalize_undeclaredNames_stayPlainStrings() {
        final NormalizationResult result = normalize(Dialect.KUBERNETES, file("svc.yaml", """
                apiVersion: v1
                kind: Service
                metadata:
                  name: web
                  namespace: edge
                spec:
                  selector:
                    app: web
                  ports:
                    - port: 80
                """));

        final ResourceNode svc = result.graph().node("edge/service/web").orElseThrow();
        assertThat(svc.property("namespace")).contains(PropertyValue.Scalar.of("edge"));
        assertThat(result.graph().edgeCount()).isZero();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void normalize_objectWithoutName_parseErrorAndOthersKept() {
        final String yaml = """
                apiVersion: v1
                kind: ConfigMap
                metadata: {}
                ---
                apiVersion: v1
                kind: ConfigMap
                metadata:
                  name: ok
                """;

        final NormalizationResult result = normalize(Dialect.KUBERNETES, file("cm.yaml", yaml));

        assertThat(result.graph().nodes()).extracting(ResourceNode::id).containsExactly("configmap/ok");
    }

    @Test
    void normalize_customKind_unknownTypeWithOriginalBlock() {
        final ResourceNode node = normalize(Dialect.KUBERNETES, file("w.yaml", """
                apiVersion: acme.io/v1
                kind: Widget
                metadata:
                  name: w
                size: 3
                """)).graph().node("widget/w").orElseThrow();

        assertThat(node.type()).isEqualTo("unknown.Widget");
        assertThat(node.metadata().originalBlock()).containsEntry("size", 3L);
    }
}
