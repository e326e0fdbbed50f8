package ai.iacgraph.model;

import org.junit.jupiter.api.Test;

import static ai.iacgraph.testutil.TestGraphs.graph;
import static ai.iacgraph.testutil.TestGraphs.node;
import static ai.iacgraph.testutil.TestGraphs.ref;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceGraphTest {

    @Test
    void addEdge_sameEndpointsAndKind_originsMerged() {
        final ResourceGraph g = graph(node("a", "storage.bucket"), node("b", "storage.bucket"));
        g.addEdge(DependencyEdge.dependsOn("a", "b", EdgeOrigin.REFERENCE));
        g.addEdge(DependencyEdge.dependsOn("a", "b", EdgeOrigin.EXPLICIT));

        assertThat(g.edgeCount()).isEqualTo(1);
        assertThat(g.edge("a", EdgeKind.DEPENDS_ON, "b").orElseThrow().origins())
                .containsExactlyInAnyOrder(EdgeOrigin.REFERENCE, EdgeOrigin.EXPLICIT);
    }

    @Test
    void nodes_iteratedInIdOrder() {
        final ResourceGraph g = graph(node("c", "x.y"), node("a", "x.y"), node("b", "x.y"));

        assertThat(g.nodes()).extracting(ResourceNode::id).containsExactly("a", "b", "c");
    }

    @Test
    void seal_mutatorsThrow() {
        final ResourceGraph g = graph(node("a", "storage.bucket")).seal();

        assertThat(g.isSealed()).isTrue();
        assertThatThrownBy(() -> g.putNode(node("b", "storage.bucket")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> g.addEdge(DependencyEdge.contains("a", "a")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void copy_ofSealedGraph_isMutableAndIndependent() {
        final ResourceGraph sealed = graph(node("a", "storage.bucket")).seal();
        final ResourceGraph copy = sealed.copy();

        copy.putNode(node("b", "storage.bucket"));

        assertThat(copy.isSealed()).isFalse();
        assertThat(sealed.hasNode("b")).isFalse();
    }

    @Test
    void redirect_rewritesEdgesAndTokensAndRecordsAlias() {
        final ResourceGraph g = graph(
                node("old", "storage.bucket"),
                node("keep", "storage.bucket"),
                node("web", "compute.instance", "bucket", ref("old")));

        g.redirect("old", "keep");

        assertThat(g.hasNode("old")).isFalse();
        assertThat(g.edge("web", EdgeKind.DEPENDS_ON, "keep")).isPresent();
        assertThat(g.edge("web", EdgeKind.DEPENDS_ON, "old")).isEmpty();
        assertThat(g.node("web").orElseThrow().property("bucket")).contains(ref("keep"));
        assertThat(g.resolve("old")).isEqualTo("keep");
        assertThat(g.resolve("web")).isEqualTo("web");
    }

    @Test
    void addAlias_chainedRenames_stayFlat() {
        final ResourceGraph g = graph(node("c", "storage.bucket"));
        g.addAlias("a", "b");
        g.addAlias("b", "c");

        assertThat(g.aliases()).containsEntry("a", "c").containsEntry("b", "c").hasSize(2);
    }

    @Test
    void renameNode_movesOutgoingEdges() {
        final ResourceGraph g = graph(
                node("db", "database.instance"),
                node("api", "compute.instance", "database", ref("db")));

        g.renameNode("api", "backend");

        assertThat(g.edge("backend", EdgeKind.DEPENDS_ON, "db")).isPresent();
        assertThat(g.resolve("api")).isEqualTo("backend");
        assertThatThrownBy(() -> g.renameNode("db", "backend"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void danglingEdges_reportsMissingTargets() {
        final ResourceGraph g = graph(node("web", "compute.instance", "bucket", ref("missing")));

        assertThat(g.danglingEdges()).extracting(DependencyEdge::target).containsExactly("missing");
    }
}
