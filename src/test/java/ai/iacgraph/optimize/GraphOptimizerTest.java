package ai.iacgraph.optimize;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.optimize.passes.HoistLiteralsPass;
import ai.iacgraph.optimize.passes.MergeDuplicatesPass;
import ai.iacgraph.optimize.passes.RedundantExplicitDependenciesPass;
import ai.iacgraph.optimize.passes.TransitiveReductionPass;

import static ai.iacgraph.testutil.TestGraphs.graph;
import static ai.iacgraph.testutil.TestGraphs.node;
import static ai.iacgraph.testutil.TestGraphs.nodeFrom;
import static ai.iacgraph.testutil.TestGraphs.ref;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphOptimizerTest {

    private final GraphOptimizer optimizer = GraphOptimizer.withDefaultPasses(3);

    @Test
    void passIds_fixedOrder() {
        assertThat(optimizer.passIds()).containsExactly(
                MergeDuplicatesPass.ID,
                HoistLiteralsPass.ID,
                RedundantExplicitDependenciesPass.ID,
                TransitiveReductionPass.ID);
    }

    @Test
    void optimize_unknownPass_throws() {
        assertThatThrownBy(() -> optimizer.optimize(graph(node("a", "storage.bucket")), List.of("inline-everything")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inline-everything");
    }

    @Test
    void optimize_identicalBuckets_mergedIntoSmallestIdWithAlias() {
        final ResourceGraph g = graph(
                node("aws_s3_bucket.logs_b", "storage.bucket", "versioning", true),
                node("aws_s3_bucket.logs_a", "storage.bucket", "versioning", true),
                node("aws_instance.web", "compute.instance", "logBucket", ref("aws_s3_bucket.logs_b")));

        final OptimizationResult result = optimizer.optimize(g, List.of(MergeDuplicatesPass.ID));

        final ResourceGraph out = result.graph();
        assertThat(out.hasNode("aws_s3_bucket.logs_b")).isFalse();
        assertThat(out.resolve("aws_s3_bucket.logs_b")).isEqualTo("aws_s3_bucket.logs_a");
        assertThat(out.node("aws_instance.web").orElseThrow().property("logBucket"))
                .contains(ref("aws_s3_bucket.logs_a"));
        assertThat(out.edge("aws_instance.web", EdgeKind.DEPENDS_ON, "aws_s3_bucket.logs_a")).isPresent();
        assertThat(result.changes())
                .singleElement()
                .satisfies(c -> {
                    assertThat(c.isApplied()).isTrue();
                    assertThat(c.subject()).isEqualTo("aws_s3_bucket.logs_b");
                });
    }

    @Test
    void optimize_doesNotMutateInput() {
        final ResourceGraph g = graph(
                node("b", "storage.bucket", "versioning", true),
                node("a", "storage.bucket", "versioning", true));

        optimizer.optimize(g, List.of());

        assertThat(g.hasNode("b")).isTrue();
        assertThat(g.aliases()).isEmpty();
    }

    @Test
    void optimize_secondRun_noChanges() {
        final ResourceGraph g = graph(
                node("b", "storage.bucket", "versioning", true),
                node("a", "storage.bucket", "versioning", true),
                node("web", "compute.instance", "bucket", ref("b")),
                node("app", "compute.instance", "upstream", ref("web")));
        g.addEdge(DependencyEdge.dependsOn("app", "b", EdgeOrigin.EXPLICIT));
        g.addEdge(DependencyEdge.dependsOn("web", "b", EdgeOrigin.EXPLICIT));

        final OptimizationResult first = optimizer.optimize(g, List.of());
        final OptimizationResult second = optimizer.optimize(first.graph(), List.of());

        assertThat(first.changes()).isNotEmpty();
        assertThat(second.changes()).isEmpty();
        assertThat(second.graph().edges()).containsExactlyElementsOf(first.graph().edges());
    }

    @Test
    void optimize_explicitEdgeImpliedByPath_kept() {
        final ResourceGraph g = graph(
                node("db", "database.instance"),
                node("api", "compute.instance", "database", ref("db")),
                node("web", "compute.instance", "backend", ref("api")));
        g.addEdge(DependencyEdge.dependsOn("web", "db", EdgeOrigin.EXPLICIT));

        final OptimizationResult result = optimizer.optimize(g, List.of(TransitiveReductionPass.ID));

        assertThat(result.graph().edge("web", EdgeKind.DEPENDS_ON, "db"))
                .hasValueSatisfying(e -> assertThat(e.origins()).containsExactly(EdgeOrigin.EXPLICIT));
        assertThat(result.changes()).isEmpty();
    }

    @Test
    void optimize_orderingEdgeImpliedByPath_removed() {
        final ResourceGraph g = graph(
                node("task.install", "host.package"),
                node("task.configure", "host.file", "after", ref("task.install")),
                node("task.start", "host.service", "after", ref("task.configure")));
        g.addEdge(DependencyEdge.dependsOn("task.start", "task.install", EdgeOrigin.ORDERING));

        final OptimizationResult result = optimizer.optimize(g, List.of(TransitiveReductionPass.ID));

        assertThat(result.graph().edge("task.start", EdgeKind.DEPENDS_ON, "task.install")).isEmpty();
        assertThat(result.changes()).extracting(OptimizationChange::subject)
                .containsExactly(DependencyEdge.dependsOn("task.start", "task.install", EdgeOrigin.ORDERING).key());
    }

    @Test
    void optimize_dependencyCycle_reductionSkipped() {
        final ResourceGraph g = graph(
                node("a", "compute.instance", "peer", ref("b")),
                node("b", "compute.instance", "peer", ref("a")));

        final OptimizationResult result = optimizer.optimize(g, List.of(TransitiveReductionPass.ID));

        assertThat(result.changes())
                .singleElement()
                .satisfies(c -> assertThat(c.status()).isEqualTo("skipped: dependency cycle"));
        assertThat(result.graph().edgeCount()).isEqualTo(2);
    }

    @Test
    void optimize_passBreakingInvariant_skippedAndGraphKept() {
        final OptimizationPass broken = new OptimizationPass() {
            @Override
            public String id() {
                return "test.dangle";
            }

            @Override
            public List<OptimizationChange> apply(ResourceGraph graph) {
                graph.addEdge(DependencyEdge.dependsOn("a", "nowhere", EdgeOrigin.EXPLICIT));
                return List.of(OptimizationChange.applied(id(), "a", "added an edge"));
            }
        };
        final ResourceGraph g = graph(node("a", "storage.bucket"));

        final OptimizationResult result = new GraphOptimizer(List.of(broken)).optimize(g, List.of());

        assertThat(result.changes())
                .singleElement()
                .satisfies(c -> {
                    assertThat(c.status()).isEqualTo(OptimizationChange.INVARIANT_VIOLATION);
                    assertThat(c.description()).contains("dangling edge");
                });
        assertThat(result.graph().edgeCount()).isZero();
    }

    @Test
    void optimize_repeatedLiteral_hoistedIntoVariable() {
        final ResourceGraph g = new ResourceGraph(Dialect.TERRAFORM);
        g.putNode(nodeFrom(Dialect.TERRAFORM, "aws_instance.a", "compute.instance", "instanceType", "t3.micro", "name", "a"));
        g.putNode(nodeFrom(Dialect.TERRAFORM, "aws_instance.b", "compute.instance", "instanceType", "t3.micro", "name", "b"));
        g.putNode(nodeFrom(Dialect.TERRAFORM, "aws_instance.c", "compute.instance", "instanceType", "t3.micro", "name", "c"));

        final OptimizationResult result = optimizer.optimize(g, List.of(HoistLiteralsPass.ID));

        final ResourceGraph out = result.graph();
        assertThat(out.node("var.instance_type")).hasValueSatisfying(v -> {
            assertThat(v.type()).isEqualTo("config.variable");
            assertThat(v.property("default")).contains(PropertyValue.Scalar.of("t3.micro"));
        });
        for (String id : List.of("aws_instance.a", "aws_instance.b", "aws_instance.c")) {
            assertThat(out.node(id).orElseThrow().property("instanceType")).contains(ref("var.instance_type"));
            assertThat(out.edge(id, EdgeKind.DEPENDS_ON, "var.instance_type")).isPresent();
        }
        assertThat(result.changes()).hasSize(1);
    }

    @Test
    void optimize_literalBelowThreshold_notHoisted() {
        final ResourceGraph g = new ResourceGraph(Dialect.TERRAFORM);
        g.putNode(nodeFrom(Dialect.TERRAFORM, "aws_instance.a", "compute.instance", "instanceType", "t3.micro"));
        g.putNode(nodeFrom(Dialect.TERRAFORM, "aws_instance.b", "compute.instance", "instanceType", "t3.micro"));

        final OptimizationResult result = optimizer.optimize(g, List.of(HoistLiteralsPass.ID));

        assertThat(result.changes()).isEmpty();
        assertThat(result.graph().nodeCount()).isEqualTo(2);
    }
}
