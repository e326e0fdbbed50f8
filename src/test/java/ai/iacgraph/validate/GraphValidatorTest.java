package ai.iacgraph.validate;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.validate.rules.ContainmentCycleRule;
import ai.iacgraph.validate.rules.DanglingReferenceRule;

import static ai.iacgraph.testutil.TestGraphs.EXECUTOR;
import static ai.iacgraph.testutil.TestGraphs.graph;
import static ai.iacgraph.testutil.TestGraphs.map;
import static ai.iacgraph.testutil.TestGraphs.node;
import static ai.iacgraph.testutil.TestGraphs.ref;
import static org.assertj.core.api.Assertions.assertThat;

class GraphValidatorTest {

    private final GraphValidator validator = new GraphValidator(RuleRegistry.defaults(), EXECUTOR);

    @Test
    void validate_containmentCycle_isStructuralError() {
        final ResourceGraph g = graph(
                node("a", "network.vpc", "cidrBlock", "10.0.0.0/16"),
                node("b", "network.vpc", "cidrBlock", "10.1.0.0/16"));
        g.addEdge(DependencyEdge.contains("a", "b"));
        g.addEdge(DependencyEdge.contains("b", "a"));

        final List<ValidationFinding> findings = validator.validate(g);

        assertThat(findings)
                .filteredOn(f -> f.ruleId().equals(ContainmentCycleRule.ID))
                .hasSize(1)
                .allSatisfy(f -> assertThat(f.severity()).isEqualTo(Severity.ERROR));
    }

    @Test
    void validate_danglingReference_isError() {
        final ResourceGraph g = graph(
                node("web", "compute.instance", "image", "ami-1", "subnetId", ref("missing"),
                        "tags", map("env", "dev")));

        final List<ValidationFinding> findings = validator.validate(g);

        assertThat(findings)
                .filteredOn(f -> f.ruleId().equals(DanglingReferenceRule.ID))
                .extracting(ValidationFinding::subject, ValidationFinding::severity)
                .containsExactly(org.assertj.core.groups.Tuple.tuple("web", Severity.ERROR));
    }

    @Test
    void validate_sameGraphTwice_identicalOrderedFindings() {
        final ResourceGraph g = graph(
                node("bucket", "storage.bucket", "bucketName", "logs", "acl", "public-read"),
                node("db", "database.instance", "engine", "postgres", "publiclyAccessible", true,
                        "password", "hunter2hunter2"),
                node("web", "compute.instance", "image", "ami-1", "subnetId", ref("nowhere")));

        final List<ValidationFinding> first = validator.validate(g);
        final List<ValidationFinding> second = validator.validate(g);

        assertThat(first).isNotEmpty().isEqualTo(second);
        assertThat(first).isSortedAccordingTo(ValidationFinding.ORDER);
        assertThat(first.get(0).severity()).isEqualTo(Severity.ERROR);
    }

    @Test
    void validate_throwingRule_becomesSingleRuleFailedFinding() {
        final RuleRegistry rules = new RuleRegistry()
                .register(new DanglingReferenceRule())
                .register(new ValidationRule() {
                    @Override
                    public String id() {
                        return "test.broken";
                    }

                    @Override
                    public List<ValidationFinding> evaluate(ResourceGraph graph) {
                        throw new IllegalStateException("boom");
                    }
                });
        final ResourceGraph g = graph(node("web", "compute.instance", "image", "ami-1", "subnetId", ref("gone")));

        final List<ValidationFinding> findings = new GraphValidator(rules, EXECUTOR).validate(g);

        assertThat(findings)
                .filteredOn(f -> f.ruleId().equals(GraphValidator.RULE_FAILED))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.subject()).isEqualTo("test.broken");
                    assertThat(f.message()).contains("boom");
                });
        assertThat(findings).anyMatch(f -> f.ruleId().equals(DanglingReferenceRule.ID));
    }

    @Test
    void validate_disabledRule_isNotRun() {
        final GraphValidator trimmed = new GraphValidator(
                RuleRegistry.defaults().without(Set.of(DanglingReferenceRule.ID)), EXECUTOR);
        final ResourceGraph g = graph(node("web", "compute.instance", "image", "ami-1", "subnetId", ref("gone")));

        assertThat(trimmed.validate(g)).noneMatch(f -> f.ruleId().equals(DanglingReferenceRule.ID));
    }
}
