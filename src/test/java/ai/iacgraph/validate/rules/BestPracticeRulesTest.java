package ai.iacgraph.validate.rules;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.validate.Severity;
import ai.iacgraph.validate.ValidationFinding;

import static ai.iacgraph.testutil.TestGraphs.file;
import static ai.iacgraph.testutil.TestGraphs.graph;
import static ai.iacgraph.testutil.TestGraphs.map;
import static ai.iacgraph.testutil.TestGraphs.node;
import static ai.iacgraph.testutil.TestGraphs.nodeFrom;
import static ai.iacgraph.testutil.TestGraphs.normalize;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class BestPracticeRulesTest {

    private static final String PLAYBOOK = """
            - hosts: all
              tasks:
                - name: Build release
                  command:
                    cmd: make release
                    creates: /opt/app/bin/app
                - name: Report status
                  shell: systemctl status app
                  changed_when: false
                - command: /usr/bin/make install
            """;

    private static ResourceGraph workload(String type, PropertyValue.MapValue container) {
        return graph(node("app", type, "labels", map("app", "web"),
                "spec", map("template", map("spec", map("containers",
                        new PropertyValue.ListValue(List.of(container)))))));
    }

    @Test
    void missingResourceLimits_noLimits_warned() {
        final ResourceGraph g = workload("workload.deployment", map("name", "web", "image", "nginx:1.25",
                "resources", map("requests", map("cpu", "100m"))));

        assertThat(new MissingResourceLimitsRule().evaluate(g))
                .extracting(ValidationFinding::severity, ValidationFinding::message)
                .containsExactly(tuple(Severity.WARNING, "container 'web' has no resource limits"));
    }

    @Test
    void missingResourceLimits_limitsSet_noFinding() {
        final ResourceGraph g = workload("workload.deployment", map("name", "web", "image", "nginx:1.25",
                "resources", map("limits", map("cpu", "500m", "memory", "256Mi"))));

        assertThat(new MissingResourceLimitsRule().evaluate(g)).isEmpty();
    }

    @Test
    void healthChecks_onlyLiveness_infoNamesReadiness() {
        final ResourceGraph g = workload("workload.statefulset", map("name", "db", "image", "postgres:16",
                "livenessProbe", map("tcpSocket", map("port", 5432))));

        assertThat(new MissingHealthProbesRule().evaluate(g)).singleElement().satisfies(f -> {
            assertThat(f.severity()).isEqualTo(Severity.INFO);
            assertThat(f.message()).isEqualTo("container 'db' has no readiness probe");
        });
    }

    @Test
    void healthChecks_jobWithoutChecks_exempt() {
        final ResourceGraph g = workload("workload.job", map("name", "migrate", "image", "app:1.0"));

        assertThat(new MissingHealthProbesRule().evaluate(g)).isEmpty();
    }

    @Test
    void healthChecks_livenessAndReadiness_noFinding() {
        final ResourceGraph g = workload("workload.deployment", map("name", "web", "image", "nginx:1.25",
                "livenessProbe", map("httpGet", map("path", "/healthz")),
                "readinessProbe", map("httpGet", map("path", "/ready"))));

        assertThat(new MissingHealthProbesRule().evaluate(g)).isEmpty();
    }

    @Test
    void unnamedTask_taskWithoutName_warned() {
        final ResourceGraph g = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph();

        assertThat(new UnnamedTaskRule().evaluate(g))
                .extracting(ValidationFinding::subject)
                .containsExactly("task.command");
    }

    @Test
    void unnamedTask_nonAnsibleNode_ignored() {
        final ResourceGraph g = graph(node("web", "compute.instance", "image", "ami-1"));

        assertThat(new UnnamedTaskRule().evaluate(g)).isEmpty();
    }

    @Test
    void nonIdempotentCommand_onlyGuardlessCommandWarned() {
        final ResourceGraph g = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph();

        assertThat(new NonIdempotentCommandRule().evaluate(g))
                .extracting(ValidationFinding::subject)
                .containsExactly("task.command");
    }

    @Test
    void serviceWithoutSelector_missingOrEmpty_warned() {
        final ResourceGraph g = graph(
                node("a", "network.service", "spec", map("ports", map("port", 80))),
                node("b", "network.service", "spec", map("selector", map())));

        assertThat(new ServiceWithoutSelectorRule().evaluate(g))
                .extracting(ValidationFinding::subject)
                .containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void serviceWithoutSelector_selectorOrExternalName_noFinding() {
        final ResourceGraph g = graph(
                node("web", "network.service", "spec", map("selector", map("app", "web"))),
                node("ext", "network.service", "spec", map("type", "ExternalName", "externalName", "db.example.com")));

        assertThat(new ServiceWithoutSelectorRule().evaluate(g)).isEmpty();
    }

    @Test
    void missingTags_untaggedBucketAndUnlabelledWorkload_warned() {
        final ResourceGraph g = graph(
                node("logs", "storage.bucket", "bucketName", "logs"),
                node("app", "workload.deployment", "spec", map()));

        assertThat(new MissingTagsRule().evaluate(g))
                .extracting(ValidationFinding::subject, ValidationFinding::message)
                .containsExactlyInAnyOrder(tuple("logs", "resource has no tags"), tuple("app", "workload has no labels"));
    }

    @Test
    void missingTags_taggedOrUntaggable_noFinding() {
        final ResourceGraph g = graph(
                node("logs", "storage.bucket", "bucketName", "logs", "tags", map("team", "ops")),
                node("app", "workload.deployment", "labels", map("app", "web"), "spec", map()),
                node("policy", "identity.policy", "policy", "{}"));

        assertThat(new MissingTagsRule().evaluate(g)).isEmpty();
    }

    @Test
    void missingDescription_undocumentedVariableAndOutput_info() {
        final ResourceGraph g = graph(
                nodeFrom(Dialect.TERRAFORM, "var.region", "config.variable", "type", "string"),
                nodeFrom(Dialect.TERRAFORM, "output.ip", "config.output", "value", "1.2.3.4", "description", " "));

        assertThat(new MissingDescriptionRule().evaluate(g))
                .extracting(ValidationFinding::subject, ValidationFinding::message)
                .containsExactlyInAnyOrder(tuple("var.region", "variable has no description"),
                        tuple("output.ip", "output has no description"));
    }

    @Test
    void missingDescription_describedOrPlaybookVar_noFinding() {
        final ResourceGraph g = graph(
                nodeFrom(Dialect.TERRAFORM, "var.region", "config.variable", "description", "Deployment region"),
                nodeFrom(Dialect.ANSIBLE, "var.pkg", "config.variable", "value", "nginx"));

        assertThat(new MissingDescriptionRule().evaluate(g)).isEmpty();
    }
}
