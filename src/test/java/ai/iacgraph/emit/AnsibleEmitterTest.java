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

class AnsibleEmitterTest {

    private final AnsibleEmitter emitter = new AnsibleEmitter();

    private static final String PLAYBOOK = """
            - hosts: web
              become: true
              vars:
                pkg: nginx
              tasks:
                - name: Install nginx
                  apt:
                    name: "{{ pkg }}"
                    state: present
                  notify: restart nginx
                - name: Start nginx
                  service:
                    name: nginx
                    state: started
                - command: /usr/bin/make install
              handlers:
                - name: restart nginx
                  service:
                    name: nginx
                    state: restarted
            """;

    @Test
    void emit_sameDialect_roundTrips() {
        final ResourceGraph graph = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph();

        final EmissionResult result = emitter.emit(graph.copy(), EmitOptions.DEFAULT);

        assertThat(result.artifacts()).containsOnlyKeys("site.yml");
        assertThat(result.warnings()).isEmpty();
        final ResourceGraph reparsed = normalize(Dialect.ANSIBLE, sources(result.artifacts())).graph();
        assertSameNodes(reparsed, graph);
        assertThat(reparsed.edges()).containsExactlyElementsOf(graph.edges());
        assertThat(result.artifacts().get("site.yml")).contains("hosts: web").contains("notify: restart nginx");
    }

    @Test
    void emit_sameDialect_topLevelPlaysNotIndented() {
        final ResourceGraph graph = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph();

        final String site = emitter.emit(graph.copy(), EmitOptions.DEFAULT).artifacts().get("site.yml");

        assertThat(site)
                .containsPattern("(?m)^- \\w+:")
                .doesNotContainPattern("(?m)^ +- hosts:");
    }

    @Test
    void emit_fromTerraform_localPlayWithStubs() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM, file("main.tf", """
                resource "aws_s3_bucket" "logs" {
                  bucket = "app-logs"
                }
                output "logs_name" {
                  value = aws_s3_bucket.logs.bucket
                }
                """)).graph();

        final EmissionResult result = emitter.emit(graph, EmitOptions.DEFAULT);

        assertThat(result.artifacts()).containsOnlyKeys(AnsibleEmitter.PLAYBOOK);
        final String playbook = result.artifacts().get(AnsibleEmitter.PLAYBOOK);
        assertThat(playbook)
                .contains("hosts: localhost")
                .contains("connection: local")
                .contains("# untranslatable resource: output.logs_name");
        assertThat(result.warnings()).extracting(EmissionWarning::code).contains(EmissionWarning.UNTRANSLATABLE);
        final ResourceGraph reparsed = normalize(Dialect.ANSIBLE, sources(result.artifacts())).graph();
        assertThat(reparsed.nodes()).extracting(ResourceNode::type).containsExactly("storage.bucket");
    }
}
