package ai.iacgraph.normalize;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;

import static ai.iacgraph.testutil.TestGraphs.file;
import static ai.iacgraph.testutil.TestGraphs.normalize;
import static ai.iacgraph.testutil.TestGraphs.ref;
import static org.assertj.core.api.Assertions.assertThat;

class AnsibleMapperTest {

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
    void normalize_playbook_taskHandlerAndVariableIds() {
        final ResourceGraph g = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph();

        assertThat(g.nodes()).extracting(ResourceNode::id).containsExactly(
                "handler.restart_nginx", "task.command", "task.install_nginx", "task.start_nginx", "var.pkg");
        assertThat(g.node("task.install_nginx").orElseThrow().type()).isEqualTo("host.package");
        assertThat(g.node("task.start_nginx").orElseThrow().type()).isEqualTo("host.service");
    }

    @Test
    void normalize_jinjaVariable_becomesReference() {
        final ResourceGraph g = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph();

        assertThat(g.node("task.install_nginx").orElseThrow().property("name")).contains(ref("var.pkg"));
        assertThat(g.edge("task.install_nginx", EdgeKind.DEPENDS_ON, "var.pkg")).isPresent();
    }

    @Test
    void normalize_consecutiveTasks_chainedByOrdering() {
        final ResourceGraph g = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph();

        assertThat(g.edge("task.start_nginx", EdgeKind.DEPENDS_ON, "task.install_nginx"))
                .hasValueSatisfying(e -> assertThat(e.origins()).containsExactly(EdgeOrigin.ORDERING));
        assertThat(g.edge("task.command", EdgeKind.DEPENDS_ON, "task.start_nginx")).isPresent();
    }

    @Test
    void normalize_notify_handlerDependsOnTask() {
        final ResourceGraph g = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph();

        assertThat(g.edge("handler.restart_nginx", EdgeKind.DEPENDS_ON, "task.install_nginx")).isPresent();
    }

    @Test
    void normalize_freeFormCommand_cmdProperty() {
        final ResourceNode cmd = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph()
                .node("task.command").orElseThrow();

        assertThat(cmd.type()).isEqualTo("host.command");
        assertThat(cmd.property("cmd")).contains(PropertyValue.Scalar.of("/usr/bin/make install"));
    }

    @Test
    void normalize_playHeader_keptAsExtension() {
        final ResourceGraph g = normalize(Dialect.ANSIBLE, file("site.yml", PLAYBOOK)).graph();

        assertThat(g.extensions()).singleElement().satisfies(ext -> {
            assertThat(ext.kind()).isEqualTo("play");
            assertThat(ext.body()).containsEntry("hosts", "web").containsEntry("become", true);
        });
    }

    @Test
    void normalize_unknownHandler_warning() {
        final NormalizationResult result = normalize(Dialect.ANSIBLE, file("site.yml", """
                - hosts: all
                  tasks:
                    - name: Touch marker
                      file:
                        path: /tmp/marker
                        state: touch
                      notify: nobody
                """));

        assertThat(result.warnings()).extracting(NormalizationWarning::code).containsExactly("unresolved-handler");
    }
}
