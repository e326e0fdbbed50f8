package ai.iacgraph.testutil;

import java.util.Map;

import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.scan.SourceFile;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Assertions over whole graphs and emitted artifacts.
 */
public final class GraphAssertions {

    private GraphAssertions() {
    }

    /**
     * Same node ids, and per node the same type and properties.
     */
    public static void assertSameNodes(ResourceGraph actual, ResourceGraph expected) {
        assertThat(actual.nodes()).extracting(ResourceNode::id)
                .containsExactlyElementsOf(expected.nodes().stream().map(ResourceNode::id).toList());
        for (ResourceNode n : expected.nodes()) {
            final ResourceNode other = actual.node(n.id()).orElseThrow();
            assertThat(other.type()).as("type of %s", n.id()).isEqualTo(n.type());
            assertThat(other.properties()).as("properties of %s", n.id()).isEqualTo(n.properties());
        }
    }

    public static SourceFile[] sources(Map<String, String> artifacts) {
        return artifacts.entrySet().stream()
                .map(e -> new SourceFile(e.getKey(), e.getValue()))
                .toArray(SourceFile[]::new);
    }
}
