package ai.iacgraph.optimize;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.GraphAlgorithms;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;

/**
 * Structural invariants of a resource graph, as a set of violation descriptions:
 * - every edge endpoint is a node
 * - every reference token has a depends-on edge from its node to its target
 * - contains edges form a forest (no cycle, at most one parent)
 */
public final class GraphInvariants {

    private GraphInvariants() {
    }

    public static Set<String> violations(ResourceGraph graph) {
        final Set<String> out = new TreeSet<>();
        for (DependencyEdge e : graph.danglingEdges()) {
            out.add("dangling edge " + e.key());
        }
        for (ResourceNode n : graph.nodes()) {
            for (PropertyValue v : n.properties().values()) {
                for (PropertyValue.Reference r : v.references()) {
                    if (graph.edge(n.id(), EdgeKind.DEPENDS_ON, r.targetId()).isEmpty()) {
                        out.add("reference " + n.id() + " -> " + r.targetId() + " has no edge");
                    }
                }
            }
        }
        for (List<String> cycle : GraphAlgorithms.cycles(graph, EdgeKind.CONTAINS)) {
            out.add("containment cycle " + cycle);
        }
        final Map<String, Integer> parents = new HashMap<>();
        for (DependencyEdge e : graph.edges()) {
            if (e.kind() == EdgeKind.CONTAINS && parents.merge(e.target(), 1, Integer::sum) == 2) {
                out.add("multiple parents of " + e.target());
            }
        }
        return out;
    }
}
