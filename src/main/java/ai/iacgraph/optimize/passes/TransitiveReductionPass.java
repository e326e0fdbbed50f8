package ai.iacgraph.optimize.passes;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.GraphAlgorithms;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.optimize.OptimizationChange;
import ai.iacgraph.optimize.OptimizationPass;

/**
 * Removes implicit ordering edges whose target stays reachable through another path, one at a
 * time. Edges carrying a user-authored dependency or a reference token are never removed.
 * Skipped entirely while the dependency graph has a cycle.
 */
public final class TransitiveReductionPass implements OptimizationPass {

    public static final String ID = "transitive-reduction";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<OptimizationChange> apply(ResourceGraph graph) {
        if (GraphAlgorithms.hasCycle(graph, EdgeKind.DEPENDS_ON)) {
            return List.of(OptimizationChange.skipped(ID, "dependency cycle",
                    "transitive reduction is undefined on a cyclic dependency graph"));
        }
        final Map<String, Set<String>> adj = GraphAlgorithms.adjacency(graph, EdgeKind.DEPENDS_ON);
        final List<OptimizationChange> changes = new ArrayList<>();
        for (DependencyEdge e : new ArrayList<>(graph.edges())) {
            if (e.kind() != EdgeKind.DEPENDS_ON || !removable(e) || !adj.containsKey(e.source())
                    || !adj.containsKey(e.target())) {
                continue;
            }
            if (GraphAlgorithms.reachableAvoidingDirect(adj, e.source(), e.target())) {
                graph.removeEdge(e);
                adj.get(e.source()).remove(e.target());
                changes.add(OptimizationChange.applied(ID, e.key(), "implied through another dependency path"));
            }
        }
        return changes;
    }

    private static boolean removable(DependencyEdge e) {
        return !e.hasOrigin(EdgeOrigin.EXPLICIT) && !e.hasOrigin(EdgeOrigin.REFERENCE) && !e.origins().isEmpty();
    }
}
