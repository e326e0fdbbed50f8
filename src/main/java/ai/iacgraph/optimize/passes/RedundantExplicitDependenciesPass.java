package ai.iacgraph.optimize.passes;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.optimize.OptimizationChange;
import ai.iacgraph.optimize.OptimizationPass;

/**
 * Drops the explicit origin of depends-on edges already carried by a reference token. The edge
 * itself stays.
 */
public final class RedundantExplicitDependenciesPass implements OptimizationPass {

    public static final String ID = "redundant-explicit-dependencies";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<OptimizationChange> apply(ResourceGraph graph) {
        final List<OptimizationChange> changes = new ArrayList<>();
        for (DependencyEdge e : new ArrayList<>(graph.edges())) {
            if (e.kind() == EdgeKind.DEPENDS_ON && e.hasOrigin(EdgeOrigin.EXPLICIT) && e.hasOrigin(EdgeOrigin.REFERENCE)) {
                final EnumSet<EdgeOrigin> origins = EnumSet.copyOf(e.origins());
                origins.remove(EdgeOrigin.EXPLICIT);
                graph.replaceEdge(e.withOrigins(origins));
                changes.add(OptimizationChange.applied(ID, e.key(), "explicit dependency already implied by a reference"));
            }
        }
        return changes;
    }
}
