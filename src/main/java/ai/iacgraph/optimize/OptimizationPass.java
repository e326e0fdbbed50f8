package ai.iacgraph.optimize;

import java.util.List;

import ai.iacgraph.model.ResourceGraph;

/**
 * A structure-preserving rewrite. The pass mutates the graph it is given (a private copy) and
 * reports what it changed; an empty list means the graph is already optimal for this pass.
 */
public interface OptimizationPass {

    String id();

    List<OptimizationChange> apply(ResourceGraph graph);
}
