package ai.iacgraph.optimize;

import java.util.List;

import ai.iacgraph.model.ResourceGraph;

public record OptimizationResult(ResourceGraph graph, List<OptimizationChange> changes) {

    public OptimizationResult {
        changes = List.copyOf(changes);
    }

    public long appliedCount() {
        return changes.stream().filter(OptimizationChange::isApplied).count();
    }

    public boolean anySkipped() {
        return changes.stream().anyMatch(c -> !c.isApplied());
    }
}
