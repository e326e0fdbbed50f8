package ai.iacgraph.engine;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import ai.iacgraph.model.AdvisoryHint;
import ai.iacgraph.model.ResourceGraph;

/**
 * Optional collaborator that suggests advisory notes for graph nodes.
 * <p>
 * Implementations must return immediately. The orchestrator never waits on the future: hints that
 * are not available when they are needed, or whose future fails, are discarded. An empty list is
 * always a valid answer.
 */
@FunctionalInterface
public interface HintProvider {

    HintProvider NONE = graph -> CompletableFuture.completedFuture(List.of());

    /**
     * @param graph read-only snapshot of the normalized graph
     */
    CompletableFuture<List<AdvisoryHint>> requestHints(ResourceGraph graph);
}
