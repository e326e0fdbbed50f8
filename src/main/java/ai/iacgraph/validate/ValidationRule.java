package ai.iacgraph.validate;

import java.util.List;

import ai.iacgraph.model.ResourceGraph;

/**
 * A single, stateless check over a read-only graph. Implementations must not mutate the graph
 * and may be evaluated concurrently with other rules.
 */
public interface ValidationRule {

    String id();

    List<ValidationFinding> evaluate(ResourceGraph graph);
}
