package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.GraphAlgorithms;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Contains edges must form a forest.
 */
public final class ContainmentCycleRule implements ValidationRule {

    public static final String ID = "structural.containment-cycle";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (List<String> cycle : GraphAlgorithms.cycles(graph, EdgeKind.CONTAINS)) {
            out.add(ValidationFinding.error(ID, cycle.get(0), "containment cycle between " + String.join(", ", cycle)));
        }
        return out;
    }
}
