package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Edges and reference tokens whose target is not in the graph.
 */
public final class DanglingReferenceRule implements ValidationRule {

    public static final String ID = "structural.dangling-reference";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final Set<String> seen = new TreeSet<>();
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            for (var p : n.properties().entrySet()) {
                for (PropertyValue.Reference r : p.getValue().references()) {
                    if (!graph.hasNode(r.targetId()) && seen.add(n.id() + " " + r.targetId())) {
                        out.add(ValidationFinding.error(ID, n.id(),
                                "property '" + p.getKey() + "' references undeclared '" + r.targetId() + "'"));
                    }
                }
            }
        }
        for (DependencyEdge e : graph.danglingEdges()) {
            if (graph.hasNode(e.source()) && seen.add(e.source() + " " + e.target())) {
                out.add(ValidationFinding.error(ID, e.source(), "depends on undeclared '" + e.target() + "'"));
            } else if (!graph.hasNode(e.source()) && seen.add(e.source() + " " + e.target())) {
                out.add(ValidationFinding.error(ID, e.key(), "edge source '" + e.source() + "' is not declared"));
            }
        }
        return out;
    }
}
