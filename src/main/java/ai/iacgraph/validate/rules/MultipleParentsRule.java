package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

public final class MultipleParentsRule implements ValidationRule {

    public static final String ID = "structural.multiple-parents";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final Map<String, List<String>> parents = new TreeMap<>();
        for (DependencyEdge e : graph.edges()) {
            if (e.kind() == EdgeKind.CONTAINS && graph.hasNode(e.source())) {
                parents.computeIfAbsent(e.target(), k -> new ArrayList<>()).add(e.source());
            }
        }
        final List<ValidationFinding> out = new ArrayList<>();
        parents.forEach((child, owners) -> {
            if (owners.size() > 1) {
                out.add(ValidationFinding.error(ID, child, "contained by " + String.join(", ", owners)));
            }
        });
        return out;
    }
}
