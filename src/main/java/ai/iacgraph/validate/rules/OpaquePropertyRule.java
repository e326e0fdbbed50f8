package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

public final class OpaquePropertyRule implements ValidationRule {

    public static final String ID = "structural.opaque-property";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            for (String name : n.metadata().opaqueProperties().keySet()) {
                out.add(ValidationFinding.warning(ID, n.id(),
                        "'" + name + "' did not match the " + n.type() + " schema and is carried as opaque metadata"));
            }
        }
        return out;
    }
}
