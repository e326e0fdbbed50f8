package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

public final class UnknownTypeRule implements ValidationRule {

    public static final String ID = "structural.unknown-type";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (n.isUnknownType()) {
                out.add(ValidationFinding.info(ID, n.id(), "type '"
                        + n.type().substring(ResourceNode.UNKNOWN_PREFIX.length())
                        + "' has no canonical mapping; kept verbatim"));
            }
        }
        return out;
    }
}
