package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

public final class PrivilegedContainerRule implements ValidationRule {

    public static final String ID = "security.privileged-container";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            final List<PropertyValue.MapValue> containers = RuleSupport.containers(n);
            for (int i = 0; i < containers.size(); i++) {
                final PropertyValue.MapValue c = containers.get(i);
                if (RuleSupport.isTrue(RuleSupport.path(c, "securityContext", "privileged"))) {
                    out.add(ValidationFinding.error(ID, n.id(),
                            "container '" + RuleSupport.containerName(c, i) + "' runs privileged"));
                }
            }
        }
        return out;
    }
}
