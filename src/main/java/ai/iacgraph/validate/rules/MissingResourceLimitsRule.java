package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

public final class MissingResourceLimitsRule implements ValidationRule {

    public static final String ID = "best-practice.missing-resource-limits";

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
                if (RuleSupport.path(containers.get(i), "resources", "limits").isEmpty()) {
                    out.add(ValidationFinding.warning(ID, n.id(), "container '"
                            + RuleSupport.containerName(containers.get(i), i) + "' has no resource limits"));
                }
            }
        }
        return out;
    }
}
