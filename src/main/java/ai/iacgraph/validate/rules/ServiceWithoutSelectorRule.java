package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

public final class ServiceWithoutSelectorRule implements ValidationRule {

    public static final String ID = "best-practice.service-without-selector";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (!n.type().equals("network.service")) {
                continue;
            }
            final PropertyValue spec = n.properties().get("spec");
            if ("ExternalName".equals(RuleSupport.text(RuleSupport.field(spec, "type")))) {
                continue;
            }
            final Optional<PropertyValue> selector = RuleSupport.field(spec, "selector");
            if (selector.isEmpty() || (selector.get() instanceof PropertyValue.MapValue m && m.entries().isEmpty())) {
                out.add(ValidationFinding.warning(ID, n.id(), "service has no selector and routes to no pods"));
            }
        }
        return out;
    }
}
