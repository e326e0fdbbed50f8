package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.PropertySchemas;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Taggable cloud resources without tags, workloads without labels.
 */
public final class MissingTagsRule implements ValidationRule {

    public static final String ID = "best-practice.missing-tags";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (PropertySchemas.forType(n.type()).spec("tags").isPresent() && isEmpty(n.properties().get("tags"))) {
                out.add(ValidationFinding.warning(ID, n.id(), "resource has no tags"));
            } else if (n.category().equals("workload") && isEmpty(n.properties().get("labels"))) {
                out.add(ValidationFinding.warning(ID, n.id(), "workload has no labels"));
            }
        }
        return out;
    }

    private static boolean isEmpty(PropertyValue v) {
        if (v == null || v.equals(PropertyValue.Scalar.NULL)) {
            return true;
        }
        return v instanceof PropertyValue.MapValue m && m.entries().isEmpty();
    }
}
