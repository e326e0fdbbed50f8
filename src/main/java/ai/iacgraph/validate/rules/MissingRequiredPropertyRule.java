package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.PropertySchemas;
import ai.iacgraph.normalize.schema.PropertySpec;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Required schema properties that are absent or null.
 */
public final class MissingRequiredPropertyRule implements ValidationRule {

    public static final String ID = "structural.missing-required-property";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            for (PropertySpec spec : PropertySchemas.forType(n.type()).required()) {
                final PropertyValue v = n.properties().get(spec.name());
                if (v == null || v.equals(PropertyValue.Scalar.NULL)) {
                    out.add(ValidationFinding.error(ID, n.id(),
                            n.type() + " requires property '" + spec.name() + "'"));
                }
            }
        }
        return out;
    }
}
