package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.AnsibleMapper;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

public final class UnnamedTaskRule implements ValidationRule {

    public static final String ID = "best-practice.unnamed-task";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (!n.metadata().originatesFrom(Dialect.ANSIBLE) || n.type().equals("config.variable")
                    || n.metadata().extension(AnsibleMapper.SCOPE) == null) {
                continue;
            }
            final Object name = n.metadata().extension("name");
            if (name == null || String.valueOf(name).isBlank()) {
                out.add(ValidationFinding.warning(ID, n.id(), "task running " + n.metadata().nativeType() + " has no name"));
            }
        }
        return out;
    }
}
