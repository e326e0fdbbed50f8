package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Variables and outputs without a description. Playbook vars cannot carry one and are skipped.
 */
public final class MissingDescriptionRule implements ValidationRule {

    public static final String ID = "best-practice.missing-description";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (!n.type().equals("config.variable") && !n.type().equals("config.output")) {
                continue;
            }
            if (n.metadata().originatesFrom(Dialect.ANSIBLE)) {
                continue;
            }
            final String d = RuleSupport.text(n.property("description"));
            if (d == null || d.isBlank()) {
                out.add(ValidationFinding.info(ID, n.id(), n.type().substring("config.".length()) + " has no description"));
            }
        }
        return out;
    }
}
