package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Shell and command tasks that report a change on every run: no {@code creates},
 * {@code removes} or {@code changed_when}.
 */
public final class NonIdempotentCommandRule implements ValidationRule {

    public static final String ID = "best-practice.non-idempotent-command";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (!n.type().equals("host.command")) {
                continue;
            }
            if (n.property("creates").isEmpty() && n.property("removes").isEmpty()
                    && n.metadata().extension("changed_when") == null) {
                out.add(ValidationFinding.warning(ID, n.id(), "command runs on every play; add creates, removes or changed_when"));
            }
        }
        return out;
    }
}
