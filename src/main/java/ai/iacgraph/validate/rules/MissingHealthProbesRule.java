package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Long-running workload containers without liveness or readiness probes. Jobs are exempt.
 */
public final class MissingHealthProbesRule implements ValidationRule {

    public static final String ID = "best-practice.missing-health-probes";

    private static final Set<String> LONG_RUNNING = Set.of(
            "workload.deployment", "workload.statefulset", "workload.daemonset");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (!LONG_RUNNING.contains(n.type())) {
                continue;
            }
            final List<PropertyValue.MapValue> containers = RuleSupport.containers(n, false);
            for (int i = 0; i < containers.size(); i++) {
                final PropertyValue.MapValue c = containers.get(i);
                final boolean liveness = RuleSupport.field(c, "livenessProbe").isPresent();
                final boolean readiness = RuleSupport.field(c, "readinessProbe").isPresent();
                if (!liveness || !readiness) {
                    out.add(ValidationFinding.info(ID, n.id(), "container '" + RuleSupport.containerName(c, i)
                            + "' has no " + (liveness ? "readiness" : readiness ? "liveness" : "liveness or readiness")
                            + " probe"));
                }
            }
        }
        return out;
    }
}
