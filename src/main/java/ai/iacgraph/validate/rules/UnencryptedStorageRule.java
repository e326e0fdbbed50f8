package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Volumes, databases and buckets without encryption at rest.
 */
public final class UnencryptedStorageRule implements ValidationRule {

    public static final String ID = "security.unencrypted-storage";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            switch (n.type()) {
                case "storage.volume" -> {
                    if (!RuleSupport.isTrue(n.property("encrypted"))) {
                        out.add(ValidationFinding.warning(ID, n.id(), "volume is not encrypted"));
                    }
                }
                case "database.instance" -> {
                    if (!RuleSupport.isTrue(n.property("storageEncrypted"))) {
                        out.add(ValidationFinding.warning(ID, n.id(), "database storage is not encrypted"));
                    }
                }
                case "storage.bucket" -> {
                    if (n.property("encryption").isEmpty()) {
                        out.add(ValidationFinding.warning(ID, n.id(), "bucket has no server-side encryption configuration"));
                    }
                }
                default -> {
                }
            }
        }
        return out;
    }
}
