package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Container images without a tag or digest, or tagged {@code latest}.
 */
public final class UnpinnedImageRule implements ValidationRule {

    public static final String ID = "best-practice.unpinned-image";

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
                final String image = RuleSupport.text(RuleSupport.field(containers.get(i), "image"));
                if (image != null && !isPinned(image)) {
                    out.add(ValidationFinding.warning(ID, n.id(), "container '"
                            + RuleSupport.containerName(containers.get(i), i) + "' uses unpinned image '" + image + "'"));
                }
            }
        }
        return out;
    }

    static boolean isPinned(String image) {
        if (image.contains("@sha256:")) {
            return true;
        }
        final String last = image.substring(image.lastIndexOf('/') + 1);
        final int colon = last.indexOf(':');
        return colon > 0 && !last.substring(colon + 1).equals("latest");
    }
}
