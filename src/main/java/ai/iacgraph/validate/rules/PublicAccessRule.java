package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Public bucket ACLs and publicly accessible databases.
 */
public final class PublicAccessRule implements ValidationRule {

    public static final String ID = "security.public-access";

    private static final Set<String> PUBLIC_ACLS = Set.of("public-read", "public-read-write", "publicread",
            "publicreadwrite", "authenticated-read", "authenticatedread");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (n.type().equals("storage.bucket")) {
                final String acl = RuleSupport.text(n.property("acl"));
                if (acl != null && PUBLIC_ACLS.contains(acl.toLowerCase(Locale.ROOT))) {
                    out.add(ValidationFinding.error(ID, n.id(), "bucket ACL '" + acl + "' grants public access"));
                }
            } else if (n.type().equals("database.instance") && RuleSupport.isTrue(n.property("publiclyAccessible"))) {
                out.add(ValidationFinding.error(ID, n.id(), "database is publicly accessible"));
            }
        }
        return out;
    }
}
