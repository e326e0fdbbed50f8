package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * IAM statements that allow every action or trust every principal. Policy documents may be
 * structured values or JSON strings; computed documents are matched textually.
 */
public final class WildcardPolicyRule implements ValidationRule {

    public static final String ID = "security.wildcard-policy";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern TEXTUAL_WILDCARD = Pattern.compile("\"?Action\"?\\s*[:=]\\s*\\[?\\s*\"\\*\"");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (!n.category().equals("identity")) {
                continue;
            }
            for (var p : n.properties().entrySet()) {
                final JsonNode doc = toJson(p.getValue());
                if (doc != null) {
                    statements(doc, n.id(), p.getKey(), out);
                } else if (p.getValue() instanceof PropertyValue.Expression e
                        && TEXTUAL_WILDCARD.matcher(e.text(id -> id)).find()) {
                    out.add(ValidationFinding.error(ID, n.id(), "'" + p.getKey() + "' allows every action"));
                }
            }
        }
        return out;
    }

    private static void statements(JsonNode node, String subject, String property, List<ValidationFinding> out) {
        if (node.isArray()) {
            node.forEach(n -> statements(n, subject, property, out));
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if ("Allow".equals(node.path("Effect").asText())) {
            if (containsStar(node.get("Action"))) {
                out.add(ValidationFinding.error(ID, subject, "'" + property + "' allows every action"
                        + (containsStar(node.get("Resource")) ? " on every resource" : "")));
            }
            final JsonNode principal = node.get("Principal");
            if (containsStar(principal) || (principal != null && containsStar(principal.get("AWS")))) {
                out.add(ValidationFinding.error(ID, subject, "'" + property + "' trusts any principal"));
            }
        }
        node.fields().forEachRemaining(f -> {
            if (f.getValue().isContainerNode()) {
                statements(f.getValue(), subject, property, out);
            }
        });
    }

    private static boolean containsStar(JsonNode n) {
        if (n == null) {
            return false;
        }
        if (n.isArray()) {
            for (JsonNode i : n) {
                if ("*".equals(i.asText())) {
                    return true;
                }
            }
            return false;
        }
        return "*".equals(n.asText());
    }

    /**
     * Structured values as a JSON tree; strings parsed when they hold a JSON document; null for
     * anything else.
     */
    static JsonNode toJson(PropertyValue v) {
        if (v instanceof PropertyValue.Scalar s && s.value() instanceof String str) {
            final String t = str.strip();
            if (!t.startsWith("{") && !t.startsWith("[")) {
                return null;
            }
            try {
                return JSON.readTree(t);
            } catch (JsonProcessingException ex) {
                return null;
            }
        }
        if (v instanceof PropertyValue.MapValue || v instanceof PropertyValue.ListValue) {
            return tree(v);
        }
        return null;
    }

    private static JsonNode tree(PropertyValue v) {
        final JsonNodeFactory f = JsonNodeFactory.instance;
        if (v instanceof PropertyValue.MapValue m) {
            final ObjectNode o = f.objectNode();
            m.entries().forEach((k, i) -> o.set(k, tree(i)));
            return o;
        }
        if (v instanceof PropertyValue.ListValue l) {
            final ArrayNode a = f.arrayNode();
            l.items().forEach(i -> a.add(tree(i)));
            return a;
        }
        if (v instanceof PropertyValue.Scalar s) {
            return s.value() == null ? f.nullNode() : f.textNode(s.asText());
        }
        return f.textNode("");
    }
}
