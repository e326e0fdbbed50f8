package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Literal credentials: string values under secret-looking keys, environment entries with a
 * secret-looking name, and well-known key formats anywhere. Secret objects are exempt.
 */
public final class HardcodedSecretRule implements ValidationRule {

    public static final String ID = "best-practice.hardcoded-secret";

    private static final Pattern SECRET_KEY = Pattern.compile(
            "(?i).*(password|passwd|secret|token|api[_-]?key|access[_-]?key|private[_-]?key|credentials?)$");
    private static final Pattern NOT_A_VALUE = Pattern.compile("(?i).*(name|arn|id|ref|file|path|length|version)$");
    private static final List<Pattern> KNOWN_FORMATS = List.of(
            Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"),
            Pattern.compile("-----BEGIN ([A-Z]+ )?PRIVATE KEY-----"),
            Pattern.compile("\\bgh[pousr]_[A-Za-z0-9]{36}\\b"));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (n.type().equals("config.secret")) {
                continue;
            }
            for (var p : n.properties().entrySet()) {
                scan(n.id(), p.getKey(), p.getKey(), p.getValue(), out);
            }
        }
        return out;
    }

    private static void scan(String subject, String path, String key, PropertyValue v, List<ValidationFinding> out) {
        if (v instanceof PropertyValue.Scalar s && s.value() instanceof String text && !text.isBlank()) {
            if (isSecretKey(key) && !isTemplated(text)) {
                out.add(ValidationFinding.error(ID, subject, "'" + path + "' holds a literal credential"));
                return;
            }
            for (Pattern p : KNOWN_FORMATS) {
                if (p.matcher(text).find()) {
                    out.add(ValidationFinding.error(ID, subject, "'" + path + "' contains what looks like a private key or access key"));
                    return;
                }
            }
        } else if (v instanceof PropertyValue.MapValue m) {
            final String name = RuleSupport.text(RuleSupport.field(m, "name", "Name"));
            final PropertyValue value = RuleSupport.field(m, "value", "Value").orElse(null);
            if (name != null && isSecretKey(name) && RuleSupport.text(value) != null
                    && !RuleSupport.text(value).isBlank() && !isTemplated(RuleSupport.text(value))) {
                out.add(ValidationFinding.error(ID, subject, "'" + path + "' sets " + name + " to a literal value"));
            }
            m.entries().forEach((k, i) -> scan(subject, path + "." + k, k, i, out));
        } else if (v instanceof PropertyValue.ListValue l) {
            for (int i = 0; i < l.items().size(); i++) {
                scan(subject, path + "[" + i + "]", key, l.items().get(i), out);
            }
        }
    }

    /**
     * Unresolved template text such as an Ansible vault lookup.
     */
    private static boolean isTemplated(String text) {
        return text.contains("{{") || text.contains("${");
    }

    private static boolean isSecretKey(String key) {
        return SECRET_KEY.matcher(key).matches() && !NOT_A_VALUE.matcher(key).matches();
    }
}
