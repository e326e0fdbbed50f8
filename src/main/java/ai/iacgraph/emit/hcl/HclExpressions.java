package ai.iacgraph.emit.hcl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.parse.hcl.HclStrings;

/**
 * Renders typed property values as HCL expressions.
 */
public final class HclExpressions {

    private static final int INLINE_LIMIT = 80;
    private static final String INDENT = "  ";

    private final Function<PropertyValue.Reference, Optional<String>> references;
    private final boolean nativeExpressions;

    /**
     * @param references        full address of a reference, attribute included; empty when the
     *                          target cannot be addressed
     * @param nativeExpressions whether expression text is HCL; foreign expressions are written as
     *                          string literals
     */
    public HclExpressions(Function<PropertyValue.Reference, Optional<String>> references,
                          boolean nativeExpressions) {
        this.references = references;
        this.nativeExpressions = nativeExpressions;
    }

    public String render(PropertyValue value, int depth) {
        if (value instanceof PropertyValue.Scalar s) {
            return scalar(s);
        }
        if (value instanceof PropertyValue.Reference r) {
            return references.apply(r)
                    .orElseGet(() -> HclStrings.quote(HclStrings.escapeTemplates(r.render(r.targetId()))));
        }
        if (value instanceof PropertyValue.Template t) {
            return HclStrings.quote(template(t.parts()));
        }
        if (value instanceof PropertyValue.Expression e) {
            return nativeExpressions ? expression(e) : HclStrings.quote(template(e.parts()));
        }
        if (value instanceof PropertyValue.ListValue l) {
            return list(l, depth);
        }
        return map((PropertyValue.MapValue) value, depth);
    }

    private static String scalar(PropertyValue.Scalar s) {
        if (s.value() == null) {
            return "null";
        }
        if (s.value() instanceof String str) {
            return HclStrings.quote(HclStrings.escapeTemplates(str));
        }
        if (s.value() instanceof Number n) {
            return PropertyValue.Scalar.numberText(n);
        }
        return String.valueOf(s.value());
    }

    /**
     * Template body without the surrounding quotes; escapes are applied later by quoting.
     */
    private String template(List<PropertyValue> parts) {
        final StringBuilder sb = new StringBuilder();
        for (PropertyValue p : parts) {
            if (p instanceof PropertyValue.Scalar s) {
                sb.append(HclStrings.escapeTemplates(s.asText()));
            } else if (p instanceof PropertyValue.Reference r) {
                final Optional<String> address = references.apply(r);
                if (address.isPresent()) {
                    sb.append("${").append(address.get()).append('}');
                } else {
                    sb.append(HclStrings.escapeTemplates(r.render(r.targetId())));
                }
            } else if (p instanceof PropertyValue.Expression e) {
                if (nativeExpressions) {
                    sb.append("${").append(expression(e)).append('}');
                } else {
                    sb.append(template(e.parts()));
                }
            } else {
                sb.append("${").append(render(p, 0)).append('}');
            }
        }
        return sb.toString();
    }

    private String expression(PropertyValue.Expression e) {
        final StringBuilder sb = new StringBuilder();
        for (PropertyValue p : e.parts()) {
            if (p instanceof PropertyValue.Reference r) {
                sb.append(render(r, 0));
            } else if (p instanceof PropertyValue.Scalar s) {
                sb.append(s.asText());
            }
        }
        return sb.toString();
    }

    private String list(PropertyValue.ListValue l, int depth) {
        if (l.items().isEmpty()) {
            return "[]";
        }
        final List<String> items = new ArrayList<>();
        boolean simple = true;
        for (PropertyValue i : l.items()) {
            final String text = render(i, depth + 1);
            simple &= !text.contains("\n");
            items.add(text);
        }
        final String inline = "[" + String.join(", ", items) + "]";
        if (simple && inline.length() <= INLINE_LIMIT) {
            return inline;
        }
        final String pad = INDENT.repeat(depth + 1);
        final StringBuilder sb = new StringBuilder("[\n");
        for (String i : items) {
            sb.append(pad).append(i).append(",\n");
        }
        return sb.append(INDENT.repeat(depth)).append(']').toString();
    }

    private String map(PropertyValue.MapValue m, int depth) {
        if (m.entries().isEmpty()) {
            return "{}";
        }
        final String pad = INDENT.repeat(depth + 1);
        final StringBuilder sb = new StringBuilder("{\n");
        m.entries().forEach((k, v) ->
                sb.append(pad).append(HclWriter.key(k)).append(" = ").append(render(v, depth + 1)).append('\n'));
        return sb.append(INDENT.repeat(depth)).append('}').toString();
    }
}
