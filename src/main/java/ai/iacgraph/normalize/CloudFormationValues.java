package ai.iacgraph.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import ai.iacgraph.model.PropertyValue;

/**
 * CloudFormation intrinsics: {@code Ref}, {@code Fn::GetAtt} and the {@code ${...}} placeholders of
 * a {@code Fn::Sub} string become reference tokens. Pseudo parameters ({@code AWS::Region}) and
 * the other intrinsic functions stay as maps.
 */
final class CloudFormationValues extends ValueConverter {

    static final String PSEUDO_PREFIX = "AWS::";

    @Override
    protected PropertyValue map(Map<String, Object> m) {
        if (m.size() == 1) {
            final var e = m.entrySet().iterator().next();
            switch (e.getKey()) {
                case "Ref" -> {
                    if (e.getValue() instanceof String target && !target.isBlank() && !target.startsWith(PSEUDO_PREFIX)) {
                        return PropertyValue.Reference.to(target);
                    }
                }
                case "Fn::GetAtt" -> {
                    final PropertyValue.Reference ref = getAtt(e.getValue());
                    if (ref != null) {
                        return ref;
                    }
                }
                case "Fn::Sub" -> {
                    if (e.getValue() instanceof String s) {
                        return sub(s);
                    }
                }
                default -> {
                }
            }
        }
        return super.map(m);
    }

    private static PropertyValue.Reference getAtt(Object value) {
        if (value instanceof List<?> l && l.size() == 2 && l.get(0) instanceof String target
                && l.get(1) instanceof String attr) {
            return new PropertyValue.Reference(target, attr);
        }
        if (value instanceof String s && s.indexOf('.') > 0) {
            final int dot = s.indexOf('.');
            return new PropertyValue.Reference(s.substring(0, dot), s.substring(dot + 1));
        }
        return null;
    }

    /**
     * Splits a substitution string into literal text, references and pseudo parameters.
     */
    static PropertyValue sub(String s) {
        final List<PropertyValue> parts = new ArrayList<>();
        final StringBuilder lit = new StringBuilder();
        int i = 0;
        while (i < s.length()) {
            if (s.startsWith("${!", i)) {
                lit.append("${");
                i += 3;
                continue;
            }
            if (s.startsWith("${", i)) {
                final int end = s.indexOf('}', i + 2);
                if (end < 0) {
                    lit.append(s.substring(i));
                    break;
                }
                final String name = s.substring(i + 2, end).strip();
                if (lit.length() > 0) {
                    parts.add(PropertyValue.Scalar.of(lit.toString()));
                    lit.setLength(0);
                }
                parts.add(placeholder(name));
                i = end + 1;
                continue;
            }
            lit.append(s.charAt(i));
            i++;
        }
        if (lit.length() > 0) {
            parts.add(PropertyValue.Scalar.of(lit.toString()));
        }
        if (parts.size() == 1 && parts.get(0) instanceof PropertyValue.Reference r) {
            return r;
        }
        return template(parts);
    }

    private static PropertyValue placeholder(String name) {
        if (name.startsWith(PSEUDO_PREFIX)) {
            return new PropertyValue.Expression(List.of(PropertyValue.Scalar.of(name)));
        }
        final int dot = name.indexOf('.');
        return dot > 0
                ? new PropertyValue.Reference(name.substring(0, dot), name.substring(dot + 1))
                : PropertyValue.Reference.to(name);
    }
}
