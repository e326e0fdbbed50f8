package ai.iacgraph.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed value of a canonical resource property.
 * <p>
 * Cross-resource references only ever appear as {@link Reference} tokens, either directly or as
 * parts of a {@link Template} / {@link Expression}.
 */
public sealed interface PropertyValue
        permits PropertyValue.Scalar,
        PropertyValue.ListValue,
        PropertyValue.MapValue,
        PropertyValue.Reference,
        PropertyValue.Template,
        PropertyValue.Expression {

    /**
     * String, Long, BigDecimal, Boolean or null. Integral numbers that fit a long are Longs; every
     * other number is an exact BigDecimal without trailing zeros.
     */
    record Scalar(Object value) implements PropertyValue {

        public static final Scalar NULL = new Scalar(null);

        public Scalar {
            value = normalize(value);
        }

        public static Scalar of(Object value) {
            return value == null ? NULL : new Scalar(value);
        }

        public boolean isString() {
            return value instanceof String;
        }

        public String asText() {
            return value == null ? "" : String.valueOf(value);
        }

        private static Object normalize(Object v) {
            if (v == null || v instanceof String || v instanceof Boolean || v instanceof Long) {
                return v;
            }
            if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
                return ((Number) v).longValue();
            }
            if (v instanceof BigInteger bi) {
                return exact(new BigDecimal(bi));
            }
            if (v instanceof BigDecimal bd) {
                return exact(bd);
            }
            if (v instanceof Double || v instanceof Float) {
                final double d = ((Number) v).doubleValue();
                return Double.isFinite(d) ? exact(new BigDecimal(Double.toString(d))) : String.valueOf(v);
            }
            return String.valueOf(v);
        }

        private static Object exact(BigDecimal bd) {
            if (bd.signum() == 0) {
                return 0L;
            }
            final BigDecimal stripped = bd.stripTrailingZeros();
            if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() <= 19) {
                try {
                    return stripped.longValueExact();
                } catch (ArithmeticException ex) {
                    return stripped;
                }
            }
            return stripped;
        }

        /**
         * Decimal text of a number without exponent, e.g. {@code 0.000001} or {@code 1500}.
         */
        public static String numberText(Number n) {
            return n instanceof BigDecimal bd ? bd.toPlainString() : String.valueOf(n);
        }
    }

    record ListValue(List<PropertyValue> items) implements PropertyValue {
        public ListValue {
            items = List.copyOf(items);
        }
    }

    /**
     * Insertion-ordered map of nested values. Keys are kept verbatim.
     */
    record MapValue(Map<String, PropertyValue> entries) implements PropertyValue {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    /**
     * Typed reference token. {@code attribute} is the dotted attribute path on the target, or null.
     */
    record Reference(String targetId, String attribute) implements PropertyValue {
        public Reference {
            Objects.requireNonNull(targetId, "targetId");
            if (attribute != null && attribute.isBlank()) {
                attribute = null;
            }
        }

        public static Reference to(String targetId) {
            return new Reference(targetId, null);
        }

        /**
         * {@code base} followed by the attribute path; index segments attach without a dot.
         */
        public String render(String base) {
            if (attribute == null) {
                return base;
            }
            return attribute.startsWith("[") ? base + attribute : base + "." + attribute;
        }
    }

    /**
     * String with embedded references. Parts are string scalars (literal text), references and
     * expressions (interpolated computations).
     */
    record Template(List<PropertyValue> parts) implements PropertyValue {
        public Template {
            parts = List.copyOf(parts);
        }
    }

    /**
     * Native computed expression. Parts are string scalars (source text) or references.
     */
    record Expression(List<PropertyValue> parts) implements PropertyValue {
        public Expression {
            parts = List.copyOf(parts);
        }

        public String text(UnaryOperator<String> refRenderer) {
            final StringBuilder sb = new StringBuilder();
            for (PropertyValue p : parts) {
                if (p instanceof Reference r) {
                    sb.append(r.render(refRenderer.apply(r.targetId())));
                } else if (p instanceof Scalar s) {
                    sb.append(s.asText());
                }
            }
            return sb.toString();
        }
    }

    /**
     * All reference tokens inside this value, depth first.
     */
    default List<Reference> references() {
        final List<Reference> out = new ArrayList<>();
        collectReferences(this, out);
        return out;
    }

    /**
     * Copy of this value with every reference token passed through {@code mapper}.
     */
    default PropertyValue mapReferences(UnaryOperator<Reference> mapper) {
        return rewrite(this, mapper);
    }

    private static void collectReferences(PropertyValue v, List<Reference> out) {
        if (v instanceof Reference r) {
            out.add(r);
        } else if (v instanceof ListValue l) {
            l.items().forEach(i -> collectReferences(i, out));
        } else if (v instanceof MapValue m) {
            m.entries().values().forEach(i -> collectReferences(i, out));
        } else if (v instanceof Template t) {
            t.parts().forEach(i -> collectReferences(i, out));
        } else if (v instanceof Expression e) {
            e.parts().forEach(i -> collectReferences(i, out));
        }
    }

    private static PropertyValue rewrite(PropertyValue v, UnaryOperator<Reference> mapper) {
        if (v instanceof Reference r) {
            return mapper.apply(r);
        }
        if (v instanceof ListValue l) {
            final List<PropertyValue> items = new ArrayList<>(l.items().size());
            l.items().forEach(i -> items.add(rewrite(i, mapper)));
            return new ListValue(items);
        }
        if (v instanceof MapValue m) {
            final Map<String, PropertyValue> entries = new LinkedHashMap<>();
            m.entries().forEach((k, i) -> entries.put(k, rewrite(i, mapper)));
            return new MapValue(entries);
        }
        if (v instanceof Template t) {
            final List<PropertyValue> parts = new ArrayList<>(t.parts().size());
            t.parts().forEach(i -> parts.add(rewrite(i, mapper)));
            return new Template(parts);
        }
        if (v instanceof Expression e) {
            final List<PropertyValue> parts = new ArrayList<>(e.parts().size());
            e.parts().forEach(i -> parts.add(rewrite(i, mapper)));
            return new Expression(parts);
        }
        return v;
    }
}
