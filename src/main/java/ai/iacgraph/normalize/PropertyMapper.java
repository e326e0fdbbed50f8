package ai.iacgraph.normalize;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.normalize.schema.PropertySchema;
import ai.iacgraph.normalize.schema.PropertySpec;
import ai.iacgraph.normalize.schema.ValueKind;

/**
 * Maps native attributes onto canonical properties through the type's property schema.
 * Values that do not fit the schema are kept as opaque metadata with a warning.
 */
public final class PropertyMapper {

    private final Dialect dialect;

    public PropertyMapper(Dialect dialect) {
        this.dialect = dialect;
    }

    public void map(NodeDraft draft, PropertySchema schema, Map<String, Object> attributes, Set<String> blockKeys,
                    ValueConverter values, GraphFragment out) {
        for (var e : attributes.entrySet()) {
            final String nativeName = e.getKey();
            final String canonical = schema.canonicalName(dialect, nativeName);
            if (draft.properties.containsKey(canonical)) {
                draft.opaque.put(nativeName, e.getValue());
                out.warn("schema-mismatch", draft.id, draft.source,
                        "'" + nativeName + "' collides with another attribute mapped to '" + canonical + "'");
                continue;
            }
            PropertyValue value = values.convert(e.getValue());
            final Optional<PropertySpec> spec = schema.spec(canonical);
            if (spec.isPresent()) {
                final Optional<PropertyValue> coerced = coerce(spec.get().kind(), value);
                if (coerced.isEmpty()) {
                    draft.opaque.put(nativeName, e.getValue());
                    out.warn("schema-mismatch", draft.id, draft.source,
                            "'" + nativeName + "' is not a valid " + spec.get().kind().name().toLowerCase(Locale.ROOT)
                                    + " value; kept as opaque metadata");
                    continue;
                }
                value = coerced.get();
            }
            if (!schema.nativeName(dialect, canonical).equals(nativeName)) {
                draft.nativeNames.put(canonical, nativeName);
            }
            if (blockKeys.contains(nativeName)) {
                draft.blockProperties.add(canonical);
            }
            draft.properties.put(canonical, value);
        }
    }

    /**
     * Value in the canonical shape for {@code kind}, empty when it does not fit. References,
     * templates and expressions fit every kind.
     */
    Optional<PropertyValue> coerce(ValueKind kind, PropertyValue value) {
        if (value instanceof PropertyValue.Reference || value instanceof PropertyValue.Template
                || value instanceof PropertyValue.Expression) {
            return Optional.of(value);
        }
        if (value instanceof PropertyValue.Scalar s && s.value() == null) {
            return Optional.of(value);
        }
        return switch (kind) {
            case ANY -> Optional.of(value);
            case STRING -> value instanceof PropertyValue.Scalar s
                    ? Optional.of(s.isString() ? s : PropertyValue.Scalar.of(s.asText()))
                    : Optional.empty();
            case NUMBER -> number(value);
            case BOOLEAN -> bool(value);
            case LIST -> value instanceof PropertyValue.ListValue ? Optional.of(value) : Optional.empty();
            case MAP -> value instanceof PropertyValue.MapValue ? Optional.of(value) : Optional.empty();
            case TAGS -> tags(value);
        };
    }

    private static Optional<PropertyValue> number(PropertyValue value) {
        if (!(value instanceof PropertyValue.Scalar s)) {
            return Optional.empty();
        }
        if (s.value() instanceof Number) {
            return Optional.of(s);
        }
        if (s.value() instanceof String str) {
            try {
                return Optional.of(PropertyValue.Scalar.of(Long.parseLong(str.trim())));
            } catch (NumberFormatException ex) {
                try {
                    return Optional.of(PropertyValue.Scalar.of(new BigDecimal(str.trim())));
                } catch (NumberFormatException ignored) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<PropertyValue> bool(PropertyValue value) {
        if (!(value instanceof PropertyValue.Scalar s)) {
            return Optional.empty();
        }
        if (s.value() instanceof Boolean) {
            return Optional.of(s);
        }
        if (s.value() instanceof String str) {
            final String t = str.trim().toLowerCase(Locale.ROOT);
            if (t.equals("true") || t.equals("false")) {
                return Optional.of(PropertyValue.Scalar.of(Boolean.parseBoolean(t)));
            }
        }
        return Optional.empty();
    }

    /**
     * A map as is; in CloudFormation also a list of {@code {Key, Value}} pairs.
     */
    private Optional<PropertyValue> tags(PropertyValue value) {
        if (value instanceof PropertyValue.MapValue) {
            return Optional.of(value);
        }
        if (dialect != Dialect.CLOUDFORMATION || !(value instanceof PropertyValue.ListValue list)) {
            return Optional.empty();
        }
        final Map<String, PropertyValue> tags = new LinkedHashMap<>();
        for (PropertyValue item : list.items()) {
            if (!(item instanceof PropertyValue.MapValue pair) || pair.entries().size() != 2
                    || !(pair.entries().get("Key") instanceof PropertyValue.Scalar key) || !key.isString()
                    || !pair.entries().containsKey("Value")) {
                return Optional.empty();
            }
            tags.put(key.asText(), pair.entries().get("Value"));
        }
        return Optional.of(new PropertyValue.MapValue(tags));
    }
}
