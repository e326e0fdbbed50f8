package ai.iacgraph.normalize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.RawExpression;

/**
 * Converts raw dialect values into typed property values. Subclasses recognize their dialect's
 * reference syntax in strings, expressions and maps.
 */
public abstract class ValueConverter {

    public PropertyValue convert(Object raw) {
        if (raw instanceof Map<?, ?> m) {
            final Map<String, Object> map = new LinkedHashMap<>();
            m.forEach((k, v) -> map.put(String.valueOf(k), v));
            return map(map);
        }
        if (raw instanceof List<?> l) {
            final List<PropertyValue> items = new ArrayList<>(l.size());
            l.forEach(i -> items.add(convert(i)));
            return new PropertyValue.ListValue(items);
        }
        if (raw instanceof RawExpression e) {
            return expression(e);
        }
        if (raw instanceof String s) {
            return string(s);
        }
        return PropertyValue.Scalar.of(raw);
    }

    protected PropertyValue string(String s) {
        return PropertyValue.Scalar.of(s);
    }

    protected PropertyValue expression(RawExpression e) {
        return new PropertyValue.Expression(List.of(PropertyValue.Scalar.of(e.text())));
    }

    protected PropertyValue map(Map<String, Object> m) {
        final Map<String, PropertyValue> entries = new LinkedHashMap<>();
        m.forEach((k, v) -> entries.put(k, convert(v)));
        return new PropertyValue.MapValue(entries);
    }

    /**
     * Merges adjacent literal parts. Without any dynamic part the result is a plain string.
     */
    protected static PropertyValue template(List<PropertyValue> parts) {
        final List<PropertyValue> merged = new ArrayList<>();
        final StringBuilder text = new StringBuilder();
        boolean anyDynamic = false;
        for (PropertyValue p : parts) {
            if (p instanceof PropertyValue.Scalar s) {
                text.append(s.asText());
                continue;
            }
            anyDynamic = true;
            if (text.length() > 0) {
                merged.add(PropertyValue.Scalar.of(text.toString()));
                text.setLength(0);
            }
            merged.add(p);
        }
        if (text.length() > 0) {
            merged.add(PropertyValue.Scalar.of(text.toString()));
        }
        if (!anyDynamic) {
            return PropertyValue.Scalar.of(merged.isEmpty() ? "" : ((PropertyValue.Scalar) merged.get(0)).asText());
        }
        return new PropertyValue.Template(merged);
    }
}
