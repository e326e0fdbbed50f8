package ai.iacgraph.emit.yaml;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.RawExpression;

/**
 * Turns typed property values back into the plain values a YAML dialect serializes. Subclasses
 * decide how references, templates and expressions are spelled.
 */
public abstract class YamlValues {

    public Object plain(PropertyValue value) {
        if (value instanceof PropertyValue.Scalar s) {
            return s.value();
        }
        if (value instanceof PropertyValue.ListValue l) {
            final List<Object> items = new ArrayList<>(l.items().size());
            l.items().forEach(i -> items.add(plain(i)));
            return items;
        }
        if (value instanceof PropertyValue.MapValue m) {
            final Map<String, Object> entries = new LinkedHashMap<>();
            m.entries().forEach((k, v) -> entries.put(k, plain(v)));
            return entries;
        }
        if (value instanceof PropertyValue.Reference r) {
            return reference(r);
        }
        if (value instanceof PropertyValue.Template t) {
            return template(t);
        }
        return expression((PropertyValue.Expression) value);
    }

    protected abstract Object reference(PropertyValue.Reference ref);

    protected abstract Object template(PropertyValue.Template template);

    protected abstract Object expression(PropertyValue.Expression expression);

    /**
     * Raw dialect value with expression tokens flattened to their text.
     */
    public static Object raw(Object value) {
        if (value instanceof RawExpression r) {
            return r.text();
        }
        if (value instanceof List<?> l) {
            final List<Object> items = new ArrayList<>(l.size());
            l.forEach(i -> items.add(raw(i)));
            return items;
        }
        if (value instanceof Map<?, ?> m) {
            final Map<String, Object> entries = new LinkedHashMap<>();
            m.forEach((k, v) -> entries.put(String.valueOf(k), raw(v)));
            return entries;
        }
        return value;
    }
}
