package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceNode;

/**
 * Value lookups shared by the rules. Nested map keys keep their native spelling, so lookups accept
 * several spellings of the same field.
 */
final class RuleSupport {

    private RuleSupport() {
    }

    /**
     * First of {@code keys} present in the map.
     */
    static Optional<PropertyValue> field(PropertyValue value, String... keys) {
        if (value instanceof PropertyValue.MapValue m) {
            for (String k : keys) {
                final PropertyValue v = m.entries().get(k);
                if (v != null) {
                    return Optional.of(v);
                }
            }
        }
        return Optional.empty();
    }

    static Optional<PropertyValue> path(PropertyValue value, String... keys) {
        PropertyValue cur = value;
        for (String k : keys) {
            final Optional<PropertyValue> next = field(cur, k);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            cur = next.get();
        }
        return Optional.of(cur);
    }

    /**
     * Literal text of a scalar, null for anything else.
     */
    static String text(PropertyValue value) {
        return value instanceof PropertyValue.Scalar s && s.value() != null ? s.asText() : null;
    }

    static String text(Optional<PropertyValue> value) {
        return value.map(RuleSupport::text).orElse(null);
    }

    static boolean isTrue(Optional<PropertyValue> value) {
        final String t = text(value);
        return t != null && t.equalsIgnoreCase("true");
    }

    /**
     * Items of a list, or the value itself when it is not a list.
     */
    static List<PropertyValue> items(PropertyValue value) {
        if (value instanceof PropertyValue.ListValue l) {
            return l.items();
        }
        return value == null ? List.of() : List.of(value);
    }

    /**
     * Containers (init containers included) anywhere under a workload's {@code spec}, pod templates
     * and cron job templates included.
     */
    static List<PropertyValue.MapValue> containers(ResourceNode node) {
        return containers(node, true);
    }

    static List<PropertyValue.MapValue> containers(ResourceNode node, boolean includeInit) {
        final List<PropertyValue.MapValue> out = new ArrayList<>();
        node.property("spec").ifPresent(spec -> collectContainers(spec, includeInit, out));
        return out;
    }

    private static void collectContainers(PropertyValue v, boolean includeInit, List<PropertyValue.MapValue> out) {
        if (v instanceof PropertyValue.MapValue m) {
            for (var e : m.entries().entrySet()) {
                if (e.getKey().equals("initContainers") && !includeInit) {
                    continue;
                }
                if (e.getKey().equals("containers") || e.getKey().equals("initContainers")) {
                    for (PropertyValue c : items(e.getValue())) {
                        if (c instanceof PropertyValue.MapValue cm) {
                            out.add(cm);
                        }
                    }
                } else {
                    collectContainers(e.getValue(), includeInit, out);
                }
            }
        } else if (v instanceof PropertyValue.ListValue l) {
            l.items().forEach(i -> collectContainers(i, includeInit, out));
        }
    }

    static String containerName(PropertyValue.MapValue container, int index) {
        final String name = text(field(container, "name"));
        return name == null ? "#" + index : name;
    }
}
