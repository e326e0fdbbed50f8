package ai.iacgraph.normalize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.iacgraph.model.Ids;
import ai.iacgraph.model.PropertyValue;

/**
 * Manifest values. Object names at well-known keys become references when an object of the
 * expected kind is declared in the same namespace; any other name stays a plain string.
 */
final class KubernetesValues extends ValueConverter {

    private final SymbolTable symbols;
    private final String namespace;

    KubernetesValues(SymbolTable symbols, String namespace) {
        this.symbols = symbols;
        this.namespace = namespace;
    }

    @Override
    public PropertyValue convert(Object raw) {
        return value("", raw);
    }

    private PropertyValue value(String key, Object raw) {
        if (raw instanceof Map<?, ?> m) {
            final Map<String, PropertyValue> entries = new LinkedHashMap<>();
            for (var e : m.entrySet()) {
                final String k = String.valueOf(e.getKey());
                final String targetKind = e.getValue() instanceof String ? referencedKind(key, k, m) : null;
                final String target = targetKind == null ? null
                        : Ids.manifestId(targetKind, namespace, (String) e.getValue());
                if (target != null && symbols.isDeclared(target)) {
                    entries.put(k, PropertyValue.Reference.to(target));
                } else {
                    entries.put(k, value(k, e.getValue()));
                }
            }
            return new PropertyValue.MapValue(entries);
        }
        if (raw instanceof List<?> l) {
            final List<PropertyValue> items = new ArrayList<>(l.size());
            l.forEach(i -> items.add(value(key, i)));
            return new PropertyValue.ListValue(items);
        }
        return super.convert(raw);
    }

    /**
     * Kind of the object named by {@code key} inside a map found under {@code parent}, or null.
     */
    static String referencedKind(String parent, String key, Map<?, ?> siblings) {
        if (key.equals("serviceAccountName")) {
            return "ServiceAccount";
        }
        if (key.equals("serviceName")) {
            return "Service";
        }
        if (key.equals("secretName") && parent.equals("secret")) {
            return "Secret";
        }
        if (key.equals("claimName") && parent.equals("persistentVolumeClaim")) {
            return "PersistentVolumeClaim";
        }
        if (!key.equals("name")) {
            return null;
        }
        return switch (parent) {
            case "configMapRef", "configMapKeyRef", "configMap" -> "ConfigMap";
            case "secretRef", "secretKeyRef", "imagePullSecrets" -> "Secret";
            case "service" -> "Service";
            case "scaleTargetRef" -> siblings.get("kind") instanceof String kind ? kind : null;
            default -> null;
        };
    }
}
