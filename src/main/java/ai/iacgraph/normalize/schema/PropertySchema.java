package ai.iacgraph.normalize.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import ai.iacgraph.model.Dialect;

/**
 * Property schema of one canonical type. Properties it does not list are accepted as-is under
 * their conventional canonical name.
 */
public final class PropertySchema {

    public static final PropertySchema EMPTY = new PropertySchema("", List.of());

    private final String canonicalType;
    private final Map<String, PropertySpec> specs = new LinkedHashMap<>();

    public PropertySchema(String canonicalType, List<PropertySpec> specs) {
        this.canonicalType = canonicalType;
        specs.forEach(s -> this.specs.put(s.name(), s));
    }

    public String canonicalType() {
        return canonicalType;
    }

    public List<PropertySpec> specs() {
        return List.copyOf(specs.values());
    }

    public Optional<PropertySpec> spec(String canonicalName) {
        return Optional.ofNullable(specs.get(canonicalName));
    }

    /**
     * Spec whose native spelling in {@code dialect} is {@code nativeName}.
     */
    public Optional<PropertySpec> byNative(Dialect dialect, String nativeName) {
        for (PropertySpec s : specs.values()) {
            if (s.nativeName(dialect).equals(nativeName)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    public List<PropertySpec> required() {
        return specs.values().stream().filter(PropertySpec::required).toList();
    }

    /**
     * Canonical name of a native property: schema rename first, dialect convention otherwise.
     */
    public String canonicalName(Dialect dialect, String nativeName) {
        return byNative(dialect, nativeName)
                .map(PropertySpec::name)
                .orElseGet(() -> PropertyNaming.toCanonical(dialect, nativeName));
    }

    /**
     * Native name of a canonical property: schema rename first, dialect convention otherwise.
     */
    public String nativeName(Dialect dialect, String canonicalName) {
        final PropertySpec s = specs.get(canonicalName);
        return s != null ? s.nativeName(dialect) : PropertyNaming.toNative(dialect, canonicalName);
    }
}
