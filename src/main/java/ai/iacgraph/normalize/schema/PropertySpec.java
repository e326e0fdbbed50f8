package ai.iacgraph.normalize.schema;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import ai.iacgraph.model.Dialect;

/**
 * Schema entry for one canonical property.
 *
 * @param name        canonical (camelCase) name
 * @param kind        expected value shape
 * @param required    whether a resource of the type is incomplete without it
 * @param owner       whether a reference in this property means "contained by the target"
 * @param nativeNames explicit native spellings where the dialect convention does not apply
 */
public record PropertySpec(String name, ValueKind kind, boolean required, boolean owner,
                           Map<Dialect, String> nativeNames) {

    public PropertySpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        final EnumMap<Dialect, String> copy = new EnumMap<>(Dialect.class);
        if (nativeNames != null) {
            copy.putAll(nativeNames);
        }
        nativeNames = copy;
    }

    public static PropertySpec of(String name, ValueKind kind) {
        return new PropertySpec(name, kind, false, false, Map.of());
    }

    public PropertySpec asRequired() {
        return new PropertySpec(name, kind, true, owner, nativeNames);
    }

    public PropertySpec asOwner() {
        return new PropertySpec(name, kind, required, true, nativeNames);
    }

    public PropertySpec tf(String nativeName) {
        return named(Dialect.TERRAFORM, nativeName);
    }

    public PropertySpec cfn(String nativeName) {
        return named(Dialect.CLOUDFORMATION, nativeName);
    }

    public PropertySpec ansible(String nativeName) {
        return named(Dialect.ANSIBLE, nativeName);
    }

    private PropertySpec named(Dialect dialect, String nativeName) {
        final EnumMap<Dialect, String> names = new EnumMap<>(Dialect.class);
        names.putAll(nativeNames);
        names.put(dialect, nativeName);
        return new PropertySpec(name, kind, required, owner, names);
    }

    /**
     * Native spelling in {@code dialect}: the explicit one, else the dialect convention.
     */
    public String nativeName(Dialect dialect) {
        final String explicit = nativeNames.get(dialect);
        return explicit != null ? explicit : PropertyNaming.toNative(dialect, name);
    }
}
