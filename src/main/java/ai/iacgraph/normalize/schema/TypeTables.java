package ai.iacgraph.normalize.schema;

import java.util.List;
import java.util.Optional;

import ai.iacgraph.model.Dialect;

/**
 * Lookup over the per-dialect type tables.
 */
public final class TypeTables {

    private TypeTables() {
    }

    public static List<? extends TypeMapping> entries(Dialect dialect) {
        return switch (dialect) {
            case TERRAFORM -> List.of(TerraformTypes.values());
            case CLOUDFORMATION -> List.of(CloudFormationTypes.values());
            case KUBERNETES -> List.of(KubernetesKinds.values());
            case ANSIBLE -> List.of(AnsibleModules.values());
        };
    }

    /**
     * Canonical type of a native resource type. Terraform data sources are looked up separately
     * through {@link TerraformTypes#lookup}.
     */
    public static Optional<String> canonical(Dialect dialect, String nativeType) {
        if (nativeType == null) {
            return Optional.empty();
        }
        if (dialect == Dialect.TERRAFORM) {
            return TerraformTypes.lookup(nativeType, false).map(TerraformTypes::canonicalType);
        }
        if (dialect == Dialect.ANSIBLE) {
            for (AnsibleModules m : AnsibleModules.values()) {
                if (m.matches(nativeType)) {
                    return Optional.of(m.canonicalType());
                }
            }
            return Optional.empty();
        }
        for (TypeMapping t : entries(dialect)) {
            if (t.nativeType().equals(nativeType)) {
                return Optional.of(t.canonicalType());
            }
        }
        return Optional.empty();
    }

    /**
     * Native spelling written for a canonical type, empty when the dialect has no equivalent.
     */
    public static Optional<String> nativeType(Dialect dialect, String canonicalType) {
        for (TypeMapping t : entries(dialect)) {
            if (t.primary() && t.canonicalType().equals(canonicalType)
                    && !(t instanceof TerraformTypes tf && tf.dataSource())) {
                return Optional.of(t.nativeType());
            }
        }
        return Optional.empty();
    }
}
