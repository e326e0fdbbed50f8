package ai.iacgraph.normalize.schema;

/**
 * One row of a dialect type table.
 */
public interface TypeMapping {

    String nativeType();

    String canonicalType();

    /**
     * Whether this is the spelling emitted for the canonical type. Aliases are read but not written.
     */
    boolean primary();
}
