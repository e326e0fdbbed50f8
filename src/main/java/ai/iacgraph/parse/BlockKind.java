package ai.iacgraph.parse;

/**
 * Dialect-native construct kinds the normalizer knows how to map.
 */
public enum BlockKind {
    RESOURCE,
    DATA,
    VARIABLE,
    OUTPUT,
    LOCAL,
    MODULE,
    TASK,
    HANDLER,
    /** Terraform {@code moved} block, read back into graph aliases. */
    MOVED,
    /** Graph-level construct kept verbatim (provider block, template header, play header). */
    EXTENSION
}
