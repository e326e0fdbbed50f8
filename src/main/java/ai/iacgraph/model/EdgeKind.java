package ai.iacgraph.model;

/**
 * Relation carried by a {@link DependencyEdge}.
 */
public enum EdgeKind {
    /** source depends on target */
    DEPENDS_ON,
    /** source owns target */
    CONTAINS
}
