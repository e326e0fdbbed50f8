package ai.iacgraph.model;

/**
 * Why an edge exists. An edge may have several origins at once.
 */
public enum EdgeOrigin {
    /** a reference token in the source node's properties */
    REFERENCE,
    /** a user-authored depends-on entry */
    EXPLICIT,
    /** implicit sequencing (e.g. consecutive playbook tasks) */
    ORDERING,
    /** owner property, e.g. subnet -> vpc */
    OWNERSHIP
}
