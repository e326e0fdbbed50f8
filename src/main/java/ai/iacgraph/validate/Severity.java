package ai.iacgraph.validate;

/**
 * Finding severity, lowest first.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR;

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
