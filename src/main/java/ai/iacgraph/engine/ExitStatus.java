package ai.iacgraph.engine;

/**
 * Process exit codes.
 */
public enum ExitStatus {
    CLEAN(0),
    FINDINGS(1),
    FATAL(2);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
