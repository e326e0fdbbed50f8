package ai.iacgraph.engine;

/**
 * Unrecoverable condition that ends one invocation in {@link Stage#FAILED}: no resources found,
 * unknown or ambiguous dialect, an invariant that cannot be repaired.
 * <p>
 * Raised inside the orchestrator only and turned into a report at its boundary.
 */
public class FatalError extends RuntimeException {

    private final Stage stage;

    public FatalError(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public FatalError(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /**
     * Stage the invocation was in when it failed.
     */
    public Stage stage() {
        return stage;
    }
}
