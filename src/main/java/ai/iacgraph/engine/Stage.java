package ai.iacgraph.engine;

/**
 * States of one invocation. {@link #FAILED} is reachable from every other state.
 */
public enum Stage {
    PARSING,
    NORMALIZING,
    VALIDATING,
    OPTIMIZING,
    EMITTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
