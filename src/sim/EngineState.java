package sim;

/**
 * Lifecycle of a liquidity engine run.
 */
public enum EngineState {
    INITIALIZED,
    RUNNING,
    BREACHED,
    COMPLETED,
    /** The run was aborted by an exception. */
    FAILED;

    public boolean isFinal() {
        return this == BREACHED || this == COMPLETED || this == FAILED;
    }
}
