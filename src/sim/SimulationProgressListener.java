package sim;

/**
 * Receives progress notifications from the liquidity engine.
 * Called synchronously on the engine's thread after each period; it cannot influence the results.
 */
public interface SimulationProgressListener {

    /**
     * @param period          index of the period just completed (0-based)
     * @param percentComplete share of the scenario horizon processed so far, 0 to 100
     * @param status          human-readable status line
     */
    void onProgress(int period, int percentComplete, String status);
}
