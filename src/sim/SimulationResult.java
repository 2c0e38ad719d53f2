package sim;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete simulation result: survival horizon, breach, cumulative depletion and losses,
 * final metrics, and the period-by-period trace.
 */
public class SimulationResult {
    public static final String NO_BREACH = "None";

    private static final Gson gson = new GsonBuilder()
            .serializeNulls()
            .create();

    private final String scenarioName;
    private final int numPeriods;
    private final int survivalHorizon;
    private final BreachInfo breachInfo;
    private final double assetDepletion;
    private final double totalLosses;
    private final double capitalErosion;
    private final double finalLcr;
    private final double finalCet1;
    private final List<PeriodResult> periodResults;

    public SimulationResult(String scenarioName, int numPeriods, int survivalHorizon, BreachInfo breachInfo,
                            double assetDepletion, double totalLosses, double capitalErosion,
                            double finalLcr, double finalCet1, List<PeriodResult> periodResults) {
        this.scenarioName = scenarioName;
        this.numPeriods = numPeriods;
        this.survivalHorizon = survivalHorizon;
        this.breachInfo = breachInfo;
        this.assetDepletion = assetDepletion;
        this.totalLosses = totalLosses;
        this.capitalErosion = capitalErosion;
        this.finalLcr = finalLcr;
        this.finalCet1 = finalCet1;
        this.periodResults = Collections.unmodifiableList(new ArrayList<>(periodResults));
    }

    // Getters
    public String getScenarioName() { return scenarioName; }
    public int getNumPeriods() { return numPeriods; }
    public int getSurvivalHorizon() { return survivalHorizon; }
    /** @return the breach that stopped the run, or null if the bank survived the horizon */
    public BreachInfo getBreachInfo() { return breachInfo; }
    public double getAssetDepletion() { return assetDepletion; }
    public double getTotalLosses() { return totalLosses; }
    /** Total losses as a percentage of initial equity. */
    public double getCapitalErosion() { return capitalErosion; }
    public double getFinalLcr() { return finalLcr; }
    public double getFinalCet1() { return finalCet1; }
    public List<PeriodResult> getPeriodResults() { return periodResults; }

    public boolean isBreached() {
        return breachInfo != null;
    }

    /**
     * @return the breach label ("LCR", "CET1", "Liquidity") or {@value #NO_BREACH}
     */
    public String getBreachType() {
        return breachInfo != null ? breachInfo.getType().getLabel() : NO_BREACH;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("scenario_name", scenarioName);
        map.put("num_periods", numPeriods);
        map.put("survival_horizon", survivalHorizon);
        map.put("breach_type", getBreachType());
        map.put("breach_info", breachInfo != null ? breachInfo.toMap() : null);
        map.put("asset_depletion", assetDepletion);
        map.put("total_losses", totalLosses);
        map.put("capital_erosion", capitalErosion);
        map.put("final_lcr", finalLcr);
        map.put("final_cet1", finalCet1);
        List<Map<String, Object>> periods = new ArrayList<>();
        for (PeriodResult result : periodResults) {
            periods.add(result.toMap());
        }
        map.put("period_results", periods);
        return map;
    }

    public String toJson() {
        return gson.toJson(toMap());
    }

    /**
     * Generate a readable summary of the run.
     */
    public String generateReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("\n========== STRESS TEST RESULTS ==========\n");
        sb.append(String.format("Scenario: %s\n", scenarioName));
        sb.append(String.format("Survival Horizon: %d of %d periods\n", survivalHorizon, numPeriods));
        sb.append(String.format("Breach: %s\n", breachInfo != null ? breachInfo : NO_BREACH));
        sb.append(String.format("\nAsset Depletion: %.2f\n", assetDepletion));
        sb.append(String.format("Total Losses: %.2f\n", totalLosses));
        sb.append(String.format("Capital Erosion: %.2f%%\n", capitalErosion));
        sb.append(String.format("Final LCR: %.2f%%\n", finalLcr));
        sb.append(String.format("Final CET1: %.2f%%\n", finalCet1));
        sb.append("\n========== SAMPLE PERIODS ==========\n");

        int sampleSize = Math.min(10, periodResults.size());
        for (int i = 0; i < sampleSize; i++) {
            sb.append(periodResults.get(i)).append("\n");
        }

        if (periodResults.size() > sampleSize) {
            sb.append(String.format("... and %d more periods\n", periodResults.size() - sampleSize));
        }

        sb.append("=========================================\n");
        return sb.toString();
    }
}
