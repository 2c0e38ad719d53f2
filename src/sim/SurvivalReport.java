package sim;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a simulation run combining the analyzer's findings with the result totals.
 */
public class SurvivalReport {
    private static final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private final String scenarioName;
    private final int survivalHorizon;
    private final BreachAnalysis breachAnalysis;
    private final String primaryDriver;
    private final List<Integer> criticalPeriods;
    private final Map<String, AssetDepletion> assetDepletion;
    private final double totalAssetDepletion;
    private final double totalLosses;
    private final double capitalErosionPct;
    private final double finalLcr;
    private final double finalCet1;

    public SurvivalReport(String scenarioName, int survivalHorizon, BreachAnalysis breachAnalysis,
                          String primaryDriver, List<Integer> criticalPeriods,
                          Map<String, AssetDepletion> assetDepletion, double totalAssetDepletion,
                          double totalLosses, double capitalErosionPct, double finalLcr, double finalCet1) {
        this.scenarioName = scenarioName;
        this.survivalHorizon = survivalHorizon;
        this.breachAnalysis = breachAnalysis;
        this.primaryDriver = primaryDriver;
        this.criticalPeriods = List.copyOf(criticalPeriods);
        this.assetDepletion = Collections.unmodifiableMap(new LinkedHashMap<>(assetDepletion));
        this.totalAssetDepletion = totalAssetDepletion;
        this.totalLosses = totalLosses;
        this.capitalErosionPct = capitalErosionPct;
        this.finalLcr = finalLcr;
        this.finalCet1 = finalCet1;
    }

    public String getScenarioName() { return scenarioName; }
    public int getSurvivalHorizon() { return survivalHorizon; }
    public BreachAnalysis getBreachAnalysis() { return breachAnalysis; }
    public String getPrimaryDriver() { return primaryDriver; }
    public List<Integer> getCriticalPeriods() { return criticalPeriods; }
    public Map<String, AssetDepletion> getAssetDepletion() { return assetDepletion; }
    public double getTotalAssetDepletion() { return totalAssetDepletion; }
    public double getTotalLosses() { return totalLosses; }
    public double getCapitalErosionPct() { return capitalErosionPct; }
    public double getFinalLcr() { return finalLcr; }
    public double getFinalCet1() { return finalCet1; }

    public Map<String, Object> toMap() {
        Map<String, Object> depletion = new LinkedHashMap<>();
        for (Map.Entry<String, AssetDepletion> entry : assetDepletion.entrySet()) {
            depletion.put(entry.getKey(), entry.getValue().toMap());
        }

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("scenario_name", scenarioName);
        map.put("survival_horizon", survivalHorizon);
        map.put("breach_analysis", breachAnalysis.toMap());
        map.put("primary_driver", primaryDriver);
        map.put("critical_periods", new ArrayList<>(criticalPeriods));
        map.put("asset_depletion", depletion);
        map.put("total_asset_depletion", totalAssetDepletion);
        map.put("total_losses", totalLosses);
        map.put("capital_erosion_pct", capitalErosionPct);
        map.put("final_lcr", finalLcr);
        map.put("final_cet1", finalCet1);
        return map;
    }

    public String toJson() {
        return gson.toJson(toMap());
    }

    /**
     * Generates a plain-text report.
     */
    public String generateReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Survival Analysis: ").append(scenarioName).append(" ===\n");
        sb.append(String.format("Survival Horizon: %d periods\n", survivalHorizon));
        sb.append("Breach: ").append(breachAnalysis).append("\n");
        sb.append("Primary Driver: ").append(primaryDriver).append("\n");
        sb.append("Critical Periods: ").append(criticalPeriods).append("\n");
        sb.append(String.format("Total Asset Depletion: %.2f\n", totalAssetDepletion));
        sb.append(String.format("Total Losses: %.2f\n", totalLosses));
        sb.append(String.format("Capital Erosion: %.2f%%\n", capitalErosionPct));
        sb.append(String.format("Final LCR: %.2f%%\n", finalLcr));
        sb.append(String.format("Final CET1: %.2f%%\n", finalCet1));

        if (!assetDepletion.isEmpty()) {
            sb.append("\nAsset Depletion:\n");
            for (AssetDepletion depletion : assetDepletion.values()) {
                sb.append("  ").append(depletion).append("\n");
            }
        }
        return sb.toString();
    }
}
