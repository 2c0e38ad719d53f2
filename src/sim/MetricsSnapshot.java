package sim;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liquidity and capital metrics recorded at the close of a simulation period.
 */
public class MetricsSnapshot {
    private final double lcr;
    private final double nsfr;
    private final double cet1Ratio;
    private final double totalCapitalRatio;
    private final double liquidAssets;
    private final double totalDeposits;

    public MetricsSnapshot(double lcr, double nsfr, double cet1Ratio, double totalCapitalRatio,
                           double liquidAssets, double totalDeposits) {
        this.lcr = lcr;
        this.nsfr = nsfr;
        this.cet1Ratio = cet1Ratio;
        this.totalCapitalRatio = totalCapitalRatio;
        this.liquidAssets = liquidAssets;
        this.totalDeposits = totalDeposits;
    }

    public double getLcr() { return lcr; }
    public double getNsfr() { return nsfr; }
    public double getCet1Ratio() { return cet1Ratio; }
    public double getTotalCapitalRatio() { return totalCapitalRatio; }
    public double getLiquidAssets() { return liquidAssets; }
    public double getTotalDeposits() { return totalDeposits; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("lcr", lcr);
        map.put("nsfr", nsfr);
        map.put("cet1_ratio", cet1Ratio);
        map.put("total_capital_ratio", totalCapitalRatio);
        map.put("liquid_assets", liquidAssets);
        map.put("total_deposits", totalDeposits);
        return map;
    }

    @Override
    public String toString() {
        return String.format("Metrics{LCR=%.2f%%, NSFR=%.2f%%, CET1=%.2f%%, liquid=%.2f}",
            lcr, nsfr, cet1Ratio, liquidAssets);
    }
}
