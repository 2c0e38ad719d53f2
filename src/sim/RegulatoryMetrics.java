package sim;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full set of regulatory liquidity and capital metrics for one balance sheet.
 */
public class RegulatoryMetrics {
    // Liquidity
    private LcrBreakdown lcr;
    private NsfrBreakdown nsfr;
    private double liquidAssets;
    private double loanToDepositRatio;

    // Capital
    private double cet1Ratio;
    private double tier1Ratio;
    private double totalCapitalRatio;
    private double leverageRatio;

    // Size
    private double totalAssets;
    private double totalDeposits;

    public LcrBreakdown getLcr() { return lcr; }
    public void setLcr(LcrBreakdown val) { this.lcr = val; }

    public NsfrBreakdown getNsfr() { return nsfr; }
    public void setNsfr(NsfrBreakdown val) { this.nsfr = val; }

    public double getLiquidAssets() { return liquidAssets; }
    public void setLiquidAssets(double val) { this.liquidAssets = val; }

    public double getLoanToDepositRatio() { return loanToDepositRatio; }
    public void setLoanToDepositRatio(double val) { this.loanToDepositRatio = val; }

    public double getCet1Ratio() { return cet1Ratio; }
    public void setCet1Ratio(double val) { this.cet1Ratio = val; }

    public double getTier1Ratio() { return tier1Ratio; }
    public void setTier1Ratio(double val) { this.tier1Ratio = val; }

    public double getTotalCapitalRatio() { return totalCapitalRatio; }
    public void setTotalCapitalRatio(double val) { this.totalCapitalRatio = val; }

    public double getLeverageRatio() { return leverageRatio; }
    public void setLeverageRatio(double val) { this.leverageRatio = val; }

    public double getTotalAssets() { return totalAssets; }
    public void setTotalAssets(double val) { this.totalAssets = val; }

    public double getTotalDeposits() { return totalDeposits; }
    public void setTotalDeposits(double val) { this.totalDeposits = val; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (lcr != null) {
            map.putAll(lcr.toMap());
        }
        if (nsfr != null) {
            map.putAll(nsfr.toMap());
        }
        map.put("cet1_ratio", cet1Ratio);
        map.put("tier1_ratio", tier1Ratio);
        map.put("total_capital_ratio", totalCapitalRatio);
        map.put("leverage_ratio", leverageRatio);
        map.put("liquid_assets", liquidAssets);
        map.put("total_assets", totalAssets);
        map.put("total_deposits", totalDeposits);
        map.put("loan_to_deposit_ratio", loanToDepositRatio);
        return map;
    }

    /**
     * Generate a formatted report of the metrics.
     */
    public String generateReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("\n========== REGULATORY METRICS ==========\n");
        if (lcr != null) {
            sb.append(String.format("LCR: %.2f%%\n", lcr.getLcr()));
            sb.append(String.format("  HQLA (capped): %.2f\n", lcr.getTotalHqla()));
            sb.append(String.format("  Net Outflows: %.2f\n", lcr.getNetOutflows()));
        }
        if (nsfr != null) {
            sb.append(String.format("NSFR: %.2f%%\n", nsfr.getNsfr()));
        }
        sb.append(String.format("\nCET1 Ratio: %.2f%%\n", cet1Ratio));
        sb.append(String.format("Tier 1 Ratio: %.2f%%\n", tier1Ratio));
        sb.append(String.format("Total Capital Ratio: %.2f%%\n", totalCapitalRatio));
        sb.append(String.format("Leverage Ratio: %.2f%%\n", leverageRatio));
        sb.append(String.format("\nLiquid Assets: %.2f\n", liquidAssets));
        sb.append(String.format("Total Assets: %.2f\n", totalAssets));
        sb.append(String.format("Total Deposits: %.2f\n", totalDeposits));
        sb.append(String.format("Loan to Deposit: %.2f%%\n", loanToDepositRatio));
        sb.append("========================================\n");
        return sb.toString();
    }
}
