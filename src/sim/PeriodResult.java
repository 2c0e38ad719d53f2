package sim;

import ledger.BalanceSheetSnapshot;
import ledger.LiquidationEvent;
import scenario.CreditDeteriorationImpact;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trace of one simulation period: balance sheet before and after, deposit outflows,
 * asset sales, realised losses, closing metrics and any credit deterioration.
 */
public class PeriodResult {
    private final int period;
    private final BalanceSheetSnapshot openingBalanceSheet;
    private final BalanceSheetSnapshot closingBalanceSheet;
    private final Map<String, Double> outflows;
    private final List<LiquidationEvent> liquidations;
    private final double losses;
    private final MetricsSnapshot metrics;
    private final CreditDeteriorationImpact creditImpact;

    public PeriodResult(int period,
                        BalanceSheetSnapshot openingBalanceSheet,
                        BalanceSheetSnapshot closingBalanceSheet,
                        Map<String, Double> outflows,
                        List<LiquidationEvent> liquidations,
                        double losses,
                        MetricsSnapshot metrics,
                        CreditDeteriorationImpact creditImpact) {
        this.period = period;
        this.openingBalanceSheet = openingBalanceSheet;
        this.closingBalanceSheet = closingBalanceSheet;
        this.outflows = Collections.unmodifiableMap(new LinkedHashMap<>(outflows));
        this.liquidations = Collections.unmodifiableList(new ArrayList<>(liquidations));
        this.losses = losses;
        this.metrics = metrics;
        this.creditImpact = creditImpact;
    }

    public int getPeriod() { return period; }
    public BalanceSheetSnapshot getOpeningBalanceSheet() { return openingBalanceSheet; }
    public BalanceSheetSnapshot getClosingBalanceSheet() { return closingBalanceSheet; }
    public Map<String, Double> getOutflows() { return outflows; }
    public List<LiquidationEvent> getLiquidations() { return liquidations; }
    public double getLosses() { return losses; }
    public MetricsSnapshot getMetrics() { return metrics; }

    /**
     * @return the credit deterioration applied this period, or null if none was
     */
    public CreditDeteriorationImpact getCreditImpact() { return creditImpact; }

    public boolean hasCreditImpact() {
        return creditImpact != null;
    }

    public double getTotalOutflow() {
        return outflows.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public double getAmountLiquidated() {
        return liquidations.stream().mapToDouble(LiquidationEvent::getAmountLiquidated).sum();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("period", period);
        map.put("opening_bs", openingBalanceSheet.toMap());
        map.put("outflows", new LinkedHashMap<>(outflows));
        List<Map<String, Object>> sales = new ArrayList<>();
        for (LiquidationEvent event : liquidations) {
            sales.add(event.toMap());
        }
        map.put("liquidations", sales);
        map.put("losses", losses);
        map.put("metrics", metrics.toMap());
        if (creditImpact != null) {
            map.put("credit_impact", creditImpact.toMap());
        }
        map.put("closing_bs", closingBalanceSheet.toMap());
        return map;
    }

    @Override
    public String toString() {
        return String.format("Period %d: outflow=%.2f, liquidated=%.2f, losses=%.2f, %s",
            period, getTotalOutflow(), getAmountLiquidated(), losses, metrics);
    }
}
