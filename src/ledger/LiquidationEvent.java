package ledger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single asset sale: how much was sold, at what haircut, and what it realised.
 */
public class LiquidationEvent {
    private final String assetType;
    private final double amountLiquidated;
    private final double haircutPct;
    private final double proceeds;
    private final double loss;

    public LiquidationEvent(String assetType, double amountLiquidated, double haircutPct,
                            double proceeds, double loss) {
        this.assetType = assetType;
        this.amountLiquidated = amountLiquidated;
        this.haircutPct = haircutPct;
        this.proceeds = proceeds;
        this.loss = loss;
    }

    public String getAssetType() { return assetType; }
    public double getAmountLiquidated() { return amountLiquidated; }
    public double getHaircutPct() { return haircutPct; }
    public double getProceeds() { return proceeds; }
    public double getLoss() { return loss; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("asset_type", assetType);
        map.put("amount_liquidated", amountLiquidated);
        map.put("haircut_pct", haircutPct);
        map.put("proceeds", proceeds);
        map.put("loss", loss);
        return map;
    }

    @Override
    public String toString() {
        return String.format("Liquidated %.2f of %s @ %.1f%% haircut (proceeds=%.2f, loss=%.2f)",
            amountLiquidated, assetType, haircutPct, proceeds, loss);
    }
}
