package sim;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated liquidation activity for one asset line item across a run.
 */
public class AssetDepletion {
    private final String assetType;
    private double totalSold;
    private double totalLoss;
    private int count;

    AssetDepletion(String assetType) {
        this.assetType = assetType;
    }

    void record(double amountSold, double loss) {
        totalSold += amountSold;
        totalLoss += loss;
        count++;
    }

    public String getAssetType() { return assetType; }
    public double getTotalSold() { return totalSold; }
    public double getTotalLoss() { return totalLoss; }
    public int getCount() { return count; }

    /**
     * Realised loss as a percentage of the amount sold, 0 when nothing was sold.
     */
    public double getAverageHaircut() {
        return totalSold > 0 ? totalLoss / totalSold * 100 : 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_sold", totalSold);
        map.put("total_loss", totalLoss);
        map.put("count", count);
        map.put("avg_haircut", getAverageHaircut());
        return map;
    }

    @Override
    public String toString() {
        return String.format("%s: sold=%.2f loss=%.2f count=%d avgHaircut=%.2f%%",
            assetType, totalSold, totalLoss, count, getAverageHaircut());
    }
}
