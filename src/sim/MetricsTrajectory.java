package sim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-period time series of the headline metrics, aligned by index.
 */
public class MetricsTrajectory {
    private final List<Integer> periods = new ArrayList<>();
    private final List<Double> lcr = new ArrayList<>();
    private final List<Double> cet1Ratio = new ArrayList<>();
    private final List<Double> liquidAssets = new ArrayList<>();
    private final List<Double> totalDeposits = new ArrayList<>();

    void add(int period, MetricsSnapshot metrics) {
        periods.add(period);
        lcr.add(metrics.getLcr());
        cet1Ratio.add(metrics.getCet1Ratio());
        liquidAssets.add(metrics.getLiquidAssets());
        totalDeposits.add(metrics.getTotalDeposits());
    }

    public List<Integer> getPeriods() { return Collections.unmodifiableList(periods); }
    public List<Double> getLcr() { return Collections.unmodifiableList(lcr); }
    public List<Double> getCet1Ratio() { return Collections.unmodifiableList(cet1Ratio); }
    public List<Double> getLiquidAssets() { return Collections.unmodifiableList(liquidAssets); }
    public List<Double> getTotalDeposits() { return Collections.unmodifiableList(totalDeposits); }

    public int size() {
        return periods.size();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("period", new ArrayList<>(periods));
        map.put("lcr", new ArrayList<>(lcr));
        map.put("cet1_ratio", new ArrayList<>(cet1Ratio));
        map.put("liquid_assets", new ArrayList<>(liquidAssets));
        map.put("total_deposits", new ArrayList<>(totalDeposits));
        return map;
    }
}
