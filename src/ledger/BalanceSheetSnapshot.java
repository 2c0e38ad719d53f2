package ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Frozen copy of a balance sheet's ledgers, used for the opening and closing state of each period.
 */
public class BalanceSheetSnapshot {
    private final Map<String, Double> assets;
    private final Map<String, Double> liabilities;
    private final Map<String, Double> equity;

    BalanceSheetSnapshot(Map<String, Double> assets, Map<String, Double> liabilities, Map<String, Double> equity) {
        this.assets = Collections.unmodifiableMap(new LinkedHashMap<>(assets));
        this.liabilities = Collections.unmodifiableMap(new LinkedHashMap<>(liabilities));
        this.equity = Collections.unmodifiableMap(new LinkedHashMap<>(equity));
    }

    public Map<String, Double> getAssets() { return assets; }
    public Map<String, Double> getLiabilities() { return liabilities; }
    public Map<String, Double> getEquity() { return equity; }

    public double getAsset(String category) {
        return assets.getOrDefault(category, 0.0);
    }

    public double getLiability(String category) {
        return liabilities.getOrDefault(category, 0.0);
    }

    public double getEquity(String category) {
        return equity.getOrDefault(category, 0.0);
    }

    public double totalAssets() {
        return assets.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public double totalLiabilities() {
        return liabilities.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public double totalEquity() {
        return equity.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(LedgerSection.ASSETS.getKey(), new LinkedHashMap<>(assets));
        map.put(LedgerSection.LIABILITIES.getKey(), new LinkedHashMap<>(liabilities));
        map.put(LedgerSection.EQUITY.getKey(), new LinkedHashMap<>(equity));
        return map;
    }
}
