package ledger;

/**
 * Asset classes that can appear in a liquidation order.
 * Each class maps a human-readable label to its balance-sheet line item and base liquidation haircut.
 */
public enum AssetClass {
    CASH("Cash", LineItems.CASH_RESERVES, 0.0),
    HQLA_LEVEL_1("HQLA Level 1", LineItems.HQLA_LEVEL1, 0.0),
    HQLA_LEVEL_2A("HQLA Level 2A", LineItems.HQLA_LEVEL2A, 5.0),
    HQLA_LEVEL_2B("HQLA Level 2B", LineItems.HQLA_LEVEL2B, 15.0),
    OTHER_SECURITIES("Other Securities", LineItems.OTHER_SECURITIES, 25.0),
    PERFORMING_LOANS("Performing Loans", LineItems.PERFORMING_LOANS, 30.0),
    REAL_ESTATE("Real Estate", LineItems.REAL_ESTATE, 40.0);

    private final String label;
    private final String lineItem;
    private final double baseHaircutPct;

    AssetClass(String label, String lineItem, double baseHaircutPct) {
        this.label = label;
        this.lineItem = lineItem;
        this.baseHaircutPct = baseHaircutPct;
    }

    public String getLabel() {
        return label;
    }

    public String getLineItem() {
        return lineItem;
    }

    public double getBaseHaircutPct() {
        return baseHaircutPct;
    }

    /**
     * Cash and level-1 HQLA are sold at their base haircut only.
     */
    public boolean isFireSaleExempt() {
        return this == CASH || this == HQLA_LEVEL_1;
    }

    /**
     * Look up an asset class by its liquidation-order label.
     *
     * @return the matching class, or null if the label is not recognised
     */
    public static AssetClass fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (AssetClass assetClass : values()) {
            if (assetClass.label.equals(label)) {
                return assetClass;
            }
        }
        return null;
    }
}
