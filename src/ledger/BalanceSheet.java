package ledger;

import Exceptions.DataValidationException;
import Exceptions.UnknownCategoryException;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bank balance sheet made of three ledgers (assets, liabilities, equity) mapping line items to amounts.
 * Aggregates and ratios are always computed from the current ledger state, never cached.
 * Mutating operations work in place; take a {@link #copy()} first to keep a baseline.
 */
public class BalanceSheet {
    private static final Logger logger = LoggerFactory.getLogger(BalanceSheet.class);
    private static final Gson gson = new Gson();

    public static final double BALANCE_WARNING_TOLERANCE = 0.01;
    public static final double BALANCE_TOLERANCE = 1.0;

    // Basel III HQLA haircut factors
    public static final double HQLA_LEVEL1_FACTOR = 1.00;
    public static final double HQLA_LEVEL2A_FACTOR = 0.85;
    public static final double HQLA_LEVEL2B_FACTOR = 0.50;

    // Simplified risk weights; cash and HQLA carry 0%
    public static final double RW_PERFORMING_LOANS = 1.00;
    public static final double RW_NPL = 1.50;
    public static final double RW_REAL_ESTATE = 1.00;
    public static final double RW_OTHER_SECURITIES = 0.50;
    public static final double RW_OTHER_ASSETS = 1.00;

    private final Map<String, Double> assets;
    private final Map<String, Double> liabilities;
    private final Map<String, Double> equity;

    /**
     * Create a balance sheet from the three section mappings.
     *
     * @throws DataValidationException if a section is missing, a key is blank,
     *                                 or an amount is negative or not a finite number
     */
    public BalanceSheet(Map<String, ? extends Number> assets,
                        Map<String, ? extends Number> liabilities,
                        Map<String, ? extends Number> equity) throws DataValidationException {
        this.assets = readSection(LedgerSection.ASSETS, assets);
        this.liabilities = readSection(LedgerSection.LIABILITIES, liabilities);
        this.equity = readSection(LedgerSection.EQUITY, equity);
    }

    private BalanceSheet(BalanceSheet source) {
        this.assets = new LinkedHashMap<>(source.assets);
        this.liabilities = new LinkedHashMap<>(source.liabilities);
        this.equity = new LinkedHashMap<>(source.equity);
    }

    private static Map<String, Double> readSection(LedgerSection section, Map<String, ? extends Number> values)
            throws DataValidationException {
        if (values == null) {
            throw new DataValidationException("Missing required section: " + section.getKey());
        }
        Map<String, Double> ledger = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Number> entry : values.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                throw new DataValidationException("Blank line item in section " + section.getKey());
            }
            if (entry.getValue() == null) {
                throw new DataValidationException(
                    String.format("Missing value for %s.%s", section.getKey(), key));
            }
            double amount = entry.getValue().doubleValue();
            if (!Double.isFinite(amount)) {
                throw new DataValidationException(
                    String.format("Non-numeric value not allowed: %s.%s = %s", section.getKey(), key, amount));
            }
            if (amount < 0) {
                throw new DataValidationException(
                    String.format("Negative value not allowed: %s.%s = %.2f", section.getKey(), key, amount));
            }
            ledger.put(key, amount);
        }
        return ledger;
    }

    /**
     * Build a balance sheet from a plain key-value record
     * ({@code {"assets": {...}, "liabilities": {...}, "equity": {...}}}).
     */
    public static BalanceSheet fromMap(Map<String, ? extends Map<String, ? extends Number>> data)
            throws DataValidationException {
        if (data == null) {
            throw new DataValidationException("Balance sheet data is required");
        }
        return new BalanceSheet(
            data.get(LedgerSection.ASSETS.getKey()),
            data.get(LedgerSection.LIABILITIES.getKey()),
            data.get(LedgerSection.EQUITY.getKey()));
    }

    /**
     * Build a balance sheet from its JSON representation.
     */
    public static BalanceSheet fromJson(String json) throws DataValidationException {
        Type type = new TypeToken<Map<String, Map<String, Double>>>() { }.getType();
        Map<String, Map<String, Double>> data;
        try {
            data = gson.fromJson(json, type);
        } catch (JsonParseException e) {
            throw new DataValidationException("Malformed balance sheet JSON: " + e.getMessage(), e);
        }
        return fromMap(data);
    }

    /**
     * Check ledger integrity: no negative line items and assets equal to liabilities plus equity.
     * Mismatches above {@value #BALANCE_WARNING_TOLERANCE} are logged, above {@value #BALANCE_TOLERANCE} rejected.
     *
     * @return true when the balance sheet is valid
     * @throws DataValidationException otherwise
     */
    public boolean validate() throws DataValidationException {
        checkNonNegative(LedgerSection.ASSETS, assets);
        checkNonNegative(LedgerSection.LIABILITIES, liabilities);
        checkNonNegative(LedgerSection.EQUITY, equity);

        double totalAssets = totalAssets();
        double totalLiabilities = totalLiabilities();
        double totalEquity = totalEquity();
        double difference = Math.abs(totalAssets - (totalLiabilities + totalEquity));

        if (difference > BALANCE_WARNING_TOLERANCE) {
            logger.warn("Balance sheet imbalance: Assets={}, Liabilities={}, Equity={}, Difference={}",
                format(totalAssets), format(totalLiabilities), format(totalEquity), format(difference));
            if (difference > BALANCE_TOLERANCE) {
                throw new DataValidationException(
                    String.format("Balance sheet significantly out of balance: %.2f", difference));
            }
        }

        logger.info("Balance sheet validation passed");
        return true;
    }

    private static void checkNonNegative(LedgerSection section, Map<String, Double> ledger)
            throws DataValidationException {
        for (Map.Entry<String, Double> entry : ledger.entrySet()) {
            if (entry.getValue() < 0) {
                throw new DataValidationException(String.format("Negative value not allowed: %s.%s = %.2f",
                    section.getKey(), entry.getKey(), entry.getValue()));
            }
        }
    }

    // Aggregates

    public double totalAssets() {
        return sum(assets);
    }

    public double totalLiabilities() {
        return sum(liabilities);
    }

    public double totalEquity() {
        return sum(equity);
    }

    /**
     * Sum of the three HQLA tiers, optionally with Basel haircuts applied to level 2A and 2B.
     * The 40% level-2 cap is not applied here.
     */
    public double totalHqla(boolean applyHaircuts) {
        double level1 = getAsset(LineItems.HQLA_LEVEL1);
        double level2a = getAsset(LineItems.HQLA_LEVEL2A);
        double level2b = getAsset(LineItems.HQLA_LEVEL2B);

        if (applyHaircuts) {
            level1 *= HQLA_LEVEL1_FACTOR;
            level2a *= HQLA_LEVEL2A_FACTOR;
            level2b *= HQLA_LEVEL2B_FACTOR;
        }
        return level1 + level2a + level2b;
    }

    public double totalHqla() {
        return totalHqla(false);
    }

    /**
     * Retail plus corporate deposits.
     */
    public double totalDeposits() {
        return totalRetailDeposits() + getLiability(LineItems.CORPORATE_DEPOSITS);
    }

    public double totalRetailDeposits() {
        return getLiability(LineItems.RETAIL_STABLE) + getLiability(LineItems.RETAIL_UNSTABLE);
    }

    /**
     * Cash plus unhaircut HQLA.
     */
    public double totalLiquidAssets() {
        return getAsset(LineItems.CASH_RESERVES) + totalHqla(false);
    }

    public double tier1Capital() {
        return getEquity(LineItems.CET1) + getEquity(LineItems.AT1);
    }

    public double totalCapital() {
        return totalEquity();
    }

    public double rwaEstimate() {
        return getAsset(LineItems.PERFORMING_LOANS) * RW_PERFORMING_LOANS
            + getAsset(LineItems.NPL) * RW_NPL
            + getAsset(LineItems.REAL_ESTATE) * RW_REAL_ESTATE
            + getAsset(LineItems.OTHER_SECURITIES) * RW_OTHER_SECURITIES
            + getAsset(LineItems.OTHER_ASSETS) * RW_OTHER_ASSETS;
    }

    public double cet1Ratio() {
        return capitalRatio(getEquity(LineItems.CET1));
    }

    public double tier1Ratio() {
        return capitalRatio(tier1Capital());
    }

    public double totalCapitalRatio() {
        return capitalRatio(totalCapital());
    }

    /**
     * Equity over total assets, as a percentage. Zero for an empty balance sheet.
     */
    public double leverageRatio() {
        double totalAssets = totalAssets();
        if (totalAssets == 0) {
            return 0;
        }
        return totalEquity() / totalAssets * 100;
    }

    private double capitalRatio(double capital) {
        double rwa = rwaEstimate();
        if (rwa == 0) {
            return 0;
        }
        return capital / rwa * 100;
    }

    // Mutations

    /**
     * Withdraw funding from a liability line. The line never goes below zero.
     *
     * @return the amount actually withdrawn, {@code min(amount, balance)}
     * @throws UnknownCategoryException if the liability is not on the balance sheet
     */
    public double applyWithdrawal(String category, double amount) throws UnknownCategoryException {
        requireNonNegative(amount, "Withdrawal amount");
        Double current = liabilities.get(category);
        if (current == null) {
            throw new UnknownCategoryException(LedgerSection.LIABILITIES.getKey(), category);
        }

        double withdrawal = Math.min(amount, current);
        liabilities.put(category, current - withdrawal);

        logger.debug("Withdrawal applied: {} = {}", category, format(withdrawal));
        return withdrawal;
    }

    /**
     * Sell part of an asset line at a haircut. Proceeds are credited to cash reserves
     * and the realised loss is charged to CET1.
     *
     * @param haircutPct haircut in percent, 0 to 100
     * @throws UnknownCategoryException if the asset is not on the balance sheet
     */
    public LiquidationEvent liquidateAsset(String category, double amount, double haircutPct)
            throws UnknownCategoryException {
        requireNonNegative(amount, "Liquidation amount");
        if (haircutPct < 0 || haircutPct > 100) {
            throw new IllegalArgumentException("Haircut must be between 0 and 100: " + haircutPct);
        }
        Double available = assets.get(category);
        if (available == null) {
            throw new UnknownCategoryException(LedgerSection.ASSETS.getKey(), category);
        }

        double liquidated = Math.min(amount, available);
        double proceeds = liquidated * (1 - haircutPct / 100);
        double loss = liquidated - proceeds;

        assets.put(category, available - liquidated);
        assets.merge(LineItems.CASH_RESERVES, proceeds, Double::sum);
        absorbLoss(loss);

        logger.debug("Asset liquidated: {} = {}, Haircut={}%, Proceeds={}, Loss={}",
            category, format(liquidated), String.format("%.1f", haircutPct), format(proceeds), format(loss));

        return new LiquidationEvent(category, liquidated, haircutPct, proceeds, loss);
    }

    /**
     * Move value from one asset line to another, e.g. performing loans migrating to NPL.
     * The target line is created if it does not exist yet.
     *
     * @return the amount moved, {@code min(amount, balance of the source line)}
     * @throws UnknownCategoryException if the source asset is not on the balance sheet
     */
    public double transferAsset(String fromCategory, String toCategory, double amount)
            throws UnknownCategoryException {
        requireNonNegative(amount, "Transfer amount");
        Double available = assets.get(fromCategory);
        if (available == null) {
            throw new UnknownCategoryException(LedgerSection.ASSETS.getKey(), fromCategory);
        }

        double moved = Math.min(amount, available);
        assets.put(fromCategory, available - moved);
        assets.merge(toCategory, moved, Double::sum);
        return moved;
    }

    /**
     * Pay out of cash reserves without a sale, never taking cash below zero.
     *
     * @return the amount actually paid, {@code min(amount, cash reserves)}
     */
    public double drawCash(double amount) {
        requireNonNegative(amount, "Cash amount");
        double available = getAsset(LineItems.CASH_RESERVES);
        double drawn = Math.min(amount, available);
        if (drawn > 0) {
            assets.put(LineItems.CASH_RESERVES, available - drawn);
        }
        return drawn;
    }

    /**
     * Charge a loss or provision directly against CET1. CET1 may become negative (capital deficit).
     */
    public void absorbLoss(double amount) {
        requireNonNegative(amount, "Loss amount");
        equity.merge(LineItems.CET1, -amount, Double::sum);
    }

    private static void requireNonNegative(double amount, String what) {
        if (!Double.isFinite(amount) || amount < 0) {
            throw new IllegalArgumentException(what + " must be a non-negative number: " + amount);
        }
    }

    // Accessors

    public double getAsset(String category) {
        return assets.getOrDefault(category, 0.0);
    }

    public double getLiability(String category) {
        return liabilities.getOrDefault(category, 0.0);
    }

    public double getEquity(String category) {
        return equity.getOrDefault(category, 0.0);
    }

    public boolean hasAsset(String category) {
        return assets.containsKey(category);
    }

    public Map<String, Double> getAssets() {
        return Collections.unmodifiableMap(assets);
    }

    public Map<String, Double> getLiabilities() {
        return Collections.unmodifiableMap(liabilities);
    }

    /**
     * Independent deep copy; mutations on the copy never reach this instance.
     */
    public BalanceSheet copy() {
        return new BalanceSheet(this);
    }

    /**
     * Immutable point-in-time view of the ledgers and their totals.
     */
    public BalanceSheetSnapshot snapshot() {
        return new BalanceSheetSnapshot(assets, liabilities, equity);
    }

    public Map<String, Map<String, Double>> toMap() {
        Map<String, Map<String, Double>> map = new LinkedHashMap<>();
        map.put(LedgerSection.ASSETS.getKey(), new LinkedHashMap<>(assets));
        map.put(LedgerSection.LIABILITIES.getKey(), new LinkedHashMap<>(liabilities));
        map.put(LedgerSection.EQUITY.getKey(), new LinkedHashMap<>(equity));
        return map;
    }

    public String toJson() {
        return gson.toJson(toMap());
    }

    private static double sum(Map<String, Double> ledger) {
        double total = 0;
        for (double value : ledger.values()) {
            total += value;
        }
        return total;
    }

    private static String format(double value) {
        return String.format("%.2f", value);
    }

    @Override
    public String toString() {
        return String.format("BalanceSheet{assets=%.2f, liabilities=%.2f, equity=%.2f}",
            totalAssets(), totalLiabilities(), totalEquity());
    }
}
