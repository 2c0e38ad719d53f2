package scenario;

import Exceptions.DataValidationException;
import Exceptions.UnknownCategoryException;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import ledger.BalanceSheet;
import ledger.LineItems;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Parameters of a liquidity and capital stress scenario: deposit run-off, market shocks,
 * fire-sale curve, funding stress and credit deterioration.
 * Instances are validated once by the {@link Builder} and are immutable afterwards.
 */
public class StressScenario {
    private static final Logger logger = LoggerFactory.getLogger(StressScenario.class);
    private static final Gson gson = new Gson();

    public static final double MAX_FIRE_SALE_DISCOUNT = 50.0;

    private final String name;
    private final TimeGranularity timeGranularity;
    private final int numPeriods;

    // Deposit run-off, percent per period
    private final Map<String, Double> runoffRates;
    // Explicit withdrawal amounts: period -> deposit category -> amount
    private final Map<Integer, Map<String, Double>> customRunoff;

    // Market stress
    private final Map<String, Double> securityShocks;
    private final double fireSaleDiscount;
    private final double fireSaleIncrement;

    // Funding stress
    private final int fundingSpreadIncrease;
    private final double collateralHaircutIncrease;

    // Credit deterioration
    private final double loanMigrationRate;
    private final double provisioningRate;
    private final double rwaIncrease;

    private final String description;
    private final String createdAt;

    private StressScenario(Builder builder) {
        this.name = builder.name;
        this.timeGranularity = builder.timeGranularity;
        this.numPeriods = builder.numPeriods;
        this.runoffRates = Collections.unmodifiableMap(new LinkedHashMap<>(
            builder.runoffRates.isEmpty() ? defaultRunoffRates() : builder.runoffRates));
        this.securityShocks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.securityShocks));

        Map<Integer, Map<String, Double>> overrides = new TreeMap<>();
        builder.customRunoff.forEach((period, amounts) ->
            overrides.put(period, Collections.unmodifiableMap(new LinkedHashMap<>(amounts))));
        this.customRunoff = Collections.unmodifiableMap(overrides);

        this.fireSaleDiscount = builder.fireSaleDiscount;
        this.fireSaleIncrement = builder.fireSaleIncrement;
        this.fundingSpreadIncrease = builder.fundingSpreadIncrease;
        this.collateralHaircutIncrease = builder.collateralHaircutIncrease;
        this.loanMigrationRate = builder.loanMigrationRate;
        this.provisioningRate = builder.provisioningRate;
        this.rwaIncrease = builder.rwaIncrease;
        this.description = builder.description;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now().toString();
    }

    /**
     * Basel III standard run-off rates, used when a scenario supplies none.
     */
    public static Map<String, Double> defaultRunoffRates() {
        Map<String, Double> rates = new LinkedHashMap<>();
        rates.put(LineItems.RETAIL_STABLE, 5.0);
        rates.put(LineItems.RETAIL_UNSTABLE, 10.0);
        rates.put(LineItems.CORPORATE_DEPOSITS, 40.0);
        rates.put(LineItems.WHOLESALE_FUNDING, 100.0);
        rates.put(LineItems.SECURED_FUNDING, 25.0);
        return rates;
    }

    public int getPeriodDurationDays() {
        return timeGranularity.getDays();
    }

    /**
     * Withdrawal for one deposit category in one period. An explicit override for the
     * period and category is returned as is; otherwise the opening balance times the run-off rate
     * (0% for categories without a rate).
     */
    public double getRunoffForPeriod(int period, String category, double openingBalance) {
        Map<String, Double> overrides = customRunoff.get(period);
        if (overrides != null && overrides.containsKey(category)) {
            return overrides.get(category);
        }

        double rate = runoffRates.getOrDefault(category, 0.0) / 100;
        return openingBalance * rate;
    }

    /**
     * Price shock for a security as a decimal fraction (-0.15 for -15%), 0 if not configured.
     */
    public double getSecurityShock(String assetType) {
        return securityShocks.getOrDefault(assetType, 0.0) / 100;
    }

    /**
     * Fire-sale discount in percent for selling {@code amountSold} out of {@code totalAvailable}:
     * the base discount plus one increment per 10% of the holding sold, capped at 50%.
     */
    public double calculateFireSaleDiscount(double amountSold, double totalAvailable) {
        double additionalDiscount = 0;
        if (totalAvailable > 0) {
            double volumePct = amountSold / totalAvailable * 100;
            additionalDiscount = volumePct / 10 * fireSaleIncrement;
        }
        return Math.min(fireSaleDiscount + additionalDiscount, MAX_FIRE_SALE_DISCOUNT);
    }

    /**
     * Migrate a share of performing loans to NPL and provision against CET1.
     * Mutates the given balance sheet in place.
     */
    public CreditDeteriorationImpact applyCreditDeterioration(BalanceSheet balanceSheet)
            throws UnknownCategoryException {
        double performingLoans = balanceSheet.getAsset(LineItems.PERFORMING_LOANS);
        double migrationAmount = performingLoans * (loanMigrationRate / 100);
        if (migrationAmount > 0) {
            migrationAmount = balanceSheet.transferAsset(LineItems.PERFORMING_LOANS, LineItems.NPL, migrationAmount);
        }

        double provision = migrationAmount * (provisioningRate / 100);
        if (provision > 0) {
            balanceSheet.absorbLoss(provision);
        }

        logger.debug("Credit deterioration: migrated {} to NPL, provision {}",
            String.format("%.2f", migrationAmount), String.format("%.2f", provision));

        return new CreditDeteriorationImpact(migrationAmount, provision, rwaIncrease);
    }

    public boolean hasCustomRunoff() {
        return !customRunoff.isEmpty();
    }

    // Getters
    public String getName() { return name; }
    public TimeGranularity getTimeGranularity() { return timeGranularity; }
    public int getNumPeriods() { return numPeriods; }
    public Map<String, Double> getRunoffRates() { return runoffRates; }
    public Map<String, Double> getSecurityShocks() { return securityShocks; }
    public Map<Integer, Map<String, Double>> getCustomRunoff() { return customRunoff; }
    public double getFireSaleDiscount() { return fireSaleDiscount; }
    public double getFireSaleIncrement() { return fireSaleIncrement; }
    public int getFundingSpreadIncrease() { return fundingSpreadIncrease; }
    public double getCollateralHaircutIncrease() { return collateralHaircutIncrease; }
    public double getLoanMigrationRate() { return loanMigrationRate; }
    public double getProvisioningRate() { return provisioningRate; }
    public double getRwaIncrease() { return rwaIncrease; }
    public String getDescription() { return description; }
    public String getCreatedAt() { return createdAt; }

    /**
     * Plain key-value form of this scenario. {@link #fromMap(Map)} restores an equal scenario.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("time_granularity", timeGranularity.getLabel());
        data.put("num_periods", numPeriods);
        data.put("runoff_rates", new LinkedHashMap<>(runoffRates));
        data.put("security_shocks", new LinkedHashMap<>(securityShocks));
        data.put("fire_sale_discount", fireSaleDiscount);
        data.put("fire_sale_increment", fireSaleIncrement);
        data.put("funding_spread_increase", fundingSpreadIncrease);
        data.put("collateral_haircut_increase", collateralHaircutIncrease);
        data.put("loan_migration_rate", loanMigrationRate);
        data.put("provisioning_rate", provisioningRate);
        data.put("rwa_increase", rwaIncrease);
        data.put("description", description);
        data.put("created_at", createdAt);

        if (hasCustomRunoff()) {
            Map<String, Map<String, Double>> overrides = new LinkedHashMap<>();
            customRunoff.forEach((period, amounts) -> overrides.put(String.valueOf(period), new LinkedHashMap<>(amounts)));
            data.put("custom_runoff", overrides);
        }
        return data;
    }

    public String toJson() {
        return gson.toJson(toMap());
    }

    /**
     * Rebuild a scenario from its key-value form. Missing optional keys take their defaults.
     */
    public static StressScenario fromMap(Map<String, ?> data) throws DataValidationException {
        if (data == null) {
            throw new DataValidationException("Scenario data is required");
        }
        if (data.get("time_granularity") == null) {
            throw new DataValidationException("Scenario time_granularity is required");
        }

        Builder builder = new Builder(asString(data.get("name")))
            .timeGranularity(asString(data.get("time_granularity")))
            .numPeriods(asInt(data, "num_periods", 0))
            .runoffRates(asAmounts(data.get("runoff_rates"), "runoff_rates"))
            .securityShocks(asAmounts(data.get("security_shocks"), "security_shocks"))
            .description(asString(data.get("description")))
            .createdAt(asString(data.get("created_at")));

        if (data.containsKey("fire_sale_discount")) {
            builder.fireSaleDiscount(asDouble(data, "fire_sale_discount"));
        }
        if (data.containsKey("fire_sale_increment")) {
            builder.fireSaleIncrement(asDouble(data, "fire_sale_increment"));
        }
        if (data.containsKey("funding_spread_increase")) {
            builder.fundingSpreadIncrease(asInt(data, "funding_spread_increase", 0));
        }
        if (data.containsKey("collateral_haircut_increase")) {
            builder.collateralHaircutIncrease(asDouble(data, "collateral_haircut_increase"));
        }
        if (data.containsKey("loan_migration_rate")) {
            builder.loanMigrationRate(asDouble(data, "loan_migration_rate"));
        }
        if (data.containsKey("provisioning_rate")) {
            builder.provisioningRate(asDouble(data, "provisioning_rate"));
        }
        if (data.containsKey("rwa_increase")) {
            builder.rwaIncrease(asDouble(data, "rwa_increase"));
        }

        Object custom = data.get("custom_runoff");
        if (custom != null) {
            if (!(custom instanceof Map)) {
                throw new DataValidationException("custom_runoff must be a mapping of period to amounts");
            }
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) custom).entrySet()) {
                int period = asPeriod(entry.getKey());
                builder.customRunoff(period, asAmounts(entry.getValue(), "custom_runoff." + period));
            }
        }

        return builder.build();
    }

    public static StressScenario fromJson(String json) throws DataValidationException {
        Type type = new TypeToken<Map<String, Object>>() { }.getType();
        Map<String, Object> data;
        try {
            data = gson.fromJson(json, type);
        } catch (JsonParseException e) {
            throw new DataValidationException("Malformed scenario JSON: " + e.getMessage(), e);
        }
        return fromMap(data);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static double asDouble(Map<String, ?> data, String key) throws DataValidationException {
        Object value = data.get(key);
        if (!(value instanceof Number)) {
            throw new DataValidationException("Expected a number for " + key + ": " + value);
        }
        return ((Number) value).doubleValue();
    }

    private static int asInt(Map<String, ?> data, String key, int defaultValue) throws DataValidationException {
        if (data.get(key) == null) {
            return defaultValue;
        }
        double value = asDouble(data, key);
        if (value != Math.rint(value)) {
            throw new DataValidationException("Expected a whole number for " + key + ": " + value);
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new DataValidationException("Value out of range for " + key + ": " + value);
        }
        return (int) value;
    }

    private static int asPeriod(Object key) throws DataValidationException {
        if (key instanceof Number) {
            return ((Number) key).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(key));
        } catch (NumberFormatException e) {
            throw new DataValidationException("Invalid custom_runoff period: " + key, e);
        }
    }

    private static Map<String, Double> asAmounts(Object value, String field) throws DataValidationException {
        Map<String, Double> amounts = new LinkedHashMap<>();
        if (value == null) {
            return amounts;
        }
        if (!(value instanceof Map)) {
            throw new DataValidationException(field + " must be a mapping of category to number");
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!(entry.getValue() instanceof Number)) {
                throw new DataValidationException(
                    String.format("Expected a number for %s.%s: %s", field, entry.getKey(), entry.getValue()));
            }
            amounts.put(String.valueOf(entry.getKey()), ((Number) entry.getValue()).doubleValue());
        }
        return amounts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StressScenario)) return false;
        StressScenario that = (StressScenario) o;
        return numPeriods == that.numPeriods
            && Double.compare(fireSaleDiscount, that.fireSaleDiscount) == 0
            && Double.compare(fireSaleIncrement, that.fireSaleIncrement) == 0
            && fundingSpreadIncrease == that.fundingSpreadIncrease
            && Double.compare(collateralHaircutIncrease, that.collateralHaircutIncrease) == 0
            && Double.compare(loanMigrationRate, that.loanMigrationRate) == 0
            && Double.compare(provisioningRate, that.provisioningRate) == 0
            && Double.compare(rwaIncrease, that.rwaIncrease) == 0
            && name.equals(that.name)
            && timeGranularity == that.timeGranularity
            && runoffRates.equals(that.runoffRates)
            && securityShocks.equals(that.securityShocks)
            && customRunoff.equals(that.customRunoff)
            && Objects.equals(description, that.description)
            && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, timeGranularity, numPeriods, runoffRates, securityShocks, customRunoff,
            fireSaleDiscount, fireSaleIncrement, fundingSpreadIncrease, collateralHaircutIncrease,
            loanMigrationRate, provisioningRate, rwaIncrease, description, createdAt);
    }

    @Override
    public String toString() {
        return String.format("StressScenario{name='%s', granularity=%s, periods=%d}",
            name, timeGranularity.getLabel(), numPeriods);
    }

    /**
     * Builder for stress scenarios. {@link #build()} validates every parameter.
     */
    public static class Builder {
        private final String name;
        private TimeGranularity timeGranularity = TimeGranularity.DAILY;
        private String granularityLabel;
        private int numPeriods = 30;
        private final Map<String, Double> runoffRates = new LinkedHashMap<>();
        private final Map<String, Double> securityShocks = new LinkedHashMap<>();
        private final Map<Integer, Map<String, Double>> customRunoff = new TreeMap<>();
        private double fireSaleDiscount = 10.0;
        private double fireSaleIncrement = 2.0;
        private int fundingSpreadIncrease = 100;
        private double collateralHaircutIncrease = 10.0;
        private double loanMigrationRate = 2.0;
        private double provisioningRate = 50.0;
        private double rwaIncrease = 10.0;
        private String description;
        private String createdAt;

        public Builder(String name) {
            this.name = name;
        }

        public Builder timeGranularity(TimeGranularity timeGranularity) {
            this.timeGranularity = timeGranularity;
            this.granularityLabel = null;
            return this;
        }

        /**
         * Granularity by label ("Daily", "Monthly", "Quarterly", "Yearly"); checked on build.
         */
        public Builder timeGranularity(String label) {
            if (label != null) {
                this.timeGranularity = TimeGranularity.fromLabel(label);
                this.granularityLabel = label;
            }
            return this;
        }

        public Builder numPeriods(int numPeriods) {
            this.numPeriods = numPeriods;
            return this;
        }

        public Builder runoffRate(String category, double ratePct) {
            this.runoffRates.put(category, ratePct);
            return this;
        }

        public Builder runoffRates(Map<String, Double> rates) {
            this.runoffRates.putAll(rates);
            return this;
        }

        public Builder securityShock(String assetType, double shockPct) {
            this.securityShocks.put(assetType, shockPct);
            return this;
        }

        public Builder securityShocks(Map<String, Double> shocks) {
            this.securityShocks.putAll(shocks);
            return this;
        }

        public Builder customRunoff(int period, String category, double amount) {
            this.customRunoff.computeIfAbsent(period, p -> new LinkedHashMap<>()).put(category, amount);
            return this;
        }

        public Builder customRunoff(int period, Map<String, Double> amounts) {
            this.customRunoff.computeIfAbsent(period, p -> new LinkedHashMap<>()).putAll(amounts);
            return this;
        }

        public Builder fireSaleDiscount(double pct) {
            this.fireSaleDiscount = pct;
            return this;
        }

        public Builder fireSaleIncrement(double pct) {
            this.fireSaleIncrement = pct;
            return this;
        }

        public Builder fundingSpreadIncrease(int bps) {
            this.fundingSpreadIncrease = bps;
            return this;
        }

        public Builder collateralHaircutIncrease(double pct) {
            this.collateralHaircutIncrease = pct;
            return this;
        }

        public Builder loanMigrationRate(double pct) {
            this.loanMigrationRate = pct;
            return this;
        }

        public Builder provisioningRate(double pct) {
            this.provisioningRate = pct;
            return this;
        }

        public Builder rwaIncrease(double pct) {
            this.rwaIncrease = pct;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(String createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public StressScenario build() throws DataValidationException {
            validate();
            StressScenario scenario = new StressScenario(this);
            logger.info("Scenario '{}' validated successfully", name);
            return scenario;
        }

        private void validate() throws DataValidationException {
            if (name == null || name.isBlank()) {
                throw new DataValidationException("Scenario name is required");
            }
            if (timeGranularity == null) {
                throw new DataValidationException("Invalid time granularity: " + granularityLabel);
            }
            if (numPeriods <= 0) {
                throw new DataValidationException("Number of periods must be positive: " + numPeriods);
            }
            for (Map.Entry<String, Double> entry : runoffRates.entrySet()) {
                requireRange(entry.getValue(), 0, 100, "runoff rate for " + entry.getKey());
            }
            for (Map.Entry<String, Double> entry : securityShocks.entrySet()) {
                requireRange(entry.getValue(), -100, 100, "shock for " + entry.getKey());
            }
            for (Map.Entry<Integer, Map<String, Double>> period : customRunoff.entrySet()) {
                if (period.getKey() < 0) {
                    throw new DataValidationException("Invalid custom runoff period: " + period.getKey());
                }
                for (Map.Entry<String, Double> entry : period.getValue().entrySet()) {
                    if (entry.getValue() == null || !Double.isFinite(entry.getValue()) || entry.getValue() < 0) {
                        throw new DataValidationException(String.format(
                            "Invalid custom runoff for %s in period %d: %s",
                            entry.getKey(), period.getKey(), entry.getValue()));
                    }
                }
            }
            requireRange(fireSaleDiscount, 0, MAX_FIRE_SALE_DISCOUNT, "fire-sale discount");
            requireRange(fireSaleIncrement, 0, 100, "fire-sale increment");
            if (fundingSpreadIncrease < 0) {
                throw new DataValidationException("Invalid funding spread increase: " + fundingSpreadIncrease);
            }
            requireRange(collateralHaircutIncrease, 0, 100, "collateral haircut increase");
            requireRange(loanMigrationRate, 0, 100, "loan migration rate");
            requireRange(provisioningRate, 0, 100, "provisioning rate");
            requireRange(rwaIncrease, 0, Double.MAX_VALUE, "RWA increase");
        }

        private static void requireRange(Double value, double min, double max, String what)
                throws DataValidationException {
            if (value == null || !Double.isFinite(value) || value < min || value > max) {
                throw new DataValidationException(String.format("Invalid %s: %s", what, value));
            }
        }
    }
}
