package sim;

import ledger.BalanceSheet;
import ledger.LineItems;

/**
 * Calculates Basel III liquidity (LCR, NSFR) and capital metrics from a balance sheet.
 * Stateless: every call reads only the balance sheet it is given.
 */
public class MetricsCalculator {

    /** Returned when the ratio's denominator is zero: no stress exposure. */
    public static final double NO_EXPOSURE_RATIO = 999.9;

    // LCR: level 2 assets may make up at most 40% of HQLA after haircuts
    static final double LEVEL2_CAP = 0.40;

    // LCR 30-day outflow run-off factors
    static final double OUTFLOW_RETAIL_STABLE = 0.05;
    static final double OUTFLOW_RETAIL_UNSTABLE = 0.10;
    static final double OUTFLOW_CORPORATE = 0.40;
    static final double OUTFLOW_WHOLESALE = 1.00;
    static final double OUTFLOW_SECURED = 0.25;

    // LCR inflows: loan maturities, capped at 75% of outflows
    static final double INFLOW_LOAN_MATURITY = 0.05;
    static final double INFLOW_CAP = 0.75;
    static final double NET_OUTFLOW_FLOOR = 0.25;

    // NSFR available stable funding factors
    static final double ASF_EQUITY = 1.00;
    static final double ASF_RETAIL_STABLE = 0.95;
    static final double ASF_RETAIL_UNSTABLE = 0.90;
    static final double ASF_CORPORATE = 0.50;

    // NSFR required stable funding factors
    static final double RSF_HQLA_LEVEL1 = 0.05;
    static final double RSF_HQLA_LEVEL2A = 0.15;
    static final double RSF_HQLA_LEVEL2B = 0.50;
    static final double RSF_PERFORMING_LOANS = 0.85;
    static final double RSF_NPL = 1.00;
    static final double RSF_REAL_ESTATE = 1.00;
    static final double RSF_OTHER = 0.85;

    // Per-period engine ratios: a flat quarter of deposits is the stressed outflow
    static final double ENGINE_DEPOSIT_OUTFLOW_RATE = 0.25;

    /**
     * Liquidity Coverage Ratio with haircuts and the 40% level-2 cap applied to the numerator.
     */
    public LcrBreakdown calculateLcr(BalanceSheet balanceSheet) {
        double level1 = balanceSheet.getAsset(LineItems.HQLA_LEVEL1) * BalanceSheet.HQLA_LEVEL1_FACTOR;
        double level2a = balanceSheet.getAsset(LineItems.HQLA_LEVEL2A) * BalanceSheet.HQLA_LEVEL2A_FACTOR;
        double level2b = balanceSheet.getAsset(LineItems.HQLA_LEVEL2B) * BalanceSheet.HQLA_LEVEL2B_FACTOR;

        double level2Total = level2a + level2b;
        double level2Cap = (level1 + level2Total) * LEVEL2_CAP;
        double level2Adjusted = Math.min(level2Total, level2Cap);
        double totalHqla = level1 + level2Adjusted;

        double outflows = calculateGrossOutflows(balanceSheet);
        double inflows = calculateGrossInflows(balanceSheet);
        double netOutflows = Math.max(outflows - inflows * INFLOW_CAP, outflows * NET_OUTFLOW_FLOOR);

        double lcr = netOutflows > 0 ? totalHqla / netOutflows * 100 : NO_EXPOSURE_RATIO;

        return new LcrBreakdown(lcr, totalHqla, level1, level2Adjusted, outflows, inflows, netOutflows);
    }

    /**
     * Stressed 30-day funding outflows.
     */
    public double calculateGrossOutflows(BalanceSheet balanceSheet) {
        return balanceSheet.getLiability(LineItems.RETAIL_STABLE) * OUTFLOW_RETAIL_STABLE
            + balanceSheet.getLiability(LineItems.RETAIL_UNSTABLE) * OUTFLOW_RETAIL_UNSTABLE
            + balanceSheet.getLiability(LineItems.CORPORATE_DEPOSITS) * OUTFLOW_CORPORATE
            + balanceSheet.getLiability(LineItems.WHOLESALE_FUNDING) * OUTFLOW_WHOLESALE
            + balanceSheet.getLiability(LineItems.SECURED_FUNDING) * OUTFLOW_SECURED;
    }

    /**
     * 30-day inflows, estimated as loans maturing within the window.
     */
    public double calculateGrossInflows(BalanceSheet balanceSheet) {
        return balanceSheet.getAsset(LineItems.PERFORMING_LOANS) * INFLOW_LOAN_MATURITY;
    }

    public NsfrBreakdown calculateNsfr(BalanceSheet balanceSheet) {
        double asf = calculateAvailableStableFunding(balanceSheet);
        double rsf = calculateRequiredStableFunding(balanceSheet);
        double nsfr = rsf > 0 ? asf / rsf * 100 : NO_EXPOSURE_RATIO;
        return new NsfrBreakdown(nsfr, asf, rsf);
    }

    public double calculateAvailableStableFunding(BalanceSheet balanceSheet) {
        return balanceSheet.totalEquity() * ASF_EQUITY
            + balanceSheet.getLiability(LineItems.RETAIL_STABLE) * ASF_RETAIL_STABLE
            + balanceSheet.getLiability(LineItems.RETAIL_UNSTABLE) * ASF_RETAIL_UNSTABLE
            + balanceSheet.getLiability(LineItems.CORPORATE_DEPOSITS) * ASF_CORPORATE;
    }

    public double calculateRequiredStableFunding(BalanceSheet balanceSheet) {
        return balanceSheet.getAsset(LineItems.HQLA_LEVEL1) * RSF_HQLA_LEVEL1
            + balanceSheet.getAsset(LineItems.HQLA_LEVEL2A) * RSF_HQLA_LEVEL2A
            + balanceSheet.getAsset(LineItems.HQLA_LEVEL2B) * RSF_HQLA_LEVEL2B
            + balanceSheet.getAsset(LineItems.PERFORMING_LOANS) * RSF_PERFORMING_LOANS
            + balanceSheet.getAsset(LineItems.NPL) * RSF_NPL
            + balanceSheet.getAsset(LineItems.REAL_ESTATE) * RSF_REAL_ESTATE
            + balanceSheet.getAsset(LineItems.OTHER_SECURITIES) * RSF_OTHER
            + balanceSheet.getAsset(LineItems.OTHER_ASSETS) * RSF_OTHER;
    }

    /**
     * LCR the engine tests each period: haircut HQLA without the level-2 cap over a quarter
     * of total deposits. Wholesale and secured funding carry no outflow here.
     */
    public double calculateEngineLcr(BalanceSheet balanceSheet) {
        double netOutflows = balanceSheet.totalDeposits() * ENGINE_DEPOSIT_OUTFLOW_RATE;
        if (netOutflows <= 0) {
            return NO_EXPOSURE_RATIO;
        }
        return balanceSheet.totalHqla(true) / netOutflows * 100;
    }

    /**
     * NSFR the engine records each period: equity plus stable retail deposits over performing loans.
     */
    public double calculateEngineNsfr(BalanceSheet balanceSheet) {
        double asf = balanceSheet.totalEquity() * ASF_EQUITY
            + balanceSheet.getLiability(LineItems.RETAIL_STABLE) * ASF_RETAIL_STABLE;
        double rsf = balanceSheet.getAsset(LineItems.PERFORMING_LOANS) * RSF_PERFORMING_LOANS;
        if (rsf <= 0) {
            return NO_EXPOSURE_RATIO;
        }
        return asf / rsf * 100;
    }

    /**
     * The metrics the liquidity engine records for each period. The ratios are the engine
     * variants; {@link #calculateAllMetrics} carries the formal Basel ones.
     */
    public MetricsSnapshot calculateSnapshot(BalanceSheet balanceSheet) {
        return new MetricsSnapshot(
            calculateEngineLcr(balanceSheet),
            calculateEngineNsfr(balanceSheet),
            balanceSheet.cet1Ratio(),
            balanceSheet.totalCapitalRatio(),
            balanceSheet.totalLiquidAssets(),
            balanceSheet.totalDeposits());
    }

    public RegulatoryMetrics calculateAllMetrics(BalanceSheet balanceSheet) {
        RegulatoryMetrics metrics = new RegulatoryMetrics();

        metrics.setLcr(calculateLcr(balanceSheet));
        metrics.setNsfr(calculateNsfr(balanceSheet));
        metrics.setCet1Ratio(balanceSheet.cet1Ratio());
        metrics.setTier1Ratio(balanceSheet.tier1Ratio());
        metrics.setTotalCapitalRatio(balanceSheet.totalCapitalRatio());
        metrics.setLeverageRatio(balanceSheet.leverageRatio());
        metrics.setLiquidAssets(balanceSheet.totalLiquidAssets());
        metrics.setTotalAssets(balanceSheet.totalAssets());

        double deposits = balanceSheet.totalDeposits();
        metrics.setTotalDeposits(deposits);
        if (deposits > 0) {
            metrics.setLoanToDepositRatio(balanceSheet.getAsset(LineItems.PERFORMING_LOANS) / deposits * 100);
        }

        return metrics;
    }
}
