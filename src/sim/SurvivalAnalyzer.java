package sim;

import config.SimulationSettings;
import ledger.LiquidationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.*;

/**
 * Read-only analysis over a completed simulation: breach narrative, near-breach periods,
 * failure attribution, per-asset liquidation totals and metric time series.
 * Every method is deterministic given the result and has no side effects.
 */
public class SurvivalAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(SurvivalAnalyzer.class);

    static final String NO_BREACH_MESSAGE = "No breach detected - bank survives full scenario";
    static final String DRIVER_SURVIVED = "No failure - scenario survived";
    static final String DRIVER_DEPOSIT_RUN = "Severe deposit withdrawals exceeded liquidity buffers";
    static final String DRIVER_FIRE_SALE = "Asset fire-sale losses depleted liquidity";
    static final String DRIVER_CAPITAL = "Realized losses from asset liquidations eroded capital";

    /** Outflows above this multiple of losses attribute a liquidity failure to the deposit run. */
    static final double OUTFLOW_TO_LOSS_MULTIPLE = 5.0;

    private final SimulationResult result;
    private final SimulationSettings settings;

    public SurvivalAnalyzer(SimulationResult result) {
        this(result, SimulationSettings.defaults());
    }

    public SurvivalAnalyzer(SimulationResult result, SimulationSettings settings) {
        this.result = Objects.requireNonNull(result, "result");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public int getSurvivalHorizon() {
        return result.getSurvivalHorizon();
    }

    public BreachAnalysis getBreachAnalysis() {
        BreachInfo breach = result.getBreachInfo();
        if (breach == null) {
            return BreachAnalysis.survived(NO_BREACH_MESSAGE);
        }

        int period = breach.getPeriod();
        switch (breach.getType()) {
            case LCR:
                return BreachAnalysis.breached(breach, BreachSeverity.CRITICAL, String.format(
                    "Liquidity Coverage Ratio fell below %s%% at period %d. The bank exhausted its "
                        + "high-quality liquid assets and could no longer meet stressed 30-day outflows.",
                    formatThreshold(breach.getThreshold()), period));
            case CET1:
                return BreachAnalysis.breached(breach, BreachSeverity.CRITICAL, String.format(
                    "CET1 capital ratio fell below %s%% at period %d. Realized losses from asset liquidations "
                        + "eroded capital below minimum regulatory requirements.",
                    formatThreshold(breach.getThreshold()), period));
            case LIQUIDITY:
                return BreachAnalysis.breached(breach, BreachSeverity.FATAL, String.format(
                    "Complete liquidity depletion at period %d. The bank ran out of all liquid assets "
                        + "including cash.", period));
            default:
                return BreachAnalysis.breached(breach, BreachSeverity.HIGH, String.format(
                    "Breach of %s at period %d", breach.getType().getLabel(), period));
        }
    }

    // 100.0 prints as "100", 4.5 as "4.5"
    private static String formatThreshold(double threshold) {
        return BigDecimal.valueOf(threshold).stripTrailingZeros().toPlainString();
    }

    /**
     * Periods whose closing metrics came within the near-breach band, whether or not the run breached.
     *
     * @return sorted period indices
     */
    public List<Integer> getCriticalPeriods() {
        SortedSet<Integer> critical = new TreeSet<>();
        for (PeriodResult periodResult : result.getPeriodResults()) {
            MetricsSnapshot metrics = periodResult.getMetrics();
            if (metrics.getLcr() < settings.getCriticalLcrThreshold()
                    || metrics.getCet1Ratio() < settings.getCriticalCet1Threshold()) {
                critical.add(periodResult.getPeriod());
            }
        }
        return new ArrayList<>(critical);
    }

    /**
     * Attribute the failure to deposit run-off or fire-sale losses, looking only at the periods
     * up to and including the breach.
     */
    public String getPrimaryDriver() {
        BreachInfo breach = result.getBreachInfo();
        if (breach == null) {
            return DRIVER_SURVIVED;
        }

        double totalOutflows = 0;
        double totalLosses = 0;
        for (PeriodResult periodResult : result.getPeriodResults()) {
            if (periodResult.getPeriod() > breach.getPeriod()) {
                break;
            }
            totalOutflows += periodResult.getTotalOutflow();
            totalLosses += periodResult.getLosses();
        }

        switch (breach.getType()) {
            case LCR:
            case LIQUIDITY:
                return totalOutflows > totalLosses * OUTFLOW_TO_LOSS_MULTIPLE ? DRIVER_DEPOSIT_RUN : DRIVER_FIRE_SALE;
            case CET1:
                return DRIVER_CAPITAL;
            default:
                return "Breach of " + breach.getType().getLabel();
        }
    }

    /**
     * Liquidation totals per asset line item, in order of first sale.
     */
    public Map<String, AssetDepletion> getAssetDepletionAnalysis() {
        Map<String, AssetDepletion> sales = new LinkedHashMap<>();
        for (PeriodResult periodResult : result.getPeriodResults()) {
            for (LiquidationEvent event : periodResult.getLiquidations()) {
                sales.computeIfAbsent(event.getAssetType(), AssetDepletion::new)
                    .record(event.getAmountLiquidated(), event.getLoss());
            }
        }
        return sales;
    }

    public MetricsTrajectory getMetricsTrajectory() {
        MetricsTrajectory trajectory = new MetricsTrajectory();
        for (PeriodResult periodResult : result.getPeriodResults()) {
            trajectory.add(periodResult.getPeriod(), periodResult.getMetrics());
        }
        return trajectory;
    }

    public SurvivalReport generateSummaryReport() {
        SurvivalReport report = new SurvivalReport(
            result.getScenarioName(),
            getSurvivalHorizon(),
            getBreachAnalysis(),
            getPrimaryDriver(),
            getCriticalPeriods(),
            getAssetDepletionAnalysis(),
            result.getAssetDepletion(),
            result.getTotalLosses(),
            result.getCapitalErosion(),
            result.getFinalLcr(),
            result.getFinalCet1());
        logger.debug("Generated survival report for '{}': horizon={}, driver={}",
            result.getScenarioName(), report.getSurvivalHorizon(), report.getPrimaryDriver());
        return report;
    }
}
