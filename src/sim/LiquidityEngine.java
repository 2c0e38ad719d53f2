package sim;

import Exceptions.UnknownCategoryException;
import config.SimulationSettings;
import ledger.AssetClass;
import ledger.BalanceSheet;
import ledger.BalanceSheetSnapshot;
import ledger.LiquidationEvent;
import ledger.LineItems;
import scenario.CreditDeteriorationImpact;
import scenario.StressScenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Core engine that steps a balance sheet through a stress scenario period by period.
 * Each period applies deposit run-off, meets the outflow by selling assets in the given
 * liquidation order, applies periodic credit deterioration, recomputes the metrics and
 * stops at the first regulatory breach.
 *
 * <p>The engine never mutates the balance sheet it was given; every run works on a fresh copy.
 * An engine instance is not meant to be shared between threads.
 */
public class LiquidityEngine {
    private static final Logger logger = LoggerFactory.getLogger(LiquidityEngine.class);

    private final BalanceSheet initialBalanceSheet;
    private final StressScenario scenario;
    private final List<String> liquidationOrder;
    private final List<String> recoveryActions;
    private final SimulationSettings settings;
    private final MetricsCalculator metricsCalculator;

    private List<PeriodResult> periodResults;
    private EngineState state;
    private int currentPeriod;

    public LiquidityEngine(BalanceSheet balanceSheet, StressScenario scenario, List<String> liquidationOrder) {
        this(balanceSheet, scenario, liquidationOrder, Collections.emptyList(), SimulationSettings.defaults());
    }

    public LiquidityEngine(BalanceSheet balanceSheet, StressScenario scenario,
                           List<String> liquidationOrder, List<String> recoveryActions) {
        this(balanceSheet, scenario, liquidationOrder, recoveryActions, SimulationSettings.defaults());
    }

    /**
     * @param balanceSheet     opening balance sheet; read only, the engine works on a copy
     * @param scenario         stress parameters
     * @param liquidationOrder asset-class labels in the order assets are sold; unknown labels are skipped
     * @param recoveryActions  recovery actions selected by the caller; kept for reporting, not modelled
     * @param settings         breach thresholds and credit-deterioration interval
     */
    public LiquidityEngine(BalanceSheet balanceSheet, StressScenario scenario, List<String> liquidationOrder,
                           List<String> recoveryActions, SimulationSettings settings) {
        this.initialBalanceSheet = Objects.requireNonNull(balanceSheet, "balanceSheet");
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.liquidationOrder = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(liquidationOrder, "liquidationOrder")));
        this.recoveryActions = recoveryActions == null
            ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(recoveryActions));
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metricsCalculator = new MetricsCalculator();
        this.periodResults = new ArrayList<>();
        this.state = EngineState.INITIALIZED;

        for (String label : this.liquidationOrder) {
            if (AssetClass.fromLabel(label) == null) {
                logger.warn("Liquidation order label '{}' is not a known asset class and will be skipped", label);
            }
        }
        if (!this.recoveryActions.isEmpty()) {
            logger.debug("Recovery actions {} are recorded but not modelled", this.recoveryActions);
        }
    }

    public SimulationResult run() throws UnknownCategoryException {
        return run(null);
    }

    /**
     * Run the full simulation.
     *
     * @param progressListener optional listener notified after every period
     * @return the simulation result with the complete period trace
     * @throws UnknownCategoryException if a ledger operation hits a line item missing from the balance sheet.
     *         Withdrawals and sales only touch lines with a positive balance, so a well-formed sheet never
     *         raises it; the engine moves to {@link EngineState#FAILED} before rethrowing.
     */
    public SimulationResult run(SimulationProgressListener progressListener) throws UnknownCategoryException {
        logger.info("Starting simulation: {}", scenario.getName());
        long startTime = System.currentTimeMillis();

        periodResults = new ArrayList<>();
        state = EngineState.RUNNING;
        currentPeriod = 0;

        BalanceSheet balanceSheet = initialBalanceSheet.copy();
        int numPeriods = scenario.getNumPeriods();
        BreachInfo breach = null;

        try {
            for (int period = 0; period < numPeriods; period++) {
                currentPeriod = period;

                PeriodResult periodResult = executePeriod(balanceSheet, period);
                periodResults.add(periodResult);

                breach = checkBreach(balanceSheet, periodResult);
                notifyProgress(progressListener, period, numPeriods, breach);

                if (breach != null) {
                    logger.info("Breach detected at period {}: {}", period, breach.getType().getLabel());
                    break;
                }
            }
        } catch (UnknownCategoryException e) {
            state = EngineState.FAILED;
            logger.error("Simulation '{}' aborted at period {}: {}", scenario.getName(), currentPeriod, e.getMessage());
            throw e;
        }

        state = breach != null ? EngineState.BREACHED : EngineState.COMPLETED;
        SimulationResult result = compileResults(breach);

        long elapsed = System.currentTimeMillis() - startTime;
        logger.info("Simulation completed in {} ms: survival horizon = {} periods, breach = {}",
            elapsed, result.getSurvivalHorizon(), result.getBreachType());

        return result;
    }

    private PeriodResult executePeriod(BalanceSheet balanceSheet, int period) throws UnknownCategoryException {
        BalanceSheetSnapshot opening = balanceSheet.snapshot();

        // 1. Deposit run-off
        Map<String, Double> outflows = new LinkedHashMap<>();
        double totalOutflow = applyWithdrawals(balanceSheet, period, outflows);

        // 2. Meet the outflow by selling assets
        List<LiquidationEvent> liquidations = new ArrayList<>();
        meetOutflows(balanceSheet, totalOutflow, liquidations);
        double losses = liquidations.stream().mapToDouble(LiquidationEvent::getLoss).sum();

        // 3. Periodic credit deterioration
        CreditDeteriorationImpact creditImpact = null;
        if (period > 0 && period % settings.getCreditDeteriorationInterval() == 0) {
            creditImpact = scenario.applyCreditDeterioration(balanceSheet);
        }

        // 4. Closing metrics
        MetricsSnapshot metrics = metricsCalculator.calculateSnapshot(balanceSheet);

        return new PeriodResult(period, opening, balanceSheet.snapshot(), outflows, liquidations,
            losses, metrics, creditImpact);
    }

    /**
     * Withdraw the period's run-off from every funded deposit category.
     *
     * @return total amount withdrawn
     */
    private double applyWithdrawals(BalanceSheet balanceSheet, int period, Map<String, Double> outflows)
            throws UnknownCategoryException {
        double totalOutflow = 0;

        for (String category : LineItems.DEPOSIT_CATEGORIES) {
            double openingBalance = balanceSheet.getLiability(category);
            if (openingBalance > 0) {
                double runoff = scenario.getRunoffForPeriod(period, category, openingBalance);
                double withdrawn = balanceSheet.applyWithdrawal(category, runoff);
                totalOutflow += withdrawn;
                outflows.put(category, withdrawn);
                logger.debug("Period {}: withdrew {} from {}", period, String.format("%.2f", withdrawn), category);
            }
        }

        return totalOutflow;
    }

    /**
     * Sell assets in liquidation order until the outflow is covered, then pay any
     * remainder straight out of cash. Outflow beyond what cash can cover is left unmet.
     */
    private void meetOutflows(BalanceSheet balanceSheet, double outflow, List<LiquidationEvent> liquidations)
            throws UnknownCategoryException {
        double remainingOutflow = outflow;

        for (String label : liquidationOrder) {
            if (remainingOutflow <= 0) {
                break;
            }

            AssetClass assetClass = AssetClass.fromLabel(label);
            if (assetClass == null) {
                continue;
            }

            double available = balanceSheet.getAsset(assetClass.getLineItem());
            if (available <= 0) {
                continue;
            }

            double haircut = getLiquidationHaircut(assetClass);
            double amountToLiquidate = Math.min(remainingOutflow / (1 - haircut / 100), available);

            if (amountToLiquidate > 0) {
                LiquidationEvent event = balanceSheet.liquidateAsset(assetClass.getLineItem(), amountToLiquidate, haircut);
                liquidations.add(event);
                logger.debug("Liquidated {}", event);
                remainingOutflow -= event.getProceeds();
            }
        }

        if (remainingOutflow > 0) {
            double cashUsed = balanceSheet.drawCash(remainingOutflow);
            if (cashUsed < remainingOutflow) {
                logger.debug("Outflow of {} left unmet after exhausting cash",
                    String.format("%.2f", remainingOutflow - cashUsed));
            }
        }
    }

    /**
     * Base haircut of the asset class plus the scenario's fire-sale discount,
     * except for cash and level-1 HQLA which are sold at their base haircut.
     */
    double getLiquidationHaircut(AssetClass assetClass) {
        double baseHaircut = assetClass.getBaseHaircutPct();
        if (assetClass.isFireSaleExempt()) {
            return baseHaircut;
        }
        return baseHaircut + scenario.getFireSaleDiscount();
    }

    /**
     * Check breach conditions in priority order: LCR, then CET1, then complete liquidity depletion.
     */
    private BreachInfo checkBreach(BalanceSheet balanceSheet, PeriodResult periodResult) {
        MetricsSnapshot metrics = periodResult.getMetrics();
        int period = periodResult.getPeriod();

        if (metrics.getLcr() < settings.getLcrMinimum()) {
            return new BreachInfo(BreachType.LCR, metrics.getLcr(), settings.getLcrMinimum(), period);
        }

        if (metrics.getCet1Ratio() < settings.getCet1Minimum()) {
            return new BreachInfo(BreachType.CET1, metrics.getCet1Ratio(), settings.getCet1Minimum(), period);
        }

        if (balanceSheet.getAsset(LineItems.CASH_RESERVES) <= 0 && balanceSheet.totalLiquidAssets() <= 0) {
            return new BreachInfo(BreachType.LIQUIDITY, 0, 0, period);
        }

        return null;
    }

    private void notifyProgress(SimulationProgressListener listener, int period, int numPeriods, BreachInfo breach) {
        if (listener == null) {
            return;
        }
        int percentComplete = (int) ((period + 1) * 100L / numPeriods);
        String status = breach != null
            ? String.format("Breach detected at period %d: %s", period, breach.getType().getLabel())
            : String.format("Processed period %d/%d", period + 1, numPeriods);
        listener.onProgress(period, percentComplete, status);
    }

    private SimulationResult compileResults(BreachInfo breach) {
        int survivalHorizon = breach != null ? breach.getPeriod() : scenario.getNumPeriods();

        double assetDepletion = 0;
        double totalLosses = 0;
        for (PeriodResult result : periodResults) {
            assetDepletion += result.getAmountLiquidated();
            totalLosses += result.getLosses();
        }

        double initialEquity = initialBalanceSheet.totalEquity();
        double capitalErosion = initialEquity > 0 ? totalLosses / initialEquity * 100 : 0;

        double finalLcr = 0;
        double finalCet1 = 0;
        if (!periodResults.isEmpty()) {
            MetricsSnapshot last = periodResults.get(periodResults.size() - 1).getMetrics();
            finalLcr = last.getLcr();
            finalCet1 = last.getCet1Ratio();
        }

        return new SimulationResult(scenario.getName(), scenario.getNumPeriods(), survivalHorizon, breach,
            assetDepletion, totalLosses, capitalErosion, finalLcr, finalCet1, periodResults);
    }

    public EngineState getState() { return state; }
    public int getCurrentPeriod() { return currentPeriod; }
    public StressScenario getScenario() { return scenario; }
    public List<String> getLiquidationOrder() { return liquidationOrder; }
    public List<String> getRecoveryActions() { return recoveryActions; }

    /**
     * Trace of the most recent run, or of the run in progress.
     */
    public List<PeriodResult> getPeriodResults() {
        return Collections.unmodifiableList(periodResults);
    }
}
