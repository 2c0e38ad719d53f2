package sim;

import Exceptions.DataValidationException;
import Exceptions.UnknownCategoryException;
import config.SimulationSettings;
import ledger.BalanceSheet;
import logging.AuditEventType;
import logging.AuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenario.ScenarioLibrary;
import scenario.StressScenario;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orchestrates simulation runs: keeps a registry of named scenarios, validates inputs,
 * runs the engine and records every step in the audit trail.
 */
public class SimulationManager {
    private static final Logger logger = LoggerFactory.getLogger(SimulationManager.class);

    private final SimulationSettings settings;
    private final AuditLogger auditLogger;
    private final Map<String, StressScenario> scenarios = new LinkedHashMap<>();

    public SimulationManager(SimulationSettings settings, AuditLogger auditLogger) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.auditLogger = Objects.requireNonNull(auditLogger, "auditLogger");
    }

    /**
     * Add a scenario to the registry.
     *
     * @throws DataValidationException if a scenario with the same name is already registered
     */
    public synchronized void registerScenario(StressScenario scenario) throws DataValidationException {
        Objects.requireNonNull(scenario, "scenario");
        if (scenarios.containsKey(scenario.getName())) {
            throw new DataValidationException("Scenario already registered: " + scenario.getName());
        }
        scenarios.put(scenario.getName(), scenario);

        auditLogger.logEvent(auditLogger.newEvent(AuditEventType.SCENARIO_REGISTERED)
                .scenario(scenario.getName())
                .addData("num_periods", scenario.getNumPeriods())
                .addData("time_granularity", scenario.getTimeGranularity().getLabel())
                .build());
        logger.info("Registered scenario '{}'", scenario.getName());
    }

    /**
     * Register every predefined scenario from {@link ScenarioLibrary}.
     */
    public void registerPresets() throws DataValidationException {
        for (StressScenario scenario : ScenarioLibrary.allPredefined()) {
            registerScenario(scenario);
        }
    }

    public synchronized StressScenario getScenario(String name) throws DataValidationException {
        StressScenario scenario = scenarios.get(name);
        if (scenario == null) {
            throw new DataValidationException("Unknown scenario: " + name);
        }
        return scenario;
    }

    public synchronized List<String> getScenarioNames() {
        return new ArrayList<>(scenarios.keySet());
    }

    public SimulationResult runSimulation(BalanceSheet balanceSheet, String scenarioName)
            throws DataValidationException, UnknownCategoryException {
        return runSimulation(balanceSheet, scenarioName, settings.getDefaultLiquidationOrder(), List.of(), null);
    }

    /**
     * Validate the balance sheet, then run the named scenario against it.
     *
     * @throws DataValidationException  if the balance sheet is invalid, the scenario is unknown,
     *                                  or the scenario is longer than the configured maximum
     * @throws UnknownCategoryException if the run aborts on a missing line item
     */
    public SimulationResult runSimulation(BalanceSheet balanceSheet, String scenarioName,
                                          List<String> liquidationOrder, List<String> recoveryActions,
                                          SimulationProgressListener progressListener)
            throws DataValidationException, UnknownCategoryException {
        StressScenario scenario = getScenario(scenarioName);

        if (scenario.getNumPeriods() > settings.getMaxPeriods()) {
            throw new DataValidationException(String.format("Scenario '%s' has %d periods, maximum is %d",
                scenarioName, scenario.getNumPeriods(), settings.getMaxPeriods()));
        }

        balanceSheet.validate();
        auditLogger.logEvent(auditLogger.newEvent(AuditEventType.BALANCE_SHEET_VALIDATED)
                .scenario(scenarioName)
                .addData("total_assets", balanceSheet.totalAssets())
                .addData("total_liabilities", balanceSheet.totalLiabilities())
                .addData("total_equity", balanceSheet.totalEquity())
                .build());

        auditLogger.logEvent(auditLogger.newEvent(AuditEventType.SIMULATION_STARTED)
                .scenario(scenarioName)
                .addData("liquidation_order", new ArrayList<>(liquidationOrder))
                .addData("recovery_actions", new ArrayList<>(recoveryActions))
                .build());

        LiquidityEngine engine = new LiquidityEngine(balanceSheet, scenario, liquidationOrder,
            recoveryActions, settings);

        SimulationResult result;
        try {
            result = engine.run(progressListener);
        } catch (UnknownCategoryException e) {
            auditLogger.logEvent(auditLogger.newEvent(AuditEventType.SIMULATION_FAILED)
                    .scenario(scenarioName)
                    .addData("period", engine.getCurrentPeriod())
                    .addData("error", e.getMessage())
                    .build());
            throw e;
        }

        if (result.isBreached()) {
            auditLogger.logEvent(auditLogger.newEvent(AuditEventType.BREACH_DETECTED)
                    .scenario(scenarioName)
                    .addAllData(result.getBreachInfo().toMap())
                    .build());
        }

        auditLogger.logEvent(auditLogger.newEvent(AuditEventType.SIMULATION_COMPLETED)
                .scenario(scenarioName)
                .addData("survival_horizon", result.getSurvivalHorizon())
                .addData("breach_type", result.getBreachType())
                .addData("total_losses", result.getTotalLosses())
                .build());

        return result;
    }

    /**
     * Produce the survival report for a finished run.
     */
    public SurvivalReport analyze(SimulationResult result) {
        SurvivalReport report = new SurvivalAnalyzer(result, settings).generateSummaryReport();
        auditLogger.logEvent(auditLogger.newEvent(AuditEventType.ANALYSIS_GENERATED)
                .scenario(result.getScenarioName())
                .addData("survival_horizon", report.getSurvivalHorizon())
                .addData("primary_driver", report.getPrimaryDriver())
                .build());
        return report;
    }

    public SimulationSettings getSettings() {
        return settings;
    }

    public AuditLogger getAuditLogger() {
        return auditLogger;
    }
}
