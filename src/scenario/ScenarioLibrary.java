package scenario;

import Exceptions.DataValidationException;
import ledger.LineItems;

import java.util.List;

/**
 * Predefined stress scenarios.
 */
public final class ScenarioLibrary {

    public static final String BASEL_LCR_STANDARD = "Basel III LCR Standard";
    public static final String SEVERE_COMBINED_STRESS = "Severe Combined Stress";
    public static final String IDIOSYNCRATIC_CRISIS = "Idiosyncratic Bank Crisis";

    private ScenarioLibrary() {
    }

    /**
     * Basel III LCR standard 30-day stress: regulatory run-off rates, no market shocks, no fire-sale discount.
     */
    public static StressScenario baselLcrStandard() {
        return build(new StressScenario.Builder(BASEL_LCR_STANDARD)
            .timeGranularity(TimeGranularity.DAILY)
            .numPeriods(30)
            .runoffRate(LineItems.RETAIL_STABLE, 5.0)
            .runoffRate(LineItems.RETAIL_UNSTABLE, 10.0)
            .runoffRate(LineItems.CORPORATE_DEPOSITS, 40.0)
            .runoffRate(LineItems.WHOLESALE_FUNDING, 100.0)
            .runoffRate(LineItems.SECURED_FUNDING, 25.0)
            .fireSaleDiscount(0.0)
            .description("Standard Basel III LCR stress scenario over 30 days"));
    }

    /**
     * Severe combined stress: deposit runs, market shocks and credit deterioration over 60 days.
     */
    public static StressScenario severeStress() {
        return build(new StressScenario.Builder(SEVERE_COMBINED_STRESS)
            .timeGranularity(TimeGranularity.DAILY)
            .numPeriods(60)
            .runoffRate(LineItems.RETAIL_STABLE, 15.0)
            .runoffRate(LineItems.RETAIL_UNSTABLE, 30.0)
            .runoffRate(LineItems.CORPORATE_DEPOSITS, 60.0)
            .runoffRate(LineItems.WHOLESALE_FUNDING, 100.0)
            .runoffRate(LineItems.SECURED_FUNDING, 50.0)
            .securityShock(LineItems.HQLA_LEVEL1, 0.0)
            .securityShock(LineItems.HQLA_LEVEL2A, -10.0)
            .securityShock(LineItems.HQLA_LEVEL2B, -25.0)
            .securityShock(LineItems.OTHER_SECURITIES, -40.0)
            .fireSaleDiscount(15.0)
            .fireSaleIncrement(3.0)
            .fundingSpreadIncrease(250)
            .collateralHaircutIncrease(20.0)
            .loanMigrationRate(5.0)
            .provisioningRate(60.0)
            .rwaIncrease(15.0)
            .description("Severe stress combining deposit runs, market shocks, and credit deterioration"));
    }

    /**
     * Bank-specific crisis with major deposit flight over 90 days.
     */
    public static StressScenario idiosyncraticCrisis() {
        return build(new StressScenario.Builder(IDIOSYNCRATIC_CRISIS)
            .timeGranularity(TimeGranularity.DAILY)
            .numPeriods(90)
            .runoffRate(LineItems.RETAIL_STABLE, 20.0)
            .runoffRate(LineItems.RETAIL_UNSTABLE, 50.0)
            .runoffRate(LineItems.CORPORATE_DEPOSITS, 80.0)
            .runoffRate(LineItems.WHOLESALE_FUNDING, 100.0)
            .runoffRate(LineItems.SECURED_FUNDING, 75.0)
            .securityShock(LineItems.HQLA_LEVEL1, 0.0)
            .securityShock(LineItems.HQLA_LEVEL2A, -15.0)
            .securityShock(LineItems.HQLA_LEVEL2B, -35.0)
            .securityShock(LineItems.OTHER_SECURITIES, -50.0)
            .fireSaleDiscount(20.0)
            .fireSaleIncrement(5.0)
            .fundingSpreadIncrease(500)
            .collateralHaircutIncrease(30.0)
            .loanMigrationRate(8.0)
            .provisioningRate(70.0)
            .rwaIncrease(25.0)
            .description("Severe idiosyncratic crisis with major deposit flight"));
    }

    public static List<StressScenario> allPredefined() {
        return List.of(baselLcrStandard(), severeStress(), idiosyncraticCrisis());
    }

    private static StressScenario build(StressScenario.Builder builder) {
        try {
            return builder.build();
        } catch (DataValidationException e) {
            throw new IllegalStateException("Predefined scenario is invalid", e);
        }
    }
}
