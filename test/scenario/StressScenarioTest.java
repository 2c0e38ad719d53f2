package scenario;

import Exceptions.DataValidationException;
import Exceptions.UnknownCategoryException;
import ledger.BalanceSheet;
import ledger.LineItems;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StressScenarioTest {

    private static final double EPS = 1e-9;

    private static StressScenario.Builder customScenario() {
        return new StressScenario.Builder("Custom")
            .timeGranularity(TimeGranularity.MONTHLY)
            .numPeriods(12)
            .runoffRate(LineItems.RETAIL_STABLE, 10.0)
            .runoffRate(LineItems.WHOLESALE_FUNDING, 50.0)
            .securityShock(LineItems.HQLA_LEVEL2B, -20.0)
            .customRunoff(3, LineItems.RETAIL_STABLE, 750.0)
            .fireSaleDiscount(12.0)
            .fireSaleIncrement(4.0)
            .loanMigrationRate(3.0)
            .provisioningRate(40.0)
            .description("Custom test scenario")
            .createdAt("2024-01-01T00:00:00Z");
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void defaultsApplyWhenNoRatesGiven() throws DataValidationException {
            StressScenario scenario = new StressScenario.Builder("Defaults").build();

            assertEquals(TimeGranularity.DAILY, scenario.getTimeGranularity());
            assertEquals(30, scenario.getNumPeriods());
            assertEquals(StressScenario.defaultRunoffRates(), scenario.getRunoffRates());
            assertEquals(10.0, scenario.getFireSaleDiscount(), EPS);
            assertEquals(2.0, scenario.getFireSaleIncrement(), EPS);
            assertEquals(100, scenario.getFundingSpreadIncrease());
            assertNotNull(scenario.getCreatedAt());
        }

        @Test
        void blankNameIsRejected() {
            assertThrows(DataValidationException.class, () -> new StressScenario.Builder(" ").build());
        }

        @Test
        void unknownGranularityIsRejected() {
            DataValidationException e = assertThrows(DataValidationException.class,
                () -> new StressScenario.Builder("Weekly").timeGranularity("Weekly").build());
            assertTrue(e.getMessage().contains("Weekly"));
        }

        @Test
        void nonPositivePeriodsAreRejected() {
            assertThrows(DataValidationException.class,
                () -> new StressScenario.Builder("Empty").numPeriods(0).build());
        }

        @Test
        void runoffRateOutOfRangeIsRejected() {
            assertThrows(DataValidationException.class,
                () -> new StressScenario.Builder("Bad").runoffRate(LineItems.RETAIL_STABLE, 120.0).build());
            assertThrows(DataValidationException.class,
                () -> new StressScenario.Builder("Bad").runoffRate(LineItems.RETAIL_STABLE, -1.0).build());
        }

        @Test
        void shockOutOfRangeIsRejected() {
            assertThrows(DataValidationException.class,
                () -> new StressScenario.Builder("Bad").securityShock(LineItems.HQLA_LEVEL2A, -150.0).build());
        }

        @Test
        void fireSaleDiscountAboveCapIsRejected() {
            assertThrows(DataValidationException.class,
                () -> new StressScenario.Builder("Bad").fireSaleDiscount(60.0).build());
        }

        @Test
        void negativeOverrideIsRejected() {
            assertThrows(DataValidationException.class,
                () -> new StressScenario.Builder("Bad").customRunoff(1, LineItems.RETAIL_STABLE, -5.0).build());
        }
    }

    @Test
    void runoffUsesOverrideVerbatimOtherwiseRate() throws DataValidationException {
        StressScenario scenario = customScenario().build();

        assertEquals(100.0, scenario.getRunoffForPeriod(0, LineItems.RETAIL_STABLE, 1000.0), EPS);
        assertEquals(750.0, scenario.getRunoffForPeriod(3, LineItems.RETAIL_STABLE, 1000.0), EPS);
        assertEquals(250.0, scenario.getRunoffForPeriod(3, LineItems.WHOLESALE_FUNDING, 500.0), EPS);
        assertEquals(0.0, scenario.getRunoffForPeriod(0, LineItems.CORPORATE_DEPOSITS, 1000.0), EPS);
        assertTrue(scenario.hasCustomRunoff());
    }

    @Test
    void shocksAreReturnedAsFractions() throws DataValidationException {
        StressScenario scenario = customScenario().build();
        assertEquals(-0.20, scenario.getSecurityShock(LineItems.HQLA_LEVEL2B), EPS);
        assertEquals(0.0, scenario.getSecurityShock(LineItems.HQLA_LEVEL1), EPS);
    }

    @Test
    void fireSaleDiscountGrowsWithVolumeAndIsCapped() throws DataValidationException {
        StressScenario scenario = customScenario().build();

        assertEquals(12.0, scenario.calculateFireSaleDiscount(0.0, 1000.0), EPS);
        // 25% of the holding sold: 2.5 increments of 4%
        assertEquals(22.0, scenario.calculateFireSaleDiscount(250.0, 1000.0), EPS);
        assertEquals(StressScenario.MAX_FIRE_SALE_DISCOUNT, scenario.calculateFireSaleDiscount(1000.0, 1000.0), EPS);
        assertEquals(12.0, scenario.calculateFireSaleDiscount(100.0, 0.0), EPS);
    }

    @Test
    void creditDeteriorationMigratesLoansAndProvisions() throws DataValidationException, UnknownCategoryException {
        StressScenario scenario = customScenario().build();
        BalanceSheet sheet = new BalanceSheet(
            Map.of(LineItems.PERFORMING_LOANS, 10000.0),
            Map.of(LineItems.RETAIL_STABLE, 9000.0),
            Map.of(LineItems.CET1, 1000.0));

        CreditDeteriorationImpact impact = scenario.applyCreditDeterioration(sheet);

        assertEquals(300.0, impact.getMigrationAmount(), EPS);
        assertEquals(120.0, impact.getProvision(), EPS);
        assertEquals(9700.0, sheet.getAsset(LineItems.PERFORMING_LOANS), EPS);
        assertEquals(300.0, sheet.getAsset(LineItems.NPL), EPS);
        assertEquals(880.0, sheet.getEquity(LineItems.CET1), EPS);
    }

    @Test
    void periodDurationFollowsGranularity() throws DataValidationException {
        assertEquals(30, customScenario().build().getPeriodDurationDays());
        assertEquals(90, customScenario().timeGranularity("Quarterly").build().getPeriodDurationDays());
    }

    @Test
    void mapRoundTripPreservesParameters() throws DataValidationException {
        StressScenario original = customScenario().build();
        StressScenario restored = StressScenario.fromMap(original.toMap());

        assertEquals(original.getRunoffRates(), restored.getRunoffRates());
        assertEquals(original.getSecurityShocks(), restored.getSecurityShocks());
        assertEquals(original.getNumPeriods(), restored.getNumPeriods());
        assertEquals(original.getCustomRunoff(), restored.getCustomRunoff());
        assertEquals(original, restored);
    }

    @Test
    void jsonRoundTripPreservesParameters() throws DataValidationException {
        StressScenario original = customScenario().build();
        StressScenario restored = StressScenario.fromJson(original.toJson());

        assertEquals(original.getRunoffRates(), restored.getRunoffRates());
        assertEquals(original.getNumPeriods(), restored.getNumPeriods());
        assertEquals(750.0, restored.getRunoffForPeriod(3, LineItems.RETAIL_STABLE, 1000.0), EPS);
        assertEquals(original.getCreatedAt(), restored.getCreatedAt());
    }

    @Test
    void missingTimeGranularityIsAValidationError() throws DataValidationException {
        Map<String, Object> data = new LinkedHashMap<>(customScenario().build().toMap());
        data.remove("time_granularity");

        DataValidationException e = assertThrows(DataValidationException.class, () -> StressScenario.fromMap(data));
        assertTrue(e.getMessage().contains("time_granularity"));
    }

    @Test
    void periodCountBeyondIntRangeIsAValidationError() throws DataValidationException {
        Map<String, Object> data = new LinkedHashMap<>(customScenario().build().toMap());
        data.put("num_periods", 1e12);

        DataValidationException e = assertThrows(DataValidationException.class, () -> StressScenario.fromMap(data));
        assertTrue(e.getMessage().contains("num_periods"));
    }

    @Test
    void malformedJsonIsAValidationError() {
        assertThrows(DataValidationException.class, () -> StressScenario.fromJson("{\"name\": "));
    }
}
