package ledger;

import Exceptions.DataValidationException;
import Exceptions.UnknownCategoryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BalanceSheetTest {

    private static final double EPS = 1e-9;

    private BalanceSheet balanceSheet;

    @BeforeEach
    void setUp() throws DataValidationException {
        Map<String, Double> assets = new LinkedHashMap<>();
        assets.put(LineItems.CASH_RESERVES, 1000.0);
        assets.put(LineItems.HQLA_LEVEL1, 2000.0);
        assets.put(LineItems.HQLA_LEVEL2A, 500.0);
        assets.put(LineItems.HQLA_LEVEL2B, 300.0);
        assets.put(LineItems.PERFORMING_LOANS, 15000.0);
        assets.put(LineItems.NPL, 500.0);
        assets.put(LineItems.REAL_ESTATE, 1000.0);
        assets.put(LineItems.OTHER_SECURITIES, 800.0);
        assets.put(LineItems.OTHER_ASSETS, 200.0);

        Map<String, Double> liabilities = new LinkedHashMap<>();
        liabilities.put(LineItems.RETAIL_STABLE, 8000.0);
        liabilities.put(LineItems.RETAIL_UNSTABLE, 4000.0);
        liabilities.put(LineItems.CORPORATE_DEPOSITS, 3000.0);
        liabilities.put(LineItems.WHOLESALE_FUNDING, 2000.0);
        liabilities.put(LineItems.SECURED_FUNDING, 1500.0);
        liabilities.put(LineItems.OTHER_LIABILITIES, 200.0);

        Map<String, Double> equity = new LinkedHashMap<>();
        equity.put(LineItems.CET1, 1500.0);
        equity.put(LineItems.AT1, 200.0);
        equity.put(LineItems.TIER2, 900.0);

        balanceSheet = new BalanceSheet(assets, liabilities, equity);
    }

    @Nested
    @DisplayName("Construction and validation")
    class Construction {

        @Test
        void balancedSheetValidates() throws DataValidationException {
            assertEquals(21300.0, balanceSheet.totalAssets(), EPS);
            assertEquals(18700.0, balanceSheet.totalLiabilities(), EPS);
            assertEquals(2600.0, balanceSheet.totalEquity(), EPS);
            assertTrue(balanceSheet.validate());
        }

        @Test
        void smallMismatchIsToleratedWithWarning() throws DataValidationException {
            BalanceSheet sheet = new BalanceSheet(
                Map.of(LineItems.CASH_RESERVES, 100.5),
                Map.of(LineItems.RETAIL_STABLE, 90.0),
                Map.of(LineItems.CET1, 10.0));
            assertTrue(sheet.validate());
        }

        @Test
        void largeMismatchIsRejectedByValidate() throws DataValidationException {
            BalanceSheet sheet = new BalanceSheet(
                Map.of(LineItems.CASH_RESERVES, 1300.0),
                Map.of(LineItems.RETAIL_STABLE, 900.0),
                Map.of(LineItems.CET1, 100.0));
            DataValidationException e = assertThrows(DataValidationException.class, sheet::validate);
            assertTrue(e.getMessage().contains("out of balance"));
        }

        @Test
        void negativeAmountIsRejected() {
            assertThrows(DataValidationException.class, () -> new BalanceSheet(
                Map.of(LineItems.CASH_RESERVES, -1.0),
                Map.of(),
                Map.of()));
        }

        @Test
        void nonFiniteAmountIsRejected() {
            assertThrows(DataValidationException.class, () -> new BalanceSheet(
                Map.of(LineItems.CASH_RESERVES, Double.NaN),
                Map.of(),
                Map.of()));
        }

        @Test
        void missingSectionIsRejected() {
            assertThrows(DataValidationException.class, () -> new BalanceSheet(
                Map.of(LineItems.CASH_RESERVES, 1.0),
                null,
                Map.of()));
        }

        @Test
        void fromJsonReadsAllSections() throws DataValidationException {
            BalanceSheet sheet = BalanceSheet.fromJson(
                "{\"assets\": {\"cash_reserves\": 100, \"hqla_level1\": 50},"
                    + " \"liabilities\": {\"retail_stable\": 120},"
                    + " \"equity\": {\"cet1\": 30}}");
            assertEquals(150.0, sheet.totalAssets(), EPS);
            assertEquals(120.0, sheet.getLiability(LineItems.RETAIL_STABLE), EPS);
            assertEquals(30.0, sheet.getEquity(LineItems.CET1), EPS);
        }

        @Test
        void fromMapRejectsMissingSection() {
            Map<String, Map<String, Double>> data = new HashMap<>();
            data.put("assets", Map.of(LineItems.CASH_RESERVES, 1.0));
            data.put("equity", Map.of(LineItems.CET1, 1.0));
            assertThrows(DataValidationException.class, () -> BalanceSheet.fromMap(data));
        }
    }

    @Nested
    @DisplayName("Aggregates")
    class Aggregates {

        @Test
        void hqlaWithAndWithoutHaircuts() {
            assertEquals(2800.0, balanceSheet.totalHqla(), EPS);
            assertEquals(2000.0 + 500.0 * 0.85 + 300.0 * 0.50, balanceSheet.totalHqla(true), EPS);
        }

        @Test
        void depositsAndLiquidAssets() {
            assertEquals(15000.0, balanceSheet.totalDeposits(), EPS);
            assertEquals(12000.0, balanceSheet.totalRetailDeposits(), EPS);
            assertEquals(3800.0, balanceSheet.totalLiquidAssets(), EPS);
        }

        @Test
        void capitalRatiosUseRiskWeightedAssets() {
            // 15000 + 500*1.5 + 1000 + 800*0.5 + 200
            double rwa = 17350.0;
            assertEquals(rwa, balanceSheet.rwaEstimate(), EPS);
            assertEquals(1500.0 / rwa * 100, balanceSheet.cet1Ratio(), EPS);
            assertEquals(1700.0 / rwa * 100, balanceSheet.tier1Ratio(), EPS);
            assertEquals(2600.0 / rwa * 100, balanceSheet.totalCapitalRatio(), EPS);
            assertEquals(2600.0 / 21300.0 * 100, balanceSheet.leverageRatio(), EPS);
        }

        @Test
        void ratiosAreZeroWithoutRiskAssets() throws DataValidationException {
            BalanceSheet sheet = new BalanceSheet(
                Map.of(LineItems.CASH_RESERVES, 100.0),
                Map.of(LineItems.RETAIL_STABLE, 90.0),
                Map.of(LineItems.CET1, 10.0));
            assertEquals(0.0, sheet.cet1Ratio(), EPS);
            assertEquals(0.0, sheet.totalCapitalRatio(), EPS);
        }
    }

    @Nested
    @DisplayName("Mutations")
    class Mutations {

        @Test
        void withdrawalIsClampedToBalance() throws UnknownCategoryException {
            assertEquals(2000.0, balanceSheet.applyWithdrawal(LineItems.WHOLESALE_FUNDING, 5000.0), EPS);
            assertEquals(0.0, balanceSheet.getLiability(LineItems.WHOLESALE_FUNDING), EPS);

            assertEquals(400.0, balanceSheet.applyWithdrawal(LineItems.RETAIL_STABLE, 400.0), EPS);
            assertEquals(7600.0, balanceSheet.getLiability(LineItems.RETAIL_STABLE), EPS);
        }

        @Test
        void withdrawalFromUnknownLiabilityFails() {
            UnknownCategoryException e = assertThrows(UnknownCategoryException.class,
                () -> balanceSheet.applyWithdrawal("interbank", 10.0));
            assertEquals("liabilities", e.getSection());
            assertEquals("interbank", e.getCategory());
        }

        @Test
        void liquidationCreditsCashAndChargesLossToCet1() throws UnknownCategoryException {
            LiquidationEvent event = balanceSheet.liquidateAsset(LineItems.HQLA_LEVEL2B, 200.0, 25.0);

            assertEquals(LineItems.HQLA_LEVEL2B, event.getAssetType());
            assertEquals(200.0, event.getAmountLiquidated(), EPS);
            assertEquals(150.0, event.getProceeds(), EPS);
            assertEquals(50.0, event.getLoss(), EPS);
            assertEquals(100.0, balanceSheet.getAsset(LineItems.HQLA_LEVEL2B), EPS);
            assertEquals(1150.0, balanceSheet.getAsset(LineItems.CASH_RESERVES), EPS);
            assertEquals(1450.0, balanceSheet.getEquity(LineItems.CET1), EPS);
        }

        @Test
        void liquidationNeverExceedsHoldingOrPreHaircutAmount() throws UnknownCategoryException {
            double cashBefore = balanceSheet.getAsset(LineItems.CASH_RESERVES);
            LiquidationEvent event = balanceSheet.liquidateAsset(LineItems.OTHER_SECURITIES, 5000.0, 10.0);

            assertEquals(800.0, event.getAmountLiquidated(), EPS);
            assertEquals(0.0, balanceSheet.getAsset(LineItems.OTHER_SECURITIES), EPS);
            assertTrue(balanceSheet.getAsset(LineItems.CASH_RESERVES) - cashBefore <= event.getAmountLiquidated());
        }

        @Test
        void liquidationRejectsOutOfRangeHaircut() {
            assertThrows(IllegalArgumentException.class,
                () -> balanceSheet.liquidateAsset(LineItems.HQLA_LEVEL1, 10.0, 120.0));
        }

        @Test
        void liquidationOfUnknownAssetFails() {
            assertThrows(UnknownCategoryException.class,
                () -> balanceSheet.liquidateAsset("gold", 10.0, 0.0));
        }

        @Test
        void drawCashStopsAtZero() {
            assertEquals(1000.0, balanceSheet.drawCash(2500.0), EPS);
            assertEquals(0.0, balanceSheet.getAsset(LineItems.CASH_RESERVES), EPS);
            assertEquals(0.0, balanceSheet.drawCash(10.0), EPS);
        }

        @Test
        void transferCreatesTargetLine() throws DataValidationException, UnknownCategoryException {
            BalanceSheet sheet = new BalanceSheet(
                Map.of(LineItems.PERFORMING_LOANS, 1000.0),
                Map.of(LineItems.RETAIL_STABLE, 900.0),
                Map.of(LineItems.CET1, 100.0));
            assertFalse(sheet.hasAsset(LineItems.NPL));

            assertEquals(50.0, sheet.transferAsset(LineItems.PERFORMING_LOANS, LineItems.NPL, 50.0), EPS);
            assertEquals(950.0, sheet.getAsset(LineItems.PERFORMING_LOANS), EPS);
            assertEquals(50.0, sheet.getAsset(LineItems.NPL), EPS);
        }

        @Test
        void lossesMayTakeCet1Negative() {
            balanceSheet.absorbLoss(2000.0);
            assertEquals(-500.0, balanceSheet.getEquity(LineItems.CET1), EPS);
        }

        @Test
        void negativeAmountsAreProgrammingErrors() {
            assertThrows(IllegalArgumentException.class,
                () -> balanceSheet.applyWithdrawal(LineItems.RETAIL_STABLE, -1.0));
            assertThrows(IllegalArgumentException.class, () -> balanceSheet.drawCash(-1.0));
        }
    }

    @Test
    void copyIsIndependent() throws UnknownCategoryException {
        BalanceSheet copy = balanceSheet.copy();
        copy.applyWithdrawal(LineItems.RETAIL_STABLE, 1000.0);
        copy.liquidateAsset(LineItems.HQLA_LEVEL1, 500.0, 0.0);

        assertEquals(8000.0, balanceSheet.getLiability(LineItems.RETAIL_STABLE), EPS);
        assertEquals(2000.0, balanceSheet.getAsset(LineItems.HQLA_LEVEL1), EPS);
    }

    @Test
    void snapshotIsFrozen() throws UnknownCategoryException {
        BalanceSheetSnapshot snapshot = balanceSheet.snapshot();
        balanceSheet.applyWithdrawal(LineItems.RETAIL_STABLE, 1000.0);

        assertEquals(8000.0, snapshot.getLiability(LineItems.RETAIL_STABLE), EPS);
        assertEquals(21300.0, snapshot.totalAssets(), EPS);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.getAssets().put("x", 1.0));
    }

    @Test
    void jsonRoundTripPreservesLedgers() throws DataValidationException {
        BalanceSheet restored = BalanceSheet.fromJson(balanceSheet.toJson());
        assertEquals(balanceSheet.toMap(), restored.toMap());
    }
}
