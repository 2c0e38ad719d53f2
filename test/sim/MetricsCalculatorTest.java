package sim;

import Exceptions.DataValidationException;
import ledger.BalanceSheet;
import ledger.LineItems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCalculatorTest {

    private static final double EPS = 1e-6;

    private MetricsCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new MetricsCalculator();
    }

    @Test
    void lcrOfLiquidBank() throws DataValidationException {
        LcrBreakdown lcr = calculator.calculateLcr(BalanceSheetFixtures.liquidBank());

        assertEquals(5000.0, lcr.getTotalHqla(), EPS);
        assertEquals(400.0, lcr.getGrossOutflows(), EPS);
        assertEquals(200.0, lcr.getGrossInflows(), EPS);
        assertEquals(250.0, lcr.getNetOutflows(), EPS);
        assertEquals(2000.0, lcr.getLcr(), EPS);
    }

    @Test
    void levelTwoAssetsAreCapped() throws DataValidationException {
        BalanceSheet sheet = new BalanceSheet(
            Map.of(LineItems.HQLA_LEVEL1, 100.0, LineItems.HQLA_LEVEL2A, 1000.0),
            Map.of(LineItems.WHOLESALE_FUNDING, 1000.0),
            Map.of(LineItems.CET1, 100.0));

        LcrBreakdown lcr = calculator.calculateLcr(sheet);

        // cap = (100 + 850) * 40%
        assertEquals(100.0, lcr.getLevel1Hqla(), EPS);
        assertEquals(380.0, lcr.getLevel2Hqla(), EPS);
        assertEquals(480.0, lcr.getTotalHqla(), EPS);
        assertEquals(48.0, lcr.getLcr(), EPS);
    }

    @Test
    void netOutflowsAreFlooredAtQuarterOfGross() throws DataValidationException {
        BalanceSheet sheet = new BalanceSheet(
            Map.of(LineItems.HQLA_LEVEL1, 100.0, LineItems.PERFORMING_LOANS, 100000.0),
            Map.of(LineItems.WHOLESALE_FUNDING, 1000.0),
            Map.of(LineItems.CET1, 100.0));

        assertEquals(250.0, calculator.calculateLcr(sheet).getNetOutflows(), EPS);
    }

    @Test
    void noOutflowsMeansNoExposure() throws DataValidationException {
        BalanceSheet sheet = new BalanceSheet(
            Map.of(LineItems.HQLA_LEVEL1, 100.0),
            Map.of(LineItems.OTHER_LIABILITIES, 90.0),
            Map.of(LineItems.CET1, 10.0));

        assertEquals(MetricsCalculator.NO_EXPOSURE_RATIO, calculator.calculateLcr(sheet).getLcr(), EPS);
    }

    @Test
    void nsfrOfLiquidBank() throws DataValidationException {
        NsfrBreakdown nsfr = calculator.calculateNsfr(BalanceSheetFixtures.liquidBank());

        assertEquals(2000.0 + 8000.0 * 0.95, nsfr.getAvailableStableFunding(), EPS);
        assertEquals(5000.0 * 0.05 + 4000.0 * 0.85, nsfr.getRequiredStableFunding(), EPS);
        assertEquals(9600.0 / 3650.0 * 100, nsfr.getNsfr(), EPS);
    }

    @Test
    void snapshotCarriesCapitalAndLiquidity() throws DataValidationException {
        MetricsSnapshot snapshot = calculator.calculateSnapshot(BalanceSheetFixtures.liquidBank());

        assertEquals(250.0, snapshot.getLcr(), EPS);
        assertEquals(9600.0 / 3400.0 * 100, snapshot.getNsfr(), EPS);
        assertEquals(50.0, snapshot.getCet1Ratio(), EPS);
        assertEquals(50.0, snapshot.getTotalCapitalRatio(), EPS);
        assertEquals(6000.0, snapshot.getLiquidAssets(), EPS);
        assertEquals(8000.0, snapshot.getTotalDeposits(), EPS);
    }

    @Test
    void engineLcrIgnoresWholesaleFundingAndLevelTwoCap() throws DataValidationException {
        BalanceSheet sheet = BalanceSheetFixtures.wholesaleHeavyBank();

        assertEquals(1000.0 / (5050.0 - 5700.0 * 0.05 * 0.75) * 100, calculator.calculateLcr(sheet).getLcr(), EPS);
        assertEquals(400.0, calculator.calculateEngineLcr(sheet), EPS);
        assertEquals(400.0, calculator.calculateSnapshot(sheet).getLcr(), EPS);

        BalanceSheet levelTwoHeavy = new BalanceSheet(
            Map.of(LineItems.HQLA_LEVEL1, 100.0, LineItems.HQLA_LEVEL2B, 1000.0),
            Map.of(LineItems.RETAIL_STABLE, 1000.0),
            Map.of(LineItems.CET1, 100.0));
        assertEquals((100.0 + 500.0) / 250.0 * 100, calculator.calculateEngineLcr(levelTwoHeavy), EPS);
    }

    @Test
    void engineRatiosWithoutDepositsOrLoansMeanNoExposure() throws DataValidationException {
        BalanceSheet sheet = new BalanceSheet(
            Map.of(LineItems.HQLA_LEVEL1, 100.0),
            Map.of(LineItems.WHOLESALE_FUNDING, 90.0),
            Map.of(LineItems.CET1, 10.0));

        assertEquals(MetricsCalculator.NO_EXPOSURE_RATIO, calculator.calculateEngineLcr(sheet), EPS);
        assertEquals(MetricsCalculator.NO_EXPOSURE_RATIO, calculator.calculateEngineNsfr(sheet), EPS);
    }

    @Test
    void allMetricsIncludeLoanToDeposit() throws DataValidationException {
        RegulatoryMetrics metrics = calculator.calculateAllMetrics(BalanceSheetFixtures.liquidBank());

        assertEquals(50.0, metrics.getLoanToDepositRatio(), EPS);
        assertEquals(20.0, metrics.getLeverageRatio(), EPS);
        assertEquals(10000.0, metrics.getTotalAssets(), EPS);
        assertNotNull(metrics.getLcr());
        assertTrue(metrics.generateReport().contains("LCR"));
    }

    @Test
    void loanToDepositIsZeroWithoutDeposits() throws DataValidationException {
        BalanceSheet sheet = new BalanceSheet(
            Map.of(LineItems.PERFORMING_LOANS, 100.0),
            Map.of(LineItems.WHOLESALE_FUNDING, 90.0),
            Map.of(LineItems.CET1, 10.0));

        assertEquals(0.0, calculator.calculateAllMetrics(sheet).getLoanToDepositRatio(), EPS);
    }
}
