package scenario;

import ledger.LineItems;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioLibraryTest {

    @Test
    void baselStandardUsesRegulatoryRunoff() {
        StressScenario scenario = ScenarioLibrary.baselLcrStandard();

        assertEquals(ScenarioLibrary.BASEL_LCR_STANDARD, scenario.getName());
        assertEquals(30, scenario.getNumPeriods());
        assertEquals(StressScenario.defaultRunoffRates(), scenario.getRunoffRates());
        assertEquals(0.0, scenario.getFireSaleDiscount());
    }

    @Test
    void severeAndIdiosyncraticPresetsAreLonger() {
        StressScenario severe = ScenarioLibrary.severeStress();
        StressScenario crisis = ScenarioLibrary.idiosyncraticCrisis();

        assertEquals(60, severe.getNumPeriods());
        assertEquals(-0.40, severe.getSecurityShock(LineItems.OTHER_SECURITIES), 1e-9);
        assertEquals(90, crisis.getNumPeriods());
        assertEquals(80.0, crisis.getRunoffRates().get(LineItems.CORPORATE_DEPOSITS));
    }

    @Test
    void allPredefinedHaveDistinctNames() {
        List<StressScenario> presets = ScenarioLibrary.allPredefined();
        assertEquals(3, presets.size());
        assertEquals(3, presets.stream().map(StressScenario::getName).distinct().count());
    }
}
