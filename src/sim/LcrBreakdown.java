package sim;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Components of a Liquidity Coverage Ratio calculation.
 */
public class LcrBreakdown {
    private final double lcr;
    private final double totalHqla;
    private final double level1Hqla;
    private final double level2Hqla;
    private final double grossOutflows;
    private final double grossInflows;
    private final double netOutflows;

    public LcrBreakdown(double lcr, double totalHqla, double level1Hqla, double level2Hqla,
                        double grossOutflows, double grossInflows, double netOutflows) {
        this.lcr = lcr;
        this.totalHqla = totalHqla;
        this.level1Hqla = level1Hqla;
        this.level2Hqla = level2Hqla;
        this.grossOutflows = grossOutflows;
        this.grossInflows = grossInflows;
        this.netOutflows = netOutflows;
    }

    public double getLcr() { return lcr; }
    /** Level 1 plus capped, haircut level 2. */
    public double getTotalHqla() { return totalHqla; }
    public double getLevel1Hqla() { return level1Hqla; }
    /** Haircut level 2A and 2B after the 40% cap. */
    public double getLevel2Hqla() { return level2Hqla; }
    public double getGrossOutflows() { return grossOutflows; }
    public double getGrossInflows() { return grossInflows; }
    public double getNetOutflows() { return netOutflows; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("lcr", lcr);
        map.put("total_hqla", totalHqla);
        map.put("level1_hqla", level1Hqla);
        map.put("level2_hqla", level2Hqla);
        map.put("net_outflows", netOutflows);
        map.put("gross_outflows", grossOutflows);
        map.put("gross_inflows", grossInflows);
        return map;
    }
}
