package sim;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Components of a Net Stable Funding Ratio calculation.
 */
public class NsfrBreakdown {
    private final double nsfr;
    private final double availableStableFunding;
    private final double requiredStableFunding;

    public NsfrBreakdown(double nsfr, double availableStableFunding, double requiredStableFunding) {
        this.nsfr = nsfr;
        this.availableStableFunding = availableStableFunding;
        this.requiredStableFunding = requiredStableFunding;
    }

    public double getNsfr() { return nsfr; }
    public double getAvailableStableFunding() { return availableStableFunding; }
    public double getRequiredStableFunding() { return requiredStableFunding; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("nsfr", nsfr);
        map.put("available_stable_funding", availableStableFunding);
        map.put("required_stable_funding", requiredStableFunding);
        return map;
    }
}
