package sim;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The first breach that stopped a simulation: which condition, the offending value and threshold, and when.
 */
public class BreachInfo {
    private final BreachType type;
    private final double value;
    private final double threshold;
    private final int period;

    public BreachInfo(BreachType type, double value, double threshold, int period) {
        this.type = type;
        this.value = value;
        this.threshold = threshold;
        this.period = period;
    }

    public BreachType getType() { return type; }
    public double getValue() { return value; }
    public double getThreshold() { return threshold; }
    public int getPeriod() { return period; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.getLabel());
        map.put("value", value);
        map.put("threshold", threshold);
        map.put("period", period);
        return map;
    }

    @Override
    public String toString() {
        return String.format("%s breach at period %d (value=%.2f, threshold=%.2f)",
            type.getLabel(), period, value, threshold);
    }
}
