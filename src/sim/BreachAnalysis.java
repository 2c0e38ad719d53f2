package sim;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Narrative classification of a simulation's breach, or of its survival when no breach occurred.
 * Type, period, value, threshold and severity are only meaningful when {@link #isBreached()} is true.
 */
public class BreachAnalysis {
    private final boolean breached;
    private final String type;
    private final int period;
    private final double value;
    private final double threshold;
    private final BreachSeverity severity;
    private final String message;

    private BreachAnalysis(boolean breached, String type, int period, double value, double threshold,
                           BreachSeverity severity, String message) {
        this.breached = breached;
        this.type = type;
        this.period = period;
        this.value = value;
        this.threshold = threshold;
        this.severity = severity;
        this.message = message;
    }

    static BreachAnalysis survived(String message) {
        return new BreachAnalysis(false, null, -1, 0, 0, null, message);
    }

    static BreachAnalysis breached(BreachInfo breach, BreachSeverity severity, String message) {
        return new BreachAnalysis(true, breach.getType().getLabel(), breach.getPeriod(), breach.getValue(),
            breach.getThreshold(), severity, message);
    }

    public boolean isBreached() { return breached; }
    public String getType() { return type; }
    public int getPeriod() { return period; }
    public double getValue() { return value; }
    public double getThreshold() { return threshold; }
    public BreachSeverity getSeverity() { return severity; }
    public String getMessage() { return message; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("breached", breached);
        if (breached) {
            map.put("type", type);
            map.put("period", period);
            map.put("value", value);
            map.put("threshold", threshold);
            map.put("severity", severity.getLabel());
        }
        map.put("message", message);
        return map;
    }

    @Override
    public String toString() {
        return breached
            ? String.format("%s breach at period %d (%s): %s", type, period, severity.getLabel(), message)
            : message;
    }
}
