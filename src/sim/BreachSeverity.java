package sim;

/**
 * Severity attached to a breach analysis.
 */
public enum BreachSeverity {
    CRITICAL("Critical"),
    FATAL("Fatal"),
    HIGH("High");

    private final String label;

    BreachSeverity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
