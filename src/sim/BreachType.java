package sim;

/**
 * Regulatory breach conditions, in the priority order the engine checks them.
 */
public enum BreachType {
    LCR("LCR"),
    CET1("CET1"),
    LIQUIDITY("Liquidity");

    private final String label;

    BreachType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
