package logging;

/**
 * Enumeration of all audit event types in the simulator.
 * Each event type represents a significant action that requires audit logging.
 */
public enum AuditEventType {
    // Input Events
    BALANCE_SHEET_VALIDATED("Balance sheet validated for simulation"),
    SCENARIO_REGISTERED("Stress scenario registered"),

    // Simulation Events
    SIMULATION_STARTED("Simulation run started"),
    BREACH_DETECTED("Regulatory breach detected during simulation"),
    SIMULATION_COMPLETED("Simulation run completed"),
    SIMULATION_FAILED("Simulation run aborted by an error"),

    // Analysis Events
    ANALYSIS_GENERATED("Survival analysis report generated");

    private final String description;

    AuditEventType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
