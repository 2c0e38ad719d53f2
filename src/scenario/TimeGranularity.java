package scenario;

/**
 * Length of one simulation period.
 */
public enum TimeGranularity {
    DAILY("Daily", 1),
    MONTHLY("Monthly", 30),
    QUARTERLY("Quarterly", 90),
    YEARLY("Yearly", 365);

    private final String label;
    private final int days;

    TimeGranularity(String label, int days) {
        this.label = label;
        this.days = days;
    }

    public String getLabel() {
        return label;
    }

    public int getDays() {
        return days;
    }

    /**
     * @return the granularity with this label, or null if there is none
     */
    public static TimeGranularity fromLabel(String label) {
        for (TimeGranularity granularity : values()) {
            if (granularity.label.equals(label)) {
                return granularity;
            }
        }
        return null;
    }
}
