package Exceptions;

/**
 * Thrown when a ledger operation references a line item that is not on the balance sheet.
 * Fatal to the simulation run that triggered it.
 */
public class UnknownCategoryException extends Exception {
    private final String section;
    private final String category;

    public UnknownCategoryException(String section, String category) {
        super(String.format("Unknown %s category: %s", section, category));
        this.section = section;
        this.category = category;
    }

    public String getSection() {
        return section;
    }

    public String getCategory() {
        return category;
    }
}
