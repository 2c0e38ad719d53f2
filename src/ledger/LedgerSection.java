package ledger;

/**
 * The three sections of a balance sheet.
 */
public enum LedgerSection {
    ASSETS("assets"),
    LIABILITIES("liabilities"),
    EQUITY("equity");

    private final String key;

    LedgerSection(String key) {
        this.key = key;
    }

    /**
     * Key used for this section in plain key-value representations.
     */
    public String getKey() {
        return key;
    }
}
