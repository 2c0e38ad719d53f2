package ledger;

import java.util.List;

/**
 * Line-item vocabulary of the balance sheet.
 */
public final class LineItems {

    // Assets
    public static final String CASH_RESERVES = "cash_reserves";
    public static final String HQLA_LEVEL1 = "hqla_level1";
    public static final String HQLA_LEVEL2A = "hqla_level2a";
    public static final String HQLA_LEVEL2B = "hqla_level2b";
    public static final String PERFORMING_LOANS = "performing_loans";
    public static final String NPL = "npl";
    public static final String REAL_ESTATE = "real_estate";
    public static final String OTHER_SECURITIES = "other_securities";
    public static final String OTHER_ASSETS = "other_assets";

    // Liabilities
    public static final String RETAIL_STABLE = "retail_stable";
    public static final String RETAIL_UNSTABLE = "retail_unstable";
    public static final String CORPORATE_DEPOSITS = "corporate_deposits";
    public static final String WHOLESALE_FUNDING = "wholesale_funding";
    public static final String SECURED_FUNDING = "secured_funding";
    public static final String OTHER_LIABILITIES = "other_liabilities";

    // Equity
    public static final String CET1 = "cet1";
    public static final String AT1 = "at1";
    public static final String TIER2 = "tier2";

    /**
     * Funding categories subject to run-off, in the order withdrawals are applied each period.
     */
    public static final List<String> DEPOSIT_CATEGORIES = List.of(
            RETAIL_STABLE, RETAIL_UNSTABLE, CORPORATE_DEPOSITS, WHOLESALE_FUNDING, SECURED_FUNDING);

    private LineItems() {
    }
}
