package scenario;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effect of one credit-deterioration step on the balance sheet.
 * The RWA increase is reported only; risk-weighted assets are always recomputed from the ledger.
 */
public class CreditDeteriorationImpact {
    private final double migrationAmount;
    private final double provision;
    private final double rwaIncreasePct;

    public CreditDeteriorationImpact(double migrationAmount, double provision, double rwaIncreasePct) {
        this.migrationAmount = migrationAmount;
        this.provision = provision;
        this.rwaIncreasePct = rwaIncreasePct;
    }

    public double getMigrationAmount() { return migrationAmount; }
    public double getProvision() { return provision; }
    public double getRwaIncreasePct() { return rwaIncreasePct; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("migration_amount", migrationAmount);
        map.put("provision", provision);
        map.put("rwa_increase_pct", rwaIncreasePct);
        return map;
    }
}
