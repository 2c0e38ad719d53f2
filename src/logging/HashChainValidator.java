package logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.util.List;

/**
 * Verifies that a sequence of audit events forms an unbroken hash chain starting from the genesis hash.
 */
public class HashChainValidator {
    private static final Logger logger = LoggerFactory.getLogger(HashChainValidator.class);

    private final MessageDigest digest = AuditLogger.newDigest();

    public ValidationResult validate(List<AuditEvent> events) {
        String expectedPrevious = AuditLogger.GENESIS_HASH;

        for (int i = 0; i < events.size(); i++) {
            AuditEvent event = events.get(i);

            if (!expectedPrevious.equals(event.getPreviousHash())) {
                logger.warn("Audit chain broken at event {} ({}): previous hash mismatch", i, event.getEventId());
                return ValidationResult.brokenAt(i, "previous hash mismatch");
            }

            String recomputed = AuditLogger.sha256Hex(digest, expectedPrevious + event.getDataForHashing());
            if (!recomputed.equals(event.getHash())) {
                logger.warn("Audit chain broken at event {} ({}): hash mismatch", i, event.getEventId());
                return ValidationResult.brokenAt(i, "hash mismatch");
            }

            expectedPrevious = event.getHash();
        }

        return ValidationResult.valid(events.size());
    }

    /**
     * Outcome of a chain validation.
     */
    public static class ValidationResult {
        private final boolean valid;
        private final int checkedEvents;
        private final int brokenIndex;
        private final String reason;

        private ValidationResult(boolean valid, int checkedEvents, int brokenIndex, String reason) {
            this.valid = valid;
            this.checkedEvents = checkedEvents;
            this.brokenIndex = brokenIndex;
            this.reason = reason;
        }

        static ValidationResult valid(int checkedEvents) {
            return new ValidationResult(true, checkedEvents, -1, null);
        }

        static ValidationResult brokenAt(int index, String reason) {
            return new ValidationResult(false, index, index, reason);
        }

        public boolean isValid() { return valid; }
        public int getCheckedEvents() { return checkedEvents; }

        /** Index of the first invalid event, or -1 when the chain is intact. */
        public int getBrokenIndex() { return brokenIndex; }
        public String getReason() { return reason; }

        @Override
        public String toString() {
            return valid
                ? String.format("Chain valid (%d events)", checkedEvents)
                : String.format("Chain broken at event %d: %s", brokenIndex, reason);
        }
    }
}
