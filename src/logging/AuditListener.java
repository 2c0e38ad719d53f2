package logging;

/**
 * Callback notified after an event has been appended to the audit chain.
 */
@FunctionalInterface
public interface AuditListener {
    void onEvent(AuditEvent event);
}
