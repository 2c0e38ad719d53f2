package logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Audit logger with hash chain implementation for non-repudiation.
 * Each event is linked to the previous one, kept in memory for the session and
 * written as one JSON line to the {@code AUDIT} logger.
 */
public class AuditLogger {
    private static final Logger auditLog = LoggerFactory.getLogger("AUDIT");
    private static final Logger logger = LoggerFactory.getLogger(AuditLogger.class);

    static final String GENESIS_HASH = "0";

    private final String sessionId;
    private final List<AuditEvent> events = new ArrayList<>();
    private final List<AuditListener> listeners = new CopyOnWriteArrayList<>();
    private final MessageDigest digest;
    private final Object lock = new Object();
    private String previousHash = GENESIS_HASH;

    public AuditLogger() {
        this(UUID.randomUUID().toString());
    }

    public AuditLogger(String sessionId) {
        this.sessionId = sessionId;
        this.digest = newDigest();
    }

    /**
     * Logs an audit event with hash chain protection.
     */
    public void logEvent(AuditEvent event) {
        synchronized (lock) {
            event.setPreviousHash(previousHash);

            String currentHash = calculateHash(previousHash + event.getDataForHashing());
            event.setHash(currentHash);

            auditLog.info(event.toJson());
            events.add(event);
            previousHash = currentHash;

            logger.debug("Audit event logged: {} - {}", event.getEventType(), event.getEventId());
        }

        for (AuditListener listener : listeners) {
            listener.onEvent(event);
        }
    }

    /**
     * Start a builder pre-filled with this logger's session id.
     */
    public AuditEvent.Builder newEvent(AuditEventType eventType) {
        return new AuditEvent.Builder()
                .eventType(eventType)
                .sessionId(sessionId);
    }

    /**
     * Convenience method to log an event with minimal information.
     */
    public void logEvent(AuditEventType eventType, String scenario) {
        logEvent(newEvent(eventType).scenario(scenario).build());
    }

    public void addListener(AuditListener listener) {
        listeners.add(listener);
    }

    public void removeListener(AuditListener listener) {
        listeners.remove(listener);
    }

    public List<AuditEvent> getEvents() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(events));
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Gets the current hash (head of the chain).
     */
    public String getCurrentHash() {
        synchronized (lock) {
            return previousHash;
        }
    }

    /**
     * Recompute every link of the in-memory chain.
     */
    public boolean verifyChain() {
        return new HashChainValidator().validate(getEvents()).isValid();
    }

    /**
     * Calculates SHA-256 hash of the input string as lowercase hex.
     */
    static String sha256Hex(MessageDigest digest, String input) {
        byte[] hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
        StringBuilder hexString = new StringBuilder(2 * hashBytes.length);
        for (byte b : hashBytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private String calculateHash(String input) {
        return sha256Hex(digest, input);
    }
}
