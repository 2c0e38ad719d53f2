package logging;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Represents an audit event in the simulator.
 * The payload is fixed at build time; only the chain fields are set by the {@link AuditLogger}.
 */
public class AuditEvent {
    private final String eventId;
    private final AuditEventType eventType;
    private final Instant timestamp;
    private final String sessionId;
    private final String scenario;
    private final Map<String, Object> data;
    private String hash;
    private String previousHash;

    private static final Gson gson = new GsonBuilder()
            .serializeNulls()
            .create();

    private AuditEvent(Builder builder) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = builder.eventType;
        this.timestamp = Instant.now();
        this.sessionId = builder.sessionId;
        this.scenario = builder.scenario;
        this.data = new LinkedHashMap<>(builder.data);
    }

    public String getEventId() {
        return eventId;
    }

    public AuditEventType getEventType() {
        return eventType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getScenario() {
        return scenario;
    }

    public Map<String, Object> getData() {
        return new LinkedHashMap<>(data);
    }

    public String getHash() {
        return hash;
    }

    void setHash(String hash) {
        this.hash = hash;
    }

    public String getPreviousHash() {
        return previousHash;
    }

    void setPreviousHash(String previousHash) {
        this.previousHash = previousHash;
    }

    /**
     * Converts the event to a single JSON line for the audit log.
     */
    public String toJson() {
        Map<String, Object> jsonMap = payload();
        jsonMap.put("hash", hash);
        jsonMap.put("previousHash", previousHash);
        return gson.toJson(jsonMap);
    }

    /**
     * Gets the data to be hashed (excludes hash fields).
     */
    public String getDataForHashing() {
        return gson.toJson(payload());
    }

    private Map<String, Object> payload() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("eventId", eventId);
        map.put("eventType", eventType.name());
        map.put("timestamp", timestamp.toString());
        map.put("sessionId", sessionId);
        map.put("scenario", scenario);
        map.put("data", data);
        return map;
    }

    @Override
    public String toString() {
        return String.format("AuditEvent{%s, scenario=%s, id=%s}", eventType, scenario, eventId);
    }

    /**
     * Builder pattern for creating AuditEvent instances.
     */
    public static class Builder {
        private AuditEventType eventType;
        private String sessionId;
        private String scenario;
        private final Map<String, Object> data = new LinkedHashMap<>();

        public Builder eventType(AuditEventType eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder scenario(String scenario) {
            this.scenario = scenario;
            return this;
        }

        public Builder addData(String key, Object value) {
            this.data.put(key, value);
            return this;
        }

        public Builder addAllData(Map<String, ?> data) {
            this.data.putAll(data);
            return this;
        }

        public AuditEvent build() {
            if (eventType == null) {
                throw new IllegalStateException("Event type is required");
            }
            return new AuditEvent(this);
        }
    }
}
