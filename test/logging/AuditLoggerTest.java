package logging;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditLoggerTest {

    private AuditLogger auditLogger;

    @BeforeEach
    void setUp() {
        auditLogger = new AuditLogger("session-1");
    }

    @Test
    void eventsAreChainedFromGenesis() {
        auditLogger.logEvent(AuditEventType.SCENARIO_REGISTERED, "Basel III LCR Standard");
        auditLogger.logEvent(auditLogger.newEvent(AuditEventType.SIMULATION_STARTED)
            .scenario("Basel III LCR Standard")
            .addData("num_periods", 30)
            .build());

        List<AuditEvent> events = auditLogger.getEvents();
        assertEquals(2, events.size());
        assertEquals(AuditLogger.GENESIS_HASH, events.get(0).getPreviousHash());
        assertEquals(events.get(0).getHash(), events.get(1).getPreviousHash());
        assertEquals(64, events.get(1).getHash().length());
        assertEquals(events.get(1).getHash(), auditLogger.getCurrentHash());
        assertTrue(auditLogger.verifyChain());
    }

    @Test
    void eventsCarryTheSessionId() {
        auditLogger.logEvent(AuditEventType.ANALYSIS_GENERATED, "Calm");
        assertEquals("session-1", auditLogger.getEvents().get(0).getSessionId());
    }

    @Test
    void listenersAreNotified() {
        List<AuditEvent> received = new ArrayList<>();
        AuditListener listener = received::add;
        auditLogger.addListener(listener);

        auditLogger.logEvent(AuditEventType.SIMULATION_COMPLETED, "Calm");
        auditLogger.removeListener(listener);
        auditLogger.logEvent(AuditEventType.SIMULATION_COMPLETED, "Calm");

        assertEquals(1, received.size());
        assertEquals(AuditEventType.SIMULATION_COMPLETED, received.get(0).getEventType());
    }

    @Test
    void jsonIncludesChainFields() {
        auditLogger.logEvent(auditLogger.newEvent(AuditEventType.BREACH_DETECTED)
            .scenario("Calm")
            .addData("type", "LCR")
            .build());

        String json = auditLogger.getEvents().get(0).toJson();
        assertTrue(json.contains("\"eventType\":\"BREACH_DETECTED\""));
        assertTrue(json.contains("\"previousHash\":\"0\""));
        assertTrue(json.contains("\"type\":\"LCR\""));
    }

    @Test
    void eventTypeIsRequired() {
        assertThrows(IllegalStateException.class, () -> new AuditEvent.Builder().scenario("Calm").build());
    }
}
