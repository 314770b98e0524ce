package com.warden.core.confirmation;

import com.warden.core.action.ActionKind;
import com.warden.core.events.EventBus;
import com.warden.core.events.WardenEvent;
import com.warden.core.risk.RiskTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusApproverTransportTest {

    private final List<WardenEvent> events = new ArrayList<>();
    private EventBusApproverTransport transport;

    @BeforeEach
    void setUp() {
        var eventBus = new EventBus();
        eventBus.subscribe("PLAN-2026-0001", events::add);
        transport = new EventBusApproverTransport(eventBus);
    }

    private static ConfirmationSnapshot snapshot(ConfirmationStatus status, String resolvedBy, String reason) {
        return new ConfirmationSnapshot("CR-1", ActionKind.SYSTEM_COMMAND, "system_command", RiskTier.WARNING,
                "Restart nginx", Map.of("command", "systemctl restart nginx"), "Command: systemctl restart nginx",
                status, "PLAN-2026-0001", "TASK-002", Instant.now(), 30,
                resolvedBy != null ? Instant.now() : null, resolvedBy, reason);
    }

    @Test
    @DisplayName("a new request is announced on its plan's stream")
    void publishesRequested() {
        transport.publish(snapshot(ConfirmationStatus.PENDING, null, null));

        assertEquals(1, events.size());
        WardenEvent event = events.get(0);
        assertEquals("confirmation.requested", event.eventType());
        assertEquals("TASK-002", event.taskId());
        assertEquals("CR-1", event.payload().get("requestId"));
        assertEquals("WARNING", event.payload().get("riskTier"));
        assertEquals(30L, event.payload().get("timeoutSeconds"));
    }

    @Test
    @DisplayName("a resolution carries the resolver and reason when present")
    void publishesResolved() {
        transport.resolved(snapshot(ConfirmationStatus.DENIED, "alice", "denied by alice"));
        transport.resolved(snapshot(ConfirmationStatus.TIMED_OUT, null, null));

        assertEquals(2, events.size());
        assertEquals("confirmation.resolved", events.get(0).eventType());
        assertEquals("DENIED", events.get(0).payload().get("status"));
        assertEquals("alice", events.get(0).payload().get("resolvedBy"));
        assertFalse(events.get(1).payload().containsKey("resolvedBy"));
        assertFalse(events.get(1).payload().containsKey("reason"));
    }
}
