package com.warden.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static WardenEvent event(String type, String planId) {
        return WardenEvent.of(type, planId, "TASK-001", Map.of("k", "v"));
    }

    @Nested
    @DisplayName("WardenEvent")
    class WardenEventTests {

        @Test
        @DisplayName("events without a plan are global")
        void nullPlanIsGlobal() {
            assertEquals(WardenEvent.GLOBAL, WardenEvent.of("confirmation.requested", null, null, Map.of()).planId());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublish {

        @Test
        @DisplayName("plan subscribers only see their plan")
        void planScoped() {
            List<WardenEvent> a = new ArrayList<>();
            List<WardenEvent> b = new ArrayList<>();
            eventBus.subscribe("PLAN-A", a::add);
            eventBus.subscribe("PLAN-B", b::add);

            eventBus.publish(event("task.started", "PLAN-A"));

            assertEquals(1, a.size());
            assertTrue(b.isEmpty());
        }

        @Test
        @DisplayName("global subscribers see every plan")
        void global() {
            List<WardenEvent> all = new ArrayList<>();
            eventBus.subscribeAll(all::add);

            eventBus.publish(event("task.started", "PLAN-A"));
            eventBus.publish(event("task.started", "PLAN-B"));

            assertEquals(2, all.size());
        }

        @Test
        @DisplayName("unsubscribing stops delivery and drops the empty plan entry")
        void unsubscribe() {
            List<WardenEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("PLAN-A", received::add);
            assertEquals(1, eventBus.subscriberCount("PLAN-A"));

            subscription.unsubscribe();
            eventBus.publish(event("task.started", "PLAN-A"));

            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.subscriberCount("PLAN-A"));
        }

        @Test
        @DisplayName("a throwing subscriber does not stop the others")
        void isolatesFailures() {
            List<WardenEvent> received = new ArrayList<>();
            eventBus.subscribe("PLAN-A", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("PLAN-A", received::add);
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("task.failed", "PLAN-A")));
            assertEquals(2, received.size());
            assertEquals(1, eventBus.globalSubscriberCount());
        }
    }
}
