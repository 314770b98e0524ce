package com.warden.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a plan runs or a confirmation changes state; feeds SSE streams and the CLI.
 *
 * @param eventType event type (e.g. "plan.created", "task.started", "confirmation.requested")
 * @param planId    the plan this event belongs to; {@link #GLOBAL} for events outside any plan
 * @param taskId    the task this event relates to (nullable for plan-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record WardenEvent(
    String eventType,
    String planId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String GLOBAL = "global";

    public static WardenEvent of(String eventType, String planId, String taskId, Map<String, Object> payload) {
        return new WardenEvent(eventType, planId != null ? planId : GLOBAL, taskId, payload, Instant.now());
    }
}
