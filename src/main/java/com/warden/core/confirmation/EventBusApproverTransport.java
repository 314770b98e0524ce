package com.warden.core.confirmation;

import com.warden.core.events.EventBus;
import com.warden.core.events.WardenEvent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Publishes confirmation requests and resolutions onto the {@link EventBus}, where SSE clients pick them up.
 */
@Component
public class EventBusApproverTransport implements ApproverTransport {

    private final EventBus eventBus;

    public EventBusApproverTransport(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void publish(ConfirmationSnapshot request) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("requestId", request.id());
        payload.put("riskTier", request.riskTier().name());
        payload.put("actionType", request.actionType().name());
        payload.put("description", request.description());
        payload.put("details", request.formattedDetails());
        payload.put("timeoutSeconds", request.timeoutSeconds());
        eventBus.publish(WardenEvent.of("confirmation.requested", request.planId(), request.taskId(), payload));
    }

    @Override
    public void resolved(ConfirmationSnapshot request) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("requestId", request.id());
        payload.put("status", request.status().name());
        if (request.resolvedBy() != null) {
            payload.put("resolvedBy", request.resolvedBy());
        }
        if (request.reason() != null) {
            payload.put("reason", request.reason());
        }
        eventBus.publish(WardenEvent.of("confirmation.resolved", request.planId(), request.taskId(), payload));
    }
}
