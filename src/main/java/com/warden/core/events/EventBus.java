package com.warden.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory fan-out of {@link WardenEvent}s to plan subscribers and global subscribers.
 * <p>
 * Delivery is synchronous on the publishing thread. A subscriber that throws is logged and skipped;
 * it never affects the publisher or the other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<WardenEvent>>> byPlan = new ConcurrentHashMap<>();
    private final List<Consumer<WardenEvent>> global = new CopyOnWriteArrayList<>();

    public void publish(WardenEvent event) {
        log.debug("Event {} plan={} task={}", event.eventType(), event.planId(), event.taskId());
        List<Consumer<WardenEvent>> planSubs = byPlan.get(event.planId());
        if (planSubs != null) {
            planSubs.forEach(s -> deliver(s, event));
        }
        global.forEach(s -> deliver(s, event));
    }

    public Subscription subscribe(String planId, Consumer<WardenEvent> consumer) {
        byPlan.computeIfAbsent(planId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> byPlan.computeIfPresent(planId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<WardenEvent> consumer) {
        global.add(consumer);
        return () -> global.remove(consumer);
    }

    /**
     * Subscribers currently attached to {@code planId}, not counting global ones.
     */
    public int subscriberCount(String planId) {
        List<Consumer<WardenEvent>> subs = byPlan.get(planId);
        return subs == null ? 0 : subs.size();
    }

    public int globalSubscriberCount() {
        return global.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<WardenEvent> subscriber, WardenEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for plan {}: {}", event.eventType(), event.planId(), e.getMessage(), e);
        }
    }
}
