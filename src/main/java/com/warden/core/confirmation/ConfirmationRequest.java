package com.warden.core.confirmation;

import com.warden.core.action.ActionKind;
import com.warden.core.risk.RiskTier;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A pending request for external approval of one action.
 * <p>
 * The resolution is set at most once by compare-and-set; every later attempt fails.
 * The completion future fires only after the gateway has finished bookkeeping for the resolution.
 */
public final class ConfirmationRequest {

    record Resolution(ConfirmationStatus status, String resolvedBy, String reason, Instant resolvedAt) {}

    private final String id;
    private final ActionKind actionType;
    private final String actionName;
    private final RiskTier riskTier;
    private final String description;
    private final Map<String, Object> details;
    private final String planId;
    private final String taskId;
    private final Duration timeout;
    private final Instant createdAt = Instant.now();

    private final AtomicReference<Resolution> resolution = new AtomicReference<>();
    private final CompletableFuture<Resolution> completion = new CompletableFuture<>();

    ConfirmationRequest(String id, ActionKind actionType, String actionName, RiskTier riskTier,
                        String description, Map<String, Object> details,
                        String planId, String taskId, Duration timeout) {
        this.id = id;
        this.actionType = actionType;
        this.actionName = actionName;
        this.riskTier = riskTier;
        this.description = description;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.planId = planId;
        this.taskId = taskId;
        this.timeout = timeout;
    }

    /**
     * Applies a terminal status if none has been applied yet.
     *
     * @return true if this call won the resolution
     */
    boolean tryResolve(ConfirmationStatus status, String resolvedBy, String reason) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Cannot resolve to " + status);
        }
        return resolution.compareAndSet(null, new Resolution(status, resolvedBy, reason, Instant.now()));
    }

    void signal() {
        completion.complete(resolution.get());
    }

    CompletableFuture<Resolution> completion() {
        return completion;
    }

    Resolution resolution() {
        return resolution.get();
    }

    public String id() {
        return id;
    }

    public String planId() {
        return planId;
    }

    public String taskId() {
        return taskId;
    }

    public RiskTier riskTier() {
        return riskTier;
    }

    public String description() {
        return description;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Duration timeout() {
        return timeout;
    }

    public ConfirmationStatus status() {
        Resolution r = resolution.get();
        return r == null ? ConfirmationStatus.PENDING : r.status();
    }

    public ConfirmationSnapshot snapshot() {
        Resolution r = resolution.get();
        return new ConfirmationSnapshot(id, actionType, actionName, riskTier, description, details,
                formatDetails(details), r == null ? ConfirmationStatus.PENDING : r.status(),
                planId, taskId, createdAt, timeout.toSeconds(),
                r == null ? null : r.resolvedAt(),
                r == null ? null : r.resolvedBy(),
                r == null ? null : r.reason());
    }

    /**
     * Renders details as "Key Name: value" lines for display in approval dialogs.
     */
    static String formatDetails(Map<String, Object> details) {
        var sb = new StringBuilder();
        details.forEach((key, value) -> {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(humanize(key)).append(": ").append(value);
        });
        return sb.toString();
    }

    private static String humanize(String key) {
        var words = key.replace('_', ' ').trim().split("\\s+");
        var sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
