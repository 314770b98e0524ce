package com.warden.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.action.ActionKind;
import com.warden.core.action.AgentAction;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single unit of work within a plan. Immutable; every state change produces a new instance
 * that the owning {@link Plan} swaps in atomically.
 *
 * @param id           unique identifier within the plan (e.g. "TASK-001")
 * @param description  what this task should accomplish
 * @param action       the typed action gated by the confirmation gateway and handed to the executor
 * @param dependencies IDs of tasks that must complete first
 * @param status       current execution status
 * @param attempts     number of times execution has started
 * @param maxRetries   attempts after which an executor failure is terminal
 * @param result       executor output of the last successful attempt
 * @param lastError    reason of the last failure, human readable
 * @param failureKind  classification of the last failure
 * @param startedAt    when the last attempt started
 * @param completedAt  when the task reached a terminal status
 * @param eligibleAt   earliest time a retried task may run again; null means immediately
 */
public record Task(
    String id,
    String description,
    @JsonIgnore AgentAction action,
    List<String> dependencies,
    TaskStatus status,
    int attempts,
    int maxRetries,
    Object result,
    String lastError,
    FailureKind failureKind,
    Instant startedAt,
    Instant completedAt,
    Instant eligibleAt
) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id is required");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
        }
    }

    public static Task create(String id, String description, AgentAction action,
                              List<String> dependencies, int maxRetries) {
        return new Task(id, description, action, dependencies, TaskStatus.PENDING, 0, maxRetries,
                null, null, null, null, null, null);
    }

    @JsonProperty("actionKind")
    public ActionKind actionKind() {
        return action != null ? action.kind() : null;
    }

    @JsonProperty("actionName")
    public String actionName() {
        return action != null ? action.name() : null;
    }

    @JsonProperty("actionDetails")
    public Map<String, Object> actionDetails() {
        return action != null ? action.details() : Map.of();
    }

    /** Claimed into a wave. */
    public Task claim() {
        return withStatus(TaskStatus.RUNNABLE);
    }

    /** Returned to the pool without having started. */
    public Task release() {
        return withStatus(TaskStatus.PENDING);
    }

    public Task start(Instant now) {
        return new Task(id, description, action, dependencies, TaskStatus.IN_PROGRESS, attempts + 1, maxRetries,
                result, lastError, failureKind, now, null, eligibleAt);
    }

    public Task complete(Object output, Instant now) {
        return new Task(id, description, action, dependencies, TaskStatus.COMPLETED, attempts, maxRetries,
                output, null, null, startedAt, now, null);
    }

    public Task fail(String error, FailureKind kind, Instant now) {
        return new Task(id, description, action, dependencies, TaskStatus.FAILED, attempts, maxRetries,
                result, error, kind, startedAt, now, null);
    }

    /**
     * Back to PENDING after a retryable failure.
     *
     * @param notBefore earliest time the task may run again, or null for immediately
     */
    public Task retry(Instant notBefore) {
        return new Task(id, description, action, dependencies, TaskStatus.PENDING, attempts, maxRetries,
                result, lastError, failureKind, startedAt, null, notBefore);
    }

    public Task cancel(String reason, Instant now) {
        return new Task(id, description, action, dependencies, TaskStatus.CANCELLED, attempts, maxRetries,
                result, reason, FailureKind.CANCELLED, startedAt, now, null);
    }

    /**
     * True if a failure of the current attempt may be retried.
     */
    public boolean canRetry() {
        return attempts < maxRetries;
    }

    public boolean isEligible(Instant now) {
        return eligibleAt == null || !now.isBefore(eligibleAt);
    }

    private Task withStatus(TaskStatus next) {
        return new Task(id, description, action, dependencies, next, attempts, maxRetries,
                result, lastError, failureKind, startedAt, completedAt, eligibleAt);
    }
}
