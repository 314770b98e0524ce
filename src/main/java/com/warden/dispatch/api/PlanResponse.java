package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.model.Plan;
import com.warden.core.model.PlanSummary;
import com.warden.core.model.Task;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for plan endpoints.
 */
public record PlanResponse(
    @JsonProperty("plan_id") String planId,
    String goal,
    String status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    List<TaskResponse> tasks,
    PlanSummary summary
) {

    public static PlanResponse from(Plan plan, PlanSummary summary) {
        return new PlanResponse(plan.id(), plan.goal(), plan.status().name(), plan.createdAt(),
                plan.startedAt(), plan.completedAt(),
                plan.tasks().stream().map(TaskResponse::from).toList(), summary);
    }

    /**
     * Nested task representation in the plan response.
     */
    public record TaskResponse(
        String id,
        String description,
        @JsonProperty("action_kind") String actionKind,
        @JsonProperty("action_name") String actionName,
        List<String> dependencies,
        String status,
        int attempts,
        @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("last_error") String lastError,
        @JsonProperty("failure_kind") String failureKind
    ) {

        static TaskResponse from(Task task) {
            return new TaskResponse(task.id(), task.description(),
                    task.actionKind() != null ? task.actionKind().name() : null,
                    task.actionName(), task.dependencies(), task.status().name(),
                    task.attempts(), task.maxRetries(), task.lastError(),
                    task.failureKind() != null ? task.failureKind().name() : null);
        }
    }
}
