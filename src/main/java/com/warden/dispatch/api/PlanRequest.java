package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/plans.
 *
 * @param goal                       what the plan should achieve
 * @param steps                      explicit steps; nullable; the goal is decomposed when absent
 * @param maxParallel                concurrent tasks; nullable; falls back to config
 * @param confirmationTimeoutSeconds per-task approval timeout; nullable; falls back to config
 */
public record PlanRequest(
    String goal,
    List<StepRequest> steps,
    @JsonProperty("max_parallel") Integer maxParallel,
    @JsonProperty("confirmation_timeout_seconds") Integer confirmationTimeoutSeconds
) {

    /**
     * @param dependsOn ids of steps that must complete first
     * @param action    nullable; a generic step action is used when absent
     */
    public record StepRequest(
        String id,
        String description,
        @JsonProperty("depends_on") List<String> dependsOn,
        ActionRequest action
    ) {}

    /**
     * @param kind   action kind, e.g. FILE_OPERATION
     * @param params kind-specific parameters
     */
    public record ActionRequest(String kind, Map<String, Object> params) {}
}
