package com.warden.core.confirmation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.action.ActionKind;
import com.warden.core.risk.RiskTier;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a {@link ConfirmationRequest}, safe to hand to dashboards and transports.
 */
public record ConfirmationSnapshot(
    String id,
    @JsonProperty("action_type") ActionKind actionType,
    @JsonProperty("action_name") String actionName,
    @JsonProperty("risk_tier") RiskTier riskTier,
    String description,
    Map<String, Object> details,
    @JsonProperty("formatted_details") String formattedDetails,
    ConfirmationStatus status,
    @JsonProperty("plan_id") String planId,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("timeout_seconds") long timeoutSeconds,
    @JsonProperty("resolved_at") Instant resolvedAt,
    @JsonProperty("resolved_by") String resolvedBy,
    String reason
) {}
