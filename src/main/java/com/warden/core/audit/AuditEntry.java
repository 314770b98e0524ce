package com.warden.core.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.risk.RiskTier;

import java.time.Instant;

/**
 * Immutable audit record of a classified action or a confirmation outcome.
 *
 * @param timestamp when the event completed
 * @param actor     who caused it
 * @param action    human-readable action description
 * @param riskTier  classification at the time of the event; null for events that were not classified
 * @param outcome   short outcome label (e.g. "auto-approved", "requested", "approved", "timed-out", "blocked")
 * @param error     optional error or reason text
 * @param resolvedBy identity of whoever resolved a confirmation, if any
 * @param planId    correlated plan, if any
 * @param taskId    correlated task, if any
 * @param requestId correlated confirmation request, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEntry(
    Instant timestamp,
    AuditActor actor,
    String action,
    @JsonProperty("risk_tier") RiskTier riskTier,
    String outcome,
    String error,
    @JsonProperty("resolved_by") String resolvedBy,
    @JsonProperty("plan_id") String planId,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("request_id") String requestId
) {

    public static Builder builder(AuditActor actor, String action, String outcome) {
        return new Builder(actor, action, outcome);
    }

    public static final class Builder {
        private final AuditActor actor;
        private final String action;
        private final String outcome;
        private RiskTier riskTier;
        private String error;
        private String resolvedBy;
        private String planId;
        private String taskId;
        private String requestId;

        private Builder(AuditActor actor, String action, String outcome) {
            this.actor = actor;
            this.action = action;
            this.outcome = outcome;
        }

        public Builder riskTier(RiskTier riskTier) {
            this.riskTier = riskTier;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder plan(String planId, String taskId) {
            this.planId = planId;
            this.taskId = taskId;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(Instant.now(), actor, action, riskTier, outcome, error, resolvedBy, planId, taskId, requestId);
        }
    }
}
