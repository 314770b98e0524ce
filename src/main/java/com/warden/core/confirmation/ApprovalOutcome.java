package com.warden.core.confirmation;

import com.warden.core.risk.RiskTier;

/**
 * What the gateway decided for one action.
 *
 * @param decision   final decision
 * @param riskTier   classification of the action
 * @param requestId  id of the confirmation request, null when no request was needed (safe or blocked)
 * @param reason     human-readable reason, always present for anything other than approval
 * @param resolvedBy who resolved the request ("system" for automatic decisions)
 */
public record ApprovalOutcome(
    Decision decision,
    RiskTier riskTier,
    String requestId,
    String reason,
    String resolvedBy
) {

    public enum Decision {
        APPROVED,
        DENIED,
        TIMED_OUT,
        BLOCKED
    }

    public static ApprovalOutcome autoApproved(RiskTier tier) {
        return new ApprovalOutcome(Decision.APPROVED, tier, null, "auto-approved", ConfirmationGateway.SYSTEM_RESOLVER);
    }

    public static ApprovalOutcome blocked(String reason) {
        return new ApprovalOutcome(Decision.BLOCKED, RiskTier.BLOCKED, null, "blocked: " + reason,
                ConfirmationGateway.SYSTEM_RESOLVER);
    }

    public boolean approved() {
        return decision == Decision.APPROVED;
    }
}
