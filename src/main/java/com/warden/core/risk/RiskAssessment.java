package com.warden.core.risk;

/**
 * Result of classifying an action.
 *
 * @param tier        the risk tier
 * @param reason      why this tier was chosen (matched pattern, critical name, category...)
 * @param description the action description, prefixed with the critical marker for {@link RiskTier#DANGER}
 */
public record RiskAssessment(RiskTier tier, String reason, String description) {}
