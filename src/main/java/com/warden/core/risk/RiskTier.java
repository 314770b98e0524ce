package com.warden.core.risk;

/**
 * Risk classification of a requested action, ordered from least to most restrictive.
 */
public enum RiskTier {
    SAFE,       // auto-approved
    WARNING,    // requires confirmation
    DANGER,     // requires confirmation, flagged as critical
    BLOCKED;    // always denied, cannot be overridden

    public boolean requiresConfirmation() {
        return this == WARNING || this == DANGER;
    }
}
