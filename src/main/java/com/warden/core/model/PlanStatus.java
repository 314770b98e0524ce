package com.warden.core.model;

/**
 * Lifecycle status of a plan.
 */
public enum PlanStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    CANCELLED,
    STALLED;     // no runnable task left but some tasks can never run

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == STALLED;
    }
}
