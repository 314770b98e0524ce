package com.warden.core.model;

/**
 * Status of an individual task within a plan.
 */
public enum TaskStatus {
    PENDING,
    RUNNABLE,     // claimed into a wave, not yet started
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
