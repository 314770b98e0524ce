package com.warden.core.model;

/**
 * Why a task did not complete. Only {@link #EXECUTOR_FAILURE} is retried.
 */
public enum FailureKind {
    CLASSIFICATION_BLOCKED,
    APPROVAL_DENIED,
    APPROVAL_TIMED_OUT,
    EXECUTOR_FAILURE,
    DEPENDENCY_STALLED,
    CANCELLED;

    public boolean isRetryable() {
        return this == EXECUTOR_FAILURE;
    }
}
