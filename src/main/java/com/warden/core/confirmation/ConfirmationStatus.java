package com.warden.core.confirmation;

/**
 * Lifecycle of a confirmation request. {@link #PENDING} moves to exactly one terminal state.
 */
public enum ConfirmationStatus {
    PENDING,
    APPROVED,
    DENIED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
