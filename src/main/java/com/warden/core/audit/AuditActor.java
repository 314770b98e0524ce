package com.warden.core.audit;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who caused an audited event.
 */
public enum AuditActor {
    SCHEDULER,
    USER,
    SYSTEM;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
