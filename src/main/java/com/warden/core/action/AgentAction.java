package com.warden.core.action;

import java.util.Map;
import java.util.Optional;

/**
 * A single side-effecting action requested by a plan step.
 * <p>
 * Each implementation is a record carrying the typed parameters of one {@link ActionKind};
 * parameters are validated when the record is constructed, never at dispatch time.
 */
public interface AgentAction {

    ActionKind kind();

    /**
     * Action identifier matched against the policy's critical-action set (e.g. "delete_file").
     */
    String name();

    /**
     * Ordered key/value view of the parameters, used for classification, display and audit.
     */
    Map<String, Object> details();

    /**
     * Approval category this action falls into, if any.
     */
    default Optional<ApprovalCategory> category() {
        return Optional.empty();
    }

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidActionException(field + " is required");
        }
        return value;
    }
}
