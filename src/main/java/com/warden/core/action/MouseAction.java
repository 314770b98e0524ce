package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Moves or clicks the pointer at screen coordinates.
 */
public record MouseAction(String operation, int x, int y) implements AgentAction {

    private static final Set<String> OPERATIONS = Set.of("move", "click", "double_click", "right_click", "drag");

    public MouseAction {
        AgentAction.requireText(operation, "operation");
        operation = operation.toLowerCase();
        if (!OPERATIONS.contains(operation)) {
            throw new InvalidActionException("Unsupported mouse operation: " + operation);
        }
        if (x < 0 || y < 0) {
            throw new InvalidActionException("Coordinates must be non-negative: (" + x + ", " + y + ")");
        }
    }

    @Override
    public ActionKind kind() {
        return ActionKind.MOUSE_CONTROL;
    }

    @Override
    public String name() {
        return "mouse_" + operation;
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("operation", operation);
        details.put("x", x);
        details.put("y", y);
        return details;
    }
}
