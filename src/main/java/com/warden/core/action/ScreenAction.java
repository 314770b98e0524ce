package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the screen (capture, locate an element). Never mutates host state.
 */
public record ScreenAction(String operation) implements AgentAction {

    public ScreenAction {
        operation = AgentAction.requireText(operation, "operation").toLowerCase();
    }

    @Override
    public ActionKind kind() {
        return ActionKind.SCREEN_CONTROL;
    }

    @Override
    public String name() {
        return "screen_" + operation;
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("operation", operation);
        return details;
    }
}
