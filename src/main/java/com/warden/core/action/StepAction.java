package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A free-text plan step with no declared side effect.
 */
public record StepAction(String instruction) implements AgentAction {

    public StepAction {
        AgentAction.requireText(instruction, "instruction");
    }

    @Override
    public ActionKind kind() {
        return ActionKind.GENERIC;
    }

    @Override
    public String name() {
        return "step";
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("instruction", instruction);
        return details;
    }
}
