package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Types text through the keyboard driver.
 */
public record KeyboardAction(String text) implements AgentAction {

    public KeyboardAction {
        if (text == null || text.isEmpty()) {
            throw new InvalidActionException("text is required");
        }
    }

    @Override
    public ActionKind kind() {
        return ActionKind.KEYBOARD_INPUT;
    }

    @Override
    public String name() {
        return "type_text";
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("text", text);
        return details;
    }
}
