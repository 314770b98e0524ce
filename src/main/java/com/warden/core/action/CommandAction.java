package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a shell command line.
 */
public record CommandAction(String command) implements AgentAction {

    public CommandAction {
        AgentAction.requireText(command, "command");
    }

    @Override
    public ActionKind kind() {
        return ActionKind.SYSTEM_COMMAND;
    }

    @Override
    public String name() {
        return "system_command";
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("command", command);
        return details;
    }

    @Override
    public Optional<ApprovalCategory> category() {
        return Optional.of(ApprovalCategory.SYSTEM_COMMAND);
    }
}
