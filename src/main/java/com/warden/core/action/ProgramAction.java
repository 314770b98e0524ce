package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Launches a program with arguments.
 */
public record ProgramAction(String program, List<String> arguments) implements AgentAction {

    public ProgramAction {
        AgentAction.requireText(program, "program");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public ActionKind kind() {
        return ActionKind.PROGRAM_EXECUTION;
    }

    @Override
    public String name() {
        return "execute_program";
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("program", program);
        details.put("arguments", arguments);
        return details;
    }

    @Override
    public Optional<ApprovalCategory> category() {
        return Optional.of(ApprovalCategory.PROGRAM_EXECUTION);
    }
}
