package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A named operating-system level operation such as {@code modify_registry} or {@code disable_security}.
 * The name is what the policy's critical-action set is matched against.
 */
public record PrivilegedAction(String name, Map<String, String> parameters) implements AgentAction {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]*");

    public PrivilegedAction {
        AgentAction.requireText(name, "name");
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new InvalidActionException("Action name must be a snake_case identifier: " + name);
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    @Override
    public ActionKind kind() {
        return ActionKind.SYSTEM_COMMAND;
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("action", name);
        parameters.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> details.put(e.getKey(), e.getValue()));
        return details;
    }

    @Override
    public Optional<ApprovalCategory> category() {
        return Optional.of(ApprovalCategory.SYSTEM_COMMAND);
    }
}
