package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads or mutates a single file.
 */
public record FileAction(FileOperation operation, String path) implements AgentAction {

    public FileAction {
        if (operation == null) {
            throw new InvalidActionException("operation is required");
        }
        AgentAction.requireText(path, "path");
    }

    @Override
    public ActionKind kind() {
        return ActionKind.FILE_OPERATION;
    }

    @Override
    public String name() {
        return operation.name().toLowerCase() + "_file";
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("operation", operation.name().toLowerCase());
        details.put("file_path", path);
        return details;
    }

    @Override
    public Optional<ApprovalCategory> category() {
        return operation.isMutating() ? Optional.of(ApprovalCategory.FILE_MUTATION) : Optional.empty();
    }
}
