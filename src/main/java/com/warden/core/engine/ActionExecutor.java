package com.warden.core.engine;

import com.warden.core.action.AgentAction;

/**
 * Performs an approved action against the host. Implementations may be slow and may throw;
 * any exception is treated as a retryable failure of the task.
 */
@FunctionalInterface
public interface ActionExecutor {

    /**
     * @return an opaque result stored on the completed task
     */
    Object execute(AgentAction action, String description) throws Exception;
}
