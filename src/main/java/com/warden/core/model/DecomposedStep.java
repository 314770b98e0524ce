package com.warden.core.model;

import com.warden.core.action.AgentAction;
import com.warden.core.action.StepAction;

import java.util.List;

/**
 * One step produced by goal decomposition, before it becomes a {@link Task}.
 *
 * @param id           optional explicit id; generated when null
 * @param description  what the step does
 * @param dependencies ids of steps that must complete first; null means "depends on nothing"
 * @param action       the action to gate and execute; a {@link StepAction} of the description when null
 */
public record DecomposedStep(String id, String description, List<String> dependencies, AgentAction action) {

    public DecomposedStep {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Step description is required");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (action == null) {
            action = new StepAction(description);
        }
    }

    public static DecomposedStep of(String description) {
        return new DecomposedStep(null, description, List.of(), null);
    }
}
