package com.warden.core.engine;

import com.warden.core.model.DecomposedStep;

import java.util.List;

/**
 * Breaks a goal into ordered steps, typically by asking a language model.
 * Optional; {@link PlanEngine} falls back to {@link FallbackDecomposer} when none is configured
 * or when decomposition fails.
 */
public interface GoalDecomposer {

    /**
     * @param maxSteps upper bound on the number of steps wanted
     * @throws DecompositionException if the goal cannot be decomposed
     */
    List<DecomposedStep> decompose(String goal, int maxSteps);
}
