package com.warden.core.engine;

import com.warden.core.model.DecomposedStep;

import java.util.List;

/**
 * Fixed generic skeleton used when no decomposer is available.
 */
public final class FallbackDecomposer {

    private FallbackDecomposer() {}

    public static List<DecomposedStep> decompose(String goal) {
        return List.of(
                DecomposedStep.of("Analyze: " + goal),
                DecomposedStep.of("Plan: Break down " + goal + " into smaller parts"),
                DecomposedStep.of("Setup: Prepare environment for " + goal),
                DecomposedStep.of("Execute: Perform main " + goal),
                DecomposedStep.of("Validate: Check if " + goal + " completed"),
                DecomposedStep.of("Optimize: Improve " + goal + " execution"),
                DecomposedStep.of("Document: Log results of " + goal));
    }
}
