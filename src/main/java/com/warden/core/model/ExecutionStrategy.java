package com.warden.core.model;

/**
 * Strategy for dispatching the tasks of a plan.
 * <p>
 * SEQUENTIAL: one task at a time, in insertion order.
 * PARALLEL: independent tasks run concurrently up to maxParallel; file actions on the same path are serialized.
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    PARALLEL
}
