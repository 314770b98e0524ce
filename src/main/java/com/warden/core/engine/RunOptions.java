package com.warden.core.engine;

import com.warden.core.model.ExecutionStrategy;
import com.warden.core.scheduler.SchedulerProperties;

import java.time.Duration;

/**
 * Per-run execution settings.
 *
 * @param confirmationTimeout how long each task waits for approval
 * @param retryBackoff        delay before a failed task may run again
 */
public record RunOptions(
    ExecutionStrategy strategy,
    int maxParallel,
    Duration confirmationTimeout,
    Duration retryBackoff
) {

    public RunOptions {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1: " + maxParallel);
        }
        if (confirmationTimeout == null || confirmationTimeout.isZero() || confirmationTimeout.isNegative()) {
            throw new IllegalArgumentException("confirmationTimeout must be positive");
        }
        if (retryBackoff == null || retryBackoff.isNegative()) {
            retryBackoff = Duration.ZERO;
        }
    }

    public static RunOptions from(SchedulerProperties properties) {
        return new RunOptions(properties.getStrategy(), properties.getMaxParallel(),
                properties.getConfirmationTimeout(), properties.getRetryBackoff());
    }

    public RunOptions withParallelism(int parallel) {
        return new RunOptions(parallel > 1 ? ExecutionStrategy.PARALLEL : ExecutionStrategy.SEQUENTIAL,
                parallel, confirmationTimeout, retryBackoff);
    }

    public RunOptions withConfirmationTimeout(Duration timeout) {
        return new RunOptions(strategy, maxParallel, timeout, retryBackoff);
    }
}
