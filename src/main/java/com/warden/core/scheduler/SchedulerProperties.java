package com.warden.core.scheduler;

import com.warden.core.model.ExecutionStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Plan execution settings, bound from {@code warden.scheduler.*}.
 */
@Component
@ConfigurationProperties(prefix = "warden.scheduler")
public class SchedulerProperties {

    private ExecutionStrategy strategy = ExecutionStrategy.SEQUENTIAL;
    private int maxParallel = 1;
    private int maxRetries = 3;
    private int maxSteps = 10;
    private Duration confirmationTimeout = Duration.ofSeconds(60);
    /** Delay before a failed task becomes eligible again. Zero retries immediately. */
    private Duration retryBackoff = Duration.ZERO;
    /** Upper bound on how long the run loop waits before re-checking cancellation. */
    private Duration pollInterval = Duration.ofMillis(250);
    /** Finished plans kept for queries; the oldest are dropped beyond this. Running plans are always kept. */
    private int planRetention = 100;

    public ExecutionStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(ExecutionStrategy strategy) {
        this.strategy = strategy;
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public Duration getConfirmationTimeout() {
        return confirmationTimeout;
    }

    public void setConfirmationTimeout(Duration confirmationTimeout) {
        this.confirmationTimeout = confirmationTimeout;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getPlanRetention() {
        return planRetention;
    }

    public void setPlanRetention(int planRetention) {
        this.planRetention = planRetention;
    }
}
