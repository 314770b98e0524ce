package com.warden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for plan execution and confirmation gating.
 */
@Service
public class WardenMetrics {

    private final MeterRegistry registry;

    public WardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClassification(String tier) {
        Counter.builder("warden.risk.classifications")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    /**
     * @param decision approved, denied, timed_out or blocked
     * @param tier     risk tier of the gated action
     */
    public void recordConfirmation(String decision, String tier) {
        Counter.builder("warden.confirmation.outcomes")
                .tag("decision", decision)
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordConfirmationLatency(long ms) {
        Timer.builder("warden.confirmation.latency")
                .description("Time from request to resolution of a pending confirmation")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementDuplicateResolutions() {
        Counter.builder("warden.confirmation.duplicate_resolutions")
                .description("Late or duplicate responses to already-resolved requests")
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String actionKind, long ms) {
        Timer.builder("warden.task.duration")
                .tag("kind", actionKind)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskRetry() {
        Counter.builder("warden.task.retries")
                .register(registry)
                .increment();
    }

    public void recordTaskFailure(String failureKind) {
        Counter.builder("warden.task.failures")
                .tag("kind", failureKind)
                .register(registry)
                .increment();
    }

    public void recordPlanResult(String status) {
        Counter.builder("warden.plans.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordWaveSize(int taskCount) {
        DistributionSummary.builder("warden.wave.task_count")
                .description("Number of tasks dispatched per wave")
                .register(registry)
                .record(taskCount);
    }

    public void recordIntegrityViolations(int count) {
        Counter.builder("warden.integrity.violations")
                .register(registry)
                .increment(count);
    }
}
