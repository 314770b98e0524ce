package com.warden.core.engine;

import com.warden.core.audit.AuditActor;
import com.warden.core.audit.AuditEntry;
import com.warden.core.audit.AuditLog;
import com.warden.core.confirmation.ApprovalOutcome;
import com.warden.core.confirmation.ConfirmationGateway;
import com.warden.core.events.EventBus;
import com.warden.core.events.WardenEvent;
import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.DecomposedStep;
import com.warden.core.model.ExecutionStrategy;
import com.warden.core.model.FailureKind;
import com.warden.core.model.Plan;
import com.warden.core.model.PlanReflection;
import com.warden.core.model.PlanStatus;
import com.warden.core.model.PlanSummary;
import com.warden.core.model.StalledTask;
import com.warden.core.model.Task;
import com.warden.core.model.TaskStatus;
import com.warden.core.scheduler.SchedulerProperties;
import com.warden.core.scheduler.TaskScheduler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds plans from goals and drives them to a terminal status.
 * <p>
 * Each run has its own bounded worker pool. A task's worker blocks only while its action awaits
 * confirmation; other tasks and other plans keep running. Every task and plan outcome is written to
 * the {@link AuditLog}, the plan's execution log and the {@link EventBus}.
 */
@Service
public class PlanEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanEngine.class);
    private static final AtomicInteger PLAN_COUNTER = new AtomicInteger(0);

    private final TaskScheduler scheduler;
    private final ConfirmationGateway gateway;
    private final AuditLog auditLog;
    private final EventBus eventBus;
    private final WardenMetrics metrics;
    private final SchedulerProperties properties;
    private final ActionExecutor defaultExecutor;

    private final Map<String, Plan> plans = new ConcurrentHashMap<>();
    private final ExecutorService runners = Executors.newCachedThreadPool(namedThreads("plan-runner"));

    private GoalDecomposer decomposer;

    public PlanEngine(TaskScheduler scheduler, ConfirmationGateway gateway, AuditLog auditLog, EventBus eventBus,
                      WardenMetrics metrics, SchedulerProperties properties, ActionExecutor defaultExecutor) {
        this.scheduler = scheduler;
        this.gateway = gateway;
        this.auditLog = auditLog;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.defaultExecutor = defaultExecutor;
    }

    @Autowired(required = false)
    public void setDecomposer(GoalDecomposer decomposer) {
        this.decomposer = decomposer;
    }

    @PreDestroy
    void shutdown() {
        runners.shutdownNow();
    }

    // ── Building ─────────────────────────────────────────────────────

    /**
     * Builds a plan by decomposing the goal, falling back to a fixed skeleton if no decomposer is
     * configured or it fails.
     */
    public Plan buildPlan(String goal) {
        requireGoal(goal);
        List<DecomposedStep> steps = List.of();
        if (decomposer != null) {
            try {
                steps = decomposer.decompose(goal, properties.getMaxSteps());
            } catch (RuntimeException e) {
                log.warn("Goal decomposition failed, using fallback steps: {}", e.getMessage());
            }
        }
        if (steps == null || steps.isEmpty()) {
            steps = FallbackDecomposer.decompose(goal);
        } else if (steps.size() > properties.getMaxSteps()) {
            log.warn("Decomposer returned {} steps, keeping the first {}", steps.size(), properties.getMaxSteps());
            steps = steps.subList(0, properties.getMaxSteps());
        }
        return buildPlan(goal, steps);
    }

    /**
     * Wraps each step into a task. Steps without an explicit id get "TASK-001", "TASK-002", ...;
     * steps without dependencies depend on nothing and run in insertion order.
     *
     * @throws IllegalArgumentException on a blank goal or duplicate task ids
     */
    public Plan buildPlan(String goal, List<DecomposedStep> steps) {
        requireGoal(goal);
        if (steps == null || steps.isEmpty()) {
            return buildPlan(goal);
        }
        var tasks = new ArrayList<Task>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            DecomposedStep step = steps.get(i);
            String id = step.id() != null && !step.id().isBlank() ? step.id() : String.format("TASK-%03d", i + 1);
            tasks.add(Task.create(id, step.description(), step.action(), step.dependencies(),
                    properties.getMaxRetries()));
        }

        Plan plan = new Plan(generatePlanId(), goal, tasks);
        plans.put(plan.id(), plan);
        evictFinishedPlans();
        plan.log(null, "created", tasks.size() + " tasks");
        log.info("Built plan {} with {} tasks for goal: {}", plan.id(), tasks.size(), goal);
        eventBus.publish(WardenEvent.of("plan.created", plan.id(), null,
                Map.of("goal", goal, "taskCount", tasks.size())));
        return plan;
    }

    /**
     * Drops the oldest finished plans once more than {@code plan-retention} of them are held.
     */
    private void evictFinishedPlans() {
        int retention = Math.max(0, properties.getPlanRetention());
        List<Plan> finished = plans.values().stream()
                .filter(p -> p.status().isTerminal())
                .sorted(Comparator.comparing(Plan::createdAt).thenComparing(Plan::id))
                .toList();
        int excess = finished.size() - retention;
        for (int i = 0; i < excess; i++) {
            Plan evicted = finished.get(i);
            if (plans.remove(evicted.id(), evicted)) {
                log.debug("Evicted finished plan {} ({})", evicted.id(), evicted.status());
            }
        }
    }

    // ── Running ──────────────────────────────────────────────────────

    public PlanSummary runPlan(Plan plan) {
        return runPlan(plan, defaultExecutor, RunOptions.from(properties));
    }

    public PlanSummary runPlan(Plan plan, ActionExecutor executor) {
        return runPlan(plan, executor, RunOptions.from(properties));
    }

    /**
     * Runs the plan on a background thread.
     */
    public CompletableFuture<PlanSummary> runPlanAsync(Plan plan, ActionExecutor executor, RunOptions options) {
        return CompletableFuture.supplyAsync(() -> runPlan(plan, executor, options), runners);
    }

    /**
     * Dispatches runnable tasks until the plan is drained, stalls or is cancelled.
     * Returns without waiting for executor calls still in flight after a cancellation; their
     * results are discarded.
     */
    public PlanSummary runPlan(Plan plan, ActionExecutor executor, RunOptions options) {
        if (plan.status() != PlanStatus.PENDING) {
            throw new IllegalStateException("Plan " + plan.id() + " is " + plan.status() + ", it can only run once");
        }
        MdcContext.setPlan(plan.id());
        int slots = options.strategy() == ExecutionStrategy.SEQUENTIAL ? 1 : options.maxParallel();
        ExecutorService workers = Executors.newFixedThreadPool(slots, namedThreads(plan.id() + "-worker"));
        try {
            if (!plan.markStarted(Instant.now())) {
                log.info("Plan {} was cancelled before it started", plan.id());
                return summarize(plan);
            }
            plan.log(null, "started", "strategy " + options.strategy() + ", max parallel " + slots);
            log.info("Running plan {} ({} tasks, strategy={}, maxParallel={})",
                    plan.id(), plan.tasks().size(), options.strategy(), slots);
            eventBus.publish(WardenEvent.of("plan.started", plan.id(), null,
                    Map.of("goal", plan.goal(), "strategy", options.strategy().name())));

            var completion = new ExecutorCompletionService<Task>(workers);
            int inFlight = 0;
            long pollMs = Math.max(1, properties.getPollInterval().toMillis());

            while (!plan.isCancelRequested()) {
                Instant now = Instant.now();
                List<String> wave = scheduler.computeNextWave(plan.tasks(), options.strategy(), slots, now);
                int dispatched = 0;
                for (String taskId : wave) {
                    if (plan.transition(taskId, TaskStatus.PENDING, Task::claim).isPresent()) {
                        completion.submit(() -> runWorker(plan, taskId, executor, options));
                        dispatched++;
                    }
                }
                if (dispatched > 0) {
                    inFlight += dispatched;
                    metrics.recordWaveSize(dispatched);
                }

                if (inFlight == 0) {
                    if (!plan.hasOpenTasks()) {
                        break;
                    }
                    Optional<Instant> retryAt = scheduler.nextEligibleTime(plan.tasks(), now);
                    if (retryAt.isEmpty()) {
                        break; // stalled
                    }
                    long waitMs = Math.min(pollMs, Math.max(1, Duration.between(now, retryAt.get()).toMillis()));
                    Thread.sleep(waitMs);
                    continue;
                }

                Future<Task> done = completion.poll(pollMs, TimeUnit.MILLISECONDS);
                if (done != null) {
                    inFlight--;
                    try {
                        done.get();
                    } catch (ExecutionException e) {
                        log.error("Task worker of plan {} failed unexpectedly", plan.id(), e.getCause());
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Plan {} runner interrupted, cancelling", plan.id());
            cancelPlan(plan, ConfirmationGateway.SYSTEM_RESOLVER);
        } finally {
            workers.shutdown();
            MdcContext.clear();
        }

        finishRun(plan);
        return summarize(plan);
    }

    private void finishRun(Plan plan) {
        if (plan.isCancelRequested()) {
            // cancelPlan already moved the plan to CANCELLED
            return;
        }
        if (plan.hasTaskInFlight()) {
            failStranded(plan);
        }
        List<StalledTask> stalled = scheduler.stalledTasks(plan.tasks());
        PlanStatus terminal = plan.hasOpenTasks() ? PlanStatus.STALLED : PlanStatus.COMPLETED;
        if (!plan.finish(terminal, Instant.now())) {
            return;
        }
        PlanSummary summary = summarize(plan);
        metrics.recordPlanResult(terminal.name());
        if (terminal == PlanStatus.STALLED) {
            for (StalledTask s : stalled) {
                plan.log(s.taskId(), "stalled", s.reason());
            }
            log.warn("Plan {} stalled: {} task(s) can never run: {}", plan.id(), stalled.size(), stalled);
        } else {
            log.info("Plan {} completed: {}/{} tasks completed, {} failed",
                    plan.id(), summary.completed(), summary.total(), summary.failed());
        }
        plan.log(null, terminal.name().toLowerCase(), summary.completed() + "/" + summary.total() + " completed");
        auditLog.record(AuditEntry.builder(AuditActor.SCHEDULER, "plan " + plan.id() + ": " + plan.goal(),
                        "plan-" + terminal.name().toLowerCase())
                .error(terminal == PlanStatus.STALLED ? stalled.size() + " stalled task(s)" : null)
                .plan(plan.id(), null));
        eventBus.publish(WardenEvent.of("plan." + terminal.name().toLowerCase(), plan.id(), null,
                summaryPayload(summary)));
    }

    /**
     * Tasks left RUNNABLE or IN_PROGRESS once the run loop has stopped will never be picked up again.
     */
    private void failStranded(Plan plan) {
        for (Task task : plan.tasks()) {
            if (task.status() == TaskStatus.RUNNABLE || task.status() == TaskStatus.IN_PROGRESS) {
                abandon(plan, task.id(), "worker stopped before the task finished");
            }
        }
    }

    private Task runWorker(Plan plan, String taskId, ActionExecutor executor, RunOptions options) {
        try {
            return executeTask(plan, taskId, executor, options);
        } catch (RuntimeException | Error e) {
            abandon(plan, taskId, "worker failed: " + describe(e));
            throw e;
        }
    }

    private void abandon(Plan plan, String taskId, String reason) {
        Instant now = Instant.now();
        Optional<Task> failed = plan.transition(taskId, TaskStatus.IN_PROGRESS,
                t -> t.fail(reason, FailureKind.EXECUTOR_FAILURE, now));
        if (failed.isEmpty()) {
            failed = plan.transition(taskId, TaskStatus.RUNNABLE, t -> t.fail(reason, FailureKind.EXECUTOR_FAILURE, now));
        }
        failed.ifPresent(task -> {
            metrics.recordTaskFailure(FailureKind.EXECUTOR_FAILURE.name());
            auditLog.record(AuditEntry.builder(AuditActor.SCHEDULER, task.description(), "failed")
                    .error(reason)
                    .plan(plan.id(), task.id()));
            plan.log(task.id(), "failed", reason);
            log.error("Task {} of plan {} abandoned: {}", task.id(), plan.id(), reason);
            eventBus.publish(WardenEvent.of("task.failed", plan.id(), task.id(),
                    Map.of("reason", reason, "failureKind", FailureKind.EXECUTOR_FAILURE.name(), "terminal", true)));
        });
    }

    /**
     * Runs one attempt of a task: start it, gate its action, then execute it.
     * A task that is not ready (dependencies incomplete, already running or terminal) is returned unchanged,
     * except that a task claimed into a wave goes back to PENDING.
     *
     * @return the task's state after this attempt
     */
    public Task executeTask(Plan plan, String taskId, ActionExecutor executor, RunOptions options) {
        Optional<Task> started = plan.start(taskId, Instant.now());
        if (started.isEmpty()) {
            log.debug("Task {} of plan {} is not ready to start", taskId, plan.id());
            return plan.transition(taskId, TaskStatus.RUNNABLE, Task::release)
                    .or(() -> plan.task(taskId))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown task " + taskId));
        }
        Task task = started.get();
        MdcContext.setTask(plan.id(), task.id());
        try {
            auditLog.record(AuditEntry.builder(AuditActor.SCHEDULER, task.description(), "started")
                    .plan(plan.id(), task.id()));
            plan.log(task.id(), "started", "attempt " + task.attempts() + ": " + task.description());
            eventBus.publish(WardenEvent.of("task.started", plan.id(), task.id(),
                    Map.of("attempt", task.attempts(), "description", task.description())));

            if (plan.isCancelRequested()) {
                return discarded(plan, task.id());
            }
            ApprovalOutcome approval = gateway.requestConfirmation(task.action(), task.description(),
                    options.confirmationTimeout(), plan.id(), task.id());
            if (!approval.approved()) {
                return notApproved(plan, task, approval);
            }
            return runExecutor(plan, task, executor, options);
        } finally {
            MdcContext.clearTask();
        }
    }

    private Task notApproved(Plan plan, Task task, ApprovalOutcome approval) {
        FailureKind kind = switch (approval.decision()) {
            case BLOCKED -> FailureKind.CLASSIFICATION_BLOCKED;
            case TIMED_OUT -> FailureKind.APPROVAL_TIMED_OUT;
            default -> FailureKind.APPROVAL_DENIED;
        };
        String reason = "not approved: " + approval.reason();
        // the gateway has already audited the decision
        return plan.transition(task.id(), TaskStatus.IN_PROGRESS, t -> t.fail(reason, kind, Instant.now()))
                .map(failed -> {
                    metrics.recordTaskFailure(kind.name());
                    plan.log(task.id(), "failed", reason);
                    log.warn("Task {} not approved ({}): {}", task.id(), kind, approval.reason());
                    eventBus.publish(WardenEvent.of("task.failed", plan.id(), task.id(),
                            Map.of("reason", reason, "failureKind", kind.name(), "terminal", true)));
                    return failed;
                })
                .orElseGet(() -> discarded(plan, task.id()));
    }

    private Task runExecutor(Plan plan, Task task, ActionExecutor executor, RunOptions options) {
        long start = System.currentTimeMillis();
        Object result;
        try {
            result = executor.execute(task.action(), task.description());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return executorFailed(plan, task, e, start, options);
        } catch (VirtualMachineError e) {
            executorFailed(plan, task, e, start, options);
            throw e;
        } catch (Exception | Error e) {
            return executorFailed(plan, task, e, start, options);
        }
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordTaskExecution(task.action().kind().name(), elapsed);

        return plan.transition(task.id(), TaskStatus.IN_PROGRESS, t -> t.complete(result, Instant.now()))
                .map(completed -> {
                    auditLog.record(AuditEntry.builder(AuditActor.SCHEDULER, task.description(), "completed")
                            .plan(plan.id(), task.id()));
                    plan.log(task.id(), "completed", "in " + elapsed + "ms");
                    log.info("Task {} completed in {}ms", task.id(), elapsed);
                    eventBus.publish(WardenEvent.of("task.completed", plan.id(), task.id(),
                            Map.of("elapsedMs", elapsed)));
                    return completed;
                })
                .orElseGet(() -> discarded(plan, task.id()));
    }

    private Task executorFailed(Plan plan, Task task, Throwable error, long start, RunOptions options) {
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordTaskExecution(task.action().kind().name(), elapsed);
        String message = describe(error);
        Instant now = Instant.now();
        boolean retry = task.canRetry();
        Instant notBefore = options.retryBackoff().isZero() ? null : now.plus(options.retryBackoff());

        Optional<Task> updated = plan.transition(task.id(), TaskStatus.IN_PROGRESS, t -> {
            Task failed = t.fail(message, FailureKind.EXECUTOR_FAILURE, now);
            return retry ? failed.retry(notBefore) : failed;
        });
        if (updated.isEmpty()) {
            return discarded(plan, task.id());
        }

        metrics.recordTaskFailure(FailureKind.EXECUTOR_FAILURE.name());
        auditLog.record(AuditEntry.builder(AuditActor.SCHEDULER, task.description(), "failed")
                .error(message)
                .plan(plan.id(), task.id()));
        plan.log(task.id(), "failed", message);
        eventBus.publish(WardenEvent.of("task.failed", plan.id(), task.id(),
                Map.of("reason", message, "failureKind", FailureKind.EXECUTOR_FAILURE.name(), "terminal", !retry)));
        if (retry) {
            metrics.recordTaskRetry();
            plan.log(task.id(), "retrying", "attempt " + task.attempts() + "/" + task.maxRetries());
            log.warn("Task {} failed (attempt {}/{}), will retry: {}",
                    task.id(), task.attempts(), task.maxRetries(), message);
        } else {
            log.error("Task {} failed after {} attempts: {}", task.id(), task.attempts(), message);
        }
        return updated.get();
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private Task discarded(Plan plan, String taskId) {
        log.info("Discarding result of task {}: plan {} moved on", taskId, plan.id());
        return plan.task(taskId).orElseThrow();
    }

    // ── Cancellation ─────────────────────────────────────────────────

    public boolean cancelPlan(String planId, String resolverId) {
        Plan plan = plans.get(planId);
        if (plan == null) {
            throw new IllegalArgumentException("Unknown plan " + planId);
        }
        return cancelPlan(plan, resolverId);
    }

    /**
     * Cancels every open task and force-denies the plan's pending confirmations.
     *
     * @return false if the plan had already finished or been cancelled
     */
    public boolean cancelPlan(Plan plan, String resolverId) {
        if (plan.status().isTerminal() || !plan.requestCancel()) {
            return false;
        }
        String resolver = resolverId != null && !resolverId.isBlank() ? resolverId : "user";
        Instant now = Instant.now();
        List<Task> cancelled = plan.cancelOpenTasks("cancelled by " + resolver, now);
        int denied = gateway.denyPending(plan.id(), resolver, "plan cancelled");
        if (!plan.finish(PlanStatus.CANCELLED, now)) {
            // the run finished in the meantime; nothing was left to cancel
            return false;
        }

        for (Task task : cancelled) {
            plan.log(task.id(), "cancelled", "cancelled by " + resolver);
        }
        plan.log(null, "cancelled", cancelled.size() + " task(s) cancelled, " + denied + " confirmation(s) denied");
        log.info("Plan {} cancelled by {}: {} task(s) cancelled, {} confirmation(s) denied",
                plan.id(), resolver, cancelled.size(), denied);
        metrics.recordPlanResult(PlanStatus.CANCELLED.name());
        auditLog.record(AuditEntry.builder(
                        ConfirmationGateway.SYSTEM_RESOLVER.equals(resolver) ? AuditActor.SYSTEM : AuditActor.USER,
                        "plan " + plan.id() + ": " + plan.goal(), "plan-cancelled")
                .resolvedBy(resolver)
                .plan(plan.id(), null));
        eventBus.publish(WardenEvent.of("plan.cancelled", plan.id(), null,
                Map.of("cancelledTasks", cancelled.size(), "deniedConfirmations", denied)));
        return true;
    }

    // ── Queries ──────────────────────────────────────────────────────

    public Optional<Plan> findPlan(String planId) {
        return Optional.ofNullable(plans.get(planId));
    }

    public List<Plan> listPlans() {
        return plans.values().stream()
                .sorted(Comparator.comparing(Plan::createdAt))
                .toList();
    }

    public PlanSummary summarize(Plan plan) {
        List<Task> tasks = plan.tasks();
        return PlanSummary.of(tasks, scheduler.stalledTasks(tasks), plan.durationMs());
    }

    /**
     * Post-run analysis: success rate and what to look at next.
     */
    public PlanReflection reflect(Plan plan) {
        PlanSummary summary = summarize(plan);
        List<Task> tasks = plan.tasks();
        List<String> failedIds = tasks.stream()
                .filter(t -> t.status() == TaskStatus.FAILED)
                .map(Task::id)
                .toList();
        Map<FailureKind, Integer> byKind = new HashMap<>();
        for (Task t : tasks) {
            if (t.status() == TaskStatus.FAILED && t.failureKind() != null) {
                byKind.merge(t.failureKind(), 1, Integer::sum);
            }
        }

        var recommendations = new ArrayList<String>();
        if (!failedIds.isEmpty()) {
            recommendations.add("Fix " + failedIds.size() + " failed tasks");
        }
        if (byKind.containsKey(FailureKind.CLASSIFICATION_BLOCKED)) {
            recommendations.add("Rephrase " + byKind.get(FailureKind.CLASSIFICATION_BLOCKED)
                    + " blocked task(s); blocked actions are never allowed");
        }
        if (byKind.containsKey(FailureKind.APPROVAL_TIMED_OUT)) {
            recommendations.add("Respond to confirmations sooner or raise the confirmation timeout ("
                    + byKind.get(FailureKind.APPROVAL_TIMED_OUT) + " timed out)");
        }
        if (byKind.containsKey(FailureKind.EXECUTOR_FAILURE)) {
            recommendations.add("Investigate executor errors for " + byKind.get(FailureKind.EXECUTOR_FAILURE)
                    + " task(s) that exhausted their retries");
        }
        if (!summary.stalled().isEmpty()) {
            recommendations.add("Resolve " + summary.stalled().size() + " stalled task(s) blocked by their dependencies");
        }

        double successRate = summary.total() > 0 ? (double) summary.completed() / summary.total() : 0.0;
        return new PlanReflection(plan.id(), plan.status(), summary.total(), summary.completed(), summary.failed(),
                successRate, failedIds, recommendations);
    }

    /**
     * Generates a unique plan ID in the format PLAN-YYYY-NNNN.
     */
    public String generatePlanId() {
        int count = PLAN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("PLAN-%d-%04d", year, count);
    }

    static Map<String, Object> summaryPayload(PlanSummary summary) {
        return Map.of(
                "total", summary.total(),
                "completed", summary.completed(),
                "failed", summary.failed(),
                "pending", summary.pending(),
                "progressPercent", summary.progressPercent());
    }

    private static void requireGoal(String goal) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Goal is required");
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
