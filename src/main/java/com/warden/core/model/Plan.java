package com.warden.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * A goal and the DAG of tasks pursuing it.
 * <p>
 * Tasks are kept in insertion order, which is also the priority tie-break. Task state changes go
 * through {@link #transition}, a compare-and-swap on the task's status under the plan's monitor, so
 * a worker finishing a task and a concurrent cancellation can never both win.
 */
public final class Plan {

    private final String id;
    private final String goal;
    private final Instant createdAt = Instant.now();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final CopyOnWriteArrayList<ExecutionLogEntry> executionLog = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private volatile PlanStatus status = PlanStatus.PENDING;
    private volatile Instant startedAt;
    private volatile Instant completedAt;

    public Plan(String id, String goal, List<Task> initialTasks) {
        this.id = id;
        this.goal = goal;
        for (Task task : initialTasks) {
            if (tasks.putIfAbsent(task.id(), task) != null) {
                throw new IllegalArgumentException("Duplicate task id in plan " + id + ": " + task.id());
            }
        }
    }

    public String id() {
        return id;
    }

    public String goal() {
        return goal;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public PlanStatus status() {
        return status;
    }

    public synchronized List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    public synchronized Optional<Task> task(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * Applies {@code change} to the task only if its status is still {@code expected}.
     *
     * @return the updated task, or empty if the task is unknown or has moved on
     */
    public synchronized Optional<Task> transition(String taskId, TaskStatus expected, UnaryOperator<Task> change) {
        Task current = tasks.get(taskId);
        if (current == null || current.status() != expected) {
            return Optional.empty();
        }
        Task updated = change.apply(current);
        tasks.put(taskId, updated);
        return Optional.of(updated);
    }

    /**
     * Moves a PENDING or RUNNABLE task to IN_PROGRESS, but only if every dependency is COMPLETED.
     *
     * @return the started task, or empty if it is not ready or not in a startable status
     */
    public synchronized Optional<Task> start(String taskId, Instant now) {
        Task current = tasks.get(taskId);
        if (current == null || cancelRequested.get()) {
            return Optional.empty();
        }
        if (current.status() != TaskStatus.PENDING && current.status() != TaskStatus.RUNNABLE) {
            return Optional.empty();
        }
        for (String dep : current.dependencies()) {
            Task d = tasks.get(dep);
            if (d == null || d.status() != TaskStatus.COMPLETED) {
                return Optional.empty();
            }
        }
        Task started = current.start(now);
        tasks.put(taskId, started);
        return Optional.of(started);
    }

    /**
     * Cancels every task that is not yet terminal, in one step.
     *
     * @return the tasks that were cancelled
     */
    public synchronized List<Task> cancelOpenTasks(String reason, Instant now) {
        var cancelled = new ArrayList<Task>();
        for (var entry : tasks.entrySet()) {
            if (!entry.getValue().status().isTerminal()) {
                Task updated = entry.getValue().cancel(reason, now);
                entry.setValue(updated);
                cancelled.add(updated);
            }
        }
        return cancelled;
    }

    public synchronized boolean hasOpenTasks() {
        return tasks.values().stream().anyMatch(t -> !t.status().isTerminal());
    }

    public synchronized boolean hasTaskInFlight() {
        return tasks.values().stream()
                .anyMatch(t -> t.status() == TaskStatus.IN_PROGRESS || t.status() == TaskStatus.RUNNABLE);
    }

    public boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * PENDING to RUNNING.
     *
     * @return false if the plan is no longer PENDING
     */
    public synchronized boolean markStarted(Instant now) {
        if (status != PlanStatus.PENDING) {
            return false;
        }
        this.startedAt = now;
        this.status = PlanStatus.RUNNING;
        return true;
    }

    /**
     * Moves the plan to a terminal status. The first terminal status wins.
     *
     * @return true if this call set the status
     */
    public synchronized boolean finish(PlanStatus terminal, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal plan status: " + terminal);
        }
        if (status.isTerminal()) {
            return false;
        }
        if (terminal == PlanStatus.COMPLETED && hasOpenTasks()) {
            throw new IllegalStateException("Plan " + id + " still has open tasks");
        }
        this.status = terminal;
        this.completedAt = now;
        return true;
    }

    public void log(String taskId, String event, String message) {
        executionLog.add(new ExecutionLogEntry(taskId, event, Instant.now(), message));
    }

    public List<ExecutionLogEntry> executionLog() {
        return List.copyOf(executionLog);
    }

    public Long durationMs() {
        Instant start = startedAt;
        Instant end = completedAt;
        return start != null && end != null ? Duration.between(start, end).toMillis() : null;
    }
}
