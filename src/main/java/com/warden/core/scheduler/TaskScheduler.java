package com.warden.core.scheduler;

import com.warden.core.action.FileAction;
import com.warden.core.model.ExecutionStrategy;
import com.warden.core.model.Plan;
import com.warden.core.model.StalledTask;
import com.warden.core.model.Task;
import com.warden.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the tasks of a plan that may run next, based on dependency satisfaction,
 * retry backoff, execution strategy and concurrency limits.
 *
 * <p>For parallel execution, also detects file overlap conflicts: two file actions on the
 * same path never run in the same wave. Such conflicts are serialized.
 *
 * <p>Stateless; the plan is the only source of truth.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /**
     * First PENDING task, in insertion order, whose dependencies are all COMPLETED.
     */
    public Optional<Task> nextRunnableTask(Plan plan) {
        return nextRunnableTask(plan.tasks(), Instant.now());
    }

    public Optional<Task> nextRunnableTask(List<Task> tasks, Instant now) {
        Map<String, Task> byId = index(tasks);
        for (Task task : tasks) {
            if (task.status() == TaskStatus.PENDING && task.isEligible(now) && dependenciesCompleted(task, byId)) {
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    /**
     * Compute the next wave of task IDs eligible for dispatch. Tasks already RUNNABLE or
     * IN_PROGRESS occupy slots and claim their files.
     *
     * @param tasks       all tasks in the plan, in insertion order
     * @param strategy    SEQUENTIAL caps concurrency at 1, PARALLEL at maxParallel
     * @param maxParallel maximum concurrent tasks
     * @param now         reference time for retry backoff
     * @return task IDs to dispatch; empty if nothing can start right now
     */
    public List<String> computeNextWave(List<Task> tasks, ExecutionStrategy strategy, int maxParallel, Instant now) {
        int limit = strategy == ExecutionStrategy.SEQUENTIAL ? 1 : Math.max(1, maxParallel);
        Map<String, Task> byId = index(tasks);

        var claimedFiles = new HashSet<String>();
        int inFlight = 0;
        for (Task task : tasks) {
            if (task.status() == TaskStatus.RUNNABLE || task.status() == TaskStatus.IN_PROGRESS) {
                inFlight++;
                targetFile(task).ifPresent(claimedFiles::add);
            }
        }

        var wave = new ArrayList<String>();
        var deferred = new ArrayList<String>();
        for (Task task : tasks) {
            if (inFlight + wave.size() >= limit) break;
            if (task.status() != TaskStatus.PENDING) continue;
            if (!task.isEligible(now)) {
                log.debug("  {} backing off until {}", task.id(), task.eligibleAt());
                continue;
            }
            if (!dependenciesCompleted(task, byId)) {
                log.debug("  {} deps unsatisfied: {}", task.id(), task.dependencies());
                continue;
            }
            Optional<String> file = targetFile(task);
            if (file.isPresent() && overlaps(file.get(), claimedFiles)) {
                deferred.add(task.id());
                continue;
            }
            wave.add(task.id());
            file.ifPresent(claimedFiles::add);
        }

        if (!deferred.isEmpty()) {
            log.info("File overlap: {} task(s) deferred to a later wave: {}", deferred.size(), deferred);
        }
        if (!wave.isEmpty()) {
            log.debug("computeNextWave: {} tasks, {} in flight, limit {}, dispatching {}",
                    tasks.size(), inFlight, limit, wave);
        }
        return wave;
    }

    /**
     * Earliest retry time among pending tasks still backing off, if any.
     */
    public Optional<Instant> nextEligibleTime(List<Task> tasks, Instant now) {
        return tasks.stream()
                .filter(t -> t.status() == TaskStatus.PENDING && !t.isEligible(now))
                .map(Task::eligibleAt)
                .min(Instant::compareTo);
    }

    /**
     * Open tasks that can never run: a dependency is unknown, failed, cancelled, stalled
     * itself, or part of a cycle.
     */
    public List<StalledTask> stalledTasks(List<Task> tasks) {
        Map<String, Task> byId = index(tasks);

        // fixed point: a task is viable if completed, or open with all dependencies viable
        Set<String> viable = new HashSet<>();
        for (Task task : tasks) {
            if (task.status() == TaskStatus.COMPLETED) viable.add(task.id());
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Task task : tasks) {
                if (viable.contains(task.id()) || task.status().isTerminal()) continue;
                if (viable.containsAll(task.dependencies())) {
                    viable.add(task.id());
                    changed = true;
                }
            }
        }

        var stalled = new ArrayList<StalledTask>();
        for (Task task : tasks) {
            if (task.status().isTerminal() || viable.contains(task.id())) continue;
            stalled.add(new StalledTask(task.id(), stallReason(task, byId)));
        }
        return stalled;
    }

    private String stallReason(Task task, Map<String, Task> byId) {
        for (String dep : task.dependencies()) {
            Task d = byId.get(dep);
            if (d == null) return "unknown dependency " + dep;
        }
        for (String dep : task.dependencies()) {
            Task d = byId.get(dep);
            if (d.status() == TaskStatus.FAILED) return "dependency " + dep + " failed";
            if (d.status() == TaskStatus.CANCELLED) return "dependency " + dep + " cancelled";
        }
        if (inCycle(task.id(), byId)) {
            return "dependency cycle";
        }
        String blocker = task.dependencies().stream()
                .filter(dep -> byId.get(dep).status() != TaskStatus.COMPLETED)
                .findFirst()
                .orElse("?");
        return "waiting on stalled dependency " + blocker;
    }

    private boolean inCycle(String start, Map<String, Task> byId) {
        var stack = new ArrayList<String>(byId.get(start).dependencies());
        var seen = new HashSet<String>();
        while (!stack.isEmpty()) {
            String id = stack.remove(stack.size() - 1);
            if (id.equals(start)) return true;
            if (!seen.add(id)) continue;
            Task t = byId.get(id);
            if (t != null) stack.addAll(t.dependencies());
        }
        return false;
    }

    private boolean dependenciesCompleted(Task task, Map<String, Task> byId) {
        for (String dep : task.dependencies()) {
            Task d = byId.get(dep);
            if (d == null || d.status() != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Task> index(List<Task> tasks) {
        var byId = new LinkedHashMap<String, Task>();
        for (Task t : tasks) byId.put(t.id(), t);
        return byId;
    }

    private static Optional<String> targetFile(Task task) {
        if (task.action() instanceof FileAction file) {
            return Optional.of(normalizePath(file.path()));
        }
        return Optional.empty();
    }

    /**
     * Paths match if they are equal or one is a suffix of the other
     * (to handle relative vs. absolute paths).
     */
    private static boolean overlaps(String target, Set<String> claimedFiles) {
        for (String claimed : claimedFiles) {
            if (target.equals(claimed) || target.endsWith("/" + claimed) || claimed.endsWith("/" + target)) {
                return true;
            }
        }
        return false;
    }

    private static String normalizePath(String path) {
        String p = path.replace('\\', '/');
        return p.startsWith("./") ? p.substring(2) : p;
    }
}
