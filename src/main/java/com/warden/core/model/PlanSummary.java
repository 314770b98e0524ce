package com.warden.core.model;

import java.util.List;

/**
 * Counts of a plan's tasks by status.
 *
 * @param pending         tasks not yet terminal and not running (PENDING or RUNNABLE)
 * @param progressPercent completed share of all tasks, rounded down
 * @param stalled         tasks that can never run, with reasons
 * @param durationMs      wall time from start to completion; null until the plan finishes
 */
public record PlanSummary(
    int total,
    int completed,
    int failed,
    int cancelled,
    int inProgress,
    int pending,
    int progressPercent,
    List<StalledTask> stalled,
    Long durationMs
) {

    public static PlanSummary of(List<Task> tasks, List<StalledTask> stalled, Long durationMs) {
        int completed = 0, failed = 0, cancelled = 0, inProgress = 0, pending = 0;
        for (Task task : tasks) {
            switch (task.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
                case IN_PROGRESS -> inProgress++;
                case PENDING, RUNNABLE -> pending++;
            }
        }
        int total = tasks.size();
        int progress = total > 0 ? completed * 100 / total : 0;
        return new PlanSummary(total, completed, failed, cancelled, inProgress, pending, progress,
                List.copyOf(stalled), durationMs);
    }
}
