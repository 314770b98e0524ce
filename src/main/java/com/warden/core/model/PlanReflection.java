package com.warden.core.model;

import java.util.List;

/**
 * Post-run analysis of a plan.
 *
 * @param successRate completed / total, 0 for an empty plan
 */
public record PlanReflection(
    String planId,
    PlanStatus status,
    int totalTasks,
    int completed,
    int failed,
    double successRate,
    List<String> failedTaskIds,
    List<String> recommendations
) {}
