package com.warden.core.model;

import java.time.Instant;

/**
 * One line of a plan's execution log.
 *
 * @param taskId    task the event concerns; null for plan-level events
 * @param event     short event label ("started", "completed", "failed", "retrying", "cancelled", ...)
 * @param timestamp when it happened
 * @param message   free text
 */
public record ExecutionLogEntry(String taskId, String event, Instant timestamp, String message) {}
