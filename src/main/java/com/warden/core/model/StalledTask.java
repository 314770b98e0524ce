package com.warden.core.model;

/**
 * A task that can never become runnable, with the reason.
 */
public record StalledTask(String taskId, String reason) {}
