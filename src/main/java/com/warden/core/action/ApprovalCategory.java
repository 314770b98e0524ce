package com.warden.core.action;

/**
 * Groups of actions that a policy may declare as requiring external approval.
 */
public enum ApprovalCategory {
    FILE_MUTATION,
    PROGRAM_EXECUTION,
    SYSTEM_COMMAND,
    NETWORK_ACCESS,
    DOWNLOAD
}
