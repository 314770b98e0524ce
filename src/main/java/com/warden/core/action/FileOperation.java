package com.warden.core.action;

/**
 * Operations a {@link FileAction} can perform. Everything except {@link #READ} mutates the file system.
 */
public enum FileOperation {
    READ,
    CREATE,
    WRITE,
    MOVE,
    DELETE;

    public boolean isMutating() {
        return this != READ;
    }
}
