package com.warden.core.action;

/**
 * Kinds of side-effecting actions an agent step can perform on the host.
 */
public enum ActionKind {
    GENERIC,
    MOUSE_CONTROL,
    KEYBOARD_INPUT,
    SCREEN_CONTROL,
    FILE_OPERATION,
    PROGRAM_EXECUTION,
    SYSTEM_COMMAND,
    NETWORK_ACCESS,
    DOWNLOAD_FILE,
    GAME_INTERACTION
}
