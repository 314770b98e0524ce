package com.warden.core.action;

/**
 * Thrown when an action is constructed with missing or malformed parameters.
 */
public class InvalidActionException extends IllegalArgumentException {

    public InvalidActionException(String message) {
        super(message);
    }
}
