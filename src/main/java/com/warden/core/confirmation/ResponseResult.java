package com.warden.core.confirmation;

/**
 * Result of submitting an external response to a confirmation request.
 */
public enum ResponseResult {
    /** The response was applied and the waiting task was woken. */
    RESOLVED,
    /** No request with that id is known. */
    NOT_FOUND,
    /** The request was already approved, denied or timed out; the response was ignored. */
    ALREADY_RESOLVED
}
