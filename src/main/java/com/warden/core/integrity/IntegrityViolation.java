package com.warden.core.integrity;

/**
 * A tracked file whose content no longer matches its baseline hash.
 */
public record IntegrityViolation(String path, Kind kind, String detail) {

    public enum Kind {
        MODIFIED,
        DELETED,
        UNREADABLE
    }
}
