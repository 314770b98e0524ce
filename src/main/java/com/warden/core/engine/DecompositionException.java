package com.warden.core.engine;

public class DecompositionException extends RuntimeException {

    public DecompositionException(String message) {
        super(message);
    }

    public DecompositionException(String message, Throwable cause) {
        super(message, cause);
    }
}
