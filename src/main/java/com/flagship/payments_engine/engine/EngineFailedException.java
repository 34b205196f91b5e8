package com.flagship.payments_engine.engine;

/**
 * Thrown when the engine's consumer stopped before draining its input.
 * A run that hits this has no valid snapshot.
 */
public class EngineFailedException extends RuntimeException {

    public EngineFailedException(String message) {
        super(message);
    }

    public EngineFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
