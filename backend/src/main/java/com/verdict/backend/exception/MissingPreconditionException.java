package com.verdict.backend.exception;

/**
 * A required input of the run is absent or unusable. Aborts the run for that ticker.
 */
public class MissingPreconditionException extends RuntimeException {
    public MissingPreconditionException(String message) {
        super(message);
    }

    public MissingPreconditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
