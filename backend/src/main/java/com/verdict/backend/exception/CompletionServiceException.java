package com.verdict.backend.exception;

public class CompletionServiceException extends RuntimeException {
    private final int statusCode;

    public CompletionServiceException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public CompletionServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public CompletionServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
