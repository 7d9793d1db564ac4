package com.verdict.backend.exception;

public class CompletionRateLimitException extends CompletionServiceException {
    public CompletionRateLimitException(String message, Throwable cause) {
        super(message, 429, cause);
    }
}
