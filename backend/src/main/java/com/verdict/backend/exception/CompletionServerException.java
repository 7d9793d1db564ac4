package com.verdict.backend.exception;

public class CompletionServerException extends CompletionServiceException {
    public CompletionServerException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
