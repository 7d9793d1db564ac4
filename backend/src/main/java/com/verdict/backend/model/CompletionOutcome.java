package com.verdict.backend.model;

public enum CompletionOutcome {
    OK,
    PARSE_FAILED,
    SERVICE_FAILED
}
