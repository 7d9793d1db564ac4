package com.verdict.backend.service.completion;

import com.fasterxml.jackson.databind.JsonNode;
import com.verdict.backend.model.CompletionOutcome;

/**
 * Tagged outcome of asking the completion service for a JSON object.
 *
 * @param payload parsed object, present only when {@code outcome} is {@link CompletionOutcome#OK}
 * @param rawText text as returned by the service, null when the call itself failed
 * @param failure short description of what went wrong, null on success
 */
public record CompletionReply(CompletionOutcome outcome, JsonNode payload, String rawText, String failure) {

    public static CompletionReply ok(JsonNode payload, String rawText) {
        return new CompletionReply(CompletionOutcome.OK, payload, rawText, null);
    }

    public static CompletionReply parseFailed(String rawText, String failure) {
        return new CompletionReply(CompletionOutcome.PARSE_FAILED, null, rawText, failure);
    }

    public static CompletionReply serviceFailed(String failure) {
        return new CompletionReply(CompletionOutcome.SERVICE_FAILED, null, null, failure);
    }

    public boolean isOk() {
        return outcome == CompletionOutcome.OK;
    }

    public String describeFailure() {
        return outcome + ": " + failure;
    }
}
