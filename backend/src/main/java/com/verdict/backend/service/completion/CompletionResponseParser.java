package com.verdict.backend.service.completion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verdict.backend.exception.CompletionServiceException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Turns free-form completion text into a JSON object.
 * The first balanced {@code {...}} block is decoded strictly; surrounding prose or code fences are ignored.
 */
@Component
@RequiredArgsConstructor
public class CompletionResponseParser {

    private final ObjectMapper objectMapper;

    public CompletionReply parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return CompletionReply.parseFailed(rawText, "empty reply");
        }
        Optional<String> candidate = extractFirstObject(rawText);
        if (candidate.isEmpty()) {
            return CompletionReply.parseFailed(rawText, "no JSON object found");
        }
        try {
            JsonNode node = objectMapper.readTree(candidate.get());
            if (node == null || !node.isObject()) {
                return CompletionReply.parseFailed(rawText, "reply is not a JSON object");
            }
            return CompletionReply.ok(node, rawText);
        } catch (JsonProcessingException e) {
            return CompletionReply.parseFailed(rawText, "invalid JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * Calls the service and parses its reply. Service failures are returned as a tagged reply, never thrown.
     */
    public CompletionReply request(CompletionClient client, String purpose, List<ChatMessage> messages) {
        try {
            return parse(client.complete(purpose, messages));
        } catch (CompletionServiceException e) {
            return CompletionReply.serviceFailed(e.getMessage());
        }
    }

    Optional<String> extractFirstObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findClosingBrace(text, start);
            if (end > start) {
                return Optional.of(text.substring(start, end + 1));
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private int findClosingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
