package com.verdict.backend.service.completion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.verdict.backend.config.CompletionProperties;
import com.verdict.backend.exception.CompletionRateLimitException;
import com.verdict.backend.exception.CompletionServerException;
import com.verdict.backend.exception.CompletionServiceException;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Chat completion client used by the debate and decision stages.
 * Every failure surfaces as {@link CompletionServiceException} once retries are exhausted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionClient {

    private final RestTemplate completionRestTemplate;
    private final Retry completionRetry;
    private final CompletionProperties completionProperties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    /**
     * Sends the messages and returns the text of the first choice.
     *
     * @param purpose short tag used for metrics and logs, e.g. "debate"
     */
    public String complete(String purpose, List<ChatMessage> messages) {
        if (!completionProperties.isEnabled()) {
            throw new CompletionServiceException("Completion service disabled: no API key configured");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        String body = buildRequestBody(messages);
        Supplier<String> supplier = () -> doRequest(body);
        try {
            String response = Retry.decorateSupplier(completionRetry, supplier).get();
            String content = extractContent(response);
            success = true;
            log.debug("Completion {} returned {} chars", purpose, content.length());
            return content;
        } catch (CompletionServiceException e) {
            log.warn("Completion {} failed status={} message={}", purpose, e.getStatusCode(), e.getMessage());
            throw e;
        } catch (RestClientException e) {
            log.warn("Completion {} unreachable: {}", purpose, e.getMessage());
            throw new CompletionServiceException("Completion service unreachable: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("completion_call_latency")
                    .tag("purpose", purpose)
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(String body) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setBearerAuth(completionProperties.getApiKey());
            headers.set("HTTP-Referer", completionProperties.getSiteUrl());
            headers.set("X-Title", completionProperties.getSiteName());
            HttpEntity<String> entity = new HttpEntity<>(body, headers);
            ResponseEntity<String> response = completionRestTemplate.exchange(
                    completionProperties.chatCompletionsUrl(), HttpMethod.POST, entity, String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Completion rate limited: {}", e.getMessage());
            throw new CompletionRateLimitException("Completion service rate limit", e);
        } catch (HttpServerErrorException e) {
            throw new CompletionServerException("Completion server error (" + e.getStatusCode().value() + ")",
                    e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Completion network error: {}", e.getMessage());
            throw e;
        } catch (HttpClientErrorException e) {
            throw new CompletionServiceException("Completion API error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        }
    }

    private String buildRequestBody(List<ChatMessage> messages) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", completionProperties.getModel());
        ArrayNode array = root.putArray("messages");
        for (ChatMessage message : messages) {
            array.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new CompletionServiceException("Unable to encode completion request", e);
        }
    }

    private String extractContent(String response) {
        if (response == null || response.isBlank()) {
            throw new CompletionServiceException("Empty completion response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new CompletionServiceException("Completion response is not JSON", e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new CompletionServiceException("Completion response has no choices[0].message.content");
        }
        return content.asText();
    }
}
