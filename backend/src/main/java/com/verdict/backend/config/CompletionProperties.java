package com.verdict.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the chat completion endpoint shared by the debate and decision stages.
 * A blank {@code apiKey} disables remote calls.
 */
@Configuration
@ConfigurationProperties(prefix = "completion")
@Data
@Validated
public class CompletionProperties {

    @NotBlank
    private String baseUrl = "https://openrouter.ai/api/v1";
    private String apiKey = "";
    @NotBlank
    private String model = "google/gemini-1.5-flash:free";
    private String siteUrl = "http://localhost:8080";
    private String siteName = "verdict";
    @Valid
    private Http http = new Http();
    @Valid
    private Retry retry = new Retry();

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String chatCompletionsUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/chat/completions";
    }

    @Data
    public static class Http {
        @Positive
        private int connectTimeoutMs = 10000;
        @Positive
        private int readTimeoutMs = 60000;
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @Positive
        private long baseDelayMs = 1000;
        @Positive
        private double multiplier = 2.0;
        @Positive
        private long maxDelayMs = 10000;
    }
}
