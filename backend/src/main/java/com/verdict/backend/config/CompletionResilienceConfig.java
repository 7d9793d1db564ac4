package com.verdict.backend.config;

import com.verdict.backend.exception.CompletionRateLimitException;
import com.verdict.backend.exception.CompletionServerException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class CompletionResilienceConfig {

    @Bean
    public Retry completionRetry(CompletionProperties completionProperties) {
        CompletionProperties.Retry retry = completionProperties.getRetry();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialBackoff(
                Duration.ofMillis(retry.getBaseDelayMs()),
                retry.getMultiplier(),
                Duration.ofMillis(retry.getMaxDelayMs())
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(CompletionRateLimitException.class, CompletionServerException.class, ResourceAccessException.class)
                .build();
        return Retry.of("completion", config);
    }
}
