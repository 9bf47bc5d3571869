package com.commerce.catalogsync.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;

/**
 * Resilience settings for platform API calls.
 * <p>
 * Page fetches are retried: a single flaky page must not abort a whole catalog fetch.
 * Price updates go through a circuit breaker: when the target platform keeps failing,
 * the remaining updates fail fast and are reported instead of hammering the API.
 * <p>
 * Circuit breaker states:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Platform is failing, requests fail fast
 * - HALF_OPEN: Testing if platform has recovered
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // Number of calls to record before calculating failure rate
                .slidingWindowSize(10)
                // Failure rate threshold to open the circuit (50%)
                .failureRateThreshold(50)
                // Time to wait before transitioning from OPEN to HALF_OPEN
                .waitDurationInOpenState(Duration.ofSeconds(30))
                // Number of calls permitted in HALF_OPEN state
                .permittedNumberOfCallsInHalfOpenState(3)
                // Automatically transition to HALF_OPEN after wait duration
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public RetryTemplate fetchRetryTemplate(CatalogSyncProperties properties) {
        CatalogSyncProperties.Retry retry = properties.getFetchRetry();
        return fetchRetryTemplate(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier());
    }

    public static RetryTemplate fetchRetryTemplate(int maxAttempts, Duration initialBackoff, double multiplier) {
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(Math.max(1L, initialBackoff.toMillis()));
        backOff.setMultiplier(multiplier);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new PlatformRetryPolicy(Math.max(1, maxAttempts)));
        template.setBackOffPolicy(backOff);
        return template;
    }
}
