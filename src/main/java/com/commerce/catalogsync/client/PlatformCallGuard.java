package com.commerce.catalogsync.client;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Applies the resilience policies shared by all HTTP platform clients:
 * reads are spaced by a rate limiter and retried, writes are spaced and go through a circuit breaker.
 */
public class PlatformCallGuard {

    private final RateLimiter rateLimiter;
    private final RetryTemplate retryTemplate;
    private final CircuitBreaker circuitBreaker;

    public PlatformCallGuard(RateLimiter rateLimiter, RetryTemplate retryTemplate,
                             CircuitBreaker circuitBreaker) {
        this.rateLimiter = rateLimiter;
        this.retryTemplate = retryTemplate;
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * One request per interval. A zero interval disables throttling.
     */
    public static RateLimiter rateLimiter(String name, Duration requestInterval) {
        if (requestInterval == null || requestInterval.isZero() || requestInterval.isNegative()) {
            return null;
        }
        return RateLimiter.of(name, RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(requestInterval)
                .timeoutDuration(requestInterval.multipliedBy(100))
                .build());
    }

    public <T> T read(Supplier<T> call) {
        return retryTemplate.<T, RuntimeException>execute(context -> throttled(call));
    }

    public void write(Runnable call) {
        circuitBreaker.executeRunnable(() -> throttled(() -> {
            call.run();
            return null;
        }));
    }

    private <T> T throttled(Supplier<T> call) {
        if (rateLimiter == null) {
            return call.get();
        }
        return RateLimiter.decorateSupplier(rateLimiter, call).get();
    }
}
