package com.commerce.catalogsync.config;

import com.commerce.catalogsync.exception.PlatformApiException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

import java.util.Map;

/**
 * Retries {@link PlatformApiException}s that are flagged as retryable, up to a maximum number
 * of attempts. Everything else, authorization failures included, fails on the first attempt.
 */
public class PlatformRetryPolicy extends SimpleRetryPolicy {

    public PlatformRetryPolicy(int maxAttempts) {
        super(maxAttempts, Map.<Class<? extends Throwable>, Boolean>of(PlatformApiException.class, true));
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last instanceof PlatformApiException && !((PlatformApiException) last).isRetryable()) {
            return false;
        }
        return super.canRetry(context);
    }
}
