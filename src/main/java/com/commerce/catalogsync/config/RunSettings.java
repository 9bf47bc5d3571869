package com.commerce.catalogsync.config;

import com.commerce.catalogsync.service.PricingPolicy;
import lombok.Builder;
import lombok.Value;

/**
 * Settings of a single run, passed explicitly through the orchestrator.
 */
@Value
@Builder(toBuilder = true)
public class RunSettings {
    String source;
    String target;
    int perPage;
    int maxPages;
    boolean dryRun;
    boolean skipInactive;
    int updateConcurrency;
    String preferredLocale;
    PricingPolicy pricingPolicy;
}
