package com.commerce.catalogsync.config;

import com.commerce.catalogsync.exception.ConfigInvalidException;
import com.commerce.catalogsync.service.PricingPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration for the catalog sync job, bound from {@code catalog-sync.*}.
 * <p>
 * Values can come from application.yml, environment variables (CATALOG_SYNC_DRY_RUN=true)
 * or the command line (--catalog-sync.dry-run=true).
 */
@Data
@ConfigurationProperties(prefix = "catalog-sync")
public class CatalogSyncProperties {

    /**
     * Name of the authoritative platform.
     */
    private String source;

    /**
     * Name of the platform that receives price updates.
     */
    private String target;

    /**
     * Fractional price difference tolerated before an update is issued (0.01 = 1%).
     */
    private BigDecimal tolerance = new BigDecimal("0.01");

    /**
     * Absolute difference tolerated when the expected price is zero.
     */
    private BigDecimal priceFloor = new BigDecimal("0.01");

    private int perPage = 50;

    /**
     * Safety net against platforms that never return an empty page.
     */
    private int maxPages = 10000;

    private boolean dryRun = false;

    private int updateConcurrency = 1;

    /**
     * Marketplace commission included in source prices, removed before pushing to the target.
     */
    private BigDecimal commissionPercent = BigDecimal.ZERO;

    private int priceScale = 2;

    private boolean skipInactive = true;

    private String preferredLocale = "es";

    private boolean runOnStartup = true;

    /**
     * Optional file the JSON run report is written to.
     */
    private String reportPath;

    private Retry fetchRetry = new Retry();

    private Map<String, Platform> platforms = new LinkedHashMap<>();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
    }

    @Data
    public static class Platform {
        private PlatformType type;
        private String baseUrl;

        /**
         * Store id on Tienda Nube, seller user id on Mercado Libre.
         */
        private String accountId;

        private String accessToken;
        private String userAgent = "catalog-sync/1.0";
        private Duration requestInterval = Duration.ofMillis(500);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String resolveBaseUrl() {
            String url = StringUtils.hasText(baseUrl) ? baseUrl.trim() : type.getDefaultBaseUrl();
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
    }

    /**
     * Validates the bound values and freezes them into the settings of one run.
     *
     * @throws ConfigInvalidException listing every problem found
     */
    public RunSettings toRunSettings() {
        List<String> problems = new ArrayList<>();

        if (!StringUtils.hasText(source)) {
            problems.add("catalog-sync.source is required");
        }
        if (!StringUtils.hasText(target)) {
            problems.add("catalog-sync.target is required");
        }
        if (StringUtils.hasText(source) && StringUtils.hasText(target)
                && source.trim().equalsIgnoreCase(target.trim())) {
            problems.add("catalog-sync.source and catalog-sync.target must be different platforms");
        }
        if (tolerance == null || tolerance.signum() < 0) {
            problems.add("catalog-sync.tolerance must be a non-negative fraction");
        }
        if (priceFloor == null || priceFloor.signum() < 0) {
            problems.add("catalog-sync.price-floor must be non-negative");
        }
        if (perPage <= 0) {
            problems.add("catalog-sync.per-page must be positive, got " + perPage);
        }
        if (maxPages <= 0) {
            problems.add("catalog-sync.max-pages must be positive, got " + maxPages);
        }
        if (updateConcurrency < 1) {
            problems.add("catalog-sync.update-concurrency must be at least 1, got " + updateConcurrency);
        }
        if (commissionPercent == null || commissionPercent.signum() < 0) {
            problems.add("catalog-sync.commission-percent must be non-negative");
        }
        if (priceScale < 0) {
            problems.add("catalog-sync.price-scale must be non-negative, got " + priceScale);
        }
        validatePlatform(source, problems);
        validatePlatform(target, problems);

        if (!problems.isEmpty()) {
            throw new ConfigInvalidException(problems);
        }

        return RunSettings.builder()
                .source(source.trim())
                .target(target.trim())
                .perPage(perPage)
                .maxPages(maxPages)
                .dryRun(dryRun)
                .skipInactive(skipInactive)
                .updateConcurrency(updateConcurrency)
                .preferredLocale(preferredLocale)
                .pricingPolicy(PricingPolicy.builder()
                        .tolerance(tolerance)
                        .priceFloor(priceFloor)
                        .commissionPercent(commissionPercent)
                        .priceScale(priceScale)
                        .build())
                .build();
    }

    // Platforms not declared here may still be provided as CatalogPlatformClient beans.
    private void validatePlatform(String name, List<String> problems) {
        if (!StringUtils.hasText(name)) {
            return;
        }
        Platform platform = platforms.get(name.trim());
        if (platform == null) {
            return;
        }
        String prefix = "catalog-sync.platforms." + name.trim();
        if (platform.getType() == null) {
            problems.add(prefix + ".type is required");
        }
        if (!StringUtils.hasText(platform.getAccountId())) {
            problems.add(prefix + ".account-id is required");
        }
        if (!StringUtils.hasText(platform.getAccessToken())) {
            problems.add(prefix + ".access-token is required");
        }
        if (platform.getRequestInterval() == null || platform.getRequestInterval().isNegative()) {
            problems.add(prefix + ".request-interval must not be negative");
        }
    }
}
