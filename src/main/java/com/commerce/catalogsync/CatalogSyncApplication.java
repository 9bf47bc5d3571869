package com.commerce.catalogsync;

import com.commerce.catalogsync.config.CatalogSyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Catalog Price Sync
 * <p>
 * Batch job that keeps product prices on a target e-commerce platform (e.g., Tienda Nube)
 * consistent with a source platform (e.g., Mercado Libre).
 * <p>
 * Key Features:
 * - Full catalog retrieval across server-side pagination
 * - SKU matching, variant aware
 * - Tolerance-based update planning with an optional commission adjustment
 * - Per-item failure isolation and a dry-run mode
 * <p>
 * The job runs once on startup and exits; the exit code reflects the run outcome.
 */
@SpringBootApplication
@EnableConfigurationProperties(CatalogSyncProperties.class)
public class CatalogSyncApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CatalogSyncApplication.class, args)));
    }
}
