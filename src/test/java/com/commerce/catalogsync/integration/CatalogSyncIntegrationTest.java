package com.commerce.catalogsync.integration;

import com.commerce.catalogsync.config.CatalogSyncProperties;
import com.commerce.catalogsync.dto.ProductRecord;
import com.commerce.catalogsync.dto.ProductVariant;
import com.commerce.catalogsync.runner.CatalogSyncRunner;
import com.commerce.catalogsync.support.InMemoryCatalogClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the catalog sync job.
 *
 * These tests run the full Spring context with two in-memory platforms
 * registered as client beans in place of the HTTP clients.
 */
@SpringBootTest
@ActiveProfiles("test")
class CatalogSyncIntegrationTest {

    @TestConfiguration
    static class InMemoryPlatforms {

        @Bean
        InMemoryCatalogClient memorySource() {
            return new InMemoryCatalogClient("memory-source");
        }

        @Bean
        InMemoryCatalogClient memoryTarget() {
            return new InMemoryCatalogClient("memory-target");
        }
    }

    @Autowired
    private CatalogSyncRunner runner;

    @Autowired
    private CatalogSyncProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    @Qualifier("memorySource")
    private InMemoryCatalogClient source;

    @Autowired
    @Qualifier("memoryTarget")
    private InMemoryCatalogClient target;

    @BeforeEach
    void setUp() {
        source.reset();
        target.reset();

        source.addProduct("MLA1", "ZAP-42", "25999.90")
                .addProduct("MLA2", "MED-1", "1200.00")
                .addProduct("MLA3", "REM-S", "1500.00")
                .addProduct("MLA4", "GORRA", "3000.00");
        target.addProduct("10", "zap-42", "20000.00")
                .addProduct("11", "MED-1 ", "1205.00")
                .addProduct(ProductRecord.builder()
                        .nativeId("12")
                        .name("es", "Remera")
                        .variant(ProductVariant.builder().nativeId("121").sku("REM-S").price(new BigDecimal("1400.00")).build())
                        .variant(ProductVariant.builder().nativeId("122").sku("REM-M").price(new BigDecimal("1400.00")).build())
                        .build());
    }

    @AfterEach
    void tearDown() {
        properties.setDryRun(false);
        properties.setReportPath(null);
    }

    @Test
    @DisplayName("Full sync - pushes source prices to matched target products and variants")
    void fullSyncFlow() {
        // When
        int exitCode = runner.runOnce();

        // Then
        assertThat(exitCode).isEqualTo(CatalogSyncRunner.EXIT_OK);
        assertThat(target.priceOf("10")).isEqualByComparingTo("25999.90");
        assertThat(target.priceOf("11")).isEqualByComparingTo("1205.00");
        assertThat(target.variantPriceOf("12", "121")).isEqualByComparingTo("1500.00");
        assertThat(target.variantPriceOf("12", "122")).isEqualByComparingTo("1400.00");
        assertThat(target.getAppliedUpdates()).hasSize(2);
        assertThat(source.getUpdateCalls()).isZero();
    }

    @Test
    @DisplayName("Second run is a no-op once the first one has converged")
    void rerunIsIdempotent() {
        // Given
        assertThat(runner.runOnce()).isEqualTo(CatalogSyncRunner.EXIT_OK);
        int updatesAfterFirstRun = target.getUpdateCalls();

        // When
        int exitCode = runner.runOnce();

        // Then
        assertThat(exitCode).isEqualTo(CatalogSyncRunner.EXIT_OK);
        assertThat(target.getUpdateCalls()).isEqualTo(updatesAfterFirstRun);
    }

    @Test
    @DisplayName("Dry run - reports planned updates without changing the target")
    void dryRunLeavesTargetUntouched(@TempDir Path tempDir) throws Exception {
        // Given
        Path reportFile = tempDir.resolve("run-report.json");
        properties.setDryRun(true);
        properties.setReportPath(reportFile.toString());

        // When
        int exitCode = runner.runOnce();

        // Then
        assertThat(exitCode).isEqualTo(CatalogSyncRunner.EXIT_OK);
        assertThat(target.getUpdateCalls()).isZero();
        assertThat(target.priceOf("10")).isEqualByComparingTo("20000.00");

        JsonNode report = objectMapper.readTree(reportFile.toFile());
        assertThat(report.path("dryRun").asBoolean()).isTrue();
        assertThat(report.path("matched").asInt()).isEqualTo(3);
        assertThat(report.path("updated").asInt()).isEqualTo(2);
        assertThat(report.path("unmatchedSource").asInt()).isEqualTo(1);
        assertThat(report.path("unmatchedTarget").asInt()).isEqualTo(1);
        assertThat(report.path("sourcePlatform").asText()).isEqualTo("memory-source");
    }

    @Test
    @DisplayName("Item failure - other items are still updated and the exit code is 1")
    void itemFailureIsIsolated() {
        // Given
        target.failUpdatesFor("zap-42");

        // When
        int exitCode = runner.runOnce();

        // Then
        assertThat(exitCode).isEqualTo(CatalogSyncRunner.EXIT_ITEM_FAILURES);
        assertThat(target.priceOf("10")).isEqualByComparingTo("20000.00");
        assertThat(target.variantPriceOf("12", "121")).isEqualByComparingTo("1500.00");
    }

    @Test
    @DisplayName("Fetch failure - run aborts before any update and the exit code is 2")
    void fetchFailureAbortsRun() {
        // Given
        target.failOnPage(2);

        // When
        int exitCode = runner.runOnce();

        // Then
        assertThat(exitCode).isEqualTo(CatalogSyncRunner.EXIT_ABORTED);
        assertThat(target.getUpdateCalls()).isZero();
        assertThat(target.priceOf("10")).isEqualByComparingTo("20000.00");
    }
}
