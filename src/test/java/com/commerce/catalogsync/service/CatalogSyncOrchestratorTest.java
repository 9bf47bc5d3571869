package com.commerce.catalogsync.service;

import com.commerce.catalogsync.client.CatalogPlatformRegistry;
import com.commerce.catalogsync.config.RunSettings;
import com.commerce.catalogsync.dto.ProductRecord;
import com.commerce.catalogsync.dto.RunReport;
import com.commerce.catalogsync.exception.CatalogSyncException;
import com.commerce.catalogsync.exception.ConfigInvalidException;
import com.commerce.catalogsync.support.InMemoryCatalogClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * Tests the full fetch, index, plan and execute sequence against in-memory platforms.
 */
@ExtendWith(MockitoExtension.class)
class CatalogSyncOrchestratorTest {

    @Mock
    private CatalogPlatformRegistry platformRegistry;

    private InMemoryCatalogClient source;
    private InMemoryCatalogClient target;
    private SimpleMeterRegistry meterRegistry;
    private CatalogSyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        source = new InMemoryCatalogClient("mercadolibre");
        target = new InMemoryCatalogClient("tiendanube");
        meterRegistry = new SimpleMeterRegistry();

        UpdateExecutor updateExecutor = new UpdateExecutor(meterRegistry);
        updateExecutor.initMetrics();
        orchestrator = new CatalogSyncOrchestrator(platformRegistry, new CatalogFetcher(),
                new CatalogIndexBuilder(), new ReconciliationPlanner(), updateExecutor, meterRegistry);
        orchestrator.initMetrics();
    }

    @Nested
    @DisplayName("Successful runs")
    class SuccessfulRunTests {

        @Test
        @DisplayName("Should push out-of-tolerance source prices to the target")
        void shouldReconcilePrices() {
            // Given
            registerPlatforms();
            source.addProduct("MLA1", "A-1", "100.00")
                    .addProduct("MLA2", "A-2", "50.00")
                    .addProduct("MLA3", "ONLY-ML", "10.00")
                    .addProduct("MLA4", "DUP", "10.00")
                    .addProduct("MLA5", "dup", "11.00");
            target.addProduct("1", "a-1", "120.00")
                    .addProduct("2", " A-2", "50.40")
                    .addProduct("3", "ONLY-TN", "5.00")
                    .addProduct("4", null, "5.00");

            // When
            RunReport report = orchestrator.run(settings(false));

            // Then
            assertThat(report.isAborted()).isFalse();
            assertThat(report.getRunId()).isNotBlank();
            assertThat(report.getSourcePlatform()).isEqualTo("mercadolibre");
            assertThat(report.getTargetPlatform()).isEqualTo("tiendanube");
            assertThat(report.getMatched()).isEqualTo(2);
            assertThat(report.getUpdated()).isEqualTo(1);
            assertThat(report.getSkippedBelowThreshold()).isEqualTo(1);
            assertThat(report.getUnmatchedSource()).isEqualTo(2);
            assertThat(report.getUnmatchedTarget()).isEqualTo(1);
            assertThat(report.getDuplicateSkus()).isEqualTo(1);
            assertThat(report.getMissingSkus()).isEqualTo(1);
            assertThat(report.getCompletedAt()).isAfterOrEqualTo(report.getStartedAt());

            assertThat(target.priceOf("1")).isEqualByComparingTo("100.00");
            assertThat(target.priceOf("2")).isEqualByComparingTo("50.40");
            assertThat(source.getUpdateCalls()).isZero();
            assertThat(meterRegistry.get("catalog.sync.run.duration").timer().count()).isEqualTo(1);
            assertThat(MDC.get("runId")).isNull();
        }

        @Test
        @DisplayName("Should count listings left out for invalid prices or inactivity")
        void shouldCountExcludedListings() {
            // Given
            registerPlatforms();
            source.addProduct("MLA1", "A-1", "100.00")
                    .addProduct("MLA2", "NEG", "-5.00")
                    .addProduct(ProductRecord.builder()
                            .nativeId("MLA3")
                            .sku("PAUSED")
                            .price(new BigDecimal("30.00"))
                            .active(false)
                            .build());
            target.addProduct("1", "A-1", "100.00")
                    .addProduct("2", "BROKEN", "-1.00");

            // When
            RunReport report = orchestrator.run(settings(false));

            // Then
            assertThat(report.getInvalidPrices()).isEqualTo(2);
            assertThat(report.getInactiveSkipped()).isEqualTo(1);
            assertThat(report.getMatched()).isEqualTo(1);
            assertThat(report.getUnmatchedSource()).isZero();
            assertThat(report.getUnmatchedTarget()).isZero();
            assertThat(target.getUpdateCalls()).isZero();
        }

        @Test
        @DisplayName("Should leave the target untouched in a dry run")
        void shouldNotWriteInDryRun() {
            // Given
            registerPlatforms();
            source.addProduct("MLA1", "A-1", "100.00");
            target.addProduct("1", "A-1", "80.00");

            // When
            RunReport report = orchestrator.run(settings(true));

            // Then
            assertThat(report.isDryRun()).isTrue();
            assertThat(report.getUpdated()).isEqualTo(1);
            assertThat(target.getUpdateCalls()).isZero();
            assertThat(target.priceOf("1")).isEqualByComparingTo("80.00");
        }
    }

    @Nested
    @DisplayName("Aborted runs")
    class AbortedRunTests {

        @Test
        @DisplayName("Should abort without updates when the source catalog cannot be fetched")
        void shouldAbortOnSourceFetchFailure() {
            // Given
            registerPlatforms();
            source.addProduct("MLA1", "A-1", "100.00").addProduct("MLA2", "A-2", "100.00");
            target.addProduct("1", "A-1", "80.00");
            source.failOnPage(2);

            // When
            RunReport report = orchestrator.run(settings(false).toBuilder().perPage(1).build());

            // Then
            assertThat(report.isAborted()).isTrue();
            assertThat(report.getAbortReason()).contains("page 2");
            assertThat(report.getUpdated()).isZero();
            assertThat(target.getFetchCalls()).isZero();
            assertThat(target.getUpdateCalls()).isZero();
        }

        @Test
        @DisplayName("Should abort without updates when the target catalog cannot be fetched")
        void shouldAbortOnTargetFetchFailure() {
            // Given
            registerPlatforms();
            source.addProduct("MLA1", "A-1", "100.00");
            target.addProduct("1", "A-1", "80.00");
            target.failOnPage(1);

            // When
            RunReport report = orchestrator.run(settings(false));

            // Then
            assertThat(report.isAborted()).isTrue();
            assertThat(report.getSourcePlatform()).isEqualTo("mercadolibre");
            assertThat(target.getUpdateCalls()).isZero();
            assertThat(target.priceOf("1")).isEqualByComparingTo("80.00");
        }

        @Test
        @DisplayName("Should propagate unknown platforms as configuration errors")
        void shouldPropagateUnknownPlatform() {
            // Given
            when(platformRegistry.resolve("mercadolibre"))
                    .thenThrow(new ConfigInvalidException("Unknown platform 'mercadolibre'"));

            // When / Then
            assertThatThrownBy(() -> orchestrator.run(settings(false)))
                    .isInstanceOf(ConfigInvalidException.class);
        }
    }

    @Nested
    @DisplayName("Concurrency guard")
    class ConcurrencyGuardTests {

        @Test
        @DisplayName("Should refuse a second run while one is in progress")
        void shouldRejectConcurrentRun() throws Exception {
            // Given
            CountDownLatch fetching = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            InMemoryCatalogClient slowSource = new InMemoryCatalogClient("mercadolibre") {
                @Override
                public List<ProductRecord> fetchPage(int page, int perPage) {
                    fetching.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return super.fetchPage(page, perPage);
                }
            };
            when(platformRegistry.resolve("mercadolibre")).thenReturn(slowSource);
            when(platformRegistry.resolve("tiendanube")).thenReturn(target);

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<RunReport> first = executor.submit(() -> orchestrator.run(settings(false)));
                assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();

                // When / Then
                assertThatThrownBy(() -> orchestrator.run(settings(false)))
                        .isInstanceOf(CatalogSyncException.class)
                        .hasMessageContaining("already in progress");

                release.countDown();
                assertThat(first.get(5, TimeUnit.SECONDS).isAborted()).isFalse();
            } finally {
                executor.shutdownNow();
            }

            // And a later run is allowed again
            assertThat(orchestrator.run(settings(true)).isAborted()).isFalse();
        }
    }

    private void registerPlatforms() {
        when(platformRegistry.resolve("mercadolibre")).thenReturn(source);
        when(platformRegistry.resolve("tiendanube")).thenReturn(target);
    }

    private static RunSettings settings(boolean dryRun) {
        return RunSettings.builder()
                .source("mercadolibre")
                .target("tiendanube")
                .perPage(2)
                .maxPages(100)
                .dryRun(dryRun)
                .skipInactive(true)
                .updateConcurrency(1)
                .preferredLocale("es")
                .pricingPolicy(PricingPolicy.builder()
                        .tolerance(new BigDecimal("0.01"))
                        .priceFloor(new BigDecimal("0.01"))
                        .build())
                .build();
    }
}
