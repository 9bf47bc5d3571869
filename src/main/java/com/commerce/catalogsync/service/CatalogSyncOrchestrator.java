package com.commerce.catalogsync.service;

import com.commerce.catalogsync.client.CatalogPlatformClient;
import com.commerce.catalogsync.client.CatalogPlatformRegistry;
import com.commerce.catalogsync.config.RunSettings;
import com.commerce.catalogsync.dto.CatalogIndex;
import com.commerce.catalogsync.dto.IndexDiagnostic;
import com.commerce.catalogsync.dto.ReconciliationDecision;
import com.commerce.catalogsync.dto.RunReport;
import com.commerce.catalogsync.exception.CatalogSyncException;
import com.commerce.catalogsync.exception.FetchFailedException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one catalog sync: fetch and index the source, fetch and index the target, plan, execute.
 * <p>
 * Key Design Decisions:
 * 1. Completeness: a fetch failure on either platform aborts the run before any update
 * 2. Authority: the configured source platform always wins
 * 3. Resilience: individual update failures are reported, not fatal
 * 4. Statelessness: nothing is kept between runs
 */
@Service
@Slf4j
public class CatalogSyncOrchestrator {

    static final String RUN_ID_KEY = "runId";

    private final CatalogPlatformRegistry platformRegistry;
    private final CatalogFetcher catalogFetcher;
    private final CatalogIndexBuilder indexBuilder;
    private final ReconciliationPlanner planner;
    private final UpdateExecutor updateExecutor;
    private final MeterRegistry meterRegistry;

    private Timer runTimer;

    // Prevents concurrent runs
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public CatalogSyncOrchestrator(CatalogPlatformRegistry platformRegistry,
                                   CatalogFetcher catalogFetcher,
                                   CatalogIndexBuilder indexBuilder,
                                   ReconciliationPlanner planner,
                                   UpdateExecutor updateExecutor,
                                   MeterRegistry meterRegistry) {
        this.platformRegistry = platformRegistry;
        this.catalogFetcher = catalogFetcher;
        this.indexBuilder = indexBuilder;
        this.planner = planner;
        this.updateExecutor = updateExecutor;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        runTimer = Timer.builder("catalog.sync.run.duration")
                .description("Time taken to complete a catalog sync run")
                .register(meterRegistry);
    }

    /**
     * Main entry point.
     *
     * @return the run report; {@link RunReport#isAborted()} is set when a catalog could not be fetched
     * @throws CatalogSyncException if a run is already in progress or a platform cannot be resolved
     */
    public RunReport run(RunSettings settings) {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Catalog sync already in progress, skipping this run");
            throw new CatalogSyncException("Catalog sync already in progress");
        }

        String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID_KEY, runId);
        try {
            return runTimer.record(() -> execute(runId, settings));
        } finally {
            MDC.remove(RUN_ID_KEY);
            isRunning.set(false);
        }
    }

    private RunReport execute(String runId, RunSettings settings) {
        LocalDateTime startedAt = LocalDateTime.now();
        log.info("Starting catalog sync {} -> {}{}", settings.getSource(), settings.getTarget(),
                settings.isDryRun() ? " (DRY RUN, no changes will be made)" : "");

        CatalogPlatformClient source = platformRegistry.resolve(settings.getSource());
        CatalogPlatformClient target = platformRegistry.resolve(settings.getTarget());

        CatalogIndex sourceIndex;
        CatalogIndex targetIndex;
        try {
            sourceIndex = fetchAndIndex(source, settings);
            targetIndex = fetchAndIndex(target, settings);
        } catch (FetchFailedException e) {
            log.error("Aborting catalog sync before any update: {}", e.getMessage(), e);
            RunReport report = RunReport.builder().dryRun(settings.isDryRun()).build();
            report.abort(e.getMessage());
            return finish(report, runId, settings, startedAt);
        }

        List<ReconciliationDecision> decisions = planner.plan(sourceIndex, targetIndex, settings.getPricingPolicy());
        RunReport report = updateExecutor.execute(decisions, target, settings.isDryRun(),
                settings.getUpdateConcurrency());
        report.setDuplicateSkus(sourceIndex.countDiagnostics(IndexDiagnostic.Type.DUPLICATE_SKU)
                + targetIndex.countDiagnostics(IndexDiagnostic.Type.DUPLICATE_SKU));
        report.setMissingSkus(sourceIndex.countDiagnostics(IndexDiagnostic.Type.MISSING_SKU)
                + targetIndex.countDiagnostics(IndexDiagnostic.Type.MISSING_SKU));
        report.setInvalidPrices(sourceIndex.countDiagnostics(IndexDiagnostic.Type.INVALID_PRICE)
                + targetIndex.countDiagnostics(IndexDiagnostic.Type.INVALID_PRICE));
        report.setInactiveSkipped(sourceIndex.countDiagnostics(IndexDiagnostic.Type.INACTIVE_SKIPPED)
                + targetIndex.countDiagnostics(IndexDiagnostic.Type.INACTIVE_SKIPPED));
        return finish(report, runId, settings, startedAt);
    }

    // Sequential by construction: the target is only fetched once the source index is complete
    private CatalogIndex fetchAndIndex(CatalogPlatformClient client, RunSettings settings) {
        PagedCatalog catalog = catalogFetcher.fetchCatalog(client, settings.getPerPage(), settings.getMaxPages());
        return indexBuilder.build(client.getPlatformName(), catalog, settings.isSkipInactive(),
                settings.getPreferredLocale());
    }

    private RunReport finish(RunReport report, String runId, RunSettings settings, LocalDateTime startedAt) {
        report.setRunId(runId);
        report.setSourcePlatform(settings.getSource());
        report.setTargetPlatform(settings.getTarget());
        report.setStartedAt(startedAt);
        report.setCompletedAt(LocalDateTime.now());
        return report;
    }
}
