package com.commerce.catalogsync.service;

import com.commerce.catalogsync.client.CatalogPlatformClient;
import com.commerce.catalogsync.dto.PriceUpdate;
import com.commerce.catalogsync.dto.ReconciliationDecision;
import com.commerce.catalogsync.dto.RunReport;
import com.commerce.catalogsync.dto.UpdateOutcome;
import com.commerce.catalogsync.exception.UpdateFailedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Applies planned price changes to the target platform.
 * <p>
 * Each update is isolated: a failing item is recorded in the report and the next one is
 * processed, so one bad product never aborts a catalog of thousands.
 * In a dry run no update call is made, but the report carries the same counts a real run would.
 */
@Component
@Slf4j
public class UpdateExecutor {

    private final MeterRegistry meterRegistry;

    private Counter appliedCounter;
    private Counter simulatedCounter;
    private Counter failedCounter;

    public UpdateExecutor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        appliedCounter = Counter.builder("catalog.sync.updates.applied")
                .description("Price updates accepted by the target platform")
                .register(meterRegistry);

        simulatedCounter = Counter.builder("catalog.sync.updates.simulated")
                .description("Price updates skipped because of dry run")
                .register(meterRegistry);

        failedCounter = Counter.builder("catalog.sync.updates.failed")
                .description("Price updates rejected by the target platform")
                .register(meterRegistry);
    }

    public RunReport execute(List<ReconciliationDecision> decisions, CatalogPlatformClient targetClient,
                             boolean dryRun) {
        return execute(decisions, targetClient, dryRun, 1);
    }

    /**
     * @param concurrency maximum number of update calls in flight; 1 means sequential
     */
    public RunReport execute(List<ReconciliationDecision> decisions, CatalogPlatformClient targetClient,
                             boolean dryRun, int concurrency) {
        RunReport report = RunReport.builder()
                .targetPlatform(targetClient.getPlatformName())
                .dryRun(dryRun)
                .build();

        List<PriceUpdate> updates = new ArrayList<>();
        for (ReconciliationDecision decision : decisions) {
            switch (decision.getType()) {
                case MATCHED_NOOP -> {
                    report.incrementMatched();
                    report.incrementSkippedBelowThreshold();
                }
                case MATCHED_UPDATE -> {
                    report.incrementMatched();
                    updates.add(decision.toPriceUpdate());
                }
                case SOURCE_ONLY -> report.incrementUnmatchedSource();
                case TARGET_ONLY -> report.incrementUnmatchedTarget();
            }
        }

        List<UpdateOutcome> outcomes;
        if (dryRun) {
            outcomes = simulate(updates);
        } else if (concurrency <= 1 || updates.size() <= 1) {
            outcomes = applySequentially(updates, targetClient);
        } else {
            outcomes = applyConcurrently(updates, targetClient, concurrency);
        }

        // Folded in decision order, whatever order the calls completed in
        for (UpdateOutcome outcome : outcomes) {
            record(outcome, report);
        }

        log.info("{} {} price updates on {}: {} succeeded, {} failed, {} unconfirmed",
                dryRun ? "Simulated" : "Applied", updates.size(), targetClient.getPlatformName(),
                report.getUpdated(), report.getFailed(), report.getUnconfirmed());
        return report;
    }

    private List<UpdateOutcome> simulate(List<PriceUpdate> updates) {
        List<UpdateOutcome> outcomes = new ArrayList<>(updates.size());
        for (PriceUpdate update : updates) {
            log.info("[DRY RUN] Would update SKU {} (item {}) from {} to {}",
                    update.getSku(), update.getProductId(), update.getCurrentPrice(), update.getNewPrice());
            outcomes.add(UpdateOutcome.simulated(update));
        }
        return outcomes;
    }

    private List<UpdateOutcome> applySequentially(List<PriceUpdate> updates, CatalogPlatformClient targetClient) {
        List<UpdateOutcome> outcomes = new ArrayList<>(updates.size());
        for (PriceUpdate update : updates) {
            outcomes.add(applyUpdate(update, targetClient));
        }
        return outcomes;
    }

    private List<UpdateOutcome> applyConcurrently(List<PriceUpdate> updates, CatalogPlatformClient targetClient,
                                                  int concurrency) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, updates.size()));
        try {
            List<Future<UpdateOutcome>> futures = new ArrayList<>(updates.size());
            for (PriceUpdate update : updates) {
                futures.add(pool.submit(() -> applyUpdate(update, targetClient)));
            }

            List<UpdateOutcome> outcomes = new ArrayList<>(updates.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(awaitOutcome(futures.get(i), updates.get(i)));
                } catch (InterruptedException e) {
                    collectAfterInterrupt(futures, updates, i, outcomes, pool);
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            return outcomes;
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Keeps the results that are already known and marks every other update UNCONFIRMED.
     * The done flags are read before the pool is stopped, so a call cancelled by
     * {@code shutdownNow} is never reported as a failure of the platform.
     */
    private void collectAfterInterrupt(List<Future<UpdateOutcome>> futures, List<PriceUpdate> updates, int from,
                                       List<UpdateOutcome> outcomes, ExecutorService pool) {
        boolean[] done = new boolean[futures.size()];
        for (int i = from; i < futures.size(); i++) {
            done[i] = futures.get(i).isDone();
        }
        pool.shutdownNow();

        int unconfirmed = 0;
        for (int i = from; i < futures.size(); i++) {
            if (done[i]) {
                outcomes.add(resultOf(futures.get(i), updates.get(i)));
            } else {
                outcomes.add(UpdateOutcome.unconfirmed(updates.get(i)));
                unconfirmed++;
            }
        }
        log.warn("Interrupted while applying price updates: {} of {} results unknown",
                unconfirmed, updates.size());
    }

    private UpdateOutcome awaitOutcome(Future<UpdateOutcome> future, PriceUpdate update)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            return unexpectedFailure(update, e.getCause());
        }
    }

    // Only called for completed futures, so get() does not block
    private UpdateOutcome resultOf(Future<UpdateOutcome> future, PriceUpdate update) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            return unexpectedFailure(update, e.getCause());
        } catch (InterruptedException e) {
            return unexpectedFailure(update, e);
        }
    }

    private UpdateOutcome unexpectedFailure(PriceUpdate update, Throwable cause) {
        log.error("Unexpected error updating SKU {}", update.getSku(), cause);
        return UpdateOutcome.failed(update, "Unexpected error: " + cause.getMessage());
    }

    /**
     * Single update call. Never throws: failures become a FAILED outcome.
     */
    private UpdateOutcome applyUpdate(PriceUpdate update, CatalogPlatformClient targetClient) {
        try {
            targetClient.updatePrice(update);
            log.info("Updated SKU {} (item {}) on {} from {} to {}", update.getSku(), update.getProductId(),
                    targetClient.getPlatformName(), update.getCurrentPrice(), update.getNewPrice());
            return UpdateOutcome.applied(update);
        } catch (UpdateFailedException e) {
            log.warn("Price update failed for SKU {} (item {}): {}",
                    update.getSku(), update.getProductId(), e.getMessage());
            return UpdateOutcome.failed(update, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error updating SKU {} (item {}): {}",
                    update.getSku(), update.getProductId(), e.getMessage(), e);
            return UpdateOutcome.failed(update, "Unexpected error: " + e.getMessage());
        }
    }

    private void record(UpdateOutcome outcome, RunReport report) {
        switch (outcome.getStatus()) {
            case APPLIED -> {
                report.incrementUpdated();
                appliedCounter.increment();
            }
            case SIMULATED -> {
                report.incrementUpdated();
                simulatedCounter.increment();
            }
            case FAILED -> {
                report.addFailure(outcome.getSku(), outcome.getProductId(), outcome.getAttemptedPrice(),
                        outcome.getErrorMessage());
                failedCounter.increment();
            }
            case UNCONFIRMED -> report.incrementUnconfirmed();
        }
    }
}
