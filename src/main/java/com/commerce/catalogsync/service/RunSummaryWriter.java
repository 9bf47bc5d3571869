package com.commerce.catalogsync.service;

import com.commerce.catalogsync.dto.RunReport;
import com.commerce.catalogsync.exception.CatalogSyncException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Emits the run report: a human-readable summary in the log and, optionally, a JSON file.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RunSummaryWriter {

    private final ObjectMapper objectMapper;

    public void logSummary(RunReport report) {
        log.info("=".repeat(60));
        log.info("Catalog sync summary {} -> {}{}", report.getSourcePlatform(), report.getTargetPlatform(),
                report.isDryRun() ? " [DRY RUN]" : "");
        if (report.isAborted()) {
            log.error("Run aborted before any update: {}", report.getAbortReason());
        } else {
            log.info("- Matched SKUs: {}", report.getMatched());
            log.info("- {}: {}", report.isDryRun() ? "Would update" : "Updated", report.getUpdated());
            log.info("- Within tolerance: {}", report.getSkippedBelowThreshold());
            log.info("- Only on source: {}", report.getUnmatchedSource());
            log.info("- Only on target: {}", report.getUnmatchedTarget());
            log.info("- Duplicate SKUs: {}, without SKU: {}", report.getDuplicateSkus(), report.getMissingSkus());
            log.info("- Invalid prices: {}, inactive skipped: {}", report.getInvalidPrices(),
                    report.getInactiveSkipped());
            log.info("- Failed: {}", report.getFailed());
            if (report.getUnconfirmed() > 0) {
                log.warn("- Unconfirmed (interrupted): {}", report.getUnconfirmed());
            }
            for (RunReport.UpdateFailure failure : report.getFailures()) {
                log.warn("  SKU {} (item {}) -> {}: {}", failure.getSku(), failure.getProductId(),
                        failure.getAttemptedPrice(), failure.getErrorMessage());
            }
        }
        log.info("Completed in {}ms", report.getDurationMs());
        log.info("=".repeat(60));
    }

    public void writeJson(RunReport report, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writer()
                    .with(SerializationFeature.INDENT_OUTPUT)
                    .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .writeValue(path.toFile(), report);
            log.info("Run report written to {}", path);
        } catch (IOException e) {
            throw new CatalogSyncException("Failed to write run report to " + path, e);
        }
    }
}
