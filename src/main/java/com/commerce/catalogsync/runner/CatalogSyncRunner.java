package com.commerce.catalogsync.runner;

import com.commerce.catalogsync.config.CatalogSyncProperties;
import com.commerce.catalogsync.config.RunSettings;
import com.commerce.catalogsync.dto.RunReport;
import com.commerce.catalogsync.exception.CatalogSyncException;
import com.commerce.catalogsync.exception.ConfigInvalidException;
import com.commerce.catalogsync.service.CatalogSyncOrchestrator;
import com.commerce.catalogsync.service.RunSummaryWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

/**
 * Runs the catalog sync once when the application starts and turns the outcome into the
 * process exit code.
 * <p>
 * Scheduling is left to the caller (cron, a Kubernetes CronJob...). Every invocation is an
 * independent batch.
 * <p>
 * Exit codes:
 * 0 - all planned updates applied (or none needed)
 * 1 - at least one item failed to update
 * 2 - run aborted, a catalog could not be fetched
 * 3 - configuration invalid, nothing was attempted
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogSyncRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ITEM_FAILURES = 1;
    public static final int EXIT_ABORTED = 2;
    public static final int EXIT_CONFIG_INVALID = 3;

    private final CatalogSyncProperties properties;
    private final CatalogSyncOrchestrator orchestrator;
    private final RunSummaryWriter summaryWriter;

    private volatile int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.debug("catalog-sync.run-on-startup is false, not running");
            return;
        }
        exitCode = runOnce();
    }

    /**
     * Validates configuration, runs one sync and reports it.
     *
     * @return the exit code for this run
     */
    public int runOnce() {
        RunSettings settings;
        try {
            settings = properties.toRunSettings();
        } catch (ConfigInvalidException e) {
            log.error("Not starting catalog sync. {}", e.getMessage());
            return EXIT_CONFIG_INVALID;
        }

        RunReport report;
        try {
            report = orchestrator.run(settings);
        } catch (ConfigInvalidException e) {
            log.error("Not starting catalog sync. {}", e.getMessage());
            return EXIT_CONFIG_INVALID;
        } catch (CatalogSyncException e) {
            log.error("Catalog sync could not run: {}", e.getMessage(), e);
            return EXIT_ABORTED;
        }

        summaryWriter.logSummary(report);
        if (StringUtils.hasText(properties.getReportPath())) {
            try {
                summaryWriter.writeJson(report, Path.of(properties.getReportPath()));
            } catch (CatalogSyncException e) {
                log.error("Run finished but the report file could not be written", e);
            }
        }

        // Alert if there are too many errors
        int attempted = report.getUpdated() + report.getFailed();
        if (attempted > 0 && report.getFailed() > attempted * 0.1) {
            log.warn("High failure rate: {} of {} price updates failed", report.getFailed(), attempted);
        }

        return exitCodeFor(report);
    }

    static int exitCodeFor(RunReport report) {
        if (report.isAborted()) {
            return EXIT_ABORTED;
        }
        return report.getFailed() > 0 || report.getUnconfirmed() > 0 ? EXIT_ITEM_FAILURES : EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
