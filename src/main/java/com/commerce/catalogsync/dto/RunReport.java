package com.commerce.catalogsync.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the results of a catalog sync run.
 * Built incrementally by the update executor and emitted once at the end of the run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunReport {

    private String runId;
    private String sourcePlatform;
    private String targetPlatform;
    private boolean dryRun;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int matched = 0;

    /**
     * Updates applied, or in a dry run, updates that would have been applied.
     */
    @Builder.Default
    private int updated = 0;

    @Builder.Default
    private int skippedBelowThreshold = 0;

    @Builder.Default
    private int unmatchedSource = 0;

    @Builder.Default
    private int unmatchedTarget = 0;

    @Builder.Default
    private int failed = 0;

    /**
     * Updates whose result is unknown because the run was interrupted.
     */
    @Builder.Default
    private int unconfirmed = 0;

    @Builder.Default
    private long duplicateSkus = 0;

    @Builder.Default
    private long missingSkus = 0;

    @Builder.Default
    private long invalidPrices = 0;

    @Builder.Default
    private long inactiveSkipped = 0;

    private boolean aborted;

    private String abortReason;

    @Builder.Default
    private List<UpdateFailure> failures = new ArrayList<>();

    /**
     * Individual update failure details.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateFailure {
        private String sku;
        private String productId;
        private BigDecimal attemptedPrice;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void incrementMatched() {
        this.matched++;
    }

    public void incrementUpdated() {
        this.updated++;
    }

    public void incrementSkippedBelowThreshold() {
        this.skippedBelowThreshold++;
    }

    public void incrementUnmatchedSource() {
        this.unmatchedSource++;
    }

    public void incrementUnmatchedTarget() {
        this.unmatchedTarget++;
    }

    public void incrementUnconfirmed() {
        this.unconfirmed++;
    }

    public void addFailure(String sku, String productId, BigDecimal attemptedPrice, String errorMessage) {
        this.failed++;
        if (this.failures == null) {
            this.failures = new ArrayList<>();
        }
        this.failures.add(UpdateFailure.builder()
                .sku(sku)
                .productId(productId)
                .attemptedPrice(attemptedPrice)
                .errorMessage(errorMessage)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    public void abort(String reason) {
        this.aborted = true;
        this.abortReason = reason;
    }

    /**
     * True when the run completed and every planned update is known to have gone through.
     */
    @JsonIgnore
    public boolean isSuccessful() {
        return !aborted && failed == 0 && unconfirmed == 0;
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return java.time.Duration.between(startedAt, completedAt).toMillis();
    }
}
