package com.commerce.catalogsync.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of handling one MATCHED_UPDATE decision.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UpdateOutcome {

    Status status;
    String sku;
    String productId;
    BigDecimal attemptedPrice;
    String errorMessage;

    public static UpdateOutcome applied(PriceUpdate update) {
        return new UpdateOutcome(Status.APPLIED, update.getSku(), update.getProductId(),
                update.getNewPrice(), null);
    }

    public static UpdateOutcome simulated(PriceUpdate update) {
        return new UpdateOutcome(Status.SIMULATED, update.getSku(), update.getProductId(),
                update.getNewPrice(), null);
    }

    public static UpdateOutcome unconfirmed(PriceUpdate update) {
        return new UpdateOutcome(Status.UNCONFIRMED, update.getSku(), update.getProductId(),
                update.getNewPrice(), null);
    }

    public static UpdateOutcome failed(PriceUpdate update, String errorMessage) {
        return new UpdateOutcome(Status.FAILED, update.getSku(), update.getProductId(),
                update.getNewPrice(), errorMessage);
    }

    public enum Status {
        APPLIED,
        /** Dry run: the update would have been sent. */
        SIMULATED,
        FAILED,
        /** The run was interrupted before the result of the call was known. */
        UNCONFIRMED
    }
}
