package com.commerce.catalogsync.service;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decides what the target price should be and whether a difference is worth an update.
 */
@Value
@Builder(toBuilder = true)
public class PricingPolicy {

    /**
     * Fractional threshold, e.g. 0.01 for 1%.
     */
    BigDecimal tolerance;

    /**
     * Absolute threshold used when the desired price is zero.
     */
    BigDecimal priceFloor;

    @Builder.Default
    BigDecimal commissionPercent = BigDecimal.ZERO;

    @Builder.Default
    int priceScale = 2;

    /**
     * Source price with the marketplace commission removed:
     * {@code source / (1 + commission / 100)}, rounded half-up to the price scale.
     * Without a commission the source price is returned as is.
     */
    public BigDecimal desiredTargetPrice(BigDecimal sourcePrice) {
        if (commissionPercent == null || commissionPercent.signum() == 0) {
            return sourcePrice;
        }
        BigDecimal factor = BigDecimal.ONE.add(commissionPercent.movePointLeft(2));
        return sourcePrice.divide(factor, priceScale, RoundingMode.HALF_UP);
    }

    /**
     * True when {@code |desired - current| / desired} is strictly above the tolerance, or, for a
     * zero desired price, when the absolute difference is strictly above the floor.
     * Compared as {@code |desired - current| > tolerance * desired} so no division is needed.
     */
    public boolean requiresUpdate(BigDecimal desired, BigDecimal current) {
        BigDecimal difference = desired.subtract(current).abs();
        if (desired.signum() == 0) {
            return difference.compareTo(priceFloor) > 0;
        }
        return difference.compareTo(tolerance.multiply(desired)) > 0;
    }
}
