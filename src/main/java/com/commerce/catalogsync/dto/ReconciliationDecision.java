package com.commerce.catalogsync.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Planner output for one SKU. Lives for a single run and is never persisted.
 */
@Value
@Builder
public class ReconciliationDecision {

    DecisionType type;

    String sku;

    /** Null for TARGET_ONLY. */
    CatalogItem sourceItem;

    /** Null for SOURCE_ONLY. */
    CatalogItem targetItem;

    BigDecimal sourcePrice;

    BigDecimal targetPrice;

    /**
     * Price the target should carry, i.e. the source price after the pricing policy.
     * Null unless the SKU is matched.
     */
    BigDecimal desiredPrice;

    /**
     * desiredPrice - targetPrice. Null unless the SKU is matched.
     */
    BigDecimal delta;

    public PriceUpdate toPriceUpdate() {
        if (type != DecisionType.MATCHED_UPDATE) {
            throw new IllegalStateException("No price update for " + type + " decision on SKU " + sku);
        }
        return PriceUpdate.builder()
                .sku(sku)
                .productId(targetItem.getProductId())
                .variantId(targetItem.getVariantId())
                .currentPrice(targetPrice)
                .newPrice(desiredPrice)
                .build();
    }
}
