package com.commerce.catalogsync.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One price change to push to the target platform.
 */
@Value
@Builder
public class PriceUpdate {
    String sku;
    String productId;
    String variantId;
    BigDecimal currentPrice;
    BigDecimal newPrice;

    public boolean isVariantUpdate() {
        return variantId != null;
    }
}
