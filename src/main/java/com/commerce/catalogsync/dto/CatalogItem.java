package com.commerce.catalogsync.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One indexable unit of a catalog: either a product without variants or a single variant.
 */
@Value
@Builder
public class CatalogItem {

    /** Normalized SKU (trimmed, lower case). */
    String sku;

    String productId;

    /** Null when the item is the product itself. */
    String variantId;

    String displayName;

    BigDecimal price;

    public boolean isVariant() {
        return variantId != null;
    }
}
