package com.commerce.catalogsync.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A purchasable variant of a product (size, color...) with its own SKU and price.
 */
@Value
@Builder
public class ProductVariant {
    String nativeId;
    String sku;
    BigDecimal price;
}
