package com.commerce.catalogsync.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Non-fatal problem found while indexing a catalog.
 */
@Value
@Builder
public class IndexDiagnostic {

    Type type;
    String platformName;
    String sku;
    String nativeId;
    String message;

    public enum Type {
        /**
         * SKU already seen earlier in the same catalog. The later record is discarded.
         */
        DUPLICATE_SKU,

        /**
         * Record (or variant) without a SKU. It cannot be matched and is not indexed.
         */
        MISSING_SKU,

        /**
         * Record without a price, or with a negative one. Not indexed.
         */
        INVALID_PRICE,

        /**
         * Inactive listing skipped on request.
         */
        INACTIVE_SKIPPED
    }
}
