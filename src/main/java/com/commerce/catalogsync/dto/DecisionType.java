package com.commerce.catalogsync.dto;

/**
 * What the planner decided for one SKU.
 */
public enum DecisionType {

    /**
     * Present on both platforms, price difference within tolerance.
     */
    MATCHED_NOOP,

    /**
     * Present on both platforms, target price must be set to the source price.
     */
    MATCHED_UPDATE,

    /**
     * Only the source platform lists this SKU.
     */
    SOURCE_ONLY,

    /**
     * Only the target platform lists this SKU.
     */
    TARGET_ONLY
}
