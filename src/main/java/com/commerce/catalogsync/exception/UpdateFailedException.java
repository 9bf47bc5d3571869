package com.commerce.catalogsync.exception;

/**
 * Thrown by a platform client when a single price update could not be applied.
 */
public class UpdateFailedException extends CatalogSyncException {

    private final String platformName;
    private final String sku;

    public UpdateFailedException(String message, String platformName, String sku, Throwable cause) {
        super(message, cause);
        this.platformName = platformName;
        this.sku = sku;
    }

    public String getPlatformName() {
        return platformName;
    }

    public String getSku() {
        return sku;
    }
}
