package com.commerce.catalogsync.exception;

/**
 * Thrown when a complete catalog could not be retrieved from a platform.
 * Fatal to the run: no update is ever attempted against a partially fetched catalog.
 */
public class FetchFailedException extends CatalogSyncException {

    private final String platformName;
    private final int page;

    public FetchFailedException(String message, String platformName, int page) {
        super(message);
        this.platformName = platformName;
        this.page = page;
    }

    public FetchFailedException(String message, String platformName, int page, Throwable cause) {
        super(message, cause);
        this.platformName = platformName;
        this.page = page;
    }

    public String getPlatformName() {
        return platformName;
    }

    public int getPage() {
        return page;
    }
}
