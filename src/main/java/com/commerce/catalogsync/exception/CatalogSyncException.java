package com.commerce.catalogsync.exception;

/**
 * Base exception for catalog sync errors.
 */
public class CatalogSyncException extends RuntimeException {

    public CatalogSyncException(String message) {
        super(message);
    }

    public CatalogSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
