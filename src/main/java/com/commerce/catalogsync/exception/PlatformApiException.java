package com.commerce.catalogsync.exception;

/**
 * Thrown when a call to a platform API fails.
 * This could be due to network issues, timeouts, an error status or an unexpected payload.
 */
public class PlatformApiException extends CatalogSyncException {

    private final String platformName;
    private final int statusCode;
    private final boolean isRetryable;

    public PlatformApiException(String message, String platformName, int statusCode,
                                boolean isRetryable) {
        super(message);
        this.platformName = platformName;
        this.statusCode = statusCode;
        this.isRetryable = isRetryable;
    }

    public PlatformApiException(String message, String platformName, Throwable cause) {
        super(message, cause);
        this.platformName = platformName;
        this.statusCode = 0;
        this.isRetryable = true;
    }

    public PlatformApiException(String message, String platformName, Throwable cause,
                                boolean isRetryable) {
        super(message, cause);
        this.platformName = platformName;
        this.statusCode = 0;
        this.isRetryable = isRetryable;
    }

    public String getPlatformName() {
        return platformName;
    }

    /**
     * HTTP status returned by the platform, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Indicates if this error is transient and the call can be retried.
     * Non-retryable errors include: client errors (4xx other than 429), authentication failures,
     * malformed responses.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
