package com.commerce.catalogsync.exception;

/**
 * Thrown when a platform rejects our credentials, or when no credential is configured for it.
 * Never retried.
 */
public class AuthFailedException extends PlatformApiException {

    public AuthFailedException(String message, String platformName) {
        super(message, platformName, 0, false);
    }

    public AuthFailedException(String message, String platformName, int statusCode) {
        super(message, platformName, statusCode, false);
    }
}
