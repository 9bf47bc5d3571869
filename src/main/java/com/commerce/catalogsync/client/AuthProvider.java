package com.commerce.catalogsync.client;

import com.commerce.catalogsync.exception.AuthFailedException;

/**
 * Supplies bearer credentials for platform API calls.
 */
public interface AuthProvider {

    /**
     * @throws AuthFailedException if no usable credential exists for the platform
     */
    String bearerToken(String platformName) throws AuthFailedException;
}
