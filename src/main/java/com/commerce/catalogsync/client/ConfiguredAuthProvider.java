package com.commerce.catalogsync.client;

import com.commerce.catalogsync.config.CatalogSyncProperties;
import com.commerce.catalogsync.exception.AuthFailedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads access tokens from {@code catalog-sync.platforms.<name>.access-token}.
 * Token refresh is handled outside this job.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredAuthProvider implements AuthProvider {

    private final CatalogSyncProperties properties;

    @Override
    public String bearerToken(String platformName) {
        CatalogSyncProperties.Platform platform = properties.getPlatforms().get(platformName);
        if (platform == null || !StringUtils.hasText(platform.getAccessToken())) {
            throw new AuthFailedException("No access token configured for platform " + platformName,
                    platformName);
        }
        return platform.getAccessToken().trim();
    }
}
