package com.commerce.catalogsync.config;

/**
 * Platform APIs this job can talk to over HTTP.
 */
public enum PlatformType {

    TIENDANUBE("https://api.tiendanube.com/v1"),

    MERCADOLIBRE("https://api.mercadolibre.com");

    private final String defaultBaseUrl;

    PlatformType(String defaultBaseUrl) {
        this.defaultBaseUrl = defaultBaseUrl;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }
}
