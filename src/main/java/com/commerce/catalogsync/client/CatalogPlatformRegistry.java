package com.commerce.catalogsync.client;

import com.commerce.catalogsync.config.CatalogSyncProperties;
import com.commerce.catalogsync.exception.ConfigInvalidException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves a configured platform name to a {@link CatalogPlatformClient}.
 * <p>
 * {@link CatalogPlatformClient} beans in the context win; otherwise an HTTP client is built from
 * {@code catalog-sync.platforms.<name>}. Clients are built per call, so no connection or
 * throttling state survives from one run to the next.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogPlatformRegistry {

    private final CatalogSyncProperties properties;
    private final ObjectProvider<CatalogPlatformClient> clientBeans;
    private final AuthProvider authProvider;
    private final ObjectMapper objectMapper;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryTemplate fetchRetryTemplate;

    /**
     * @throws ConfigInvalidException if nothing is registered or configured under this name
     */
    public CatalogPlatformClient resolve(String platformName) {
        Optional<CatalogPlatformClient> bean = clientBeans.orderedStream()
                .filter(client -> client.getPlatformName().equalsIgnoreCase(platformName))
                .findFirst();
        if (bean.isPresent()) {
            log.debug("Using registered client bean for platform {}", platformName);
            return bean.get();
        }

        CatalogSyncProperties.Platform config = properties.getPlatforms().get(platformName);
        if (config == null) {
            throw new ConfigInvalidException("Unknown platform '" + platformName
                    + "': no client registered and no catalog-sync.platforms." + platformName + " entry");
        }
        if (config.getType() == null || config.getAccountId() == null) {
            throw new ConfigInvalidException("catalog-sync.platforms." + platformName
                    + " needs both type and account-id");
        }
        return createClient(platformName, config);
    }

    private CatalogPlatformClient createClient(String platformName, CatalogSyncProperties.Platform config) {
        PlatformHttpClient http = PlatformHttpClient.create(platformName, objectMapper,
                config.getConnectTimeout(), config.getRequestTimeout());
        PlatformCallGuard guard = new PlatformCallGuard(
                PlatformCallGuard.rateLimiter(platformName, config.getRequestInterval()),
                fetchRetryTemplate,
                circuitBreakerRegistry.circuitBreaker(platformName + "-updates"));
        String baseUrl = config.resolveBaseUrl();
        String accountId = config.getAccountId().trim();

        log.info("Connecting to {} ({}) at {}", platformName, config.getType(), baseUrl);
        return switch (config.getType()) {
            case TIENDANUBE -> new TiendaNubeClient(platformName, baseUrl, accountId,
                    config.getUserAgent(), http, authProvider, guard);
            case MERCADOLIBRE -> new MercadoLibreClient(platformName, baseUrl, accountId,
                    http, authProvider, guard);
        };
    }
}
