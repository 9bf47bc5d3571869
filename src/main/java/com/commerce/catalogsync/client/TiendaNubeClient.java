package com.commerce.catalogsync.client;

import com.commerce.catalogsync.dto.PriceUpdate;
import com.commerce.catalogsync.dto.ProductRecord;
import com.commerce.catalogsync.dto.ProductVariant;
import com.commerce.catalogsync.exception.PlatformApiException;
import com.commerce.catalogsync.exception.UpdateFailedException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tienda Nube catalog client.
 * <p>
 * Products are listed with page/per_page pagination. Prices live on variants (every product has
 * at least one), so records are always variant-bearing and updates target the variant endpoint.
 * Tienda Nube answers 404 once the requested page is past the last one; a 404 on the first page
 * is an error (unknown store or wrong base URL), never an empty catalog.
 */
@Slf4j
public class TiendaNubeClient implements CatalogPlatformClient {

    private static final String DEFAULT_LOCALE = "es";

    private final String platformName;
    private final String storeUrl;
    private final String userAgent;
    private final PlatformHttpClient http;
    private final AuthProvider authProvider;
    private final PlatformCallGuard guard;

    public TiendaNubeClient(String platformName, String baseUrl, String storeId, String userAgent,
                            PlatformHttpClient http, AuthProvider authProvider, PlatformCallGuard guard) {
        this.platformName = platformName;
        this.storeUrl = baseUrl + "/" + storeId;
        this.userAgent = userAgent;
        this.http = http;
        this.authProvider = authProvider;
        this.guard = guard;
    }

    @Override
    public String getPlatformName() {
        return platformName;
    }

    @Override
    public List<ProductRecord> fetchPage(int page, int perPage) {
        String url = storeUrl + "/products";
        JsonNode body;
        try {
            body = guard.read(() -> http.get(url, Map.of("page", page, "per_page", perPage), headers()));
        } catch (PlatformApiException e) {
            // Past the last page Tienda Nube answers 404; on page 1 it means a wrong store or URL
            if (e.getStatusCode() == 404 && page > 1) {
                log.debug("{} returned 404 for page {}, treating it as past the last page", platformName, page);
                return List.of();
            }
            throw e;
        }

        if (body.isMissingNode()) {
            return List.of();
        }
        if (!body.isArray()) {
            throw new PlatformApiException("Expected a JSON array of products for page " + page,
                    platformName, 200, false);
        }

        List<ProductRecord> records = new ArrayList<>(body.size());
        for (JsonNode product : body) {
            records.add(toRecord(product));
        }
        return records;
    }

    @Override
    public void updatePrice(PriceUpdate update) {
        String url = update.isVariantUpdate()
                ? storeUrl + "/products/" + update.getProductId() + "/variants/" + update.getVariantId()
                : storeUrl + "/products/" + update.getProductId();
        try {
            guard.write(() -> http.put(url, Map.of("price", update.getNewPrice()), headers()));
        } catch (PlatformApiException | CallNotPermittedException | RequestNotPermitted e) {
            throw new UpdateFailedException("Tienda Nube rejected price update: " + e.getMessage(),
                    platformName, update.getSku(), e);
        }
    }

    private Map<String, String> headers() {
        return Map.of(
                "Authentication", "bearer " + authProvider.bearerToken(platformName),
                "User-Agent", userAgent,
                "Accept", "application/json");
    }

    ProductRecord toRecord(JsonNode product) {
        ProductRecord.ProductRecordBuilder builder = ProductRecord.builder()
                .nativeId(product.path("id").asText())
                .sku(JsonValues.text(product.get("sku")))
                .price(JsonValues.decimal(product.get("price")));

        JsonNode name = product.path("name");
        if (name.isObject()) {
            name.fields().forEachRemaining(e -> builder.name(e.getKey(), e.getValue().asText()));
        } else if (name.isTextual()) {
            builder.name(DEFAULT_LOCALE, name.asText());
        }

        for (JsonNode variant : product.path("variants")) {
            builder.variant(ProductVariant.builder()
                    .nativeId(variant.path("id").asText())
                    .sku(JsonValues.text(variant.get("sku")))
                    .price(JsonValues.decimal(variant.get("price")))
                    .build());
        }
        return builder.build();
    }
}
