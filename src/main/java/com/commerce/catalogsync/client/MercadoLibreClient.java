package com.commerce.catalogsync.client;

import com.commerce.catalogsync.dto.PriceUpdate;
import com.commerce.catalogsync.dto.ProductRecord;
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
 * Mercado Libre catalog client.
 * <p>
 * The seller's item search pages with offset/limit and only returns item ids, so each page is
 * followed by one detail lookup per item. The SKU comes from the SELLER_SKU attribute, falling
 * back to seller_custom_field. Variations are not mapped: items are reconciled at item level.
 */
@Slf4j
public class MercadoLibreClient implements CatalogPlatformClient {

    private static final String TITLE_LOCALE = "es";
    private static final String SELLER_SKU = "SELLER_SKU";

    private final String platformName;
    private final String baseUrl;
    private final String userId;
    private final PlatformHttpClient http;
    private final AuthProvider authProvider;
    private final PlatformCallGuard guard;

    public MercadoLibreClient(String platformName, String baseUrl, String userId,
                              PlatformHttpClient http, AuthProvider authProvider, PlatformCallGuard guard) {
        this.platformName = platformName;
        this.baseUrl = baseUrl;
        this.userId = userId;
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
        int offset = (page - 1) * perPage;
        String searchUrl = baseUrl + "/users/" + userId + "/items/search";
        JsonNode search = guard.read(() ->
                http.get(searchUrl, Map.of("offset", offset, "limit", perPage), headers()));

        JsonNode results = search.path("results");
        if (!results.isArray()) {
            throw new PlatformApiException("Item search response has no results array for offset " + offset,
                    platformName, 200, false);
        }
        log.debug("{} item search offset {} returned {} ids (total {})",
                platformName, offset, results.size(), search.path("paging").path("total").asInt());

        List<ProductRecord> records = new ArrayList<>(results.size());
        for (JsonNode id : results) {
            String itemUrl = baseUrl + "/items/" + id.asText();
            JsonNode item = guard.read(() -> http.get(itemUrl, Map.of(), headers()));
            records.add(toRecord(item));
        }
        return records;
    }

    @Override
    public void updatePrice(PriceUpdate update) {
        String url = baseUrl + "/items/" + update.getProductId();
        try {
            guard.write(() -> http.put(url, Map.of("price", update.getNewPrice()), headers()));
        } catch (PlatformApiException | CallNotPermittedException | RequestNotPermitted e) {
            throw new UpdateFailedException("Mercado Libre rejected price update: " + e.getMessage(),
                    platformName, update.getSku(), e);
        }
    }

    private Map<String, String> headers() {
        return Map.of(
                "Authorization", "Bearer " + authProvider.bearerToken(platformName),
                "Accept", "application/json");
    }

    ProductRecord toRecord(JsonNode item) {
        ProductRecord.ProductRecordBuilder builder = ProductRecord.builder()
                .nativeId(item.path("id").asText())
                .sku(sellerSku(item))
                .price(JsonValues.decimal(item.get("price")))
                .active("active".equals(item.path("status").asText()));

        String title = JsonValues.text(item.get("title"));
        if (title != null) {
            builder.name(TITLE_LOCALE, title);
        }
        return builder.build();
    }

    private static String sellerSku(JsonNode item) {
        for (JsonNode attribute : item.path("attributes")) {
            if (SELLER_SKU.equals(attribute.path("id").asText())) {
                String value = JsonValues.text(attribute.get("value_name"));
                if (value != null && !value.isBlank()) {
                    return value;
                }
            }
        }
        return JsonValues.text(item.get("seller_custom_field"));
    }
}
