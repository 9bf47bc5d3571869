package com.commerce.catalogsync.service;

import com.commerce.catalogsync.client.CatalogPlatformClient;
import com.commerce.catalogsync.dto.ProductRecord;
import com.commerce.catalogsync.exception.FetchFailedException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Retrieves complete catalogs, walking the platform's pagination until it runs dry.
 */
@Component
public class CatalogFetcher {

    static final int DEFAULT_MAX_PAGES = 10000;

    public PagedCatalog fetchCatalog(CatalogPlatformClient client, int perPage) {
        return fetchCatalog(client, perPage, DEFAULT_MAX_PAGES);
    }

    /**
     * @throws FetchFailedException right away if {@code perPage} is not positive
     */
    public PagedCatalog fetchCatalog(CatalogPlatformClient client, int perPage, int maxPages) {
        if (perPage <= 0) {
            throw new FetchFailedException("Page size must be positive, got " + perPage,
                    client.getPlatformName(), 1);
        }
        return new PagedCatalog(client, perPage, maxPages);
    }

    /**
     * Fetches the whole catalog into memory.
     */
    public List<ProductRecord> fetchAll(CatalogPlatformClient client, int perPage) {
        List<ProductRecord> records = new ArrayList<>();
        fetchCatalog(client, perPage).forEach(records::add);
        return records;
    }
}
