package com.commerce.catalogsync.client;

import com.commerce.catalogsync.dto.PriceUpdate;
import com.commerce.catalogsync.dto.ProductRecord;
import com.commerce.catalogsync.exception.PlatformApiException;
import com.commerce.catalogsync.exception.UpdateFailedException;

import java.util.List;

/**
 * Interface for talking to one e-commerce platform's catalog.
 * <p>
 * Implementations map the platform's own JSON into {@link ProductRecord}s:
 * - TiendaNubeClient
 * - MercadoLibreClient
 * <p>
 * Tests use an in-memory implementation.
 */
public interface CatalogPlatformClient {

    /**
     * Name this platform is configured under. Used for lookup, logging and reporting.
     */
    String getPlatformName();

    /**
     * Fetches one page of the catalog.
     *
     * @param page    1-based page number
     * @param perPage page size requested from the platform
     * @return the page's records in platform order; empty once past the last page
     * @throws PlatformApiException if the platform is unreachable or rejects the request
     */
    List<ProductRecord> fetchPage(int page, int perPage) throws PlatformApiException;

    /**
     * Sets the price of one product or variant.
     *
     * @throws UpdateFailedException if the platform did not accept the change
     */
    void updatePrice(PriceUpdate update) throws UpdateFailedException;
}
