package com.commerce.catalogsync.service;

import com.commerce.catalogsync.client.CatalogPlatformClient;
import com.commerce.catalogsync.dto.ProductRecord;
import com.commerce.catalogsync.exception.FetchFailedException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy view of a platform's full catalog.
 * <p>
 * Every {@link #iterator()} starts again from page 1. Pages are requested one at a time, the next
 * one only once the current one has been consumed, and iteration ends at the first empty page.
 * Any failure surfaces as a {@link FetchFailedException} from {@code hasNext()}/{@code next()}.
 */
@Slf4j
public class PagedCatalog implements Iterable<ProductRecord> {

    private final CatalogPlatformClient client;
    private final int perPage;
    private final int maxPages;

    PagedCatalog(CatalogPlatformClient client, int perPage, int maxPages) {
        this.client = client;
        this.perPage = perPage;
        this.maxPages = maxPages;
    }

    public String getPlatformName() {
        return client.getPlatformName();
    }

    @Override
    public Iterator<ProductRecord> iterator() {
        return new PageIterator();
    }

    private class PageIterator implements Iterator<ProductRecord> {

        private int page = 0;
        private int recordCount = 0;
        private boolean exhausted = false;
        private Iterator<ProductRecord> current = Collections.emptyIterator();

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && !exhausted) {
                loadNextPage();
            }
            return current.hasNext();
        }

        @Override
        public ProductRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Catalog of " + getPlatformName() + " is exhausted");
            }
            return current.next();
        }

        private void loadNextPage() {
            page++;
            String platformName = getPlatformName();
            if (page > maxPages) {
                throw new FetchFailedException(String.format(
                        "%s still returned records after %d pages, refusing to continue",
                        platformName, maxPages), platformName, page);
            }

            List<ProductRecord> records;
            try {
                records = client.fetchPage(page, perPage);
            } catch (RuntimeException e) {
                throw new FetchFailedException(String.format("Failed to fetch page %d from %s: %s",
                        page, platformName, e.getMessage()), platformName, page, e);
            }

            if (records == null || records.isEmpty()) {
                exhausted = true;
                log.info("Fetched {} records from {} in {} pages", recordCount, platformName, page - 1);
                return;
            }
            if (records.size() > perPage) {
                throw new FetchFailedException(String.format(
                        "%s returned %d records for page %d although only %d were requested",
                        platformName, records.size(), page, perPage), platformName, page);
            }

            log.debug("Fetched page {} from {} with {} records", page, platformName, records.size());
            recordCount += records.size();
            current = records.iterator();
        }
    }
}
