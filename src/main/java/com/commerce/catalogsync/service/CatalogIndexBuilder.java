package com.commerce.catalogsync.service;

import com.commerce.catalogsync.dto.CatalogIndex;
import com.commerce.catalogsync.dto.CatalogItem;
import com.commerce.catalogsync.dto.IndexDiagnostic;
import com.commerce.catalogsync.dto.ProductRecord;
import com.commerce.catalogsync.dto.ProductVariant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the SKU index of one catalog.
 * <p>
 * SKUs are trimmed and lower-cased. Variant-bearing records are indexed per variant.
 * The first record seen for a SKU wins; later ones are reported as duplicates.
 */
@Component
@Slf4j
public class CatalogIndexBuilder {

    public static String normalizeSku(String sku) {
        if (sku == null) {
            return null;
        }
        String normalized = sku.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    public CatalogIndex build(String platformName, Iterable<ProductRecord> records) {
        return build(platformName, records, true, null);
    }

    public CatalogIndex build(String platformName, Iterable<ProductRecord> records,
                              boolean skipInactive, String preferredLocale) {
        Map<String, CatalogItem> items = new HashMap<>();
        List<IndexDiagnostic> diagnostics = new ArrayList<>();

        for (ProductRecord record : records) {
            if (skipInactive && !record.isActive()) {
                diagnostics.add(diagnostic(IndexDiagnostic.Type.INACTIVE_SKIPPED, platformName,
                        record.getSku(), record.getNativeId(), "inactive listing skipped"));
                log.debug("Skipping inactive {} listing {}", platformName, record.getNativeId());
                continue;
            }

            String name = record.preferredName(preferredLocale);
            if (record.hasVariants()) {
                for (ProductVariant variant : record.getVariants()) {
                    add(items, diagnostics, platformName, CatalogItem.builder()
                            .sku(variant.getSku())
                            .productId(record.getNativeId())
                            .variantId(variant.getNativeId())
                            .displayName(name)
                            .price(variant.getPrice())
                            .build());
                }
            } else {
                add(items, diagnostics, platformName, CatalogItem.builder()
                        .sku(record.getSku())
                        .productId(record.getNativeId())
                        .displayName(name)
                        .price(record.getPrice())
                        .build());
            }
        }

        CatalogIndex index = new CatalogIndex(platformName, items, diagnostics);
        log.info("Indexed {} SKUs from {} ({} duplicates, {} without SKU, {} without valid price)",
                index.size(), platformName,
                index.countDiagnostics(IndexDiagnostic.Type.DUPLICATE_SKU),
                index.countDiagnostics(IndexDiagnostic.Type.MISSING_SKU),
                index.countDiagnostics(IndexDiagnostic.Type.INVALID_PRICE));
        return index;
    }

    // The raw item carries the platform's SKU; it is normalized here before insertion.
    private void add(Map<String, CatalogItem> items, List<IndexDiagnostic> diagnostics,
                     String platformName, CatalogItem raw) {
        String nativeId = raw.isVariant() ? raw.getProductId() + "/" + raw.getVariantId() : raw.getProductId();
        String sku = normalizeSku(raw.getSku());

        if (sku == null) {
            log.warn("{} item {} ('{}') has no SKU and cannot be matched",
                    platformName, nativeId, raw.getDisplayName());
            diagnostics.add(diagnostic(IndexDiagnostic.Type.MISSING_SKU, platformName, null, nativeId,
                    "no SKU"));
            return;
        }

        BigDecimal price = raw.getPrice();
        if (price == null || price.signum() < 0) {
            log.warn("{} item {} (SKU {}) has no valid price: {}", platformName, nativeId, sku, price);
            diagnostics.add(diagnostic(IndexDiagnostic.Type.INVALID_PRICE, platformName, sku, nativeId,
                    "invalid price " + price));
            return;
        }

        CatalogItem existing = items.get(sku);
        if (existing != null) {
            log.warn("Duplicate SKU {} on {}: keeping item {}, discarding item {}",
                    sku, platformName, existing.getProductId(), nativeId);
            diagnostics.add(diagnostic(IndexDiagnostic.Type.DUPLICATE_SKU, platformName, sku, nativeId,
                    "SKU already indexed for item " + existing.getProductId()));
            return;
        }

        items.put(sku, CatalogItem.builder()
                .sku(sku)
                .productId(raw.getProductId())
                .variantId(raw.getVariantId())
                .displayName(raw.getDisplayName())
                .price(price)
                .build());
    }

    private static IndexDiagnostic diagnostic(IndexDiagnostic.Type type, String platformName, String sku,
                                              String nativeId, String message) {
        return IndexDiagnostic.builder()
                .type(type)
                .platformName(platformName)
                .sku(sku)
                .nativeId(nativeId)
                .message(message)
                .build();
    }
}
