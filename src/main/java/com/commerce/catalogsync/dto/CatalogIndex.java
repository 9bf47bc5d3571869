package com.commerce.catalogsync.dto;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable SKU lookup over one platform's catalog, built once per run.
 */
public final class CatalogIndex {

    private final String platformName;
    private final Map<String, CatalogItem> items;
    private final List<IndexDiagnostic> diagnostics;

    public CatalogIndex(String platformName, Map<String, CatalogItem> items,
                        List<IndexDiagnostic> diagnostics) {
        this.platformName = platformName;
        this.items = Collections.unmodifiableMap(new TreeMap<>(items));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getPlatformName() {
        return platformName;
    }

    public Optional<CatalogItem> get(String normalizedSku) {
        return Optional.ofNullable(items.get(normalizedSku));
    }

    /**
     * Indexed SKUs in lexical order.
     */
    public Set<String> skus() {
        return items.keySet();
    }

    public int size() {
        return items.size();
    }

    public List<IndexDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public long countDiagnostics(IndexDiagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.getType() == type).count();
    }
}
