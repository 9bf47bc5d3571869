package com.commerce.catalogsync.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Platform-agnostic view of one catalog item.
 * Platform clients map their own JSON payloads into this shape, so nothing downstream of the
 * fetcher knows which platform a record came from.
 */
@Value
@Builder(toBuilder = true)
public class ProductRecord {

    /**
     * SKU as delivered by the platform. Normalized when the record is indexed.
     */
    String sku;

    /**
     * The platform's own identifier, used to send updates back.
     * e.g., Tienda Nube's numeric product id or Mercado Libre's item id (MLA123...)
     */
    String nativeId;

    /**
     * Locale-tagged product names, in the order the platform returned them.
     */
    @Singular("name")
    Map<String, String> displayName;

    /**
     * Listing price. Currency is assumed to be the same on both platforms.
     */
    BigDecimal price;

    /**
     * Variants, only on platforms that support them. When present, prices are reconciled
     * per variant and the parent's own SKU and price are ignored.
     */
    @Singular
    List<ProductVariant> variants;

    /**
     * Whether the listing is active on its platform.
     */
    @Builder.Default
    boolean active = true;

    public boolean hasVariants() {
        return !variants.isEmpty();
    }

    /**
     * Name in the requested locale, falling back to the first available one.
     */
    public String preferredName(String locale) {
        String name = locale == null ? null : displayName.get(locale);
        if (name != null && !name.isBlank()) {
            return name;
        }
        return displayName.values().stream()
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(nativeId);
    }
}
