package com.commerce.catalogsync.service;

import com.commerce.catalogsync.dto.CatalogIndex;
import com.commerce.catalogsync.dto.CatalogItem;
import com.commerce.catalogsync.dto.IndexDiagnostic;
import com.commerce.catalogsync.dto.ProductRecord;
import com.commerce.catalogsync.dto.ProductVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogIndexBuilderTest {

    private CatalogIndexBuilder indexBuilder;

    @BeforeEach
    void setUp() {
        indexBuilder = new CatalogIndexBuilder();
    }

    @Nested
    @DisplayName("SKU normalization")
    class NormalizationTests {

        @Test
        @DisplayName("Should trim and lower-case SKUs")
        void shouldNormalizeSkus() {
            assertThat(CatalogIndexBuilder.normalizeSku("  AbC-001 ")).isEqualTo("abc-001");
            assertThat(CatalogIndexBuilder.normalizeSku("   ")).isNull();
            assertThat(CatalogIndexBuilder.normalizeSku(null)).isNull();
        }

        @Test
        @DisplayName("Should match records whose SKUs differ only in case and whitespace")
        void shouldIndexUnderNormalizedSku() {
            // Given
            List<ProductRecord> records = List.of(product("1", " SKU-1 ", "10.00"));

            // When
            CatalogIndex index = indexBuilder.build("tiendanube", records);

            // Then
            assertThat(index.get("sku-1")).isPresent();
            assertThat(index.get("sku-1").get().getSku()).isEqualTo("sku-1");
            assertThat(index.get("SKU-1")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Diagnostics")
    class DiagnosticTests {

        @Test
        @DisplayName("Should keep the first record of a duplicated SKU")
        void shouldKeepFirstDuplicate() {
            // Given
            List<ProductRecord> records = List.of(
                    product("1", "X", "10"),
                    product("2", "x ", "20"));

            // When
            CatalogIndex index = indexBuilder.build("mercadolibre", records);

            // Then
            assertThat(index.size()).isEqualTo(1);
            CatalogItem kept = index.get("x").orElseThrow();
            assertThat(kept.getProductId()).isEqualTo("1");
            assertThat(kept.getPrice()).isEqualByComparingTo("10");
            assertThat(index.countDiagnostics(IndexDiagnostic.Type.DUPLICATE_SKU)).isEqualTo(1);
            assertThat(index.getDiagnostics().get(0).getNativeId()).isEqualTo("2");
        }

        @Test
        @DisplayName("Should report records without SKU and leave them out")
        void shouldReportMissingSku() {
            // Given
            List<ProductRecord> records = List.of(
                    product("1", null, "10"),
                    product("2", "  ", "10"),
                    product("3", "ok", "10"));

            // When
            CatalogIndex index = indexBuilder.build("tiendanube", records);

            // Then
            assertThat(index.skus()).containsExactly("ok");
            assertThat(index.countDiagnostics(IndexDiagnostic.Type.MISSING_SKU)).isEqualTo(2);
        }

        @Test
        @DisplayName("Should report records with missing or negative price")
        void shouldReportInvalidPrice() {
            // Given
            List<ProductRecord> records = List.of(
                    ProductRecord.builder().nativeId("1").sku("no-price").build(),
                    product("2", "negative", "-1"),
                    product("3", "free", "0"));

            // When
            CatalogIndex index = indexBuilder.build("tiendanube", records);

            // Then
            assertThat(index.skus()).containsExactly("free");
            assertThat(index.countDiagnostics(IndexDiagnostic.Type.INVALID_PRICE)).isEqualTo(2);
        }

        @Test
        @DisplayName("Should skip inactive listings only when asked to")
        void shouldSkipInactiveListings() {
            // Given
            List<ProductRecord> records = List.of(
                    product("1", "live", "10"),
                    product("2", "paused", "10").toBuilder().active(false).build());

            // When
            CatalogIndex skipping = indexBuilder.build("mercadolibre", records, true, null);
            CatalogIndex keeping = indexBuilder.build("mercadolibre", records, false, null);

            // Then
            assertThat(skipping.skus()).containsExactly("live");
            assertThat(skipping.countDiagnostics(IndexDiagnostic.Type.INACTIVE_SKIPPED)).isEqualTo(1);
            assertThat(keeping.skus()).containsExactly("live", "paused");
        }
    }

    @Nested
    @DisplayName("Variants")
    class VariantTests {

        @Test
        @DisplayName("Should index each variant under its own SKU")
        void shouldIndexVariants() {
            // Given
            ProductRecord shirt = ProductRecord.builder()
                    .nativeId("100")
                    .sku("parent-ignored")
                    .name("es", "Remera")
                    .name("en", "T-shirt")
                    .price(new BigDecimal("1.00"))
                    .variant(ProductVariant.builder().nativeId("1001").sku("SHIRT-S").price(new BigDecimal("15.00")).build())
                    .variant(ProductVariant.builder().nativeId("1002").sku("SHIRT-M").price(new BigDecimal("16.00")).build())
                    .build();

            // When
            CatalogIndex index = indexBuilder.build("tiendanube", List.of(shirt), true, "en");

            // Then
            assertThat(index.skus()).containsExactly("shirt-m", "shirt-s");
            CatalogItem small = index.get("shirt-s").orElseThrow();
            assertThat(small.getProductId()).isEqualTo("100");
            assertThat(small.getVariantId()).isEqualTo("1001");
            assertThat(small.getPrice()).isEqualByComparingTo("15.00");
            assertThat(small.getDisplayName()).isEqualTo("T-shirt");
            assertThat(index.get("parent-ignored")).isEmpty();
        }

        @Test
        @DisplayName("Should fall back to the first available name")
        void shouldFallBackToFirstName() {
            // Given
            ProductRecord record = product("7", "sku-7", "5");

            // When
            CatalogIndex index = indexBuilder.build("tiendanube", List.of(record), true, "pt");

            // Then
            assertThat(index.get("sku-7").orElseThrow().getDisplayName()).isEqualTo("Producto 7");
        }
    }

    private static ProductRecord product(String id, String sku, String price) {
        return ProductRecord.builder()
                .nativeId(id)
                .sku(sku)
                .name("es", "Producto " + id)
                .price(new BigDecimal(price))
                .build();
    }
}
