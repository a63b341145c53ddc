package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;

/**
 * A product variant.
 */
public record Variant(long id, long productId, String title, @Nullable String sku, @Nullable String price,
		@Nullable String compareAtPrice, int position, @Nullable Long inventoryItemId, int inventoryQuantity,
		@Nullable String barcode, @Nullable OffsetDateTime createdAt, @Nullable OffsetDateTime updatedAt) {
}
