package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A Shopify product with its variants, options and images.
 */
public record Product(long id, String title, String handle, @Nullable String bodyHtml, @Nullable String vendor,
		@Nullable String productType, @Nullable String status, @Nullable String tags,
		@Nullable OffsetDateTime createdAt, @Nullable OffsetDateTime updatedAt, @Nullable OffsetDateTime publishedAt,
		List<Variant> variants, List<ProductOption> options, List<ProductImage> images) {
}
