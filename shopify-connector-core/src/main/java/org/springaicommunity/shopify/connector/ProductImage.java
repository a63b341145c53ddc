package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

/**
 * A product image.
 */
public record ProductImage(long id, String src, int position, @Nullable String alt, @Nullable Integer width,
		@Nullable Integer height) {
}
