package org.springaicommunity.shopify.connector;

import java.util.List;

/**
 * A product option such as size or color.
 */
public record ProductOption(long id, String name, int position, List<String> values) {
}
