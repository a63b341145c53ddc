package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;

/**
 * A metafield attached to an owner resource.
 *
 * @param id metafield ID
 * @param namespace metafield namespace
 * @param key metafield key
 * @param value the value as text; structured values keep their JSON form
 * @param type the metafield type, e.g. {@code single_line_text_field}
 * @param ownerId ID of the owning resource
 * @param ownerResource kind of the owning resource, e.g. {@code product}
 * @param description optional description
 * @param createdAt creation time
 * @param updatedAt last update time
 */
public record Metafield(long id, String namespace, String key, @Nullable String value, @Nullable String type,
		@Nullable Long ownerId, @Nullable String ownerResource, @Nullable String description,
		@Nullable OffsetDateTime createdAt, @Nullable OffsetDateTime updatedAt) {
}
