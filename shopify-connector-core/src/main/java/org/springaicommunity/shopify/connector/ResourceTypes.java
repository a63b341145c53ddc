package org.springaicommunity.shopify.connector;

/**
 * Standard {@link ResourceType} definitions.
 */
public final class ResourceTypes {

	public static final ResourceType PRODUCTS = of("products");

	public static final ResourceType CUSTOM_COLLECTIONS = of("custom_collections");

	public static final ResourceType SMART_COLLECTIONS = of("smart_collections");

	private ResourceTypes() {
	}

	/**
	 * A top-level collection whose items are keyed by the last path segment.
	 * @param path collection endpoint, e.g. {@code "products"}
	 * @return the resource type
	 */
	public static ResourceType of(String path) {
		String key = path.substring(path.lastIndexOf('/') + 1);
		return new CollectionType(path, key);
	}

	/**
	 * The variants of one product.
	 * @param productId Shopify product ID
	 * @return the resource type
	 */
	public static ResourceType variantsOf(long productId) {
		return new CollectionType("products/" + productId + "/variants", "variants");
	}

	/**
	 * The metafields attached to one owner resource.
	 * @param ownerResource owner collection, e.g. {@code "products"} or {@code "variants"}
	 * @param ownerId owner ID
	 * @return the resource type
	 */
	public static ResourceType metafieldsOf(String ownerResource, long ownerId) {
		return new CollectionType(ownerResource + "/" + ownerId + "/metafields", "metafields");
	}

	/**
	 * Collection with the default page decoding and Link header pagination.
	 *
	 * @param path collection endpoint
	 * @param collectionKey array key in the page body
	 */
	public record CollectionType(String path, String collectionKey) implements ResourceType {
	}

}
