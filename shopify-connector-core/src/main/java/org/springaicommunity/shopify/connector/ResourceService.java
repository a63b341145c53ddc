package org.springaicommunity.shopify.connector;

import java.util.List;
import java.util.Optional;

/**
 * Typed read access to shop resources.
 */
public interface ResourceService {

	/**
	 * Retrieve all of the shop's products.
	 * @return every product, in API order
	 */
	List<Product> getAllProducts();

	/**
	 * Retrieve a single product by its Shopify ID.
	 * @param id Shopify product ID
	 * @return the product
	 * @throws ShopifyApiException if the product cannot be fetched
	 */
	Product getProductByShopifyId(long id);

	/**
	 * Look up the product that owns the variant with the given inventory item.
	 * @param inventoryItemId inventory item ID
	 * @return the product's Shopify ID, or empty if no variant matches
	 */
	Optional<Long> getProductIdByInventoryItemId(long inventoryItemId);

	/**
	 * Retrieve the metafields of a product. Returns an empty list without calling the API
	 * when product metafield sync is disabled.
	 * @param id Shopify product ID
	 * @return the product's metafields
	 */
	List<Metafield> getMetafieldsByProductId(long id);

	/**
	 * Retrieve the metafields of a variant. Returns an empty list without calling the API
	 * when variant metafield sync is disabled.
	 * @param id Shopify variant ID
	 * @return the variant's metafields
	 */
	List<Metafield> getMetafieldsByVariantId(long id);

	/**
	 * Retrieve the metafields of any owner resource, following every page.
	 * @param id owner ID
	 * @param ownerResource owner collection, e.g. {@code "products"}
	 * @return the metafields, empty if the owner has none
	 */
	List<Metafield> getMetafieldsByIdAndOwnerResource(long id, String ownerResource);

	/**
	 * Retrieve the variants of a product, following every page.
	 * @param id Shopify product ID
	 * @return the variants, empty if the product has none
	 */
	List<Variant> getVariantsByProductId(long id);

}
