package org.springaicommunity.shopify.connector;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.springaicommunity.shopify.connector.JsonNodeUtils.*;

/**
 * {@link ResourceService} backed by {@link ShopifyApi}.
 *
 * <p>
 * Converts Admin API JSON responses to records at the service boundary.
 */
public class ShopifyResourceService implements ResourceService {

	private static final Logger logger = LoggerFactory.getLogger(ShopifyResourceService.class);

	private final ShopifyApi api;

	public ShopifyResourceService(ShopifyApi api) {
		this.api = api;
	}

	@Override
	public List<Product> getAllProducts() {
		List<Product> products = new ArrayList<>();
		for (JsonNode node : api.fetchAll(ResourceTypes.PRODUCTS)) {
			products.add(parseProduct(node));
		}
		return products;
	}

	@Override
	public Product getProductByShopifyId(long id) {
		JsonNode body = api.fetchOne("products/" + id);
		JsonNode product = body.path("product");
		if (isAbsent(product)) {
			throw new ShopifyApiException("Product " + id + " not found in response", -1, body.toString());
		}
		return parseProduct(product);
	}

	@Override
	public Optional<Long> getProductIdByInventoryItemId(long inventoryItemId) {
		JsonNode body = api.fetchOne("variants", Map.of("inventory_item_id", inventoryItemId));
		List<JsonNode> variants = array(body, "variants");
		if (variants.isEmpty()) {
			logger.debug("No variant found for inventory item {}", inventoryItemId);
			return Optional.empty();
		}
		return Optional.ofNullable(longValue(variants.get(0), "product_id"));
	}

	@Override
	public List<Metafield> getMetafieldsByProductId(long id) {
		if (!api.getProperties().isSyncProductMetafields()) {
			return List.of();
		}
		return getMetafieldsByIdAndOwnerResource(id, "products");
	}

	@Override
	public List<Metafield> getMetafieldsByVariantId(long id) {
		if (!api.getProperties().isSyncVariantMetafields()) {
			return List.of();
		}
		return getMetafieldsByIdAndOwnerResource(id, "variants");
	}

	@Override
	public List<Metafield> getMetafieldsByIdAndOwnerResource(long id, String ownerResource) {
		Map<String, Object> owner = new LinkedHashMap<>();
		owner.put("owner_id", id);
		owner.put("owner_resource", ownerResource);

		List<Metafield> metafields = new ArrayList<>();
		for (JsonNode node : api.fetchAll(ResourceTypes.metafieldsOf(ownerResource, id), Map.of("metafield", owner))) {
			metafields.add(parseMetafield(node));
		}
		return metafields;
	}

	@Override
	public List<Variant> getVariantsByProductId(long id) {
		List<Variant> variants = new ArrayList<>();
		for (JsonNode node : api.fetchAll(ResourceTypes.variantsOf(id))) {
			variants.add(parseVariant(node));
		}
		return variants;
	}

	// ========== JSON Parsing Methods ==========

	static Product parseProduct(JsonNode node) {
		List<Variant> variants = new ArrayList<>();
		for (JsonNode variant : array(node, "variants")) {
			variants.add(parseVariant(variant));
		}

		List<ProductOption> options = new ArrayList<>();
		for (JsonNode option : array(node, "options")) {
			List<String> values = new ArrayList<>();
			for (JsonNode value : array(option, "values")) {
				values.add(value.asText());
			}
			options.add(new ProductOption(option.path("id").asLong(), text(option, "name", ""),
					option.path("position").asInt(0), values));
		}

		List<ProductImage> images = new ArrayList<>();
		for (JsonNode image : array(node, "images")) {
			images.add(new ProductImage(image.path("id").asLong(), text(image, "src", ""),
					image.path("position").asInt(0), text(image, "alt"), intValue(image, "width"),
					intValue(image, "height")));
		}

		return new Product(node.path("id").asLong(), text(node, "title", ""), text(node, "handle", ""),
				text(node, "body_html"), text(node, "vendor"), text(node, "product_type"), text(node, "status"),
				text(node, "tags"), dateTime(node, "created_at"), dateTime(node, "updated_at"),
				dateTime(node, "published_at"), variants, options, images);
	}

	static Variant parseVariant(JsonNode node) {
		return new Variant(node.path("id").asLong(), node.path("product_id").asLong(), text(node, "title", ""),
				text(node, "sku"), text(node, "price"), text(node, "compare_at_price"),
				node.path("position").asInt(0), longValue(node, "inventory_item_id"),
				node.path("inventory_quantity").asInt(0), text(node, "barcode"), dateTime(node, "created_at"),
				dateTime(node, "updated_at"));
	}

	static Metafield parseMetafield(JsonNode node) {
		return new Metafield(node.path("id").asLong(), text(node, "namespace", ""), text(node, "key", ""),
				text(node, "value"), text(node, "type"), longValue(node, "owner_id"), text(node, "owner_resource"),
				text(node, "description"), dateTime(node, "created_at"), dateTime(node, "updated_at"));
	}

}
