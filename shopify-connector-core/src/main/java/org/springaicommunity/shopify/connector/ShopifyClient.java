package org.springaicommunity.shopify.connector;

import java.util.Map;

/**
 * Interface for Shopify Admin REST API transport.
 *
 * <p>
 * Implementations return the raw response for every HTTP status; interpreting status
 * codes and bodies is left to {@link RequestExecutor}. This keeps the transport
 * replaceable in tests.
 */
public interface ShopifyClient {

	/**
	 * Execute a GET request against the Admin REST API.
	 * @param path resource path relative to the versioned API root (e.g.
	 * {@code "products/42"}) or a full URL
	 * @param query query parameters; nested maps and lists are encoded with bracket
	 * notation
	 * @return the raw response
	 * @throws ShopifyApiException if no response could be obtained
	 */
	RestResponse get(String path, Map<String, ?> query);

	/**
	 * Returns the shop this client is bound to.
	 * @return the shop host name
	 */
	String getShop();

}
