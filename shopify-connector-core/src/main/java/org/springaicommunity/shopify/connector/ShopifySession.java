package org.springaicommunity.shopify.connector;

/**
 * Binds a shop to the access token used to authenticate every request.
 *
 * <p>
 * Sessions created by this library are always offline (background) sessions backed by a
 * pre-issued access token, so {@code id} and {@code state} carry the fixed placeholder
 * {@link #PLACEHOLDER}.
 *
 * @param id session identifier
 * @param shop the shop host name, e.g. {@code my-store.myshopify.com}
 * @param accessToken the Admin API access token
 * @param online whether this is an online (per-user) session
 * @param state OAuth state value
 */
public record ShopifySession(String id, String shop, String accessToken, boolean online, String state) {

	public static final String PLACEHOLDER = "NA";

	/**
	 * Create an offline session for the given shop and token.
	 * @param shop the shop host name
	 * @param accessToken the access token
	 * @return a new offline session
	 */
	public static ShopifySession offline(String shop, String accessToken) {
		return new ShopifySession(PLACEHOLDER, shop, accessToken, false, PLACEHOLDER);
	}

	@Override
	public String toString() {
		return "ShopifySession[id=" + id + ", shop=" + shop + ", online=" + online + "]";
	}

}
