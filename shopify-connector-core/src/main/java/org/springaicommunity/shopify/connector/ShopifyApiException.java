package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when Shopify API calls fail.
 *
 * <p>
 * Carries the HTTP status code and the response body (or the serialized {@code errors}
 * payload of an otherwise successful response). A status code of {@code -1} means the
 * request never produced a response.
 */
public class ShopifyApiException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	public ShopifyApiException(String message, int statusCode, @Nullable String responseBody) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public ShopifyApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	/**
	 * Returns true if this exception represents a 429 Too Many Requests response.
	 */
	public boolean isRateLimitError() {
		return statusCode == 429;
	}

}
