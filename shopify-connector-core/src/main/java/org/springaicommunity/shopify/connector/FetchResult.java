package org.springaicommunity.shopify.connector;

/**
 * Outcome of a single request attempt, as classified by {@link RequestExecutor}.
 */
public sealed interface FetchResult permits FetchResult.Success, FetchResult.RateLimited, FetchResult.Failed {

	/**
	 * The request succeeded and its body carried no {@code errors} field.
	 *
	 * @param response the decoded response
	 */
	record Success(ApiResponse response) implements FetchResult {
	}

	/**
	 * The server answered 429 Too Many Requests.
	 *
	 * @param retryAfterSeconds whole seconds to wait before the next attempt
	 * @param detail the response body
	 */
	record RateLimited(int retryAfterSeconds, String detail) implements FetchResult {
	}

	/**
	 * The request failed and must not be retried.
	 *
	 * @param statusCode HTTP status code
	 * @param message short description
	 * @param detail the error body or serialized {@code errors} payload
	 */
	record Failed(int statusCode, String message, String detail) implements FetchResult {
	}

}
