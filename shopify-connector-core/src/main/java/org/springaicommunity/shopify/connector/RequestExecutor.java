package org.springaicommunity.shopify.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Executes single Admin API GET requests and absorbs rate limiting.
 *
 * <p>
 * Behavior:
 * <ul>
 * <li>Every successful response is followed by a fixed 500ms pause before it is
 * returned, keeping sequential callers under the API call limit</li>
 * <li>429 Too Many Requests is retried after the number of seconds given by the
 * {@code Retry-After} header (1 second when absent), at most {@value #MAX_RETRIES}
 * times</li>
 * <li>Any other failure, including a 2xx body carrying an {@code errors} field, is
 * raised immediately as a {@link ShopifyApiException}</li>
 * </ul>
 *
 * <p>
 * All waits block the calling thread. Instances are meant for sequential use.
 */
public class RequestExecutor {

	private static final Logger logger = LoggerFactory.getLogger(RequestExecutor.class);

	/**
	 * Maximum number of retries after a 429 response.
	 */
	public static final int MAX_RETRIES = 5;

	/**
	 * Pause applied after every successful request.
	 */
	public static final Duration SUCCESS_PAUSE = Duration.ofMillis(500);

	static final int DEFAULT_RETRY_AFTER_SECONDS = 1;

	/**
	 * Longest wait honored for a single {@code Retry-After} value.
	 */
	static final int MAX_RETRY_AFTER_SECONDS = 3600;

	private final Supplier<ShopifyClient> clientSupplier;

	private final ObjectMapper objectMapper;

	private final Sleeper sleeper;

	/**
	 * Create an executor.
	 * @param clientSupplier supplies the bound client; called once per attempt so the
	 * client can be established lazily
	 * @param objectMapper mapper used to decode bodies and serialize error payloads
	 * @param sleeper used for the success pause and rate limit backoff
	 */
	public RequestExecutor(Supplier<ShopifyClient> clientSupplier, ObjectMapper objectMapper, Sleeper sleeper) {
		this.clientSupplier = clientSupplier;
		this.objectMapper = objectMapper;
		this.sleeper = sleeper;
	}

	/**
	 * Fetch a resource and return its decoded body unchanged.
	 * @param path resource path relative to the API root
	 * @param query query parameters
	 * @return the decoded body
	 * @throws ShopifyApiException if the request fails or the retry limit is reached
	 */
	public JsonNode fetchOne(String path, Map<String, ?> query) {
		return execute(path, query).body();
	}

	/**
	 * Fetch a resource and return the decoded body together with the raw response.
	 * @param path resource path relative to the API root
	 * @param query query parameters
	 * @return the decoded response
	 * @throws ShopifyApiException if the request fails or the retry limit is reached
	 */
	public ApiResponse execute(String path, Map<String, ?> query) {
		int retries = 0;

		while (true) {
			FetchResult result = attempt(path, query);

			if (result instanceof FetchResult.Success success) {
				sleeper.sleep(SUCCESS_PAUSE);
				return success.response();
			}

			if (result instanceof FetchResult.RateLimited rateLimited) {
				if (retries >= MAX_RETRIES) {
					logger.error("GET {} still rate limited after {} retries", path, retries);
					throw new ShopifyApiException("Too Many Requests (429): gave up after " + retries + " retries",
							429, rateLimited.detail());
				}
				logger.warn("GET {} rate limited (attempt {}/{}). Waiting {}s...", path, retries + 1,
						MAX_RETRIES + 1, rateLimited.retryAfterSeconds());
				sleeper.sleep(Duration.ofSeconds(rateLimited.retryAfterSeconds()));
				retries++;
				continue;
			}

			FetchResult.Failed failed = (FetchResult.Failed) result;
			logger.error("GET {} failed with status {}: {}", path, failed.statusCode(), failed.message());
			throw new ShopifyApiException(failed.message(), failed.statusCode(), failed.detail());
		}
	}

	private FetchResult attempt(String path, Map<String, ?> query) {
		RestResponse response = clientSupplier.get().get(path, query);
		return classify(response);
	}

	/**
	 * Classify a raw response.
	 * @param response the raw response
	 * @return the classified result
	 */
	FetchResult classify(RestResponse response) {
		int status = response.statusCode();

		if (status == 429) {
			return new FetchResult.RateLimited(parseRetryAfter(response.firstHeader("Retry-After")), response.body());
		}

		if (!response.isSuccessful()) {
			return new FetchResult.Failed(status, "Shopify API error: " + status, response.body());
		}

		JsonNode body;
		try {
			body = objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			return new FetchResult.Failed(status, "Invalid JSON in response: " + e.getOriginalMessage(),
					response.body());
		}
		if (body == null || body.isMissingNode()) {
			body = objectMapper.createObjectNode();
		}

		if (body.has("errors")) {
			String errors = serialize(body.get("errors"));
			return new FetchResult.Failed(status, "API Error: " + errors, errors);
		}

		return new FetchResult.Success(new ApiResponse(body, response));
	}

	/**
	 * Parse a {@code Retry-After} value given in seconds. Fractions are truncated,
	 * negative values become 0 and values above {@value #MAX_RETRY_AFTER_SECONDS} are
	 * capped. Missing or non-numeric values, including the HTTP-date form, fall back to
	 * {@value #DEFAULT_RETRY_AFTER_SECONDS} second.
	 * @param header the header value, possibly null
	 * @return the wait in seconds
	 */
	static int parseRetryAfter(@Nullable String header) {
		if (header == null || header.isBlank()) {
			return DEFAULT_RETRY_AFTER_SECONDS;
		}
		try {
			double seconds = Double.parseDouble(header.trim());
			if (Double.isNaN(seconds)) {
				return DEFAULT_RETRY_AFTER_SECONDS;
			}
			return (int) Math.min(Math.max(seconds, 0), MAX_RETRY_AFTER_SECONDS);
		}
		catch (NumberFormatException e) {
			return DEFAULT_RETRY_AFTER_SECONDS;
		}
	}

	private String serialize(JsonNode node) {
		try {
			return objectMapper.writeValueAsString(node);
		}
		catch (JsonProcessingException e) {
			return node.toString();
		}
	}

}
