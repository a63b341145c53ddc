package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Raw HTTP response returned by a {@link ShopifyClient}.
 *
 * <p>
 * Header names are matched case-insensitively.
 *
 * @param statusCode HTTP status code
 * @param body response body as text
 * @param headers response headers
 */
public record RestResponse(int statusCode, String body, Map<String, List<String>> headers) {

	public RestResponse {
		Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		headers.forEach((name, values) -> copy.put(name.toLowerCase(Locale.ROOT), List.copyOf(values)));
		headers = Collections.unmodifiableMap(copy);
	}

	public static RestResponse of(int statusCode, String body) {
		return new RestResponse(statusCode, body, Map.of());
	}

	/**
	 * Returns the first value of a header.
	 * @param name header name (any case)
	 * @return the first value, or {@code null} if the header is absent
	 */
	@Nullable
	public String firstHeader(String name) {
		List<String> values = headers.get(name);
		return (values == null || values.isEmpty()) ? null : values.get(0);
	}

	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

}
