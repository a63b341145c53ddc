package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Encodes query parameter maps the way the Shopify Admin REST API expects them.
 *
 * <p>
 * Nested maps become {@code key[sub]=value}, collections become {@code key[]=value},
 * {@code null} values are skipped and booleans are written as {@code 1}/{@code 0}.
 * Parameter order follows the map's iteration order.
 */
public final class QueryStringEncoder {

	private QueryStringEncoder() {
	}

	/**
	 * Encode a query map.
	 * @param query the parameters
	 * @return the query string without leading {@code ?}; empty when there is nothing to
	 * encode
	 */
	public static String encode(Map<String, ?> query) {
		List<String> pairs = new ArrayList<>();
		for (Map.Entry<String, ?> entry : query.entrySet()) {
			append(pairs, entry.getKey(), entry.getValue());
		}
		return String.join("&", pairs);
	}

	private static void append(List<String> pairs, String key, @Nullable Object value) {
		if (value == null) {
			return;
		}
		if (value instanceof Map<?, ?> map) {
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				append(pairs, key + "[" + entry.getKey() + "]", entry.getValue());
			}
		}
		else if (value instanceof Collection<?> collection) {
			for (Object item : collection) {
				append(pairs, key + "[]", item);
			}
		}
		else if (value instanceof Boolean bool) {
			pairs.add(encodeComponent(key) + "=" + (bool ? "1" : "0"));
		}
		else {
			pairs.add(encodeComponent(key) + "=" + encodeComponent(String.valueOf(value)));
		}
	}

	private static String encodeComponent(String text) {
		return URLEncoder.encode(text, StandardCharsets.UTF_8);
	}

}
