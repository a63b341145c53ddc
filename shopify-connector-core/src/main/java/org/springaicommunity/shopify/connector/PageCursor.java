package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Continuation of a paginated collection.
 *
 * <p>
 * The query already carries every filter of the original request, so it is sent on its
 * own when fetching the next page.
 *
 * @param query the complete query for the next page
 */
public record PageCursor(Map<String, String> query) {

	private static final Pattern LINK_ENTRY = Pattern.compile("<([^>]*)>\\s*;\\s*rel=\"?([^\",;]+)\"?");

	public PageCursor {
		query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
	}

	/**
	 * Extract the {@code rel="next"} cursor from a {@code Link} response header.
	 * @param linkHeader the header value, possibly null
	 * @return the next page cursor, or empty on the last page
	 */
	public static Optional<PageCursor> fromLinkHeader(@Nullable String linkHeader) {
		if (linkHeader == null || linkHeader.isBlank()) {
			return Optional.empty();
		}
		Matcher matcher = LINK_ENTRY.matcher(linkHeader);
		while (matcher.find()) {
			if ("next".equalsIgnoreCase(matcher.group(2).trim())) {
				return Optional.of(new PageCursor(parseQuery(URI.create(matcher.group(1)).getRawQuery())));
			}
		}
		return Optional.empty();
	}

	static Map<String, String> parseQuery(@Nullable String rawQuery) {
		Map<String, String> query = new LinkedHashMap<>();
		if (rawQuery == null || rawQuery.isEmpty()) {
			return query;
		}
		for (String pair : rawQuery.split("&")) {
			if (pair.isEmpty()) {
				continue;
			}
			int eq = pair.indexOf('=');
			String name = eq < 0 ? pair : pair.substring(0, eq);
			String value = eq < 0 ? "" : pair.substring(eq + 1);
			query.put(URLDecoder.decode(name, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
		}
		return query;
	}

}
