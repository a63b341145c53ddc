package org.springaicommunity.shopify.connector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * A successful Admin API response with its decoded body.
 *
 * @param body the decoded JSON body
 * @param raw the raw response, for status and headers
 */
public record ApiResponse(JsonNode body, RestResponse raw) {

	public int statusCode() {
		return raw.statusCode();
	}

	@Nullable
	public String header(String name) {
		return raw.firstHeader(name);
	}

}
