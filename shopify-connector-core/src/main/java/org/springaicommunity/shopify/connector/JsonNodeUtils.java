package org.springaicommunity.shopify.connector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for reading Admin API JSON.
 */
final class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	private JsonNodeUtils() {
	}

	static boolean isAbsent(@Nullable JsonNode node) {
		return node == null || node.isMissingNode() || node.isNull();
	}

	@Nullable
	static String text(JsonNode node, String field) {
		JsonNode value = node.path(field);
		if (isAbsent(value)) {
			return null;
		}
		return value.isValueNode() ? value.asText() : value.toString();
	}

	static String text(JsonNode node, String field, String defaultValue) {
		String value = text(node, field);
		return value != null ? value : defaultValue;
	}

	@Nullable
	static Long longValue(JsonNode node, String field) {
		JsonNode value = node.path(field);
		return isAbsent(value) ? null : value.asLong();
	}

	@Nullable
	static Integer intValue(JsonNode node, String field) {
		JsonNode value = node.path(field);
		return isAbsent(value) ? null : value.asInt();
	}

	@Nullable
	static OffsetDateTime dateTime(JsonNode node, String field) {
		String value = text(node, field);
		if (value == null || value.isEmpty()) {
			return null;
		}
		try {
			return OffsetDateTime.parse(value);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", value);
			return null;
		}
	}

	static List<JsonNode> array(JsonNode node, String field) {
		JsonNode target = node.path(field);
		if (!target.isArray()) {
			return List.of();
		}
		List<JsonNode> result = new ArrayList<>();
		target.forEach(result::add);
		return result;
	}

}
