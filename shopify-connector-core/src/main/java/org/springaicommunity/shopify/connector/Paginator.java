package org.springaicommunity.shopify.connector;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects every item of a paginated collection by following page cursors.
 *
 * <p>
 * The page size is forced to the resource type's maximum on every request. The first
 * page is requested with the caller's parameters; each later page is requested with the
 * cursor's query alone plus the page size, since the cursor already encodes the original
 * filters. Pages are fetched strictly one after another through {@link RequestExecutor}, so a 429 on any
 * page is retried without restarting the collection.
 *
 * <p>
 * Items are returned in page order with no deduplication. Walking stops only when a
 * page arrives without a next cursor; a server that keeps returning one is followed
 * indefinitely.
 */
public class Paginator {

	private static final Logger logger = LoggerFactory.getLogger(Paginator.class);

	/**
	 * Query parameter that sets the page size.
	 */
	public static final String LIMIT_PARAM = "limit";

	private final RequestExecutor executor;

	public Paginator(RequestExecutor executor) {
		this.executor = executor;
	}

	/**
	 * Fetch every item of a collection.
	 * @param type the collection to walk
	 * @param params filters for the first page; any page size is overridden
	 * @return all items across all pages, in order
	 * @throws ShopifyApiException if any page fails
	 */
	public List<JsonNode> fetchAll(ResourceType type, Map<String, ?> params) {
		List<JsonNode> resources = new ArrayList<>();
		Optional<PageCursor> cursor = Optional.empty();
		int pages = 0;

		do {
			Map<String, ?> query = withPageSize(cursor.<Map<String, ?>>map(PageCursor::query).orElse(params), type);
			ApiResponse response = executor.execute(type.path(), query);
			List<JsonNode> page = type.decodePage(response.body());
			resources.addAll(page);
			pages++;
			logger.debug("Fetched page {} of {} with {} items (total: {})", pages, type.path(), page.size(),
					resources.size());
			cursor = type.nextPage(response);
		}
		while (cursor.isPresent());

		logger.info("Fetched {} {} in {} pages", resources.size(), type.collectionKey(), pages);
		return resources;
	}

	private static Map<String, Object> withPageSize(Map<String, ?> query, ResourceType type) {
		Map<String, Object> sized = new LinkedHashMap<>(query);
		sized.put(LIMIT_PARAM, type.maxPageSize());
		return sized;
	}

}
