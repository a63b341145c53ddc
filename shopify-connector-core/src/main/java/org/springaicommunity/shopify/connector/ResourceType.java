package org.springaicommunity.shopify.connector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A paginated Admin API collection that {@link Paginator} can walk.
 *
 * <p>
 * Implementations know their endpoint, how to pull the items out of one page and how to
 * find the next page. The defaults follow the Admin REST API conventions: items live in
 * an array named after the collection and the next page is announced in the
 * {@code Link} header.
 */
public interface ResourceType {

	/**
	 * Largest page size accepted by the Admin REST API.
	 */
	int MAX_PAGE_SIZE = 250;

	/**
	 * Collection endpoint, relative to the API root (e.g. {@code "products"}).
	 * @return the endpoint path
	 */
	String path();

	/**
	 * Name of the array holding the items in a page body.
	 * @return the collection key
	 */
	String collectionKey();

	default int maxPageSize() {
		return MAX_PAGE_SIZE;
	}

	/**
	 * Extract the items of one page, in server order.
	 * @param body decoded page body
	 * @return the items, empty if the page has none
	 */
	default List<JsonNode> decodePage(JsonNode body) {
		JsonNode items = body.path(collectionKey());
		List<JsonNode> result = new ArrayList<>();
		if (items.isArray()) {
			items.forEach(result::add);
		}
		return result;
	}

	/**
	 * Find the cursor of the page after this one.
	 * @param response the page response
	 * @return the next cursor, or empty if this is the last page
	 */
	default Optional<PageCursor> nextPage(ApiResponse response) {
		return PageCursor.fromLinkHeader(response.header("Link"));
	}

}
