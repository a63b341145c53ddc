package org.springaicommunity.shopify.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link Paginator}.
 *
 * Tests cursor following, page size forcing and item ordering across pages.
 */
@DisplayName("Paginator Tests")
@ExtendWith(MockitoExtension.class)
class PaginatorTest {

	private static final String API_ROOT = "https://test-shop.myshopify.com/admin/api/2023-10/";

	@Mock
	private ShopifyClient mockClient;

	@Captor
	private ArgumentCaptor<Map<String, ?>> queryCaptor;

	private ObjectMapper objectMapper;

	private Paginator paginator;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		paginator = new Paginator(new RequestExecutor(() -> mockClient, objectMapper, new RecordingSleeper()));
	}

	private RestResponse page(String key, int firstId, int count, String linkHeader) {
		ObjectNode body = objectMapper.createObjectNode();
		ArrayNode items = body.putArray(key);
		for (int i = 0; i < count; i++) {
			items.addObject().put("id", firstId + i);
		}
		Map<String, List<String>> headers = linkHeader.isEmpty() ? Map.of() : Map.of("Link", List.of(linkHeader));
		return new RestResponse(200, body.toString(), headers);
	}

	private static String next(String path, String cursor) {
		return "<" + API_ROOT + path + ".json?limit=250&page_info=" + cursor + ">; rel=\"next\"";
	}

	private static String previous(String path, String cursor) {
		return "<" + API_ROOT + path + ".json?limit=250&page_info=" + cursor + ">; rel=\"previous\"";
	}

	private static List<Long> ids(List<JsonNode> items) {
		return items.stream().map(item -> item.path("id").asLong()).toList();
	}

	@Nested
	@DisplayName("Cursor Following Tests")
	class CursorFollowingTest {

		@Test
		@DisplayName("Should collect 250/250/10 items across three pages in order")
		void shouldCollectAllPagesInOrder() {
			when(mockClient.get(eq("products"), any())).thenReturn(page("products", 1, 250, next("products", "p2")))
				.thenReturn(page("products", 251, 250, previous("products", "p1") + ", " + next("products", "p3")))
				.thenReturn(page("products", 501, 10, previous("products", "p2")));

			Map<String, Object> params = new LinkedHashMap<>();
			params.put("status", "active");
			params.put("limit", 50);

			List<JsonNode> products = paginator.fetchAll(ResourceTypes.PRODUCTS, params);

			assertThat(products).hasSize(510);
			assertThat(ids(products)).isEqualTo(java.util.stream.LongStream.rangeClosed(1, 510).boxed().toList());

			verify(mockClient, times(3)).get(eq("products"), queryCaptor.capture());
			List<Map<String, ?>> queries = queryCaptor.getAllValues();

			Map<String, Object> first = new LinkedHashMap<>(queries.get(0));
			assertThat(first).containsEntry("limit", 250).containsEntry("status", "active");

			Map<String, Object> second = new LinkedHashMap<>(queries.get(1));
			assertThat(second).containsOnly(entry("limit", 250), entry("page_info", "p2"));

			Map<String, Object> third = new LinkedHashMap<>(queries.get(2));
			assertThat(third).containsOnly(entry("limit", 250), entry("page_info", "p3"));
		}

		@Test
		@DisplayName("Should force the page size on cursor pages whose link omits it")
		void shouldForcePageSizeWhenLinkOmitsLimit() {
			String nextWithoutLimit = "<" + API_ROOT + "products.json?page_info=p2>; rel=\"next\"";
			when(mockClient.get(eq("products"), any())).thenReturn(page("products", 1, 250, nextWithoutLimit))
				.thenReturn(page("products", 251, 3, ""));

			List<JsonNode> products = paginator.fetchAll(ResourceTypes.PRODUCTS, Map.of("limit", 10));

			assertThat(products).hasSize(253);
			verify(mockClient, times(2)).get(eq("products"), queryCaptor.capture());
			List<Map<String, ?>> queries = queryCaptor.getAllValues();
			assertThat(new LinkedHashMap<String, Object>(queries.get(0))).containsOnly(entry("limit", 250));
			assertThat(new LinkedHashMap<String, Object>(queries.get(1))).containsOnly(entry("page_info", "p2"),
					entry("limit", 250));
		}

		@Test
		@DisplayName("Should stop after a single page without Link header")
		void shouldStopOnSinglePage() {
			when(mockClient.get(eq("custom_collections"), any())).thenReturn(page("custom_collections", 1, 3, ""));

			List<JsonNode> collections = paginator.fetchAll(ResourceTypes.CUSTOM_COLLECTIONS, Map.of());

			assertThat(ids(collections)).containsExactly(1L, 2L, 3L);
			verify(mockClient, times(1)).get(eq("custom_collections"), any());
		}

		@Test
		@DisplayName("Should not modify the caller's parameters")
		void shouldNotModifyCallerParams() {
			when(mockClient.get(eq("products"), any())).thenReturn(page("products", 1, 1, ""));
			Map<String, Object> params = new LinkedHashMap<>();
			params.put("limit", 10);

			paginator.fetchAll(ResourceTypes.PRODUCTS, params);

			assertThat(params).containsOnly(entry("limit", 10));
		}

		@Test
		@DisplayName("Should return an empty list for an empty collection")
		void shouldReturnEmptyList() {
			when(mockClient.get(eq("products"), any())).thenReturn(RestResponse.of(200, "{\"products\":[]}"));

			assertThat(paginator.fetchAll(ResourceTypes.PRODUCTS, Map.of())).isEmpty();
		}

		@Test
		@DisplayName("Should keep duplicates reissued across pages")
		void shouldKeepDuplicates() {
			when(mockClient.get(eq("products"), any())).thenReturn(page("products", 1, 2, next("products", "p2")))
				.thenReturn(page("products", 2, 2, ""));

			List<JsonNode> products = paginator.fetchAll(ResourceTypes.PRODUCTS, Map.of());

			assertThat(ids(products)).containsExactly(1L, 2L, 2L, 3L);
		}

	}

	@Nested
	@DisplayName("Failure Handling Tests")
	class FailureHandlingTest {

		@Test
		@DisplayName("Should absorb a 429 mid-pagination without restarting")
		void shouldAbsorbRateLimitMidPagination() {
			when(mockClient.get(eq("products"), any())).thenReturn(page("products", 1, 250, next("products", "p2")))
				.thenReturn(new RestResponse(429, "{\"errors\":\"Exceeded 2 calls per second\"}",
						Map.of("Retry-After", List.of("2.0"))))
				.thenReturn(page("products", 251, 5, ""));

			List<JsonNode> products = paginator.fetchAll(ResourceTypes.PRODUCTS, Map.of());

			assertThat(products).hasSize(255);
			verify(mockClient, times(3)).get(eq("products"), queryCaptor.capture());
			Map<String, Object> retried = new LinkedHashMap<>(queryCaptor.getAllValues().get(2));
			assertThat(retried).containsEntry("page_info", "p2");
		}

		@Test
		@DisplayName("Should propagate a failure on a later page")
		void shouldPropagateLaterPageFailure() {
			when(mockClient.get(eq("products"), any())).thenReturn(page("products", 1, 250, next("products", "p2")))
				.thenReturn(RestResponse.of(500, "Internal Server Error"));

			assertThatThrownBy(() -> paginator.fetchAll(ResourceTypes.PRODUCTS, Map.of()))
				.isInstanceOf(ShopifyApiException.class);
		}

	}

	@Nested
	@DisplayName("Resource Type Tests")
	class ResourceTypeTest {

		@Test
		@DisplayName("Should use a custom page decoder, cursor and page size")
		void shouldUseCustomResourceType() {
			ResourceType inventoryLevels = new ResourceType() {
				@Override
				public String path() {
					return "inventory_levels";
				}

				@Override
				public String collectionKey() {
					return "inventory_levels";
				}

				@Override
				public int maxPageSize() {
					return 100;
				}

				@Override
				public Optional<PageCursor> nextPage(ApiResponse response) {
					String cursor = response.body().path("next").asText("");
					return cursor.isEmpty() ? Optional.empty() : Optional.of(new PageCursor(Map.of("cursor", cursor)));
				}
			};
			when(mockClient.get(eq("inventory_levels"), any()))
				.thenReturn(RestResponse.of(200, "{\"inventory_levels\":[{\"id\":1}],\"next\":\"c2\"}"))
				.thenReturn(RestResponse.of(200, "{\"inventory_levels\":[{\"id\":2}]}"));

			List<JsonNode> levels = paginator.fetchAll(inventoryLevels, Map.of("location_ids", "655441491"));

			assertThat(ids(levels)).containsExactly(1L, 2L);
			verify(mockClient, times(2)).get(eq("inventory_levels"), queryCaptor.capture());
			Map<String, Object> first = new LinkedHashMap<>(queryCaptor.getAllValues().get(0));
			assertThat(first).containsEntry("limit", 100);
			Map<String, Object> second = new LinkedHashMap<>(queryCaptor.getAllValues().get(1));
			assertThat(second).containsOnly(entry("cursor", "c2"), entry("limit", 100));
		}

		@Test
		@DisplayName("Should build nested collection paths")
		void shouldBuildNestedPaths() {
			assertThat(ResourceTypes.variantsOf(632910392L).path()).isEqualTo("products/632910392/variants");
			assertThat(ResourceTypes.variantsOf(632910392L).collectionKey()).isEqualTo("variants");
			assertThat(ResourceTypes.metafieldsOf("variants", 808950810L).path())
				.isEqualTo("variants/808950810/metafields");
			assertThat(ResourceTypes.of("orders").collectionKey()).isEqualTo("orders");
			assertThat(ResourceTypes.PRODUCTS.maxPageSize()).isEqualTo(250);
		}

	}

}
