package org.springaicommunity.shopify.connector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for request URI construction in {@link ShopifyHttpClient}. No network access.
 */
@DisplayName("ShopifyHttpClient Tests")
class ShopifyHttpClientTest {

	private ShopifyHttpClient client;

	@BeforeEach
	void setUp() {
		client = new ShopifyHttpClient("test-shop.myshopify.com", "shpat_test_token", "2023-10");
	}

	@Nested
	@DisplayName("URI Construction Tests")
	class UriTest {

		@Test
		@DisplayName("Should build the versioned JSON resource URI")
		void shouldBuildResourceUri() {
			assertThat(client.buildUri("products", Map.of()))
				.hasToString("https://test-shop.myshopify.com/admin/api/2023-10/products.json");
		}

		@Test
		@DisplayName("Should strip leading slashes and keep an existing .json suffix")
		void shouldNormalizePath() {
			assertThat(client.buildUri("/products/42/variants", Map.of()))
				.hasToString("https://test-shop.myshopify.com/admin/api/2023-10/products/42/variants.json");
			assertThat(client.buildUri("products/count.json", Map.of()))
				.hasToString("https://test-shop.myshopify.com/admin/api/2023-10/products/count.json");
		}

		@Test
		@DisplayName("Should accept a shop given with a scheme")
		void shouldStripSchemeFromShop() {
			ShopifyHttpClient schemed = new ShopifyHttpClient("https://test-shop.myshopify.com/", "token", "2023-10");

			assertThat(schemed.buildUri("shop", Map.of()))
				.hasToString("https://test-shop.myshopify.com/admin/api/2023-10/shop.json");
		}

		@Test
		@DisplayName("Should append the encoded query")
		void shouldAppendQuery() {
			Map<String, Object> query = new LinkedHashMap<>();
			query.put("limit", 250);
			query.put("status", "active");

			assertThat(client.buildUri("products", query))
				.hasToString("https://test-shop.myshopify.com/admin/api/2023-10/products.json?limit=250&status=active");
		}

		@Test
		@DisplayName("Should use absolute URLs as given and extend their query")
		void shouldUseAbsoluteUrl() {
			String next = "https://test-shop.myshopify.com/admin/api/2023-10/products.json?limit=250";

			assertThat(client.buildUri(next, Map.of("page_info", "abc"))).hasToString(next + "&page_info=abc");
		}

	}

	@Test
	@DisplayName("Should bind shop and version from a session")
	void shouldCreateFromSession() {
		ShopifyHttpClient fromSession = ShopifyHttpClient
			.forSession(ShopifySession.offline("other-shop.myshopify.com", "token"), "2023-10");

		assertThat(fromSession.getShop()).isEqualTo("other-shop.myshopify.com");
		assertThat(fromSession.getApiVersion()).isEqualTo("2023-10");
	}

}
