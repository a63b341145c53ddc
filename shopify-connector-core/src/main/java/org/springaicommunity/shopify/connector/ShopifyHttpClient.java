package org.springaicommunity.shopify.connector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shopify Admin REST API client bound to one shop and access token, using the Java 11+
 * {@link HttpClient}.
 *
 * <p>
 * Requests go to {@code https://{shop}/admin/api/{version}/{path}.json} and carry the
 * access token in the {@code X-Shopify-Access-Token} header. Every response is returned
 * as is, whatever its status.
 */
public class ShopifyHttpClient implements ShopifyClient {

	private static final Logger logger = LoggerFactory.getLogger(ShopifyHttpClient.class);

	private static final String USER_AGENT = "shopify-connector";

	private final HttpClient httpClient;

	private final String shop;

	private final String accessToken;

	private final String apiVersion;

	public ShopifyHttpClient(String shop, String accessToken, String apiVersion) {
		this.shop = shop;
		this.accessToken = accessToken;
		this.apiVersion = apiVersion;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	/**
	 * Create a client from a session and the API version of its context.
	 * @param session the session supplying shop and token
	 * @param apiVersion the Admin API version
	 * @return a new client
	 */
	public static ShopifyHttpClient forSession(ShopifySession session, String apiVersion) {
		return new ShopifyHttpClient(session.shop(), session.accessToken(), apiVersion);
	}

	@Override
	public String getShop() {
		return shop;
	}

	public String getApiVersion() {
		return apiVersion;
	}

	@Override
	public RestResponse get(String path, Map<String, ?> query) {
		URI uri = buildUri(path, query);
		logger.debug("GET {}", uri);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(uri)
			.header("X-Shopify-Access-Token", accessToken)
			.header("Accept", "application/json")
			.header("User-Agent", USER_AGENT)
			.GET()
			.build();

		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			logger.debug("GET {} returned {} in {}ms ({} bytes)", uri, response.statusCode(),
					System.currentTimeMillis() - start, response.body().length());
			return new RestResponse(response.statusCode(), response.body(), response.headers().map());
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new ShopifyApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ShopifyApiException("HTTP request interrupted", e);
		}
	}

	/**
	 * Build the request URI for a path and query.
	 * @param path relative resource path or full URL
	 * @param query query parameters
	 * @return the absolute URI
	 */
	URI buildUri(String path, Map<String, ?> query) {
		String url;
		if (path.startsWith("http://") || path.startsWith("https://")) {
			url = path;
		}
		else {
			String host = shop.replaceFirst("^https?://", "").replaceAll("/+$", "");
			String resource = path.replaceAll("^/+", "");
			if (!resource.endsWith(".json")) {
				resource = resource + ".json";
			}
			url = "https://" + host + "/admin/api/" + apiVersion + "/" + resource;
		}

		String queryString = QueryStringEncoder.encode(query);
		if (!queryString.isEmpty()) {
			url += (url.contains("?") ? "&" : "?") + queryString;
		}
		return URI.create(url);
	}

}
