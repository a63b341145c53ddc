package org.springaicommunity.shopify.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Entry point to the Shopify Admin REST API.
 *
 * <p>
 * Owns the session and client binding for one shop. Both are built on first use and
 * cached for the life of this instance: the session from {@link ConnectorProperties}
 * (environment references are resolved at that moment), the client from the session.
 * If the API key or secret cannot be resolved no session is created and
 * {@link #getSession()} returns empty; this is the "not configured" state, not an
 * error.
 *
 * <p>
 * Single requests go through {@link RequestExecutor}, collections through
 * {@link Paginator}.
 */
public class ShopifyApi {

	private static final Logger logger = LoggerFactory.getLogger(ShopifyApi.class);

	/**
	 * Admin REST API version used for every request.
	 */
	public static final String API_VERSION = "2023-10";

	private final ConnectorProperties properties;

	private final BiFunction<ShopifySession, ApiContext, ShopifyClient> clientFactory;

	@Nullable
	private final String requestHostName;

	private final RequestExecutor executor;

	private final Paginator paginator;

	@Nullable
	private ApiContext context;

	@Nullable
	private ShopifySession session;

	@Nullable
	private ShopifyClient client;

	/**
	 * Create the API service. Prefer {@link ShopifyConnectorBuilder}.
	 * @param properties connector configuration
	 * @param objectMapper mapper used for decoding responses
	 * @param clientFactory builds the client binding from the session and context
	 * @param sleeper used for request pacing and rate limit backoff
	 * @param requestHostName host name of the request that triggered this connection, or
	 * null for console and background use
	 */
	public ShopifyApi(ConnectorProperties properties, ObjectMapper objectMapper,
			BiFunction<ShopifySession, ApiContext, ShopifyClient> clientFactory, Sleeper sleeper,
			@Nullable String requestHostName) {
		this.properties = properties;
		this.clientFactory = clientFactory;
		this.requestHostName = requestHostName;
		this.executor = new RequestExecutor(this::getClient, objectMapper, sleeper);
		this.paginator = new Paginator(executor);
	}

	public ConnectorProperties getProperties() {
		return properties;
	}

	/**
	 * Returns the session, creating it and the API context on first call. The session
	 * storage directory is created at the same time; if that fails a warning is logged and
	 * the session is created anyway.
	 * @return the session, or empty if the API key or secret is not configured
	 */
	public synchronized Optional<ShopifySession> getSession() {
		if (session != null) {
			return Optional.of(session);
		}

		String apiKey = EnvironmentSupport.resolve(properties.getApiKey());
		String apiSecretKey = EnvironmentSupport.resolve(properties.getApiSecretKey());
		if (isBlank(apiKey) || isBlank(apiSecretKey)) {
			logger.debug("Shopify API key or secret not configured");
			return Optional.empty();
		}

		ApiContext apiContext = getOrInitializeContext(apiKey, apiSecretKey);

		String shop = EnvironmentSupport.resolve(properties.getHostName());
		String accessToken = EnvironmentSupport.resolve(properties.getAccessToken());
		if (isBlank(shop) || isBlank(accessToken)) {
			logger.warn("Shopify shop host name or access token is empty; requests will fail");
		}

		this.session = ShopifySession.offline(shop != null ? shop : "", accessToken != null ? accessToken : "");
		logger.info("Created offline session for shop {} (API version {})", session.shop(),
				apiContext.apiVersion());
		return Optional.of(session);
	}

	/**
	 * Returns the client binding, creating it from the session on first call.
	 * @return the cached client
	 * @throws IllegalStateException if no session can be created
	 */
	public synchronized ShopifyClient getClient() {
		if (client == null) {
			ShopifySession current = getSession().orElseThrow(() -> new IllegalStateException(
					"Shopify API is not configured. Set the API key and API secret key."));
			this.client = clientFactory.apply(current, requireContext());
			logger.debug("Created client for shop {}", current.shop());
		}
		return client;
	}

	/**
	 * Returns the API context, if a session has been created.
	 * @return the context, or empty before the first successful {@link #getSession()}
	 */
	public synchronized Optional<ApiContext> getContext() {
		return Optional.ofNullable(context);
	}

	/**
	 * Fetch a single resource. The decoded body is returned unchanged; unpacking it is
	 * the caller's job.
	 * @param path resource path relative to the API root, e.g. {@code "products/42"}
	 * @param query query parameters
	 * @return the decoded body
	 * @throws ShopifyApiException if the request fails
	 * @throws IllegalStateException if the API is not configured
	 */
	public JsonNode fetchOne(String path, Map<String, ?> query) {
		return executor.fetchOne(path, query);
	}

	public JsonNode fetchOne(String path) {
		return fetchOne(path, Map.of());
	}

	/**
	 * Fetch every item of a paginated collection.
	 * @param type the collection
	 * @param params filters for the first page
	 * @return all items, in page order
	 * @throws ShopifyApiException if any page fails
	 * @throws IllegalStateException if the API is not configured
	 */
	public List<JsonNode> fetchAll(ResourceType type, Map<String, ?> params) {
		return paginator.fetchAll(type, params);
	}

	public List<JsonNode> fetchAll(ResourceType type) {
		return fetchAll(type, Map.of());
	}

	private ApiContext getOrInitializeContext(String apiKey, String apiSecretKey) {
		if (context == null) {
			String hostName = !isBlank(requestHostName) ? requestHostName : ApiContext.FALLBACK_HOST_NAME;
			Path sessionDirectory = prepareSessionDirectory(properties.getSessionStorageDirectory());
			this.context = new ApiContext(apiKey, apiSecretKey, ApiContext.DEFAULT_SCOPES, hostName, sessionDirectory,
					API_VERSION, false);
			logger.info("Initialized Shopify API context for host {} with scopes {}", hostName,
					ApiContext.DEFAULT_SCOPES);
		}
		return context;
	}

	private static Path prepareSessionDirectory(Path directory) {
		try {
			Files.createDirectories(directory);
			logger.debug("Session storage directory: {}", directory);
		}
		catch (IOException e) {
			logger.warn("Could not create session storage directory {}: {}", directory, e.getMessage());
		}
		return directory;
	}

	private ApiContext requireContext() {
		if (context == null) {
			throw new IllegalStateException("Shopify API context has not been initialized");
		}
		return context;
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

}
