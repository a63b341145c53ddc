package org.springaicommunity.shopify.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.function.BiFunction;

/**
 * Builder for wiring the Shopify connector services.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Credentials from SHOPIFY_* environment variables (the defaults)
 * ResourceService resources = ShopifyConnectorBuilder.create()
 *     .buildResourceService();
 *
 * // Explicit configuration
 * ConnectorProperties props = new ConnectorProperties();
 * props.setHostName("my-store.myshopify.com");
 * props.setAccessToken("shpat_xxxxx");
 *
 * ShopifyApi api = ShopifyConnectorBuilder.create()
 *     .properties(props)
 *     .buildApi();
 *
 * // For testing with a mock transport
 * ShopifyClient mockClient = mock(ShopifyClient.class);
 * ShopifyApi testApi = ShopifyConnectorBuilder.create()
 *     .properties(props)
 *     .httpClient(mockClient)
 *     .sleeper(duration -> {})
 *     .buildApi();
 * }
 * </pre>
 */
public class ShopifyConnectorBuilder {

	private ConnectorProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private BiFunction<ShopifySession, ApiContext, ShopifyClient> clientFactory;

	@Nullable
	private Sleeper sleeper;

	@Nullable
	private String requestHostName;

	private ShopifyConnectorBuilder() {
		this.properties = new ConnectorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ShopifyConnectorBuilder
	 */
	public static ShopifyConnectorBuilder create() {
		return new ShopifyConnectorBuilder();
	}

	/**
	 * Set connector properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ShopifyConnectorBuilder properties(@Nullable ConnectorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ShopifyConnectorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Use a fixed {@link ShopifyClient} instead of building one from the session. Useful
	 * for testing with mocks. Credentials are still required for the session to exist.
	 * @param httpClient custom client (null to use default)
	 * @return this builder
	 */
	public ShopifyConnectorBuilder httpClient(@Nullable ShopifyClient httpClient) {
		this.clientFactory = httpClient != null ? (session, context) -> httpClient : null;
		return this;
	}

	/**
	 * Set the factory that builds the client binding from the session and context.
	 * @param clientFactory custom factory (null to use default)
	 * @return this builder
	 */
	public ShopifyConnectorBuilder clientFactory(
			@Nullable BiFunction<ShopifySession, ApiContext, ShopifyClient> clientFactory) {
		this.clientFactory = clientFactory;
		return this;
	}

	/**
	 * Set the sleeper used for request pacing and rate limit backoff.
	 * @param sleeper custom sleeper (null to use {@link Sleeper#threadSleeper()})
	 * @return this builder
	 */
	public ShopifyConnectorBuilder sleeper(@Nullable Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Set the host name of the request that initiates the connection. Leave unset for
	 * console and background use.
	 * @param requestHostName the request host name (null for none)
	 * @return this builder
	 */
	public ShopifyConnectorBuilder requestHostName(@Nullable String requestHostName) {
		this.requestHostName = requestHostName;
		return this;
	}

	/**
	 * Build the ShopifyApi.
	 * @return configured ShopifyApi
	 */
	public ShopifyApi buildApi() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		BiFunction<ShopifySession, ApiContext, ShopifyClient> factory = this.clientFactory != null
				? this.clientFactory : (session, context) -> ShopifyHttpClient.forSession(session, context.apiVersion());
		Sleeper pause = this.sleeper != null ? this.sleeper : Sleeper.threadSleeper();
		return new ShopifyApi(properties, mapper, factory, pause, requestHostName);
	}

	/**
	 * Build a ResourceService on top of a new ShopifyApi.
	 * @return configured ResourceService
	 */
	public ResourceService buildResourceService() {
		return new ShopifyResourceService(buildApi());
	}

}
