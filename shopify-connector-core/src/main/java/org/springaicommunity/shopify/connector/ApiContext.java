package org.springaicommunity.shopify.connector;

import java.nio.file.Path;
import java.util.List;

/**
 * Authentication context shared by every request made through one {@link ShopifyApi}.
 *
 * <p>
 * Holds the app credentials, the requested access scopes and the name of the host that
 * initiates the connection. The {@code hostName} here is the caller's environment, not
 * the shop being called.
 *
 * @param apiKey the app API key
 * @param apiSecretKey the app API secret key
 * @param scopes access scopes requested by the app
 * @param hostName name of the host initiating the connection
 * @param sessionStorageDirectory directory reserved for session bookkeeping; created
 * when the context is initialized if possible
 * @param apiVersion Admin API version, e.g. {@code 2023-10}
 * @param embeddedApp whether the app runs embedded in the Shopify admin
 */
public record ApiContext(String apiKey, String apiSecretKey, List<String> scopes, String hostName,
		Path sessionStorageDirectory, String apiVersion, boolean embeddedApp) {

	/**
	 * Scopes requested by the connector.
	 */
	public static final List<String> DEFAULT_SCOPES = List.of("write_products", "read_products", "read_inventory");

	/**
	 * Host name used when there is no request host, e.g. for console or background runs.
	 */
	public static final String FALLBACK_HOST_NAME = "localhost";

	public ApiContext {
		scopes = List.copyOf(scopes);
	}

	@Override
	public String toString() {
		return "ApiContext[apiKey=" + apiKey + ", scopes=" + scopes + ", hostName=" + hostName + ", apiVersion="
				+ apiVersion + ", embeddedApp=" + embeddedApp + "]";
	}

}
