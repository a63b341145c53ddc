package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration properties for the Shopify connector.
 *
 * <p>
 * Credential properties may hold either a literal value or a reference to an
 * environment variable ({@code $NAME} or {@code ${NAME}}). References are resolved
 * through {@link EnvironmentSupport} when the session is first built, not when the
 * property is set, so the environment can be populated late.
 *
 * <p>
 * Default values point every credential at its conventional environment variable.
 */
public class ConnectorProperties {

	/**
	 * Directory name, under {@link #getStoragePath()}, used for session bookkeeping.
	 */
	public static final String SESSION_DIRECTORY = "shopify_api_sessions";

	/**
	 * Shopify app API key.
	 */
	@Nullable
	private String apiKey = "$SHOPIFY_API_KEY";

	/**
	 * Shopify app API secret key.
	 */
	@Nullable
	private String apiSecretKey = "$SHOPIFY_API_SECRET_KEY";

	/**
	 * Host name of the shop to connect to, e.g. {@code my-store.myshopify.com}.
	 */
	@Nullable
	private String hostName = "$SHOPIFY_HOST_NAME";

	/**
	 * Pre-issued offline Admin API access token.
	 */
	@Nullable
	private String accessToken = "$SHOPIFY_ACCESS_TOKEN";

	/**
	 * Whether product metafields are fetched.
	 */
	private boolean syncProductMetafields = true;

	/**
	 * Whether variant metafields are fetched.
	 */
	private boolean syncVariantMetafields = false;

	/**
	 * Base directory for files written by the connector.
	 */
	private String storagePath = "storage";

	@Nullable
	public String getApiKey() {
		return apiKey;
	}

	public void setApiKey(@Nullable String apiKey) {
		this.apiKey = apiKey;
	}

	@Nullable
	public String getApiSecretKey() {
		return apiSecretKey;
	}

	public void setApiSecretKey(@Nullable String apiSecretKey) {
		this.apiSecretKey = apiSecretKey;
	}

	@Nullable
	public String getHostName() {
		return hostName;
	}

	public void setHostName(@Nullable String hostName) {
		this.hostName = hostName;
	}

	@Nullable
	public String getAccessToken() {
		return accessToken;
	}

	public void setAccessToken(@Nullable String accessToken) {
		this.accessToken = accessToken;
	}

	public boolean isSyncProductMetafields() {
		return syncProductMetafields;
	}

	public void setSyncProductMetafields(boolean syncProductMetafields) {
		this.syncProductMetafields = syncProductMetafields;
	}

	public boolean isSyncVariantMetafields() {
		return syncVariantMetafields;
	}

	public void setSyncVariantMetafields(boolean syncVariantMetafields) {
		this.syncVariantMetafields = syncVariantMetafields;
	}

	public String getStoragePath() {
		return storagePath;
	}

	public void setStoragePath(String storagePath) {
		this.storagePath = storagePath;
	}

	/**
	 * Returns the directory handed to the session storage.
	 * @return {@code <storagePath>/shopify_api_sessions}
	 */
	public Path getSessionStorageDirectory() {
		return Paths.get(storagePath, SESSION_DIRECTORY);
	}

}
