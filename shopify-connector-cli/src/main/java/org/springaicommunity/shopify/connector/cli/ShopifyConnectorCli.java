package org.springaicommunity.shopify.connector.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.shopify.connector.*;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shopify Connector CLI Application
 *
 * Plain Java command-line application that reads products, variants and metafields from
 * a shop and prints them as JSON. Uses ShopifyConnectorBuilder for service wiring.
 *
 * Usage: java -jar shopify-connector-cli.jar <command> [OPTIONS]
 *
 * Environment Variables: SHOPIFY_API_KEY, SHOPIFY_API_SECRET_KEY, SHOPIFY_HOST_NAME,
 * SHOPIFY_ACCESS_TOKEN
 *
 * Examples: java -jar shopify-connector-cli.jar products java -jar
 * shopify-connector-cli.jar product --id 632910392 java -jar shopify-connector-cli.jar
 * get --path shop
 */
public class ShopifyConnectorCli {

	private static final Logger logger = LoggerFactory.getLogger(ShopifyConnectorCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_NOT_CONFIGURED = 2;

	public static void main(String[] args) {
		try {
			int exitCode = run(args, propertiesFromEnvironment(), ShopifyConnectorBuilder.create(), System.out);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Command failed: {}", e.getMessage());
			System.exit(EXIT_FAILURE);
		}
	}

	/**
	 * Run one command.
	 * @param args command-line arguments
	 * @param properties base configuration; command-line overrides are applied to it
	 * @param builder builder used to wire the services
	 * @param out where results are printed
	 * @return the process exit code
	 */
	public static int run(String[] args, ConnectorProperties properties, ShopifyConnectorBuilder builder,
			PrintStream out) throws Exception {
		ArgumentParser argumentParser = new ArgumentParser();

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		if (config.verbose) {
			enableDebugLogging();
		}
		applyOverrides(config, properties);
		logConfiguration(config, properties);

		ObjectMapper objectMapper = ObjectMapperFactory.create();
		ShopifyApi api = builder.properties(properties).objectMapper(objectMapper).buildApi();

		if (api.getSession().isEmpty()) {
			logger.error("Shopify API is not configured: set SHOPIFY_API_KEY and SHOPIFY_API_SECRET_KEY");
			return EXIT_NOT_CONFIGURED;
		}

		try {
			Object result = execute(config, api, new ShopifyResourceService(api));
			out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
			return EXIT_OK;
		}
		catch (ShopifyApiException e) {
			logger.error("Shopify API request failed (status {}): {}", e.getStatusCode(), e.getMessage());
			if (config.verbose && e.getResponseBody() != null) {
				logger.error("Response body: {}", e.getResponseBody());
			}
			return EXIT_FAILURE;
		}
	}

	private static Object execute(ParsedConfiguration config, ShopifyApi api, ResourceService resources) {
		String command = config.command != null ? config.command : "";
		long id = config.id != null ? config.id : 0L;

		switch (command) {
			case "products":
				return resources.getAllProducts();
			case "product":
				return resources.getProductByShopifyId(id);
			case "variants":
				return resources.getVariantsByProductId(id);
			case "metafields":
				return "variants".equals(config.ownerResource) ? resources.getMetafieldsByVariantId(id)
						: resources.getMetafieldsByProductId(id);
			case "inventory-item":
				Optional<Long> productId = resources.getProductIdByInventoryItemId(id);
				Map<String, Object> lookup = new LinkedHashMap<>();
				lookup.put("inventory_item_id", id);
				lookup.put("product_id", productId.orElse(null));
				return lookup;
			case "get":
				return api.fetchOne(config.path != null ? config.path : "", config.query);
			default:
				throw new IllegalArgumentException("Unknown command: " + command);
		}
	}

	/**
	 * Build connector properties from the environment. Credentials stay as
	 * {@code $VAR} references and are resolved when the session is created.
	 * @return the properties
	 */
	static ConnectorProperties propertiesFromEnvironment() {
		ConnectorProperties properties = new ConnectorProperties();
		String syncProduct = EnvironmentSupport.get("SHOPIFY_SYNC_PRODUCT_METAFIELDS");
		if (syncProduct != null && !syncProduct.isBlank()) {
			properties.setSyncProductMetafields(Boolean.parseBoolean(syncProduct.trim()));
		}
		String syncVariant = EnvironmentSupport.get("SHOPIFY_SYNC_VARIANT_METAFIELDS");
		if (syncVariant != null && !syncVariant.isBlank()) {
			properties.setSyncVariantMetafields(Boolean.parseBoolean(syncVariant.trim()));
		}
		String storagePath = EnvironmentSupport.get("SHOPIFY_STORAGE_PATH");
		if (storagePath != null && !storagePath.isBlank()) {
			properties.setStoragePath(storagePath.trim());
		}
		return properties;
	}

	private static void applyOverrides(ParsedConfiguration config, ConnectorProperties properties) {
		if (config.shop != null) {
			properties.setHostName(config.shop);
		}
		if (config.storagePath != null) {
			properties.setStoragePath(config.storagePath);
		}
	}

	private static void enableDebugLogging() {
		org.slf4j.Logger root = LoggerFactory.getLogger("org.springaicommunity.shopify");
		if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config, ConnectorProperties properties) {
		logger.info("Configuration:");
		logger.info("  Command: {}", config.command);
		logger.info("  Id: {}", config.id != null ? config.id : "(not set)");
		logger.info("  Shop: {}", properties.getHostName());
		logger.info("  Storage path: {}", properties.getStoragePath());
		logger.info("  Sync product metafields: {}", properties.isSyncProductMetafields());
		logger.info("  Sync variant metafields: {}", properties.isSyncVariantMetafields());
		if ("metafields".equals(config.command)) {
			logger.info("  Owner: {}", config.ownerResource);
		}
		if ("get".equals(config.command)) {
			logger.info("  Path: {}", config.path);
			logger.info("  Query: {}", config.query);
		}
	}

}
