package org.springaicommunity.shopify.connector;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the Shopify connector CLI. Pure Java with no framework
 * dependencies for easy testing.
 */
public class ArgumentParser {

	/**
	 * Commands understood by the CLI.
	 */
	public static final List<String> COMMANDS = List.of("products", "product", "variants", "metafields",
			"inventory-item", "get");

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--id":
					String idStr = getRequiredValue(args, i, "id");
					try {
						config.id = Long.parseLong(idStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException("Invalid id '" + idStr + "': must be a positive integer");
					}
					i++; // Skip next argument since we consumed it
					break;

				case "--owner":
					String owner = getRequiredValue(args, i, "owner").toLowerCase();
					if (!List.of("products", "variants").contains(owner)) {
						throw new IllegalArgumentException(
								"Invalid owner '" + owner + "': must be 'products' or 'variants'");
					}
					config.ownerResource = owner;
					i++;
					break;

				case "-p", "--path":
					config.path = getRequiredValue(args, i, "path");
					i++;
					break;

				case "-q", "--query":
					String pair = getRequiredValue(args, i, "query");
					int eq = pair.indexOf('=');
					if (eq <= 0) {
						throw new IllegalArgumentException("Invalid query '" + pair + "': must be in format key=value");
					}
					config.query.put(pair.substring(0, eq), pair.substring(eq + 1));
					i++;
					break;

				case "--shop":
					config.shop = getRequiredValue(args, i, "shop");
					i++;
					break;

				case "--storage-path":
					config.storagePath = getRequiredValue(args, i, "storage-path");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.command != null) {
						throw new IllegalArgumentException(
								"Unexpected argument '" + arg + "': command already set to '" + config.command + "'");
					}
					config.command = arg.toLowerCase();
					break;
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}
		return config;
	}

	/**
	 * Check if help was requested.
	 * @param args Command-line arguments
	 * @return true if help was requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return args.length == 0;
	}

	/**
	 * Generate help text.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Shopify Connector - read products, variants and metafields from a shop\n");
		help.append("\n");
		help.append("USAGE:\n");
		help.append("    shopify-connector <command> [OPTIONS]\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    products                List every product (all pages)\n");
		help.append("    product --id <id>       Show one product\n");
		help.append("    variants --id <id>      List the variants of a product\n");
		help.append("    metafields --id <id>    List metafields of a product or variant (see --owner)\n");
		help.append("    inventory-item --id <id>\n");
		help.append("                            Find the product owning an inventory item\n");
		help.append("    get --path <path>       Fetch any resource path and print the raw body\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    --id <id>               Resource ID\n");
		help.append("    --owner <resource>      Metafield owner: products, variants (default: products)\n");
		help.append("    -p, --path <path>       Resource path for 'get', e.g. shop or products/count\n");
		help.append("    -q, --query <k=v>       Query parameter for 'get' (repeatable)\n");
		help.append("    --shop <host>           Shop host name, overrides SHOPIFY_HOST_NAME\n");
		help.append("    --storage-path <dir>    Base directory for session bookkeeping (default: storage)\n");
		help.append("    -v, --verbose           Enable debug logging\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    SHOPIFY_API_KEY                   App API key (required)\n");
		help.append("    SHOPIFY_API_SECRET_KEY            App API secret key (required)\n");
		help.append("    SHOPIFY_HOST_NAME                 Shop host name, e.g. my-store.myshopify.com\n");
		help.append("    SHOPIFY_ACCESS_TOKEN              Admin API access token\n");
		help.append("    SHOPIFY_SYNC_PRODUCT_METAFIELDS   Fetch product metafields (default: true)\n");
		help.append("    SHOPIFY_SYNC_VARIANT_METAFIELDS   Fetch variant metafields (default: false)\n");
		help.append("    Variables may also be placed in a .env file\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    shopify-connector products\n");
		help.append("    shopify-connector product --id 632910392\n");
		help.append("    shopify-connector metafields --owner variants --id 808950810\n");
		help.append("    shopify-connector get --path products/count --query status=active\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("A command is required (one of " + String.join(", ", COMMANDS) + ")");
		}
		else if (!COMMANDS.contains(config.command)) {
			errors.add("Unknown command: " + config.command + " (must be one of " + String.join(", ", COMMANDS) + ")");
		}
		else if (List.of("product", "variants", "metafields", "inventory-item").contains(config.command)) {
			if (config.id == null) {
				errors.add("Command '" + config.command + "' requires --id");
			}
			else if (config.id <= 0) {
				errors.add("Id must be positive (got: " + config.id + ")");
			}
		}
		else if ("get".equals(config.command) && (config.path == null || config.path.isBlank())) {
			errors.add("Command 'get' requires --path");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
