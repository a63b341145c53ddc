package org.springaicommunity.shopify.connector;

import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Command to run
	@Nullable
	public String command;

	// Resource selection
	@Nullable
	public Long id;

	public String ownerResource = "products";

	@Nullable
	public String path;

	public Map<String, String> query = new LinkedHashMap<>();

	// Connection overrides
	@Nullable
	public String shop;

	@Nullable
	public String storagePath;

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

}
