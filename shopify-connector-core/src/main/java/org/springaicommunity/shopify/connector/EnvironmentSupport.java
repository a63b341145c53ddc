package org.springaicommunity.shopify.connector;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves environment variables by checking a {@code .env} file first, then falling back
 * to the system environment. The {@code .env} file is loaded once and cached for the
 * lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	private static final Pattern REFERENCE = Pattern.compile("^\\$(?:\\{([A-Za-z_][A-Za-z0-9_]*)}|([A-Za-z_][A-Za-z0-9_]*))$");

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Resolve a configuration value that may reference an environment variable. Values of
	 * the form {@code $NAME} or {@code ${NAME}} are replaced by the variable's value; any
	 * other value is returned unchanged.
	 * @param value the raw configuration value
	 * @return the resolved value, or {@code null} if the value is null or references an
	 * undefined variable
	 */
	@Nullable
	public static String resolve(@Nullable String value) {
		if (value == null) {
			return null;
		}
		Matcher matcher = REFERENCE.matcher(value.trim());
		if (!matcher.matches()) {
			return value;
		}
		String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
		return get(name);
	}

}
