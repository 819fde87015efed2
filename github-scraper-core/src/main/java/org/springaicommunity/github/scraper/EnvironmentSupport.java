package org.springaicommunity.github.scraper;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

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

	/**
	 * Comma separated list of tokens for the credential pool.
	 */
	public static final String TOKENS_VARIABLE = "GITHUB_TOKENS";

	/**
	 * Single token, used when {@value #TOKENS_VARIABLE} is not set.
	 */
	public static final String TOKEN_VARIABLE = "GITHUB_TOKEN";

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
	 * Tokens configured in the environment: {@value #TOKENS_VARIABLE} if set, otherwise
	 * {@value #TOKEN_VARIABLE}.
	 * @return the tokens, empty if neither variable is set
	 */
	public static List<String> tokens() {
		String tokens = get(TOKENS_VARIABLE);
		if (tokens == null || tokens.isBlank()) {
			tokens = get(TOKEN_VARIABLE);
		}
		return splitTokens(tokens);
	}

	static List<String> splitTokens(@Nullable String value) {
		if (value == null) {
			return List.of();
		}
		return Arrays.stream(value.split(","))
			.map(String::strip)
			.filter(token -> !token.isEmpty())
			.collect(Collectors.toList());
	}

}
