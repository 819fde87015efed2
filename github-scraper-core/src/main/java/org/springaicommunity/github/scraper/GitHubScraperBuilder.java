package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

/**
 * Builder for creating scraper components without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Tokens from GITHUB_TOKENS / GITHUB_TOKEN
 * GitHubScraperService scraper = GitHubScraperBuilder.create()
 *     .tokensFromEnv()
 *     .buildScraperService();
 *
 * // With a token file and custom limits
 * ScraperProperties props = new ScraperProperties();
 * props.setCacheDirectory("/var/cache/scraper");
 *
 * RequestDispatcher dispatcher = GitHubScraperBuilder.create()
 *     .tokenFile(Path.of("tokens.txt"))
 *     .properties(props)
 *     .buildDispatcher();
 *
 * // For testing with a mock client per token
 * GitHubClient mockClient = mock(GitHubClient.class);
 * RequestDispatcher testDispatcher = GitHubScraperBuilder.create()
 *     .token("test")
 *     .clientFactory(token -> mockClient)
 *     .sleeper(duration -> {})
 *     .buildDispatcher();
 * }
 * </pre>
 */
public class GitHubScraperBuilder {

	private static final Logger logger = LoggerFactory.getLogger(GitHubScraperBuilder.class);

	private final List<String> tokens = new ArrayList<>();

	private ScraperProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private Function<String, GitHubClient> clientFactory;

	@Nullable
	private BlobStore blobStore;

	private Clock clock = Clock.systemUTC();

	private Sleeper sleeper = Sleeper.threadSleeper();

	private Random random = new Random();

	private GitHubScraperBuilder() {
		this.properties = new ScraperProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubScraperBuilder
	 */
	public static GitHubScraperBuilder create() {
		return new GitHubScraperBuilder();
	}

	/**
	 * Add a GitHub token to the pool.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubScraperBuilder token(String token) {
		if (!token.isBlank()) {
			this.tokens.add(token.strip());
		}
		return this;
	}

	/**
	 * Add several GitHub tokens to the pool, in order.
	 * @param tokens GitHub personal access tokens
	 * @return this builder
	 */
	public GitHubScraperBuilder tokens(List<String> tokens) {
		tokens.forEach(this::token);
		return this;
	}

	/**
	 * Add the tokens of the {@code GITHUB_TOKENS} (comma separated) or
	 * {@code GITHUB_TOKEN} environment variable.
	 * @return this builder
	 * @throws ConfigurationException if neither variable is set
	 */
	public GitHubScraperBuilder tokensFromEnv() {
		List<String> fromEnv = EnvironmentSupport.tokens();
		if (fromEnv.isEmpty()) {
			throw new ConfigurationException(
					"GITHUB_TOKENS or GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token(s).");
		}
		return tokens(fromEnv);
	}

	/**
	 * Add the tokens listed in a file, one per line. Blank lines and lines starting with
	 * {@code #} are ignored.
	 * @param tokenFile path of the token file
	 * @return this builder
	 * @throws ConfigurationException if the file cannot be read
	 */
	public GitHubScraperBuilder tokenFile(Path tokenFile) {
		return tokens(readTokenFile(tokenFile));
	}

	/**
	 * Set scraper properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubScraperBuilder properties(@Nullable ScraperProperties properties) {
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
	public GitHubScraperBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the factory creating the HTTP client of each token. Useful for testing with
	 * mocks or for adding decorators.
	 * @param clientFactory maps a token to its client (null to use {@link GitHubHttpClient})
	 * @return this builder
	 */
	public GitHubScraperBuilder clientFactory(@Nullable Function<String, GitHubClient> clientFactory) {
		this.clientFactory = clientFactory;
		return this;
	}

	/**
	 * Set a custom BlobStore for the response cache.
	 * @param blobStore custom BlobStore (null to use a {@link FileSystemBlobStore} rooted
	 * at the configured cache directory)
	 * @return this builder
	 */
	public GitHubScraperBuilder blobStore(@Nullable BlobStore blobStore) {
		this.blobStore = blobStore;
		return this;
	}

	public GitHubScraperBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	public GitHubScraperBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	public GitHubScraperBuilder random(Random random) {
		this.random = random;
		return this;
	}

	/**
	 * Build the credential pool.
	 * @return pool with one credential per configured token
	 * @throws ConfigurationException if no token was configured
	 */
	public CredentialPool buildPool() {
		if (tokens.isEmpty()) {
			throw new ConfigurationException(
					"At least one GitHub token is required. Call token(), tokenFile() or tokensFromEnv() first.");
		}
		Duration timeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
		List<Credential> credentials = new ArrayList<>();
		for (String token : tokens) {
			GitHubClient client = clientFactory != null ? clientFactory.apply(token)
					: new GitHubHttpClient(token, timeout);
			credentials.add(new Credential(token, client));
		}
		logger.debug("Created credential pool with {} token(s)", credentials.size());
		return new CredentialPool(credentials, clock);
	}

	/**
	 * Build a RequestDispatcher over a new credential pool.
	 * @return configured RequestDispatcher
	 */
	public RequestDispatcher buildDispatcher() {
		return RequestDispatcher.builder()
			.pool(buildPool())
			.objectMapper(resolveObjectMapper())
			.sleeper(sleeper)
			.random(random)
			.perPage(properties.getPerPage())
			.maxRateLimitJitter(Duration.ofSeconds(properties.getMaxRateLimitJitterSeconds()))
			.maxServerErrorJitter(Duration.ofSeconds(properties.getMaxServerErrorJitterSeconds()))
			.rateLimitFallbackWindow(Duration.ofSeconds(properties.getRateLimitFallbackSeconds()))
			.build();
	}

	/**
	 * Build a DiffParser with the configured hunk ceiling. Needs no token.
	 * @return configured DiffParser
	 */
	public DiffParser buildDiffParser() {
		return new DiffParser(properties.getMaxHunkLength());
	}

	/**
	 * Build a GitHubScraperService with its dispatcher, parser and cache.
	 * @return configured GitHubScraperService
	 */
	public GitHubScraperService buildScraperService() {
		ObjectMapper mapper = resolveObjectMapper();
		RequestDispatcher dispatcher = buildDispatcher();
		BlobStore store = this.blobStore != null ? this.blobStore
				: new FileSystemBlobStore(Paths.get(properties.getCacheDirectory()));
		CodeFileFilter filter = new CodeFileFilter(CodeFileFilter.loadSuffixes(CodeFileFilter.SUFFIX_RESOURCE),
				properties.getMaxCodeFiles());
		return new GitHubScraperService(dispatcher, store, buildDiffParser(), filter, mapper,
				properties.getMaxFileChanges());
	}

	private ObjectMapper resolveObjectMapper() {
		if (this.objectMapper == null) {
			this.objectMapper = ObjectMapperFactory.create();
		}
		return this.objectMapper;
	}

	static List<String> readTokenFile(Path tokenFile) {
		List<String> lines;
		try {
			lines = Files.readAllLines(tokenFile, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new ConfigurationException("Failed to read token file: " + tokenFile, e);
		}
		List<String> result = new ArrayList<>();
		for (String line : lines) {
			String token = line.strip();
			if (!token.isEmpty() && !token.startsWith("#")) {
				result.add(token);
			}
		}
		return result;
	}

}
