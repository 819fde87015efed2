package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Spring configuration exposing the dispatcher, diff parser and scraper service as beans.
 *
 * <p>
 * Tokens are read from the {@code GITHUB_TOKENS} property (comma separated), then
 * {@code GITHUB_TOKEN}, then the {@code .env} lookup of {@link EnvironmentSupport}.
 */
@Configuration
public class ScraperConfig {

	@Value("${GITHUB_TOKENS:}")
	private String githubTokens;

	@Value("${GITHUB_TOKEN:}")
	private String githubToken;

	@Bean
	public ScraperProperties scraperProperties() {
		return new ScraperProperties();
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public CredentialPool credentialPool(ScraperProperties properties) {
		List<String> tokens = EnvironmentSupport.splitTokens(githubTokens);
		if (tokens.isEmpty()) {
			tokens = EnvironmentSupport.splitTokens(githubToken);
		}
		if (tokens.isEmpty()) {
			tokens = EnvironmentSupport.tokens();
		}
		return CredentialPool.fromTokens(tokens, Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
				Clock.systemUTC());
	}

	@Bean
	public RequestDispatcher requestDispatcher(CredentialPool credentialPool, ObjectMapper objectMapper,
			ScraperProperties properties) {
		return RequestDispatcher.builder()
			.pool(credentialPool)
			.objectMapper(objectMapper)
			.sleeper(Sleeper.threadSleeper())
			.random(new Random())
			.perPage(properties.getPerPage())
			.maxRateLimitJitter(Duration.ofSeconds(properties.getMaxRateLimitJitterSeconds()))
			.maxServerErrorJitter(Duration.ofSeconds(properties.getMaxServerErrorJitterSeconds()))
			.rateLimitFallbackWindow(Duration.ofSeconds(properties.getRateLimitFallbackSeconds()))
			.build();
	}

	@Bean
	public DiffParser diffParser(ScraperProperties properties) {
		return new DiffParser(properties.getMaxHunkLength());
	}

	@Bean
	public CodeFileFilter codeFileFilter(ScraperProperties properties) {
		return new CodeFileFilter(CodeFileFilter.loadSuffixes(CodeFileFilter.SUFFIX_RESOURCE),
				properties.getMaxCodeFiles());
	}

	@Bean
	public BlobStore blobStore(ScraperProperties properties) {
		return new FileSystemBlobStore(Paths.get(properties.getCacheDirectory()));
	}

	@Bean
	public GitHubScraperService gitHubScraperService(RequestDispatcher requestDispatcher, BlobStore blobStore,
			DiffParser diffParser, CodeFileFilter codeFileFilter, ObjectMapper objectMapper,
			ScraperProperties properties) {
		return new GitHubScraperService(requestDispatcher, blobStore, diffParser, codeFileFilter, objectMapper,
				properties.getMaxFileChanges());
	}

}
