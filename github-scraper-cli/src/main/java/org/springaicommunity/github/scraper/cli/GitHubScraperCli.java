package org.springaicommunity.github.scraper.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.scraper.*;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * GitHub Scraper CLI Application
 *
 * Plain Java command-line application to fetch pull requests, commits, diff statistics,
 * issue timelines, comments and repository lists, spreading requests over a pool of tokens. No Spring dependencies
 * - uses GitHubScraperBuilder for service wiring.
 *
 * Usage: java -jar github-scraper-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKENS - comma separated GitHub tokens, GITHUB_TOKEN -
 * single token used when GITHUB_TOKENS is not set
 *
 * Examples: java -jar github-scraper-cli.jar --repo spring-projects/spring-ai --number
 * 4347 java -jar github-scraper-cli.jar --type pr-diff --repo owner/repo --number 12
 * --renew java -jar github-scraper-cli.jar --type list --list-type forks --repo
 * owner/repo --output forks.json
 */
public class GitHubScraperCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubScraperCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Scraping failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) throws Exception {
		return run(args, System.out, null);
	}

	/**
	 * Run the command line with an explicit output stream and, optionally, a prepared
	 * builder (tests supply one with mock clients).
	 */
	static int run(String[] args, PrintStream out, GitHubScraperBuilder preparedBuilder) throws Exception {
		ScraperProperties properties = new ScraperProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		properties.setCacheDirectory(config.cacheDirectory);

		GitHubScraperBuilder builder = preparedBuilder;
		if (builder == null) {
			argumentParser.validateEnvironment(config);
			builder = GitHubScraperBuilder.create();
			if (config.tokenFile != null) {
				builder.tokenFile(Paths.get(config.tokenFile));
			}
			else {
				builder.tokensFromEnv();
			}
		}

		logConfiguration(config);

		ObjectMapper objectMapper = ObjectMapperFactory.create();
		GitHubScraperService scraper = builder.properties(properties).objectMapper(objectMapper).buildScraperService();

		Object result = execute(scraper, config);

		if (config.outputFile != null) {
			Path outputPath = Paths.get(config.outputFile);
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), result);
			logger.info("Wrote {} to {}", config.requestType, outputPath.toAbsolutePath());
		}
		else {
			out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
		}
		return 0;
	}

	private static Object execute(GitHubScraperService scraper, ParsedConfiguration config) {
		switch (config.requestType) {
			case "state":
				return scraper.pullRequestState(config.repository, config.number, config.renew);
			case "commits":
				return scraper.pullRequestCommits(config.repository, config.number, config.renew);
			case "pr-diff":
				return logFiles(scraper.pullRequestDiff(config.repository, config.number, config.renew),
						config.verbose);
			case "commit-diff":
				return logFiles(scraper.commitDiff(config.repository, config.sha, config.renew), config.verbose);
			case "raw-diff":
				return logFiles(scraper.rawPullRequestDiff(config.repository, config.number), config.verbose);
			case "timeline":
				return scraper.issueTimeline(config.repository, config.number, config.renew);
			case "events":
				return scraper.timelineEvents(config.repository, config.number, config.renew);
			case "comments":
				return scraper.issueComments(config.repository, config.number, config.renew);
			case "review-comments":
				return scraper.reviewComments(config.repository, config.number, config.renew);
			case "list":
				return scraper.repositoryList(config.repository,
						GitHubScraperService.ListType.fromName(config.listType), config.renew);
			case "user":
				return scraper.user(config.login);
			default:
				return scraper.pullRequest(config.repository, config.number, config.renew);
		}
	}

	private static List<FileDiffStats> logFiles(List<FileDiffStats> files, boolean verbose) {
		logger.info("Parsed {} file(s)", files.size());
		if (verbose) {
			for (FileDiffStats file : files) {
				logger.info("  - {} (+{} -{})", file.fileName(), file.addedLoc(), file.deletedLoc());
			}
		}
		return files;
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Type: {}", config.requestType);
		logger.info("  Repository: {}", config.repository);
		logger.info("  Number: {}", config.number != null ? config.number : "(not set)");
		logger.info("  SHA: {}", config.sha != null ? config.sha : "(not set)");
		logger.info("  Login: {}", config.login != null ? config.login : "(not set)");
		logger.info("  List type: {}", config.listType);
		logger.info("  Cache directory: {}", config.cacheDirectory);
		logger.info("  Renew: {}", config.renew);
		logger.info("  Token file: {}", config.tokenFile != null ? config.tokenFile : "(environment)");
		logger.info("  Output file: {}", config.outputFile != null ? config.outputFile : "(stdout)");
		logger.info("  Verbose: {}", config.verbose);
	}

}
