package org.springaicommunity.github.scraper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line argument parser for the scraper. Pure Java implementation with no Spring
 * dependencies for maximum testability.
 */
public class ArgumentParser {

	static final List<String> REQUEST_TYPES = List.of("pr", "state", "commits", "pr-diff", "commit-diff", "raw-diff",
			"timeline", "events", "comments", "review-comments", "list", "user");

	private static final List<String> NUMBERED_TYPES = List.of("pr", "state", "commits", "pr-diff", "raw-diff",
			"timeline", "events", "comments", "review-comments");

	private final ScraperProperties defaultProperties;

	public ArgumentParser(ScraperProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-t", "--type":
					String type = getRequiredValue(args, i, "type").toLowerCase(Locale.ROOT);
					if (!REQUEST_TYPES.contains(type)) {
						throw new IllegalArgumentException(
								"Invalid type '" + type + "': must be one of " + String.join(", ", REQUEST_TYPES));
					}
					config.requestType = type;
					i++;
					break;

				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repository");
					i++;
					break;

				case "-n", "--number":
					config.number = parsePositive(getRequiredValue(args, i, "number"), "pull request number");
					i++;
					break;

				case "--sha":
					config.sha = getRequiredValue(args, i, "sha");
					i++;
					break;

				case "--login":
					config.login = getRequiredValue(args, i, "login");
					i++;
					break;

				case "--list-type":
					String listType = getRequiredValue(args, i, "list-type");
					GitHubScraperService.ListType.fromName(listType);
					config.listType = listType.toLowerCase(Locale.ROOT);
					i++;
					break;

				case "--cache-dir":
					config.cacheDirectory = getRequiredValue(args, i, "cache-dir");
					i++;
					break;

				case "--renew":
					config.renew = true;
					break;

				case "--token-file":
					config.tokenFile = getRequiredValue(args, i, "token-file");
					i++;
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
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
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-scraper [OPTIONS]\n");
		help.append("\n");
		help.append("Fetch pull request, commit and repository data from the GitHub REST API,\n");
		help.append("rotating over a pool of tokens and caching responses on disk.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -t, --type <type>       What to fetch (default: pr):\n");
		help.append("                              pr          pull request details\n");
		help.append("                              state       pull request state (open or closed)\n");
		help.append("                              commits     pull request commits\n");
		help.append("                              pr-diff     per-file diff statistics of a pull request\n");
		help.append("                              commit-diff per-file diff statistics of a commit\n");
		help.append("                              raw-diff    statistics parsed from the .diff media type\n");
		help.append("                              timeline    raw timeline events of an issue or pull request\n");
		help.append("                              events      flattened timeline events\n");
		help.append("                              comments    conversation comments of an issue or pull request\n");
		help.append("                              review-comments  review comments on a pull request diff\n");
		help.append("                              list        repository list (see --list-type)\n");
		help.append("                              user        public profile of a user (see --login)\n");
		help.append("    -r, --repo REPO         Repository in format owner/repo (required)\n");
		help.append("    -n, --number <number>   Pull request or issue number\n");
		help.append("    --sha <sha>             Commit SHA (for commit-diff)\n");
		help.append("    --login <login>         GitHub login (for user)\n");
		help.append("    --list-type <type>      pulls, issues, branches, forks (default: pulls)\n");
		help.append("\n");
		help.append("CACHE OPTIONS:\n");
		help.append("    --cache-dir DIR         Cache directory (default: ")
			.append(defaultProperties.getCacheDirectory())
			.append(")\n");
		help.append("    --renew                 Ignore cached entries and fetch again\n");
		help.append("\n");
		help.append("OUTPUT OPTIONS:\n");
		help.append("    -o, --output <file>     Write JSON to a file instead of standard output\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("CREDENTIALS:\n");
		help.append("    --token-file FILE       File with one GitHub token per line\n");
		help.append("    GITHUB_TOKENS           Comma separated GitHub tokens (environment or .env)\n");
		help.append("    GITHUB_TOKEN            Single GitHub token, used when GITHUB_TOKENS is not set\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-scraper --type pr --repo spring-projects/spring-ai --number 4347\n");
		help.append("    github-scraper --type pr-diff --repo owner/repo --number 12 --renew\n");
		help.append("    github-scraper --type commit-diff --repo owner/repo --sha 3f2a9c1\n");
		help.append("    github-scraper --type list --list-type forks --repo owner/repo -o forks.json\n");
		help.append("    github-scraper --type events --repo jquery/jquery --number 4406\n");
		help.append("    github-scraper --type user --login octocat\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate that tokens are available, either from a token file or the environment.
	 * @param config the parsed configuration
	 * @throws IllegalStateException if no token source is configured
	 */
	public void validateEnvironment(ParsedConfiguration config) {
		if (config.tokenFile != null) {
			return;
		}
		if (EnvironmentSupport.tokens().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKENS or GITHUB_TOKEN environment variable is required, or pass --token-file. Please set your GitHub personal access token(s).");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositive(String value, String name) {
		int parsed;
		try {
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		if (parsed <= 0) {
			throw new IllegalArgumentException(name + " must be positive: " + parsed);
		}
		return parsed;
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		boolean userRequest = "user".equals(config.requestType);
		if (userRequest) {
			if (config.login == null || config.login.isBlank()) {
				errors.add("Type 'user' requires --login");
			}
		}
		else if (config.repository == null || config.repository.trim().isEmpty()) {
			errors.add("Repository is required (--repo owner/repo)");
		}
		else if (!config.repository.matches("^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$")) {
			errors.add("Repository must be in format 'owner/repo' (e.g., 'spring-projects/spring-ai')");
		}

		if (NUMBERED_TYPES.contains(config.requestType) && config.number == null) {
			errors.add("Type '" + config.requestType + "' requires --number");
		}

		if ("commit-diff".equals(config.requestType)) {
			if (config.sha == null || config.sha.isBlank()) {
				errors.add("Type 'commit-diff' requires --sha");
			}
			else if (!config.sha.matches("^[0-9a-fA-F]{4,64}$")) {
				errors.add("Invalid commit SHA: " + config.sha);
			}
		}

		if (config.cacheDirectory == null || config.cacheDirectory.isBlank()) {
			errors.add("Cache directory cannot be empty");
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
