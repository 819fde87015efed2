package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Pull request, issue, commit and repository data with a local cache in front of the
 * {@link RequestDispatcher}.
 *
 * <p>
 * Every operation first looks for its entry in the {@link BlobStore} (unless
 * {@code renew} is set) and only calls the API on a miss. Entries live under
 * {@code pr_data/<owner>/<repo>/}. Empty results (the resource is gone or not
 * accessible) are returned but never cached; failed calls throw the dispatcher's error.
 */
public class GitHubScraperService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubScraperService.class);

	private static final Pattern REPOSITORY_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+/[A-Za-z0-9_.-]+");

	private static final Pattern SHA_PATTERN = Pattern.compile("[0-9a-fA-F]{4,64}");

	private static final Pattern LOGIN_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9-]*(\\[bot\\])?");

	private static final String CACHE_ROOT = "pr_data/";

	/**
	 * Repository level lists that can be fetched with
	 * {@link #repositoryList(String, ListType, boolean)}.
	 */
	public enum ListType {

		PULLS("pulls", true), ISSUES("issues", true), BRANCHES("branches", false), FORKS("forks", false);

		private final String path;

		private final boolean stateFilter;

		ListType(String path, boolean stateFilter) {
			this.path = path;
			this.stateFilter = stateFilter;
		}

		public String path() {
			return path;
		}

		/**
		 * Parse a list type name such as {@code pulls} or {@code pull}.
		 * @param name the name, case-insensitive
		 * @return the list type
		 * @throws IllegalArgumentException for unknown names
		 */
		public static ListType fromName(String name) {
			String normalized = name.trim().toLowerCase(Locale.ROOT);
			for (ListType type : values()) {
				if (type.path.equals(normalized) || type.path.equals(normalized + "s")
						|| type.path.equals(normalized + "es")) {
					return type;
				}
			}
			throw new IllegalArgumentException("Unknown list type: " + name + ". Use pulls, issues, branches or forks");
		}

	}

	private final RequestDispatcher dispatcher;

	private final BlobStore blobStore;

	private final DiffParser diffParser;

	private final CodeFileFilter codeFileFilter;

	private final ObjectMapper objectMapper;

	private final int maxFileChanges;

	public GitHubScraperService(RequestDispatcher dispatcher, BlobStore blobStore, DiffParser diffParser,
			CodeFileFilter codeFileFilter, ObjectMapper objectMapper, int maxFileChanges) {
		this.dispatcher = dispatcher;
		this.blobStore = blobStore;
		this.diffParser = diffParser;
		this.codeFileFilter = codeFileFilter;
		this.objectMapper = objectMapper;
		this.maxFileChanges = maxFileChanges;
	}

	/**
	 * Get a pull request. Cached as {@code <n>/api.json}.
	 * @param repository repository in "owner/repo" format
	 * @param number pull request number
	 * @param renew true to ignore the cache
	 * @return the pull request JSON, or an empty object if it is not accessible
	 */
	public JsonNode pullRequest(String repository, int number, boolean renew) {
		String key = pullRequestKey(repository, number) + "api.json";
		return cached(key, renew, new TypeReference<JsonNode>() {
		}, () -> {
			DispatchResult result = dispatcher
				.execute(ApiRequest.get("repos/" + repository + "/pulls/" + number));
			return new Fetched<>(result.bodyOrThrow(), result.isSuccess());
		});
	}

	/**
	 * Get the commits of a pull request. The raw API response is cached as
	 * {@code <n>/commits.json}.
	 * @param repository repository in "owner/repo" format
	 * @param number pull request number
	 * @param renew true to ignore the cache
	 * @return the commits in API order
	 */
	public List<CommitSummary> pullRequestCommits(String repository, int number, boolean renew) {
		String key = pullRequestKey(repository, number) + "commits.json";
		JsonNode commits = cached(key, renew, new TypeReference<JsonNode>() {
		}, () -> {
			DispatchResult result = dispatcher
				.execute(ApiRequest.get("repos/" + repository + "/pulls/" + number + "/commits"), true);
			return new Fetched<>(result.bodyOrThrow(), result.isSuccess() && !result.body().isEmpty());
		});

		List<CommitSummary> summaries = new ArrayList<>();
		commits.forEach(commit -> summaries.add(CommitSummary.from(commit)));
		return summaries;
	}

	/**
	 * Get the state of a pull request, read from the cached pull request when present.
	 * @param repository repository in "owner/repo" format
	 * @param number pull request number
	 * @param renew true to ignore the cache
	 * @return {@code open} or {@code closed}, empty if the pull request is not accessible
	 */
	public String pullRequestState(String repository, int number, boolean renew) {
		return pullRequest(repository, number, renew).path("state").asText("");
	}

	/**
	 * Get every timeline event of an issue or pull request as returned by the API. Cached
	 * as {@code <n>/timeline.json}.
	 * @param repository repository in "owner/repo" format
	 * @param number issue or pull request number
	 * @param renew true to ignore the cache
	 * @return the events in API order
	 */
	public JsonNode issueTimeline(String repository, int number, boolean renew) {
		return cachedList(pullRequestKey(repository, number) + "timeline.json", renew,
				ApiRequest.get("repos/" + repository + "/issues/" + number + "/timeline"));
	}

	/**
	 * Get the timeline of an issue or pull request as flat events. Shares the cache entry
	 * of {@link #issueTimeline(String, int, boolean)}.
	 * @param repository repository in "owner/repo" format
	 * @param number issue or pull request number
	 * @param renew true to ignore the cache
	 * @return the events in API order
	 */
	public List<TimelineEvent> timelineEvents(String repository, int number, boolean renew) {
		List<TimelineEvent> events = new ArrayList<>();
		issueTimeline(repository, number, renew).forEach(event -> events.add(TimelineEvent.from(event)));
		return events;
	}

	/**
	 * Get the conversation comments of an issue or pull request. Review comments on the
	 * diff are not included, see {@link #reviewComments(String, int, boolean)}. Cached as
	 * {@code <n>/comments.json}.
	 * @param repository repository in "owner/repo" format
	 * @param number issue or pull request number
	 * @param renew true to ignore the cache
	 * @return the comments in API order
	 */
	public List<IssueComment> issueComments(String repository, int number, boolean renew) {
		return comments(cachedList(pullRequestKey(repository, number) + "comments.json", renew,
				ApiRequest.get("repos/" + repository + "/issues/" + number + "/comments")));
	}

	/**
	 * Get the review comments attached to the diff of a pull request. Cached as
	 * {@code <n>/review_comments.json}.
	 * @param repository repository in "owner/repo" format
	 * @param number pull request number
	 * @param renew true to ignore the cache
	 * @return the comments in API order
	 */
	public List<IssueComment> reviewComments(String repository, int number, boolean renew) {
		return comments(cachedList(pullRequestKey(repository, number) + "review_comments.json", renew,
				ApiRequest.get("repos/" + repository + "/pulls/" + number + "/comments")));
	}

	/**
	 * Get the public profile of a user. Not cached.
	 * @param login GitHub login
	 * @return the user JSON, or an empty object for deleted accounts
	 */
	public JsonNode user(String login) {
		if (!LOGIN_PATTERN.matcher(login).matches()) {
			throw new IllegalArgumentException("Invalid GitHub login: " + login);
		}
		return dispatcher.execute(ApiRequest.get("users/" + login)).bodyOrThrow();
	}

	/**
	 * Get the public email address of a user.
	 * @param login GitHub login
	 * @return the email, empty when the account is gone or shows no email
	 */
	public Optional<String> userEmail(String login) {
		JsonNode email = user(login).path("email");
		if (email.isTextual() && !email.asText().isBlank()) {
			return Optional.of(email.asText());
		}
		logger.debug("No public email for {}", login);
		return Optional.empty();
	}

	/**
	 * Get per-file diff statistics of a pull request from its files endpoint. Files with
	 * more changes than the configured maximum or without a patch are left out, as are
	 * non-code files. Cached as {@code <n>/raw_diff.json}.
	 * @param repository repository in "owner/repo" format
	 * @param number pull request number
	 * @param renew true to ignore the cache
	 * @return statistics of the changed code files
	 */
	public List<FileDiffStats> pullRequestDiff(String repository, int number, boolean renew) {
		String key = pullRequestKey(repository, number) + "raw_diff.json";
		return cached(key, renew, new TypeReference<List<FileDiffStats>>() {
		}, () -> {
			DispatchResult result = dispatcher
				.execute(ApiRequest.get("repos/" + repository + "/pulls/" + number + "/files"), true);
			List<FileDiffStats> files = new ArrayList<>();
			for (JsonNode file : result.bodyOrThrow()) {
				if (file.path("changes").asInt(0) <= maxFileChanges && file.hasNonNull("filename")
						&& file.hasNonNull("patch")) {
					files.add(diffParser.parse(file.get("filename").asText(), file.get("patch").asText()));
				}
				else {
					logger.debug("Skipping {} of {}#{}: no patch or too many changes", file.path("filename").asText(),
							repository, number);
				}
			}
			return new Fetched<>(codeFileFilter.codeFilesOnly(files), result.isSuccess());
		});
	}

	/**
	 * Get per-file diff statistics of a single commit. Cached as
	 * {@code commits/<sha>.json}.
	 * @param repository repository in "owner/repo" format
	 * @param sha commit SHA
	 * @param renew true to ignore the cache
	 * @return statistics of every file with a patch
	 */
	public List<FileDiffStats> commitDiff(String repository, String sha, boolean renew) {
		if (!SHA_PATTERN.matcher(sha).matches()) {
			throw new IllegalArgumentException("Invalid commit SHA: " + sha);
		}
		String key = CACHE_ROOT + validRepository(repository) + "/commits/" + sha + ".json";
		return cached(key, renew, new TypeReference<List<FileDiffStats>>() {
		}, () -> {
			DispatchResult result = dispatcher.execute(ApiRequest.get("repos/" + repository + "/commits/" + sha));
			List<FileDiffStats> files = new ArrayList<>();
			for (JsonNode file : result.bodyOrThrow().path("files")) {
				if (file.hasNonNull("filename") && file.hasNonNull("patch")) {
					files.add(diffParser.parse(file.get("filename").asText(), file.get("patch").asText()));
				}
			}
			return new Fetched<>(files, result.isSuccess());
		});
	}

	/**
	 * Get per-file diff statistics of a pull request from its {@code .diff}
	 * representation. Not cached.
	 * @param repository repository in "owner/repo" format
	 * @param number pull request number
	 * @return statistics of every file in the diff
	 */
	public List<FileDiffStats> rawPullRequestDiff(String repository, int number) {
		validRepository(repository);
		DispatchResult result = dispatcher
			.execute(ApiRequest.get("repos/" + repository + "/pulls/" + number).withAccept(ApiRequest.DIFF));
		JsonNode body = result.bodyOrThrow();
		if (!body.isTextual()) {
			return new ArrayList<>();
		}
		return diffParser.parseFiles(body.asText());
	}

	/**
	 * Get a complete repository list. Cached as {@code <type>_list.json}.
	 * @param repository repository in "owner/repo" format
	 * @param type the list to fetch
	 * @param renew true to ignore the cache
	 * @return the list items in API order
	 */
	public JsonNode repositoryList(String repository, ListType type, boolean renew) {
		String key = CACHE_ROOT + validRepository(repository) + "/" + type.path() + "_list.json";
		return cached(key, renew, new TypeReference<JsonNode>() {
		}, () -> {
			ApiRequest request = ApiRequest.get("repos/" + repository + "/" + type.path());
			if (type.stateFilter) {
				request = request.withQueryParam("state", "all");
			}
			DispatchResult result = dispatcher.execute(request, true);
			return new Fetched<>(result.bodyOrThrow(), result.isSuccess());
		});
	}

	private JsonNode cachedList(String key, boolean renew, ApiRequest request) {
		return cached(key, renew, new TypeReference<JsonNode>() {
		}, () -> {
			DispatchResult result = dispatcher.execute(request, true);
			return new Fetched<>(result.bodyOrThrow(), result.isSuccess());
		});
	}

	private static List<IssueComment> comments(JsonNode comments) {
		List<IssueComment> result = new ArrayList<>();
		comments.forEach(comment -> result.add(IssueComment.from(comment)));
		return result;
	}

	private <T> T cached(String key, boolean renew, TypeReference<T> type, Supplier<Fetched<T>> fetcher) {
		if (!renew) {
			Optional<T> hit = readCache(key, type);
			if (hit.isPresent()) {
				logger.debug("Read {} from cache", key);
				return hit.get();
			}
		}

		Fetched<T> fetched = fetcher.get();
		if (fetched.cacheable()) {
			try {
				blobStore.write(key, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(fetched.value()));
			}
			catch (IOException e) {
				throw new RuntimeException("Failed to serialize cache entry " + key, e);
			}
		}
		return fetched.value();
	}

	private <T> Optional<T> readCache(String key, TypeReference<T> type) {
		Optional<byte[]> bytes = blobStore.read(key);
		if (bytes.isEmpty()) {
			return Optional.empty();
		}
		try {
			return Optional.of(objectMapper.readValue(bytes.get(), type));
		}
		catch (IOException e) {
			logger.warn("Ignoring unreadable cache entry {}: {}", key, e.getMessage());
			return Optional.empty();
		}
	}

	private static String pullRequestKey(String repository, int number) {
		if (number < 1) {
			throw new IllegalArgumentException("Pull request number must be positive: " + number);
		}
		return CACHE_ROOT + validRepository(repository) + "/" + number + "/";
	}

	private static String validRepository(String repository) {
		if (!REPOSITORY_PATTERN.matcher(repository).matches() || repository.contains("..")) {
			throw new IllegalArgumentException("Repository must be in 'owner/repo' format, got: " + repository);
		}
		return repository;
	}

	private record Fetched<T>(T value, boolean cacheable) {
	}

}
