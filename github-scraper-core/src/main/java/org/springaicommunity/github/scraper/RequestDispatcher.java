package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Drives a request (optionally across all of its pages) to completion over a
 * {@link CredentialPool}, hiding rate limit exhaustion and transient failures from the
 * caller.
 *
 * <p>
 * Per attempt the dispatcher picks the first ready credential, sends the request and
 * classifies the response with {@link ResponseOutcome}:
 * <ul>
 * <li>2xx: done, or on to the next page when paginating</li>
 * <li>404/409/410/451: empty result ({@link DispatchResult.Status#SOFT_EMPTY})</li>
 * <li>401: skip that credential for the rest of the call and pick another</li>
 * <li>403 without quota, 429: mark the credential exhausted, jittered wait, pick again</li>
 * <li>5xx: short jittered wait, pick again; more consecutive failures than credentials
 * ends the call</li>
 * <li>anything else: {@link GitHubApiException}</li>
 * </ul>
 * Network failures are counted separately and bounded by the pool size as well. When no
 * credential is ready the dispatcher waits until the earliest reset; that wait has no
 * upper bound unless the call carries a deadline or the thread is interrupted.
 *
 * <p>
 * Failures are returned inside the {@link DispatchResult}, together with the pages fetched
 * so far, rather than thrown.
 *
 * <pre>
 * {@code
 * RequestDispatcher dispatcher = RequestDispatcher.builder()
 *     .pool(CredentialPool.fromTokens(tokens, Duration.ofSeconds(30), Clock.systemUTC()))
 *     .build();
 *
 * DispatchResult result = dispatcher.execute(ApiRequest.get("repos/owner/repo/pulls"), true);
 * }
 * </pre>
 */
public final class RequestDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);

	private static final Duration MIN_POOL_WAIT = Duration.ofSeconds(1);

	private final CredentialPool pool;

	private final ObjectMapper objectMapper;

	private final Sleeper sleeper;

	private final Random random;

	private final Clock clock;

	private final int perPage;

	private final int maxRateLimitJitterSeconds;

	private final int maxServerErrorJitterSeconds;

	private final Duration rateLimitFallbackWindow;

	/**
	 * Private constructor - use {@link #builder()} to create instances.
	 */
	private RequestDispatcher(Builder builder) {
		this.pool = builder.pool;
		this.objectMapper = builder.objectMapper != null ? builder.objectMapper : ObjectMapperFactory.create();
		this.sleeper = builder.sleeper;
		this.random = builder.random;
		this.clock = builder.pool.clock();
		this.perPage = builder.perPage;
		this.maxRateLimitJitterSeconds = builder.maxRateLimitJitterSeconds;
		this.maxServerErrorJitterSeconds = builder.maxServerErrorJitterSeconds;
		this.rateLimitFallbackWindow = builder.rateLimitFallbackWindow;
	}

	/**
	 * Create a new builder for RequestDispatcher.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Execute a single, non-paginated request.
	 * @param request the request
	 * @return the result
	 */
	public DispatchResult execute(ApiRequest request) {
		return execute(request, false, null);
	}

	/**
	 * Execute a request, following {@code rel="next"} links when {@code paginate} is set.
	 * @param request the request
	 * @param paginate true to fetch and concatenate all pages
	 * @return the result
	 */
	public DispatchResult execute(ApiRequest request, boolean paginate) {
		return execute(request, paginate, null);
	}

	/**
	 * Execute a request with an optional deadline. A wait that would end after the
	 * deadline cancels the call instead, as does interrupting the calling thread.
	 * @param request the request
	 * @param paginate true to fetch and concatenate all pages
	 * @param deadline latest time to keep waiting, or null to wait indefinitely
	 * @return the result
	 * @throws IllegalArgumentException if pagination is requested for a non-JSON request
	 */
	public DispatchResult execute(ApiRequest request, boolean paginate, @Nullable Instant deadline) {
		if (paginate && !request.expectsJson()) {
			throw new IllegalArgumentException("Pagination requires a JSON media type, got " + request.accept());
		}
		return new Call(request, paginate, deadline).run();
	}

	public CredentialPool pool() {
		return pool;
	}

	public ObjectMapper objectMapper() {
		return objectMapper;
	}

	/**
	 * State of one {@code execute} invocation.
	 */
	private final class Call {

		private final RateClass rateClass;

		private final boolean paginate;

		@Nullable
		private final Instant deadline;

		private final ArrayNode accumulated = objectMapper.createArrayNode();

		private final Set<Credential> rejected = new HashSet<>();

		@Nullable
		private Credential lastFailed;

		private ApiRequest current;

		private int page = 1;

		private int pagesFetched = 0;

		private int transportFailures = 0;

		private int serverErrors = 0;

		Call(ApiRequest request, boolean paginate, @Nullable Instant deadline) {
			this.rateClass = request.rateClass();
			this.paginate = paginate;
			this.deadline = deadline;
			this.current = paginate ? request.withQueryParam("page", 1).withQueryParam("per_page", perPage) : request;
		}

		DispatchResult run() {
			try {
				while (true) {
					checkCancelled();
					Credential credential = selectCredential();
					ApiResponse response;
					try {
						response = credential.send(current);
					}
					catch (IllegalArgumentException e) {
						logger.error("{} is not a valid request: {}", current.describe(), e.getMessage());
						return fatal(new GitHubApiException("Invalid request " + current.describe(), e));
					}
					catch (GitHubTransportException e) {
						transportFailures++;
						if (transportFailures > pool.size()) {
							logger.error("{} failed {} times in a row on the network, giving up", current.describe(),
									transportFailures);
							return fatal(new FatalNetworkException("Giving up on " + current.describe() + " after "
									+ transportFailures + " network failures", transportFailures, e));
						}
						logger.warn("{} failed with {} ({}/{}): {}. Retrying with another credential",
								current.describe(), credential, transportFailures, pool.size(), e.getMessage());
						lastFailed = credential;
						continue;
					}
					lastFailed = null;
					transportFailures = 0;
					DispatchResult terminal = handle(credential, response);
					if (terminal != null) {
						return terminal;
					}
				}
			}
			catch (RequestCancelledException e) {
				logger.warn("{} cancelled after {} page(s): {}", current.describe(), pagesFetched, e.getMessage());
				return fatal(e);
			}
		}

		@Nullable
		private DispatchResult handle(Credential credential, ApiResponse response) {
			ResponseOutcome outcome = ResponseOutcome.classify(response);
			if (outcome != ResponseOutcome.SERVER_ERROR) {
				serverErrors = 0;
			}
			switch (outcome) {
				case SUCCESS:
					return onSuccess(response);
				case SOFT_EMPTY:
					logger.info("{} returned {}, treating as empty", current.describe(), response.statusCode());
					if (pagesFetched > 0) {
						return DispatchResult.success(accumulated, pagesFetched);
					}
					return DispatchResult
						.softEmpty(paginate ? objectMapper.createArrayNode() : objectMapper.createObjectNode());
				case BAD_CREDENTIAL:
					rejected.add(credential);
					logger.warn("401 Bad credentials for {}, please remove this token ({}/{} rejected)", credential,
							rejected.size(), pool.size());
					if (rejected.size() >= pool.size()) {
						logger.error("Every credential in the pool was rejected for {}", current.describe());
						return fatal(GitHubApiException.of(current, response));
					}
					return null;
				case RATE_LIMITED:
					onRateLimited(credential, response);
					return null;
				case SERVER_ERROR:
					return onServerError(response);
				default:
					GitHubApiException error = GitHubApiException.of(current, response);
					logger.error("{}", error.getMessage());
					return fatal(error);
			}
		}

		@Nullable
		private DispatchResult onSuccess(ApiResponse response) {
			JsonNode body;
			try {
				body = parseBody(response);
			}
			catch (JsonProcessingException e) {
				logger.error("Malformed JSON in response to {}: {}", current.describe(), e.getOriginalMessage());
				return fatal(new GitHubApiException("Malformed JSON in response to " + current.describe(), e));
			}
			if (!paginate) {
				return DispatchResult.success(body, 1);
			}

			pagesFetched++;
			List<JsonNode> items = pageItems(body);
			items.forEach(accumulated::add);
			Optional<PageCursor> next = response.nextPage(page);
			if (items.isEmpty() || next.isEmpty()) {
				logger.debug("{} complete: {} page(s), {} item(s)", current.describe(), pagesFetched,
						accumulated.size());
				return DispatchResult.success(accumulated, pagesFetched);
			}
			page = next.get().page() > page ? next.get().page() : page + 1;
			current = current.withQueryParam("page", page);
			return null;
		}

		private void onRateLimited(Credential credential, ApiResponse response) {
			Instant now = clock.instant();
			credential.tracker(rateClass).markExhausted(now, now.plus(rateLimitFallbackWindow));
			Duration wait = jitter(maxRateLimitJitterSeconds);
			logger.warn("{} rate limited ({}) on {}, retrying in {}s", current.describe(), response.statusCode(),
					credential, wait.getSeconds());
			pause(wait);
		}

		@Nullable
		private DispatchResult onServerError(ApiResponse response) {
			serverErrors++;
			if (serverErrors > pool.size()) {
				logger.error("{} failed with server errors {} times in a row, giving up", current.describe(),
						serverErrors);
				return fatal(new FatalNetworkException(
						"Giving up on " + current.describe() + " after " + serverErrors + " server errors",
						serverErrors, GitHubApiException.of(current, response)));
			}
			Duration wait = jitter(maxServerErrorJitterSeconds);
			logger.warn("{} returned {} ({}/{}), retrying in {}s", current.describe(), response.statusCode(),
					serverErrors, pool.size(), wait.getSeconds());
			pause(wait);
			return null;
		}

		private Credential selectCredential() {
			while (true) {
				Optional<Credential> ready = Optional.empty();
				if (lastFailed != null) {
					Set<Credential> skip = new HashSet<>(rejected);
					skip.add(lastFailed);
					ready = pool.pickReady(rateClass, skip);
				}
				if (ready.isEmpty()) {
					ready = pool.pickReady(rateClass, rejected);
				}
				if (ready.isPresent()) {
					return ready.get();
				}

				Instant now = clock.instant();
				Duration wait = Duration.between(now, pool.earliestReadyAt(rateClass, rejected)).plusSeconds(1);
				if (wait.compareTo(MIN_POOL_WAIT) < 0) {
					wait = MIN_POOL_WAIT;
				}
				long seconds = wait.getSeconds();
				logger.info("Out of credentials for {} requests, resuming in {} minutes, {} seconds",
						rateClass.resource(), seconds / 60, seconds % 60);
				pause(wait);
				logger.info(".. resumed");
			}
		}

		private void pause(Duration duration) {
			if (deadline != null && clock.instant().plus(duration).isAfter(deadline)) {
				throw new RequestCancelledException(
						"Waiting " + duration.getSeconds() + "s would pass the deadline " + deadline);
			}
			try {
				sleeper.sleep(duration);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new RequestCancelledException("Interrupted while waiting to retry", e);
			}
		}

		private void checkCancelled() {
			if (Thread.currentThread().isInterrupted()) {
				throw new RequestCancelledException("Thread interrupted");
			}
			if (deadline != null && !clock.instant().isBefore(deadline)) {
				throw new RequestCancelledException("Deadline " + deadline + " has passed");
			}
		}

		private JsonNode parseBody(ApiResponse response) throws JsonProcessingException {
			if (!current.expectsJson()) {
				return TextNode.valueOf(response.body());
			}
			if (response.body().isBlank()) {
				return NullNode.getInstance();
			}
			return objectMapper.readTree(response.body());
		}

		private DispatchResult fatal(RuntimeException error) {
			JsonNode partial = paginate ? accumulated : MissingNode.getInstance();
			return DispatchResult.fatal(error, partial, pagesFetched);
		}

		private Duration jitter(int maxSeconds) {
			return Duration.ofSeconds(1 + random.nextInt(Math.max(1, maxSeconds)));
		}

	}

	/**
	 * Items of one page: the elements of an array body, or of the {@code items} array of
	 * a search response.
	 */
	static List<JsonNode> pageItems(JsonNode body) {
		JsonNode items = body;
		if (body.isObject() && body.path("items").isArray()) {
			items = body.get("items");
		}
		List<JsonNode> result = new ArrayList<>();
		if (items.isArray()) {
			items.forEach(result::add);
		}
		else if (items.isObject() && !items.isEmpty()) {
			result.add(items);
		}
		return result;
	}

	/**
	 * Builder for {@link RequestDispatcher}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>perPage: 100</li>
	 * <li>rate limit jitter: 1-60 seconds</li>
	 * <li>server error jitter: 1-29 seconds</li>
	 * <li>rate limit fallback window: 60 seconds (used when a 403/429 carries no reset
	 * time)</li>
	 * </ul>
	 */
	public static class Builder {

		private CredentialPool pool;

		@Nullable
		private ObjectMapper objectMapper;

		private Sleeper sleeper = Sleeper.threadSleeper();

		private Random random = new Random();

		private int perPage = 100;

		private int maxRateLimitJitterSeconds = 60;

		private int maxServerErrorJitterSeconds = 29;

		private Duration rateLimitFallbackWindow = Duration.ofSeconds(60);

		private Builder() {
		}

		/**
		 * Set the credential pool (required).
		 * @param pool the pool
		 * @return this builder
		 */
		public Builder pool(CredentialPool pool) {
			this.pool = pool;
			return this;
		}

		/**
		 * Set the ObjectMapper used to parse response bodies.
		 * @param objectMapper Jackson ObjectMapper (null to use default)
		 * @return this builder
		 */
		public Builder objectMapper(@Nullable ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Set the wait primitive.
		 * @param sleeper the sleeper (default: {@link Sleeper#threadSleeper()})
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Set the random source for backoff jitter.
		 * @param random the random source
		 * @return this builder
		 */
		public Builder random(Random random) {
			this.random = random;
			return this;
		}

		/**
		 * Set the page size requested when paginating.
		 * @param perPage items per page, 1-100 (default: 100)
		 * @return this builder
		 */
		public Builder perPage(int perPage) {
			this.perPage = perPage;
			return this;
		}

		/**
		 * Set the upper bound of the wait after a rate limit rejection.
		 * @param max maximum wait (default: 60 seconds)
		 * @return this builder
		 */
		public Builder maxRateLimitJitter(Duration max) {
			this.maxRateLimitJitterSeconds = (int) max.getSeconds();
			return this;
		}

		/**
		 * Set the upper bound of the wait after a 5xx response.
		 * @param max maximum wait (default: 29 seconds)
		 * @return this builder
		 */
		public Builder maxServerErrorJitter(Duration max) {
			this.maxServerErrorJitterSeconds = (int) max.getSeconds();
			return this;
		}

		/**
		 * Set how long a credential is assumed exhausted after a rate limit rejection
		 * that did not report a reset time.
		 * @param window the window (default: 60 seconds)
		 * @return this builder
		 */
		public Builder rateLimitFallbackWindow(Duration window) {
			this.rateLimitFallbackWindow = window;
			return this;
		}

		/**
		 * Build the RequestDispatcher.
		 * @return configured RequestDispatcher
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RequestDispatcher build() {
			if (pool == null) {
				throw new IllegalStateException("A CredentialPool is required. Call pool() first.");
			}
			if (perPage < 1 || perPage > 100) {
				throw new IllegalStateException("perPage must be between 1 and 100");
			}
			if (maxRateLimitJitterSeconds < 1 || maxServerErrorJitterSeconds < 1) {
				throw new IllegalStateException("Jitter bounds must be at least one second");
			}
			if (rateLimitFallbackWindow.isNegative() || rateLimitFallbackWindow.isZero()) {
				throw new IllegalStateException("rateLimitFallbackWindow must be positive");
			}
			return new RequestDispatcher(this);
		}

	}

}
