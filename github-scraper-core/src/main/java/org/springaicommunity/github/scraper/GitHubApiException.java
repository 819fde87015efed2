package org.springaicommunity.github.scraper;

import org.jspecify.annotations.Nullable;

/**
 * Exception raised when the GitHub API answers with a status the dispatcher does not
 * retry or soften.
 *
 * <p>
 * Carries the status code, the response body and the quota reported with the response
 * so callers can decide what to do with it.
 */
public class GitHubApiException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1, -1);
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
	}

	public GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
	}

	/**
	 * Create an exception describing an unexpected response.
	 * @param request the request that was sent
	 * @param response the response received
	 * @return the exception
	 */
	public static GitHubApiException of(ApiRequest request, ApiResponse response) {
		RateLimitInfo info = response.rateLimitInfo().orElse(null);
		return new GitHubApiException(
				"GitHub API error " + response.statusCode() + " for " + request.method() + " " + request.endpoint(),
				response.statusCode(), response.body(), info != null ? info.remaining() : -1,
				info != null ? info.reset() : -1);
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public int getRateLimitRemaining() {
		return rateLimitRemaining;
	}

	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

	/**
	 * Returns true if this exception represents a rate limit error (either 403 with
	 * remaining=0 or 429).
	 */
	public boolean isRateLimitError() {
		return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
	}

}
