package org.springaicommunity.github.scraper;

/**
 * Configuration properties for the scraper.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GitHubScraperBuilder}.
 * Default values follow the limits GitHub documents for the REST API and are suitable
 * for most use cases.
 */
public class ScraperProperties {

	/**
	 * Number of items requested per page when paginating (1-100).
	 */
	private int perPage = 100;

	/**
	 * Timeout in seconds for a single HTTP request.
	 */
	private int requestTimeoutSeconds = 30;

	/**
	 * Upper bound in seconds of the randomized wait after a rate limit rejection.
	 */
	private int maxRateLimitJitterSeconds = 60;

	/**
	 * Upper bound in seconds of the randomized wait after a 5xx response.
	 */
	private int maxServerErrorJitterSeconds = 29;

	/**
	 * Seconds a credential stays exhausted after a rate limit rejection without a reset header.
	 */
	private int rateLimitFallbackSeconds = 60;

	/**
	 * Maximum text length of one hunk body; longer hunks are skipped (default: 100KB).
	 */
	private int maxHunkLength = 102400;

	/**
	 * Files of a pull request with more changed lines than this are not parsed.
	 */
	private int maxFileChanges = 5000;

	/**
	 * Change sets with more code files than this are treated as empty.
	 */
	private int maxCodeFiles = 500;

	/**
	 * Root directory of the local response cache.
	 */
	private String cacheDirectory = "data";

	/**
	 * Returns the page size.
	 * @return the page size
	 */
	public int getPerPage() {
		return perPage;
	}

	/**
	 * Sets the page size.
	 * @param perPage items per page
	 */
	public void setPerPage(int perPage) {
		this.perPage = perPage;
	}

	/**
	 * Returns the request timeout in seconds.
	 * @return the request timeout in seconds
	 */
	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	/**
	 * Sets the request timeout in seconds.
	 * @param requestTimeoutSeconds timeout in seconds
	 */
	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	/**
	 * Returns the maximum rate limit wait.
	 * @return the maximum rate limit wait
	 */
	public int getMaxRateLimitJitterSeconds() {
		return maxRateLimitJitterSeconds;
	}

	/**
	 * Sets the maximum rate limit wait.
	 * @param maxRateLimitJitterSeconds maximum wait in seconds
	 */
	public void setMaxRateLimitJitterSeconds(int maxRateLimitJitterSeconds) {
		this.maxRateLimitJitterSeconds = maxRateLimitJitterSeconds;
	}

	/**
	 * Returns the maximum server error wait.
	 * @return the maximum server error wait
	 */
	public int getMaxServerErrorJitterSeconds() {
		return maxServerErrorJitterSeconds;
	}

	/**
	 * Sets the maximum server error wait.
	 * @param maxServerErrorJitterSeconds maximum wait in seconds
	 */
	public void setMaxServerErrorJitterSeconds(int maxServerErrorJitterSeconds) {
		this.maxServerErrorJitterSeconds = maxServerErrorJitterSeconds;
	}

	/**
	 * Returns the fallback window in seconds.
	 * @return the fallback window in seconds
	 */
	public int getRateLimitFallbackSeconds() {
		return rateLimitFallbackSeconds;
	}

	/**
	 * Sets the fallback window in seconds.
	 * @param rateLimitFallbackSeconds window in seconds
	 */
	public void setRateLimitFallbackSeconds(int rateLimitFallbackSeconds) {
		this.rateLimitFallbackSeconds = rateLimitFallbackSeconds;
	}

	/**
	 * Returns the maximum hunk length.
	 * @return the maximum hunk length
	 */
	public int getMaxHunkLength() {
		return maxHunkLength;
	}

	/**
	 * Sets the maximum hunk length.
	 * @param maxHunkLength maximum length in characters
	 */
	public void setMaxHunkLength(int maxHunkLength) {
		this.maxHunkLength = maxHunkLength;
	}

	/**
	 * Returns the per-file change limit.
	 * @return the per-file change limit
	 */
	public int getMaxFileChanges() {
		return maxFileChanges;
	}

	/**
	 * Sets the per-file change limit.
	 * @param maxFileChanges maximum changed lines
	 */
	public void setMaxFileChanges(int maxFileChanges) {
		this.maxFileChanges = maxFileChanges;
	}

	/**
	 * Returns the code file limit.
	 * @return the code file limit
	 */
	public int getMaxCodeFiles() {
		return maxCodeFiles;
	}

	/**
	 * Sets the code file limit.
	 * @param maxCodeFiles maximum number of code files
	 */
	public void setMaxCodeFiles(int maxCodeFiles) {
		this.maxCodeFiles = maxCodeFiles;
	}

	/**
	 * Returns the cache directory.
	 * @return the cache directory
	 */
	public String getCacheDirectory() {
		return cacheDirectory;
	}

	/**
	 * Sets the cache directory.
	 * @param cacheDirectory the cache directory
	 */
	public void setCacheDirectory(String cacheDirectory) {
		this.cacheDirectory = cacheDirectory;
	}

}
