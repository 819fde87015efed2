package org.springaicommunity.github.scraper;

/**
 * Interface for raw GitHub API HTTP operations, bound to a single credential.
 *
 * <p>
 * Implementations return every HTTP status as an {@link ApiResponse}; deciding what a
 * status means is left to {@link RequestDispatcher}. This keeps the transport swappable
 * for fakes in tests.
 */
public interface GitHubClient {

	/**
	 * Send a request to the GitHub REST API.
	 * @param request the request
	 * @return the response, whatever its status code
	 * @throws GitHubTransportException if no response was received
	 * @throws RequestCancelledException if the calling thread was interrupted
	 */
	ApiResponse send(ApiRequest request);

}
