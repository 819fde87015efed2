package org.springaicommunity.github.scraper;

/**
 * A request never produced an HTTP response: connection refused, reset, or timed out.
 */
public class GitHubTransportException extends RuntimeException {

	private final boolean timeout;

	public GitHubTransportException(String message, boolean timeout, Throwable cause) {
		super(message, cause);
		this.timeout = timeout;
	}

	/**
	 * Returns true if the request timed out rather than failing to connect.
	 * @return true for timeouts
	 */
	public boolean isTimeout() {
		return timeout;
	}

}
