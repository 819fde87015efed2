package org.springaicommunity.github.scraper;

/**
 * The dispatcher gave up on a request after more consecutive server errors or network
 * failures than there are credentials in the pool.
 */
public class FatalNetworkException extends RuntimeException {

	private final int attempts;

	public FatalNetworkException(String message, int attempts, Throwable cause) {
		super(message, cause);
		this.attempts = attempts;
	}

	public FatalNetworkException(String message, int attempts) {
		super(message);
		this.attempts = attempts;
	}

	/**
	 * Returns the number of consecutive failed attempts that led to giving up.
	 * @return the attempt count
	 */
	public int getAttempts() {
		return attempts;
	}

}
