package org.springaicommunity.github.scraper;

/**
 * A request was abandoned because its thread was interrupted or its deadline would have
 * passed while waiting.
 */
public class RequestCancelledException extends RuntimeException {

	public RequestCancelledException(String message) {
		super(message);
	}

	public RequestCancelledException(String message, Throwable cause) {
		super(message, cause);
	}

}
