package org.springaicommunity.github.scraper;

/**
 * Invalid setup detected at construction time, such as an empty credential pool.
 */
public class ConfigurationException extends RuntimeException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

}
