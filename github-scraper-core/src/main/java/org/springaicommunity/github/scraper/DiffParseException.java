package org.springaicommunity.github.scraper;

/**
 * A hunk header or file boundary that does not follow the unified diff grammar. Raised
 * and handled inside {@link DiffParser}; callers never see it.
 */
public class DiffParseException extends RuntimeException {

	public DiffParseException(String message) {
		super(message);
	}

}
