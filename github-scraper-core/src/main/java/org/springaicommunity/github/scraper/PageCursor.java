package org.springaicommunity.github.scraper;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Continuation of a paginated result: the page number to request next.
 *
 * <p>
 * Derived from the {@code Link} response header. GitHub lists the next page as
 * {@code <https://api.github.com/...&page=3>; rel="next"}; when that entry is absent the
 * result set is exhausted.
 *
 * @param page the page number to request next
 */
public record PageCursor(int page) {

	private static final Pattern PAGE_PARAM = Pattern.compile("[?&]page=(\\d{1,9})(?:&|$)");

	/**
	 * Parse the next-page cursor from a {@code Link} header.
	 * @param linkHeader the header value, may be empty
	 * @param currentPage the page the header was returned with
	 * @return the cursor, or empty if there is no {@code rel="next"} entry
	 */
	public static Optional<PageCursor> fromLinkHeader(String linkHeader, int currentPage) {
		for (String part : linkHeader.split(",")) {
			if (!part.contains("rel=\"next\"")) {
				continue;
			}
			int open = part.indexOf('<');
			int close = part.indexOf('>');
			if (open >= 0 && close > open) {
				Matcher matcher = PAGE_PARAM.matcher(part.substring(open + 1, close));
				if (matcher.find()) {
					return Optional.of(new PageCursor(Integer.parseInt(matcher.group(1))));
				}
			}
			return Optional.of(new PageCursor(currentPage + 1));
		}
		return Optional.empty();
	}

}
