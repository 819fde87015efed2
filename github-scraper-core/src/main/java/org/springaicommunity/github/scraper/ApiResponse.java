package org.springaicommunity.github.scraper;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Raw HTTP response from the GitHub API, whatever its status code.
 *
 * @param statusCode HTTP status code
 * @param body response body as text (empty if none)
 * @param headers response headers, looked up case-insensitively
 */
public record ApiResponse(int statusCode, String body, Map<String, List<String>> headers) {

	public ApiResponse {
		TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
		headers = copy;
	}

	/**
	 * Returns the first value of a header.
	 * @param name header name (case-insensitive)
	 * @return the value, or empty if absent
	 */
	public Optional<String> header(String name) {
		List<String> values = headers.get(name);
		if (values == null || values.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(values.get(0));
	}

	/**
	 * Returns true for 2xx status codes.
	 * @return true if successful
	 */
	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

	/**
	 * Parse the rate limit snapshot from the {@code X-RateLimit-*} headers. A response
	 * without a numeric {@code X-RateLimit-Remaining} carries no snapshot.
	 * @return the snapshot, or empty
	 */
	public Optional<RateLimitInfo> rateLimitInfo() {
		int remaining = intHeader("X-RateLimit-Remaining", -1);
		if (remaining < 0) {
			return Optional.empty();
		}
		return Optional.of(new RateLimitInfo(intHeader("X-RateLimit-Limit", -1), remaining,
				longHeader("X-RateLimit-Reset", -1), intHeader("X-RateLimit-Used", -1)));
	}

	/**
	 * Returns the next-page cursor advertised by the {@code Link} header.
	 * @param currentPage page number this response belongs to
	 * @return the cursor, or empty on the last page
	 */
	public Optional<PageCursor> nextPage(int currentPage) {
		return header("Link").flatMap(link -> PageCursor.fromLinkHeader(link, currentPage));
	}

	private int intHeader(String name, int defaultValue) {
		return header(name).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private long longHeader(String name, long defaultValue) {
		return header(name).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
