package org.springaicommunity.github.scraper;

import java.time.Instant;

/**
 * Rate limit snapshot reported by the GitHub API in the {@code X-RateLimit-*} response
 * headers.
 *
 * @param limit the maximum number of requests allowed in the window, or -1 if unknown
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the window resets (epoch seconds), or -1 if unknown
 * @param used the number of requests used in the current window, or -1 if unknown
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the reset time was reported.
	 * @return true if {@link #reset()} is known
	 */
	public boolean hasReset() {
		return reset >= 0;
	}

	/**
	 * Returns true if the rate limit has been exceeded.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

	/**
	 * Copy of this snapshot with no requests left, resetting at the given time.
	 * @param resetEpochSeconds reset time in epoch seconds
	 * @return the exhausted snapshot
	 */
	public RateLimitInfo exhaustedUntil(long resetEpochSeconds) {
		return new RateLimitInfo(limit, 0, resetEpochSeconds, used);
	}

}
