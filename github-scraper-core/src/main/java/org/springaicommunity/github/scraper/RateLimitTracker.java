package org.springaicommunity.github.scraper;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Last observed quota of one credential for one {@link RateClass}.
 *
 * <p>
 * The tracker starts out unknown and is considered ready until the first response tells
 * otherwise. Remaining count, reset time and limit always come from the same response:
 * they are swapped in as a single {@link RateLimitInfo} snapshot, so readers never see a
 * mix of two responses.
 */
public class RateLimitTracker {

	@Nullable
	private volatile RateLimitInfo snapshot;

	/**
	 * Replace the tracked quota with the one reported by a response.
	 * @param info snapshot parsed from the response headers
	 */
	public synchronized void update(RateLimitInfo info) {
		this.snapshot = info;
	}

	/**
	 * Force the tracker into the exhausted state after a rate limit rejection. A reset
	 * time already known to lie in the future is kept; otherwise the fallback is used.
	 * @param now current time
	 * @param fallbackReset reset time to assume when none is known
	 */
	public synchronized void markExhausted(Instant now, Instant fallbackReset) {
		RateLimitInfo current = this.snapshot;
		long reset = fallbackReset.getEpochSecond();
		if (current != null && current.hasReset() && current.getResetTime().isAfter(now)) {
			reset = current.reset();
		}
		this.snapshot = current != null ? current.exhaustedUntil(reset) : new RateLimitInfo(-1, 0, reset, -1);
	}

	/**
	 * Returns true if a request may be sent now: quota unknown, quota left, or the reset
	 * time has passed.
	 * @param now current time
	 * @return true if ready
	 */
	public boolean isReady(Instant now) {
		RateLimitInfo info = this.snapshot;
		if (info == null || info.remaining() > 0) {
			return true;
		}
		return !now.isBefore(info.getResetTime());
	}

	/**
	 * Returns the time from which this tracker is ready: the reset time when the quota is
	 * used up, otherwise {@code now}.
	 * @param now current time
	 * @return the ready time
	 */
	public Instant readyAt(Instant now) {
		RateLimitInfo info = this.snapshot;
		if (info == null || info.remaining() != 0) {
			return now;
		}
		return info.getResetTime();
	}

	/**
	 * Returns the last snapshot, or null if no response has been observed yet.
	 * @return the snapshot or null
	 */
	@Nullable
	public RateLimitInfo snapshot() {
		return snapshot;
	}

}
