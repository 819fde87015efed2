package org.springaicommunity.github.scraper;

import java.time.Duration;

/**
 * Blocking wait used by {@link RequestDispatcher} between attempts. Replaceable so tests
 * can record waits and advance a fake clock instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Block for the given duration.
	 * @param duration how long to wait
	 * @throws InterruptedException if the waiting thread is interrupted
	 */
	void sleep(Duration duration) throws InterruptedException;

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 * @return the sleeper
	 */
	static Sleeper threadSleeper() {
		return duration -> Thread.sleep(duration.toMillis());
	}

}
