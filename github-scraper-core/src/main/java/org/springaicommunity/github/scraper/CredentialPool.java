package org.springaicommunity.github.scraper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed, ordered set of {@link Credential}s shared by all requests of a dispatcher.
 *
 * <p>
 * Selection is deterministic: the pool is always scanned in construction order and the
 * first ready credential wins. A credential is only rotated out once its quota for the
 * requested rate class is used up, which keeps behaviour reproducible in tests.
 */
public class CredentialPool {

	private final List<Credential> credentials;

	private final Clock clock;

	public CredentialPool(List<Credential> credentials, Clock clock) {
		if (credentials.isEmpty()) {
			throw new ConfigurationException("No GitHub API tokens configured. Please add at least one.");
		}
		this.credentials = List.copyOf(credentials);
		this.clock = clock;
	}

	/**
	 * Build a pool of HTTP-backed credentials, one per token, in list order. Duplicate
	 * tokens are kept as separate credentials.
	 * @param tokens personal access tokens
	 * @param requestTimeout timeout for each request
	 * @param clock time source for readiness checks
	 * @return the pool
	 * @throws ConfigurationException if {@code tokens} is empty
	 */
	public static CredentialPool fromTokens(List<String> tokens, Duration requestTimeout, Clock clock) {
		return new CredentialPool(tokens.stream().map(t -> Credential.of(t, requestTimeout)).toList(), clock);
	}

	/**
	 * Returns the first credential, in pool order, that is ready for the rate class.
	 * @param rateClass rate class of the request
	 * @return the credential, or empty if none is ready
	 */
	public Optional<Credential> pickReady(RateClass rateClass) {
		return pickReady(rateClass, Set.of());
	}

	/**
	 * Returns the first ready credential that is not in {@code excluded}.
	 * @param rateClass rate class of the request
	 * @param excluded credentials to skip
	 * @return the credential, or empty if none is ready
	 */
	public Optional<Credential> pickReady(RateClass rateClass, Set<Credential> excluded) {
		Instant now = clock.instant();
		for (Credential credential : credentials) {
			if (!excluded.contains(credential) && credential.isReady(rateClass, now)) {
				return Optional.of(credential);
			}
		}
		return Optional.empty();
	}

	/**
	 * Returns the earliest reset time among the credentials that are not ready for the
	 * rate class. Used to decide how long to wait once the whole pool is exhausted.
	 * @param rateClass rate class of the request
	 * @return the earliest ready time
	 */
	public Instant earliestReadyAt(RateClass rateClass) {
		return earliestReadyAt(rateClass, Set.of());
	}

	/**
	 * Returns the earliest reset time among the not-ready credentials that are not in
	 * {@code excluded}.
	 * @param rateClass rate class of the request
	 * @param excluded credentials to skip
	 * @return the earliest ready time, or the current time if no candidate is waiting
	 */
	public Instant earliestReadyAt(RateClass rateClass, Set<Credential> excluded) {
		Instant now = clock.instant();
		Instant earliest = null;
		for (Credential credential : credentials) {
			if (excluded.contains(credential) || credential.isReady(rateClass, now)) {
				continue;
			}
			Instant readyAt = credential.readyAt(rateClass, now);
			if (earliest == null || readyAt.isBefore(earliest)) {
				earliest = readyAt;
			}
		}
		return earliest != null ? earliest : now;
	}

	public int size() {
		return credentials.size();
	}

	public List<Credential> credentials() {
		return credentials;
	}

	public Clock clock() {
		return clock;
	}

}
