package org.springaicommunity.github.scraper;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * One API token together with the quota last observed for it in each {@link RateClass}.
 *
 * <p>
 * Credentials have identity semantics: two instances built from the same secret are
 * distinct pool members with independent trackers.
 */
public final class Credential {

	private final String secret;

	private final GitHubClient client;

	private final Map<RateClass, RateLimitTracker> trackers = new EnumMap<>(RateClass.class);

	public Credential(String secret, GitHubClient client) {
		this.secret = secret;
		this.client = client;
		for (RateClass rateClass : RateClass.values()) {
			trackers.put(rateClass, new RateLimitTracker());
		}
	}

	/**
	 * Create a credential backed by {@link GitHubHttpClient}.
	 * @param secret personal access token
	 * @param requestTimeout timeout for each request
	 * @return new credential
	 */
	public static Credential of(String secret, Duration requestTimeout) {
		return new Credential(secret, new GitHubHttpClient(secret, requestTimeout));
	}

	/**
	 * Send a request with this credential and record the quota reported in the response
	 * headers against the request's rate class.
	 * @param request the request
	 * @return the response
	 * @throws GitHubTransportException if no response was received
	 */
	public ApiResponse send(ApiRequest request) {
		ApiResponse response = client.send(request);
		response.rateLimitInfo().ifPresent(info -> tracker(request.rateClass()).update(info));
		return response;
	}

	public RateLimitTracker tracker(RateClass rateClass) {
		return trackers.get(rateClass);
	}

	public boolean isReady(RateClass rateClass, Instant now) {
		return tracker(rateClass).isReady(now);
	}

	public Instant readyAt(RateClass rateClass, Instant now) {
		return tracker(rateClass).readyAt(now);
	}

	/**
	 * Returns the token with all but its last four characters hidden, for log output.
	 * @return the masked token
	 */
	public String maskedSecret() {
		if (secret.length() <= 4) {
			return "****";
		}
		return "****" + secret.substring(secret.length() - 4);
	}

	@Override
	public String toString() {
		return "Credential[" + maskedSecret() + "]";
	}

}
