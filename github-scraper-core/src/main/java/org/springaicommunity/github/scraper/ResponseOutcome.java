package org.springaicommunity.github.scraper;

/**
 * How {@link RequestDispatcher} treats a response, decided by its status code.
 */
public enum ResponseOutcome {

	/**
	 * 2xx: use the body.
	 */
	SUCCESS,

	/**
	 * 404, 409, 410, 451: the resource is absent or unavailable; an empty result.
	 */
	SOFT_EMPTY,

	/**
	 * 401: the token was rejected; try another credential.
	 */
	BAD_CREDENTIAL,

	/**
	 * 403 with no quota left, or 429: wait and try again.
	 */
	RATE_LIMITED,

	/**
	 * 5xx: transient server failure; wait briefly and try again.
	 */
	SERVER_ERROR,

	/**
	 * Any other status: give up and report the error.
	 */
	FATAL;

	/**
	 * Classify a response.
	 * @param response the response
	 * @return the outcome
	 */
	public static ResponseOutcome classify(ApiResponse response) {
		int status = response.statusCode();
		if (response.isSuccessful()) {
			return SUCCESS;
		}
		switch (status) {
			case 404, 409, 410, 451:
				return SOFT_EMPTY;
			case 401:
				return BAD_CREDENTIAL;
			case 429:
				return RATE_LIMITED;
			case 403:
				boolean exhausted = response.rateLimitInfo().map(RateLimitInfo::isExceeded).orElse(false);
				return exhausted ? RATE_LIMITED : FATAL;
			default:
				return (status >= 500 && status < 600) ? SERVER_ERROR : FATAL;
		}
	}

}
