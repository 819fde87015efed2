package org.springaicommunity.github.scraper;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable GitHub REST request.
 *
 * @param method HTTP method, e.g. {@code GET}
 * @param endpoint API path relative to the API root (e.g. {@code repos/o/r/pulls}) or a
 * full URL
 * @param queryParams query parameters in insertion order
 * @param body request body, or null for none
 * @param accept value of the {@code Accept} header
 */
public record ApiRequest(String method, String endpoint, Map<String, String> queryParams, @Nullable String body,
		String accept) {

	/**
	 * Default media type for JSON responses.
	 */
	public static final String JSON = "application/vnd.github.v3+json";

	/**
	 * Media type for unified-diff responses.
	 */
	public static final String DIFF = "application/vnd.github.v3.diff";

	public ApiRequest {
		queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
	}

	/**
	 * Create a GET request for the given endpoint.
	 * @param endpoint API path or full URL
	 * @return new request
	 */
	public static ApiRequest get(String endpoint) {
		return new ApiRequest("GET", endpoint, Map.of(), null, JSON);
	}

	/**
	 * Create a GET request with query parameters.
	 * @param endpoint API path or full URL
	 * @param queryParams query parameters
	 * @return new request
	 */
	public static ApiRequest get(String endpoint, Map<String, String> queryParams) {
		return new ApiRequest("GET", endpoint, queryParams, null, JSON);
	}

	/**
	 * Returns the rate class of this request, derived from its endpoint.
	 * @return the rate class
	 */
	public RateClass rateClass() {
		return RateClass.forEndpoint(endpoint);
	}

	/**
	 * Returns true if the response body is expected to be JSON.
	 * @return true for JSON media types
	 */
	public boolean expectsJson() {
		return accept.contains("json");
	}

	/**
	 * Copy of this request with one query parameter set (added or replaced).
	 * @param name parameter name
	 * @param value parameter value
	 * @return new request
	 */
	public ApiRequest withQueryParam(String name, Object value) {
		Map<String, String> params = new LinkedHashMap<>(queryParams);
		params.put(name, String.valueOf(value));
		return new ApiRequest(method, endpoint, params, body, accept);
	}

	/**
	 * Copy of this request with a different {@code Accept} header.
	 * @param mediaType the media type
	 * @return new request
	 */
	public ApiRequest withAccept(String mediaType) {
		return new ApiRequest(method, endpoint, queryParams, body, mediaType);
	}

	/**
	 * Short description used in log messages.
	 * @return e.g. {@code GET repos/o/r/pulls?page=2}
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder(method).append(' ').append(endpoint);
		if (!queryParams.isEmpty()) {
			sb.append('?');
			queryParams.forEach((k, v) -> sb.append(k).append('=').append(v).append('&'));
			sb.setLength(sb.length() - 1);
		}
		return sb.toString();
	}

}
