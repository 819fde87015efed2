package org.springaicommunity.github.scraper;

/**
 * Partition of the GitHub API quota. Each credential tracks its remaining requests
 * separately for every rate class.
 */
public enum RateClass {

	/**
	 * Regular REST endpoints (GitHub resource {@code core}).
	 */
	STANDARD("core"),

	/**
	 * Search endpoints (GitHub resource {@code search}).
	 */
	SEARCH("search");

	private final String resource;

	RateClass(String resource) {
		this.resource = resource;
	}

	/**
	 * Returns the name GitHub uses for this quota in {@code /rate_limit} and in the
	 * {@code X-RateLimit-Resource} header.
	 * @return the resource name
	 */
	public String resource() {
		return resource;
	}

	/**
	 * Determine the rate class of an endpoint path. Paths starting with {@code search}
	 * (leading slash and scheme/host of a full URL ignored) are {@link #SEARCH},
	 * everything else is {@link #STANDARD}.
	 * @param endpoint endpoint path, e.g. {@code search/issues} or {@code /repos/o/r}
	 * @return the rate class
	 */
	public static RateClass forEndpoint(String endpoint) {
		String path = endpoint;
		int scheme = path.indexOf("://");
		if (scheme >= 0) {
			int slash = path.indexOf('/', scheme + 3);
			path = slash >= 0 ? path.substring(slash) : "";
		}
		while (path.startsWith("/")) {
			path = path.substring(1);
		}
		return path.startsWith("search") ? SEARCH : STANDARD;
	}

}
