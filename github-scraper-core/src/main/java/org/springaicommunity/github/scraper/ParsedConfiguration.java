package org.springaicommunity.github.scraper;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// What to fetch
	public String requestType = "pr";

	public String repository;

	public Integer number;

	public String sha;

	public String login;

	public String listType = "pulls";

	// Cache and credentials
	public String cacheDirectory;

	public boolean renew = false;

	public String tokenFile = null;

	// Output
	public String outputFile = null;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(ScraperProperties defaultProperties) {
		this.cacheDirectory = defaultProperties.getCacheDirectory();
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "requestType='" + requestType + '\'' + ", repository='" + repository + '\''
				+ ", number=" + number + ", sha='" + sha + '\'' + ", login='" + login + '\'' + ", listType='"
				+ listType + '\'' + ", cacheDirectory='" + cacheDirectory + '\'' + ", renew=" + renew
				+ ", tokenFile='" + tokenFile + '\'' + ", outputFile='" + outputFile + '\'' + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
