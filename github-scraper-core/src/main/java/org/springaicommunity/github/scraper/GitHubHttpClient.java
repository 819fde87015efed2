package org.springaicommunity.github.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link GitHubClient} on top of the Java 11+ {@link HttpClient}, authenticated with one
 * personal access token.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	static final String GITHUB_API_BASE = "https://api.github.com/";

	private static final String USER_AGENT = "github-scraper";

	private static final String ALLOWED_IN_PATH = "-._~!$&'()*+,;=:@/%?";

	private final HttpClient httpClient;

	private final String token;

	private final Duration requestTimeout;

	public GitHubHttpClient(String token, Duration requestTimeout) {
		this.token = token;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public ApiResponse send(ApiRequest request) {
		URI uri = resolve(request);
		logger.debug("{} {}", request.method(), uri);
		long start = System.currentTimeMillis();

		HttpRequest.BodyPublisher publisher = request.body() != null
				? HttpRequest.BodyPublishers.ofString(request.body()) : HttpRequest.BodyPublishers.noBody();
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(uri)
			.timeout(requestTimeout)
			.header("Authorization", "token " + token)
			.header("Accept", request.accept())
			.header("User-Agent", USER_AGENT)
			.method(request.method(), publisher);
		if (request.body() != null) {
			builder.header("Content-Type", "application/json");
		}

		try {
			HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
			logger.debug("{} {} -> {} in {}ms", request.method(), uri, response.statusCode(),
					System.currentTimeMillis() - start);
			String body = response.body() != null ? response.body() : "";
			return new ApiResponse(response.statusCode(), body, response.headers().map());
		}
		catch (HttpTimeoutException e) {
			logger.debug("{} {} timed out after {}ms", request.method(), uri, System.currentTimeMillis() - start);
			throw new GitHubTransportException("Request timed out: " + request.describe(), true, e);
		}
		catch (IOException e) {
			logger.debug("{} {} failed after {}ms: {}", request.method(), uri, System.currentTimeMillis() - start,
					e.getMessage());
			throw new GitHubTransportException("HTTP request failed: " + e.getMessage(), false, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RequestCancelledException("HTTP request interrupted", e);
		}
	}

	static URI resolve(ApiRequest request) {
		String endpoint = request.endpoint();
		String url;
		if (endpoint.startsWith("http")) {
			url = endpoint;
		}
		else {
			url = GITHUB_API_BASE + encodePath(endpoint.startsWith("/") ? endpoint.substring(1) : endpoint);
		}
		String query = encodeQuery(request.queryParams());
		if (!query.isEmpty()) {
			url += (url.contains("?") ? "&" : "?") + query;
		}
		return URI.create(url);
	}

	/**
	 * Percent-encode the characters of a relative endpoint that may not appear in a URI.
	 * Existing escapes and an embedded query string are kept as they are.
	 */
	static String encodePath(String endpoint) {
		StringBuilder encoded = new StringBuilder(endpoint.length());
		for (byte b : endpoint.getBytes(StandardCharsets.UTF_8)) {
			char c = (char) (b & 0xFF);
			if (c < 0x80 && (Character.isLetterOrDigit(c) || ALLOWED_IN_PATH.indexOf(c) >= 0)) {
				encoded.append(c);
			}
			else {
				encoded.append('%').append(String.format("%02X", b & 0xFF));
			}
		}
		return encoded.toString();
	}

	private static String encodeQuery(Map<String, String> params) {
		StringBuilder query = new StringBuilder();
		for (Map.Entry<String, String> entry : params.entrySet()) {
			if (query.length() > 0) {
				query.append('&');
			}
			query.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
				.append('=')
				.append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
		}
		return query.toString();
	}

}
