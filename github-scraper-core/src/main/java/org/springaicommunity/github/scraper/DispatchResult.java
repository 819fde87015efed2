package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Result of {@link RequestDispatcher#execute(ApiRequest, boolean)}.
 *
 * <p>
 * A {@link Status#FATAL} result still carries whatever pages were fetched before the
 * failure in {@link #body()}.
 *
 * @param status terminal state of the call
 * @param body parsed body: the response document, or an array of all page items when
 * paginating; empty when nothing was fetched
 * @param pagesFetched number of successful pages
 * @param error cause of a {@link Status#FATAL} result, null otherwise
 */
public record DispatchResult(Status status, JsonNode body, int pagesFetched, @Nullable RuntimeException error) {

	/**
	 * Terminal state of a dispatched request.
	 */
	public enum Status {

		SUCCESS, SOFT_EMPTY, FATAL

	}

	public static DispatchResult success(JsonNode body, int pagesFetched) {
		return new DispatchResult(Status.SUCCESS, body, pagesFetched, null);
	}

	public static DispatchResult softEmpty(JsonNode emptyBody) {
		return new DispatchResult(Status.SOFT_EMPTY, emptyBody, 0, null);
	}

	public static DispatchResult fatal(RuntimeException error, JsonNode partialBody, int pagesFetched) {
		return new DispatchResult(Status.FATAL, partialBody, pagesFetched, error);
	}

	public boolean isSuccess() {
		return status == Status.SUCCESS;
	}

	public boolean isSoftEmpty() {
		return status == Status.SOFT_EMPTY;
	}

	public boolean isFatal() {
		return status == Status.FATAL;
	}

	/**
	 * Returns the body, or rethrows the error of a fatal result.
	 * @return the body
	 * @throws RuntimeException the recorded error when {@link #isFatal()}
	 */
	public JsonNode bodyOrThrow() {
		if (error != null) {
			throw error;
		}
		return body;
	}

}
