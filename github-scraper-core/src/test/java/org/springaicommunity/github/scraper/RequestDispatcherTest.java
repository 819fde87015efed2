package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RequestDispatcher}.
 *
 * Credentials are backed by mocked {@link GitHubClient}s; time only moves through the
 * recording sleeper.
 */
@DisplayName("RequestDispatcher Tests")
@ExtendWith(MockitoExtension.class)
class RequestDispatcherTest {

	private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

	@Mock
	private GitHubClient firstClient;

	@Mock
	private GitHubClient secondClient;

	private MutableClock clock;

	private RecordingSleeper sleeper;

	private Credential first;

	private Credential second;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(START);
		sleeper = new RecordingSleeper(clock);
		first = new Credential("token-one-aaaa", firstClient);
		second = new Credential("token-two-bbbb", secondClient);
	}

	@AfterEach
	void clearInterrupt() {
		Thread.interrupted();
	}

	private RequestDispatcher dispatcher(Credential... credentials) {
		return dispatcher(sleeper, credentials);
	}

	private RequestDispatcher dispatcher(Sleeper sleeper, Credential... credentials) {
		return RequestDispatcher.builder()
			.pool(new CredentialPool(List.of(credentials), clock))
			.sleeper(sleeper)
			.random(new Random(42))
			.build();
	}

	private static List<Integer> ints(JsonNode array) {
		List<Integer> values = new ArrayList<>();
		array.forEach(node -> values.add(node.asInt()));
		return values;
	}

	@Nested
	@DisplayName("Pagination Tests")
	class PaginationTest {

		@Test
		@DisplayName("Should fetch exactly three pages and concatenate them in order")
		void shouldFetchAllPagesInOrder() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.page("[1,2]", 2),
					Responses.page("[3]", 3), Responses.ok("[4,5]"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/pulls"), true);

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.pagesFetched()).isEqualTo(3);
			assertThat(ints(result.body())).containsExactly(1, 2, 3, 4, 5);
			assertThat(sleeper.sleeps()).isEmpty();

			ArgumentCaptor<ApiRequest> captor = ArgumentCaptor.forClass(ApiRequest.class);
			verify(firstClient, times(3)).send(captor.capture());
			assertThat(captor.getAllValues()).extracting(r -> r.queryParams().get("page"))
				.containsExactly("1", "2", "3");
			assertThat(captor.getAllValues())
				.allSatisfy(r -> assertThat(r.queryParams()).containsEntry("per_page", "100"));
		}

		@Test
		@DisplayName("Should stop on an empty page even if a next link is present")
		void shouldStopOnEmptyPage() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.page("[]", 2));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/forks"), true);

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.pagesFetched()).isEqualTo(1);
			assertThat(result.body()).isEmpty();
			verify(firstClient, times(1)).send(any(ApiRequest.class));
		}

		@Test
		@DisplayName("Should collect the items array of search responses")
		void shouldCollectSearchItems() {
			when(firstClient.send(any(ApiRequest.class)))
				.thenReturn(Responses.ok("{\"total_count\":2,\"items\":[{\"number\":7},{\"number\":9}]}"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("search/issues", Map.of("q", "repo:o/r")),
					true);

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.body()).hasSize(2);
			assertThat(result.body().get(1).get("number").asInt()).isEqualTo(9);
		}

		@Test
		@DisplayName("Should keep the original query parameters on every page")
		void shouldKeepQueryParameters() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.page("[1]", 2), Responses.ok("[2]"));

			dispatcher(first).execute(ApiRequest.get("repos/o/r/issues").withQueryParam("state", "all"), true);

			ArgumentCaptor<ApiRequest> captor = ArgumentCaptor.forClass(ApiRequest.class);
			verify(firstClient, times(2)).send(captor.capture());
			assertThat(captor.getAllValues())
				.allSatisfy(r -> assertThat(r.queryParams()).containsEntry("state", "all"));
		}

		@Test
		@DisplayName("Should reject pagination of non-JSON media types")
		void shouldRejectPaginatedDiff() {
			RequestDispatcher dispatcher = dispatcher(first);
			ApiRequest request = ApiRequest.get("repos/o/r/pulls/1").withAccept(ApiRequest.DIFF);

			assertThatThrownBy(() -> dispatcher.execute(request, true)).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("JSON");
		}

		@Test
		@DisplayName("Should return non-JSON bodies as text")
		void shouldReturnDiffAsText() {
			String diff = "diff --git a/x b/x\n@@ -1 +1 @@\n-a\n+b\n";
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.ok(diff));

			DispatchResult result = dispatcher(first)
				.execute(ApiRequest.get("repos/o/r/pulls/1").withAccept(ApiRequest.DIFF));

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.body().isTextual()).isTrue();
			assertThat(result.body().asText()).isEqualTo(diff);
		}

	}

	@Nested
	@DisplayName("Soft Failure Tests")
	class SoftFailureTest {

		@ParameterizedTest
		@ValueSource(ints = { 404, 409, 410, 451 })
		@DisplayName("Should return an empty result for unavailable resources")
		void shouldReturnSoftEmpty(int status) {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(status));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/pulls/1"));

			assertThat(result.isSoftEmpty()).isTrue();
			assertThat(result.error()).isNull();
			assertThat(result.body().isObject()).isTrue();
			assertThat(result.body()).isEmpty();
			assertThatCode(result::bodyOrThrow).doesNotThrowAnyException();
			assertThat(sleeper.sleeps()).isEmpty();
		}

		@Test
		@DisplayName("Should return an empty array when paginating")
		void shouldReturnEmptyArrayWhenPaginating() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(404));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/pulls/1/commits"), true);

			assertThat(result.isSoftEmpty()).isTrue();
			assertThat(result.body().isArray()).isTrue();
			assertThat(result.body()).isEmpty();
		}

		@Test
		@DisplayName("Should keep pages fetched before a soft failure")
		void shouldKeepPagesBeforeSoftFailure() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.page("[1,2]", 2), Responses.status(404));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/pulls"), true);

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.pagesFetched()).isEqualTo(1);
			assertThat(ints(result.body())).containsExactly(1, 2);
		}

	}

	@Nested
	@DisplayName("Bad Credential Tests")
	class BadCredentialTest {

		@Test
		@DisplayName("Should move on to the next credential after a 401")
		void shouldSkipRejectedCredential() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(401));
			when(secondClient.send(any(ApiRequest.class))).thenReturn(Responses.ok("{\"number\":1}"));

			RequestDispatcher dispatcher = dispatcher(first, second);
			DispatchResult result = dispatcher.execute(ApiRequest.get("repos/o/r/pulls/1"));

			assertThat(result.isSuccess()).isTrue();
			assertThat(sleeper.sleeps()).isEmpty();
			verify(firstClient, times(1)).send(any(ApiRequest.class));
			verify(secondClient, times(1)).send(any(ApiRequest.class));
		}

		@Test
		@DisplayName("Should not retry a rejected credential within the same call")
		void shouldNotRetryRejectedCredentialWhilePaginating() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(401));
			when(secondClient.send(any(ApiRequest.class))).thenReturn(Responses.page("[1]", 2), Responses.ok("[2]"));

			DispatchResult result = dispatcher(first, second).execute(ApiRequest.get("repos/o/r/pulls"), true);

			assertThat(ints(result.body())).containsExactly(1, 2);
			verify(firstClient, times(1)).send(any(ApiRequest.class));
			verify(secondClient, times(2)).send(any(ApiRequest.class));
		}

		@Test
		@DisplayName("Should fail when every credential is rejected")
		void shouldFailWhenAllRejected() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(401));
			when(secondClient.send(any(ApiRequest.class))).thenReturn(Responses.status(401));

			DispatchResult result = dispatcher(first, second).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isFatal()).isTrue();
			assertThat(result.error()).isInstanceOf(GitHubApiException.class);
			assertThat(((GitHubApiException) result.error()).getStatusCode()).isEqualTo(401);
			assertThat(sleeper.sleeps()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Rate Limit Tests")
	class RateLimitTest {

		@Test
		@DisplayName("Should sleep exactly once after a 403 with no quota left, then retry")
		void shouldSleepOnceAfterRateLimit() {
			when(firstClient.send(any(ApiRequest.class)))
				.thenReturn(Responses.rateLimited(403, START.plus(Duration.ofHours(1))));
			when(secondClient.send(any(ApiRequest.class))).thenReturn(Responses.ok("{\"id\":1}"));

			DispatchResult result = dispatcher(first, second).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.body().get("id").asInt()).isEqualTo(1);
			assertThat(sleeper.sleeps()).hasSize(1);
			assertThat(sleeper.sleeps().get(0)).isBetween(Duration.ofSeconds(1), Duration.ofSeconds(60));
			assertThat(first.isReady(RateClass.STANDARD, clock.instant())).isFalse();
		}

		@Test
		@DisplayName("Should treat 429 without headers as exhaustion for the fallback window")
		void shouldTreat429AsExhausted() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(429), Responses.ok("[]"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/branches"));

			assertThat(result.isSuccess()).isTrue();
			Duration total = sleeper.sleeps().stream().reduce(Duration.ZERO, Duration::plus);
			assertThat(total).isGreaterThanOrEqualTo(Duration.ofSeconds(60));
			verify(firstClient, times(2)).send(any(ApiRequest.class));
		}

		@Test
		@DisplayName("Should fail on 403 while quota is left")
		void shouldFailOnForbidden() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.withHeaders(403,
					"{\"message\":\"Resource not accessible by integration\"}", "X-RateLimit-Remaining", "4000"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/collaborators"));

			assertThat(result.isFatal()).isTrue();
			assertThat(((GitHubApiException) result.error()).getStatusCode()).isEqualTo(403);
			assertThat(sleeper.sleeps()).isEmpty();
		}

		@Test
		@DisplayName("Should wait for the earliest reset when no credential is ready")
		void shouldWaitForEarliestReset() {
			first.tracker(RateClass.STANDARD)
				.update(new RateLimitInfo(5000, 0, START.plusSeconds(300).getEpochSecond(), 5000));
			second.tracker(RateClass.STANDARD)
				.update(new RateLimitInfo(5000, 0, START.plusSeconds(120).getEpochSecond(), 5000));
			when(secondClient.send(any(ApiRequest.class))).thenReturn(Responses.ok("{}"));

			DispatchResult result = dispatcher(first, second).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isSuccess()).isTrue();
			assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(121));
			verifyNoInteractions(firstClient);
		}

		@Test
		@DisplayName("Should track search quota separately from the standard quota")
		void shouldTrackSearchQuotaSeparately() {
			first.tracker(RateClass.SEARCH)
				.update(new RateLimitInfo(30, 0, START.plusSeconds(30).getEpochSecond(), 30));
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.ok("{}"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isSuccess()).isTrue();
			assertThat(sleeper.sleeps()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Server Error Tests")
	class ServerErrorTest {

		@Test
		@DisplayName("Should retry after a 5xx with a short jittered wait")
		void shouldRetryServerError() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(502), Responses.ok("{}"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isSuccess()).isTrue();
			assertThat(sleeper.sleeps()).hasSize(1);
			assertThat(sleeper.sleeps().get(0)).isBetween(Duration.ofSeconds(1), Duration.ofSeconds(29));
		}

		@Test
		@DisplayName("Should give up after more server errors than credentials")
		void shouldEscalateServerErrors() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(500));

			DispatchResult result = dispatcher(first, second).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isFatal()).isTrue();
			assertThat(result.error()).isInstanceOf(FatalNetworkException.class);
			assertThat(((FatalNetworkException) result.error()).getAttempts()).isEqualTo(3);
			assertThat(sleeper.sleeps()).hasSize(2);
			verify(firstClient, times(3)).send(any(ApiRequest.class));
		}

		@Test
		@DisplayName("Should reset the server error budget after a successful page")
		void shouldResetBudgetAfterSuccess() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(500), Responses.page("[1]", 2),
					Responses.status(503), Responses.ok("[2]"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/pulls"), true);

			assertThat(result.isSuccess()).isTrue();
			assertThat(ints(result.body())).containsExactly(1, 2);
		}

		@Test
		@DisplayName("Should only count server errors that follow each other")
		void shouldResetBudgetAfterOtherOutcome() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(500), Responses.status(429),
					Responses.status(500), Responses.ok("{\"id\":7}"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.body().get("id").asInt()).isEqualTo(7);
			verify(firstClient, times(4)).send(any(ApiRequest.class));
		}

	}

	@Nested
	@DisplayName("Transport Failure Tests")
	class TransportFailureTest {

		@Test
		@DisplayName("Should retry a timed out request with another credential")
		void shouldRetryWithAnotherCredential() {
			when(firstClient.send(any(ApiRequest.class)))
				.thenThrow(new GitHubTransportException("timed out", true, new IOException("timeout")));
			when(secondClient.send(any(ApiRequest.class))).thenReturn(Responses.ok("{}"));

			DispatchResult result = dispatcher(first, second).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isSuccess()).isTrue();
			assertThat(sleeper.sleeps()).isEmpty();
		}

		@Test
		@DisplayName("Should give up after more network failures than credentials")
		void shouldEscalateTransportFailures() {
			when(firstClient.send(any(ApiRequest.class)))
				.thenThrow(new GitHubTransportException("connection reset", false, new IOException("reset")));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isFatal()).isTrue();
			assertThat(result.error()).isInstanceOf(FatalNetworkException.class)
				.hasCauseInstanceOf(GitHubTransportException.class);
			verify(firstClient, times(2)).send(any(ApiRequest.class));
		}

		@Test
		@DisplayName("Should only count network failures that follow each other")
		void shouldResetBudgetWhenResponseArrives() {
			when(firstClient.send(any(ApiRequest.class)))
				.thenThrow(new GitHubTransportException("connection reset", false, new IOException("reset")))
				.thenReturn(Responses.status(502))
				.thenThrow(new GitHubTransportException("timed out", true, new IOException("timeout")))
				.thenReturn(Responses.ok("{}"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isSuccess()).isTrue();
			verify(firstClient, times(4)).send(any(ApiRequest.class));
		}

	}

	@Nested
	@DisplayName("Fatal Error Tests")
	class FatalErrorTest {

		@Test
		@DisplayName("Should return unclassified statuses as fatal")
		void shouldFailOnUnclassifiedStatus() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(422));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isFatal()).isTrue();
			assertThat(((GitHubApiException) result.error()).getStatusCode()).isEqualTo(422);
			assertThatThrownBy(result::bodyOrThrow).isSameAs(result.error());
		}

		@Test
		@DisplayName("Should keep pages fetched before a fatal error")
		void shouldKeepPartialPages() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.page("[1,2]", 2), Responses.status(422));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/pulls"), true);

			assertThat(result.isFatal()).isTrue();
			assertThat(result.pagesFetched()).isEqualTo(1);
			assertThat(ints(result.body())).containsExactly(1, 2);
		}

		@Test
		@DisplayName("Should report malformed JSON as fatal")
		void shouldFailOnMalformedJson() {
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.ok("{not json"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isFatal()).isTrue();
			assertThat(result.error()).isInstanceOf(GitHubApiException.class).hasMessageContaining("Malformed JSON");
		}

		@Test
		@DisplayName("Should return a request the client cannot send as fatal instead of throwing")
		void shouldFailOnInvalidRequest() {
			when(firstClient.send(any(ApiRequest.class)))
				.thenThrow(new IllegalArgumentException("Illegal character in path at index 44"));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r/contents/bad%zz.txt"));

			assertThat(result.isFatal()).isTrue();
			assertThat(result.error()).isInstanceOf(GitHubApiException.class)
				.hasCauseInstanceOf(IllegalArgumentException.class);
			assertThat(sleeper.sleeps()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Cancellation Tests")
	class CancellationTest {

		@Test
		@DisplayName("Should cancel instead of waiting past the deadline")
		void shouldCancelAtDeadline() {
			first.tracker(RateClass.STANDARD)
				.update(new RateLimitInfo(5000, 0, START.plus(Duration.ofHours(1)).getEpochSecond(), 5000));

			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r"), false,
					START.plus(Duration.ofMinutes(10)));

			assertThat(result.isFatal()).isTrue();
			assertThat(result.error()).isInstanceOf(RequestCancelledException.class);
			assertThat(sleeper.sleeps()).isEmpty();
			verifyNoInteractions(firstClient);
		}

		@Test
		@DisplayName("Should not send when the deadline has already passed")
		void shouldNotSendAfterDeadline() {
			DispatchResult result = dispatcher(first).execute(ApiRequest.get("repos/o/r"), false, START);

			assertThat(result.isFatal()).isTrue();
			assertThat(result.error()).isInstanceOf(RequestCancelledException.class);
			verifyNoInteractions(firstClient);
		}

		@Test
		@DisplayName("Should end the call and restore the interrupt flag when interrupted")
		void shouldStopWhenInterrupted() {
			Sleeper interrupted = duration -> {
				throw new InterruptedException("stop");
			};
			when(firstClient.send(any(ApiRequest.class))).thenReturn(Responses.status(503));

			DispatchResult result = dispatcher(interrupted, first).execute(ApiRequest.get("repos/o/r"));

			assertThat(result.isFatal()).isTrue();
			assertThat(result.error()).isInstanceOf(RequestCancelledException.class)
				.hasCauseInstanceOf(InterruptedException.class);
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
		}

	}

	@Nested
	@DisplayName("Builder Tests")
	class BuilderTest {

		@Test
		@DisplayName("Should require a credential pool")
		void shouldRequirePool() {
			assertThatThrownBy(() -> RequestDispatcher.builder().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("CredentialPool");
		}

		@Test
		@DisplayName("Should reject page sizes outside 1-100")
		void shouldValidatePerPage() {
			CredentialPool pool = new CredentialPool(List.of(first), clock);

			assertThatThrownBy(() -> RequestDispatcher.builder().pool(pool).perPage(0).build())
				.isInstanceOf(IllegalStateException.class);
			assertThatThrownBy(() -> RequestDispatcher.builder().pool(pool).perPage(101).build())
				.isInstanceOf(IllegalStateException.class);
		}

	}

}
