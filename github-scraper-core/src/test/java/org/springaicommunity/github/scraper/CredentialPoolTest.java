package org.springaicommunity.github.scraper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CredentialPool Tests")
@ExtendWith(MockitoExtension.class)
class CredentialPoolTest {

	private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

	@Mock
	private GitHubClient client;

	private MutableClock clock;

	private Credential c1;

	private Credential c2;

	private Credential c3;

	private CredentialPool pool;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(NOW);
		c1 = new Credential("ghp_first000001", client);
		c2 = new Credential("ghp_second00002", client);
		c3 = new Credential("ghp_third000003", client);
		pool = new CredentialPool(List.of(c1, c2, c3), clock);
	}

	private static void exhaust(Credential credential, RateClass rateClass, Instant reset) {
		credential.tracker(rateClass).update(new RateLimitInfo(5000, 0, reset.getEpochSecond(), 5000));
	}

	@Nested
	@DisplayName("Selection Tests")
	class SelectionTest {

		@Test
		@DisplayName("Should pick the first ready credential in pool order")
		void shouldPickFirstReady() {
			exhaust(c1, RateClass.STANDARD, NOW.plusSeconds(60));

			assertThat(pool.pickReady(RateClass.STANDARD)).containsSame(c2);
			assertThat(pool.pickReady(RateClass.STANDARD)).containsSame(c2);
		}

		@Test
		@DisplayName("Should return empty when no credential is ready")
		void shouldReturnEmptyWhenExhausted() {
			exhaust(c1, RateClass.STANDARD, NOW.plusSeconds(60));
			exhaust(c2, RateClass.STANDARD, NOW.plusSeconds(60));
			exhaust(c3, RateClass.STANDARD, NOW.plusSeconds(60));

			assertThat(pool.pickReady(RateClass.STANDARD)).isEmpty();
		}

		@Test
		@DisplayName("Should skip excluded credentials")
		void shouldSkipExcluded() {
			assertThat(pool.pickReady(RateClass.STANDARD, Set.of(c1, c2))).containsSame(c3);
			assertThat(pool.pickReady(RateClass.STANDARD, Set.of(c1, c2, c3))).isEmpty();
		}

		@Test
		@DisplayName("Should judge readiness per rate class")
		void shouldJudgePerRateClass() {
			exhaust(c1, RateClass.SEARCH, NOW.plusSeconds(60));

			assertThat(pool.pickReady(RateClass.SEARCH)).containsSame(c2);
			assertThat(pool.pickReady(RateClass.STANDARD)).containsSame(c1);
		}

		@Test
		@DisplayName("Should pick a credential again once its reset time passes")
		void shouldRecoverAfterReset() {
			exhaust(c1, RateClass.STANDARD, NOW.plusSeconds(60));
			clock.advance(Duration.ofSeconds(60));

			assertThat(pool.pickReady(RateClass.STANDARD)).containsSame(c1);
		}

	}

	@Nested
	@DisplayName("Earliest Ready Tests")
	class EarliestReadyTest {

		@Test
		@DisplayName("Should return the minimum reset across not-ready credentials")
		void shouldReturnMinimumReset() {
			exhaust(c1, RateClass.STANDARD, NOW.plusSeconds(300));
			exhaust(c2, RateClass.STANDARD, NOW.plusSeconds(120));
			exhaust(c3, RateClass.STANDARD, NOW.plusSeconds(900));

			assertThat(pool.earliestReadyAt(RateClass.STANDARD)).isEqualTo(NOW.plusSeconds(120));
		}

		@Test
		@DisplayName("Should ignore ready credentials")
		void shouldIgnoreReadyCredentials() {
			exhaust(c1, RateClass.STANDARD, NOW.plusSeconds(300));
			c2.tracker(RateClass.STANDARD)
				.update(new RateLimitInfo(5000, 10, NOW.plusSeconds(30).getEpochSecond(), 4990));
			exhaust(c3, RateClass.STANDARD, NOW.plusSeconds(900));

			assertThat(pool.earliestReadyAt(RateClass.STANDARD)).isEqualTo(NOW.plusSeconds(300));
		}

		@Test
		@DisplayName("Should ignore excluded credentials")
		void shouldIgnoreExcluded() {
			exhaust(c1, RateClass.STANDARD, NOW.plusSeconds(100));
			exhaust(c2, RateClass.STANDARD, NOW.plusSeconds(200));
			exhaust(c3, RateClass.STANDARD, NOW.plusSeconds(300));

			assertThat(pool.earliestReadyAt(RateClass.STANDARD, Set.of(c1))).isEqualTo(NOW.plusSeconds(200));
		}

	}

	@Nested
	@DisplayName("Construction Tests")
	class ConstructionTest {

		@Test
		@DisplayName("Should reject an empty pool")
		void shouldRejectEmptyPool() {
			assertThatThrownBy(() -> new CredentialPool(List.of(), clock)).isInstanceOf(ConfigurationException.class);
			assertThatThrownBy(() -> CredentialPool.fromTokens(List.of(), Duration.ofSeconds(5), clock))
				.isInstanceOf(ConfigurationException.class);
		}

		@Test
		@DisplayName("Should keep duplicate tokens as separate credentials")
		void shouldKeepDuplicates() {
			CredentialPool duplicates = CredentialPool.fromTokens(List.of("same", "same"), Duration.ofSeconds(5),
					clock);

			assertThat(duplicates.size()).isEqualTo(2);
			assertThat(duplicates.credentials().get(0)).isNotSameAs(duplicates.credentials().get(1));
		}

		@Test
		@DisplayName("Should never expose the full secret")
		void shouldMaskSecret() {
			assertThat(c1.maskedSecret()).endsWith("0001").doesNotContain("ghp_first");
			assertThat(c1.toString()).doesNotContain("ghp_first");
		}

	}

}
