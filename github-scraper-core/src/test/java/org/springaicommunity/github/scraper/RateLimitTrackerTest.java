package org.springaicommunity.github.scraper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RateLimitTracker Tests")
class RateLimitTrackerTest {

	private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

	private RateLimitTracker tracker;

	@BeforeEach
	void setUp() {
		tracker = new RateLimitTracker();
	}

	@Nested
	@DisplayName("Readiness Tests")
	class ReadinessTest {

		@Test
		@DisplayName("Should be ready before any response was observed")
		void shouldBeReadyWhenUnknown() {
			assertThat(tracker.snapshot()).isNull();
			assertThat(tracker.isReady(NOW)).isTrue();
			assertThat(tracker.readyAt(NOW)).isEqualTo(NOW);
		}

		@Test
		@DisplayName("Should be ready while quota is left")
		void shouldBeReadyWithQuota() {
			tracker.update(new RateLimitInfo(5000, 1, NOW.plusSeconds(600).getEpochSecond(), 4999));

			assertThat(tracker.isReady(NOW)).isTrue();
			assertThat(tracker.readyAt(NOW)).isEqualTo(NOW);
		}

		@Test
		@DisplayName("Should not be ready until the reset time once quota is used up")
		void shouldWaitForReset() {
			Instant reset = NOW.plusSeconds(600);
			tracker.update(new RateLimitInfo(5000, 0, reset.getEpochSecond(), 5000));

			assertThat(tracker.isReady(NOW)).isFalse();
			assertThat(tracker.readyAt(NOW)).isEqualTo(reset);
			assertThat(tracker.isReady(reset.minusSeconds(1))).isFalse();
			assertThat(tracker.isReady(reset)).isTrue();
		}

	}

	@Nested
	@DisplayName("Exhaustion Tests")
	class ExhaustionTest {

		@Test
		@DisplayName("Should use the fallback reset when none is known")
		void shouldUseFallbackReset() {
			tracker.markExhausted(NOW, NOW.plusSeconds(60));

			assertThat(tracker.snapshot().remaining()).isZero();
			assertThat(tracker.readyAt(NOW)).isEqualTo(NOW.plusSeconds(60));
		}

		@Test
		@DisplayName("Should keep a known future reset")
		void shouldKeepKnownReset() {
			tracker.update(new RateLimitInfo(5000, 12, NOW.plusSeconds(900).getEpochSecond(), 4988));

			tracker.markExhausted(NOW, NOW.plusSeconds(60));

			RateLimitInfo snapshot = tracker.snapshot();
			assertThat(snapshot.remaining()).isZero();
			assertThat(snapshot.limit()).isEqualTo(5000);
			assertThat(snapshot.getResetTime()).isEqualTo(NOW.plusSeconds(900));
		}

		@Test
		@DisplayName("Should replace a reset time that has already passed")
		void shouldReplaceStaleReset() {
			tracker.update(new RateLimitInfo(5000, 0, NOW.minusSeconds(5).getEpochSecond(), 5000));

			tracker.markExhausted(NOW, NOW.plusSeconds(60));

			assertThat(tracker.readyAt(NOW)).isEqualTo(NOW.plusSeconds(60));
		}

	}

}
