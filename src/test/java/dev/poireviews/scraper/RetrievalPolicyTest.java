package dev.poireviews.scraper;

import static org.assertj.core.api.Assertions.*;

import dev.poireviews.scraper.RetrievalPolicy.Action;
import dev.poireviews.scraper.RetrievalPolicy.State;
import dev.poireviews.scraper.RetrievalPolicy.Transition;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetrievalPolicyTest {

	private final RetrievalPolicy policy = new RetrievalPolicy(3, RetrievalConfig.Backoff.DEFAULT);

	@Test
	void testPageWithItemsAdvancesAndResetsFailures() {
		// When
		Transition transition = policy.next(new State(4, 2), ScriptedPageFetcher.page(1, 10, 100));

		// Then
		assertThat(transition.action()).isEqualTo(Action.ADVANCE);
		assertThat(transition.next()).isEqualTo(new State(5, 0));
		assertThat(transition.reason()).isNull();
	}

	@Test
	void testEmptyPageEndsRun() {
		// When
		Transition transition = policy.next(new State(3, 0), ScriptedPageFetcher.empty(20));

		// Then
		assertThat(transition.action()).isEqualTo(Action.STOP);
		assertThat(transition.reason()).isEqualTo(StopReason.END_OF_DATA);
	}

	@Test
	void testEmptyFirstPageWithZeroTotalMeansNoReviews() {
		// When
		Transition transition = policy.next(State.start(), ScriptedPageFetcher.empty(0));

		// Then
		assertThat(transition.reason()).isEqualTo(StopReason.NO_REVIEWS);
	}

	@Test
	void testEmptyFirstPageWithNonZeroTotalIsEndOfData() {
		// When
		Transition transition = policy.next(State.start(), ScriptedPageFetcher.empty(12));

		// Then
		assertThat(transition.reason()).isEqualTo(StopReason.END_OF_DATA);
	}

	@Test
	void testHttpErrorRetriesSamePageAndCounts() {
		// When
		Transition transition = policy.next(new State(2, 0), PageResult.httpError(500));

		// Then
		assertThat(transition.action()).isEqualTo(Action.RETRY);
		assertThat(transition.next()).isEqualTo(new State(2, 1));
		assertThat(transition.backoff()).isEqualTo(Duration.ofSeconds(3));
	}

	@Test
	void testRequestErrorRetriesSamePageAndCounts() {
		// When
		Transition transition =
				policy.next(new State(2, 1), PageResult.failure(FetchFailure.GENERIC_REQUEST, "broken pipe"));

		// Then
		assertThat(transition.action()).isEqualTo(Action.RETRY);
		assertThat(transition.next()).isEqualTo(new State(2, 2));
		assertThat(transition.backoff()).isEqualTo(Duration.ofSeconds(5));
	}

	@Test
	void testCountedFailureAtCeilingStops() {
		// When
		Transition transition = policy.next(new State(2, 2), PageResult.httpError(503));

		// Then
		assertThat(transition.action()).isEqualTo(Action.STOP);
		assertThat(transition.reason()).isEqualTo(StopReason.TOO_MANY_FAILURES);
		assertThat(transition.next().consecutiveFailures()).isEqualTo(3);
	}

	@Test
	void testTimeoutAndConnectionErrorsRetryWithoutCounting() {
		// When
		Transition timeout = policy.next(new State(2, 2), PageResult.failure(FetchFailure.TIMEOUT, "timeout"));
		Transition connection =
				policy.next(new State(2, 2), PageResult.failure(FetchFailure.CONNECTION, "refused"));

		// Then
		assertThat(timeout.action()).isEqualTo(Action.RETRY);
		assertThat(timeout.next()).isEqualTo(new State(2, 2));
		assertThat(timeout.backoff()).isEqualTo(Duration.ofSeconds(5));
		assertThat(connection.action()).isEqualTo(Action.RETRY);
		assertThat(connection.next()).isEqualTo(new State(2, 2));
		assertThat(connection.backoff()).isEqualTo(Duration.ofSeconds(10));
	}

	@Test
	void testContractViolationsStop() {
		// When
		Transition malformed =
				policy.next(new State(2, 1), PageResult.failure(FetchFailure.MALFORMED_RESPONSE, "no result"));
		Transition decode = policy.next(new State(2, 1), PageResult.failure(FetchFailure.DECODE, "bad json"));

		// Then
		assertThat(malformed.action()).isEqualTo(Action.STOP);
		assertThat(malformed.reason()).isEqualTo(StopReason.MALFORMED_RESPONSE);
		assertThat(decode.action()).isEqualTo(Action.STOP);
		assertThat(decode.reason()).isEqualTo(StopReason.DECODE_ERROR);
	}

	@Test
	void testOnlyHttpAndRequestErrorsAreCountable() {
		assertThat(FetchFailure.values())
				.filteredOn(FetchFailure::countable)
				.containsExactlyInAnyOrder(FetchFailure.TRANSIENT_HTTP, FetchFailure.GENERIC_REQUEST);
	}

	@Test
	void testRetryCountsExactlyTheCountableFailures() {
		for (FetchFailure failure : FetchFailure.values()) {
			// When
			Transition transition = policy.next(new State(2, 1), PageResult.failure(failure, "x"));

			// Then
			if (transition.action() == Action.STOP && failure != FetchFailure.MALFORMED_RESPONSE
					&& failure != FetchFailure.DECODE) {
				fail("Unexpected stop for " + failure);
			}
			if (transition.action() == Action.RETRY) {
				int expected = failure.countable() ? 2 : 1;
				assertThat(transition.next().consecutiveFailures()).as(failure.name()).isEqualTo(expected);
			}
		}
	}
}
