package dev.poireviews.scraper;

import java.time.Duration;

/**
 * Decides what the retrieval loop does after each page attempt. This is a pure function of the
 * loop position and the page outcome; it performs no I/O and does not sleep.
 *
 * <table>
 *   <caption>Transitions</caption>
 *   <tr><th>Outcome</th><th>Action</th><th>Failure counter</th></tr>
 *   <tr><td>HTTP error</td><td>retry after backoff, stop at ceiling</td><td>+1</td></tr>
 *   <tr><td>Request error</td><td>retry after backoff, stop at ceiling</td><td>+1</td></tr>
 *   <tr><td>Connection error</td><td>retry after backoff</td><td>unchanged</td></tr>
 *   <tr><td>Timeout</td><td>retry after backoff</td><td>unchanged</td></tr>
 *   <tr><td>Malformed envelope</td><td>stop</td><td>-</td></tr>
 *   <tr><td>Decode error</td><td>stop</td><td>-</td></tr>
 *   <tr><td>Items</td><td>accumulate, advance</td><td>reset</td></tr>
 *   <tr><td>No items</td><td>stop</td><td>-</td></tr>
 * </table>
 */
public class RetrievalPolicy {

	/** Where the loop currently is */
	public record State(int page, int consecutiveFailures) {
		public static State start() {
			return new State(1, 0);
		}
	}

	public enum Action {
		/** Wait for the backoff and request the same page again */
		RETRY,
		/** Keep the page items, wait for the pacing delay and request the next page */
		ADVANCE,
		STOP
	}

	public record Transition(State next, Action action, Duration backoff, StopReason reason) {
		static Transition retry(State next, Duration backoff) {
			return new Transition(next, Action.RETRY, backoff, null);
		}

		static Transition advance(State next) {
			return new Transition(next, Action.ADVANCE, Duration.ZERO, null);
		}

		static Transition stop(State state, StopReason reason) {
			return new Transition(state, Action.STOP, Duration.ZERO, reason);
		}
	}

	private final int maxFailureCount;
	private final RetrievalConfig.Backoff backoff;

	public RetrievalPolicy(int maxFailureCount, RetrievalConfig.Backoff backoff) {
		this.maxFailureCount = maxFailureCount;
		this.backoff = backoff;
	}

	public static RetrievalPolicy of(RetrievalConfig config) {
		return new RetrievalPolicy(config.maxFailureCount(), config.backoff());
	}

	public Transition next(State state, PageResult result) {
		if (result.success()) {
			if (result.items().isEmpty()) {
				boolean nothingAtAll = state.page() == 1 && result.totalCount() == 0;
				return Transition.stop(state, nothingAtAll ? StopReason.NO_REVIEWS : StopReason.END_OF_DATA);
			}
			return Transition.advance(new State(state.page() + 1, 0));
		}

		FetchFailure failure = result.failure();
		if (failure == FetchFailure.MALFORMED_RESPONSE) {
			return Transition.stop(state, StopReason.MALFORMED_RESPONSE);
		}
		if (failure == FetchFailure.DECODE) {
			return Transition.stop(state, StopReason.DECODE_ERROR);
		}
		Duration wait = backoffFor(failure);
		return failure.countable() ? countedRetry(state, wait) : Transition.retry(state, wait);
	}

	private Duration backoffFor(FetchFailure failure) {
		return switch (failure) {
			case TRANSIENT_HTTP -> backoff.httpError();
			case GENERIC_REQUEST -> backoff.requestError();
			case TIMEOUT -> backoff.timeout();
			case CONNECTION -> backoff.connectionError();
			case MALFORMED_RESPONSE, DECODE -> Duration.ZERO;
		};
	}

	private Transition countedRetry(State state, Duration wait) {
		State next = new State(state.page(), state.consecutiveFailures() + 1);
		if (next.consecutiveFailures() >= maxFailureCount) {
			return Transition.stop(next, StopReason.TOO_MANY_FAILURES);
		}
		return Transition.retry(next, wait);
	}
}
