package dev.poireviews.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import dev.poireviews.model.ReviewRecord;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;

/**
 * Retrieves all reviews of one POI by requesting pages one after the other until the API runs out
 * of items. Failures are retried or end the run according to {@link RetrievalPolicy}; whatever was
 * collected before the run ended is always returned.
 *
 * <p>Pages are fetched strictly sequentially with a random pause between them. An instance runs one
 * retrieval at a time; independent instances share no state.
 */
public class ReviewRetriever {
	private final PageFetcher fetcher;
	private final RetrievalConfig config;
	private final RetrievalPolicy policy;
	private final ReviewMapper mapper;
	private final Sleeper sleeper;
	private final Random random;
	private final Logger logger;

	private volatile boolean cancelled;

	public ReviewRetriever(PageFetcher fetcher, RetrievalConfig config) {
		this(fetcher, config, new ReviewMapper(), Sleeper.THREAD, new Random());
	}

	public ReviewRetriever(
			PageFetcher fetcher, RetrievalConfig config, ReviewMapper mapper, Sleeper sleeper, Random random) {
		this.fetcher = fetcher;
		this.config = config;
		this.policy = RetrievalPolicy.of(config);
		this.mapper = mapper;
		this.sleeper = sleeper;
		this.random = random;
		this.logger = config.logger();
	}

	/** Ask a running retrieval to stop before its next request or pause */
	public void cancel() {
		cancelled = true;
	}

	/**
	 * Run the retrieval. Never throws for page-level problems.
	 *
	 * @return the collected reviews and the reason the run ended
	 */
	public RetrievalResult retrieve() {
		RetrievalSession session = new RetrievalSession();
		logger.info("Starting retrieval of reviews for POI {}", config.poiId());

		StopReason reason;
		try {
			reason = run(session);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted on page {}, keeping {} reviews", session.page(), session.records().size());
			reason = StopReason.INTERRUPTED;
		}

		RetrievalResult result = session.finish(reason);
		logger.info("Retrieval finished: {}", result);
		return result;
	}

	private StopReason run(RetrievalSession session) throws InterruptedException {
		while (true) {
			if (cancelled) {
				logger.info("Retrieval cancelled before page {}", session.page());
				return StopReason.CANCELLED;
			}

			int page = session.page();
			if (config.pageLimitReached(page)) {
				logger.info("Reached page limit of {}", config.maxPages());
				return StopReason.PAGE_LIMIT;
			}

			RetrievalPolicy.Transition transition;
			try {
				logger.info("Fetching page {}", page);
				PageRequest request = new PageRequest(config.poiId(), page, config.pageSize());
				session.requestIssued();
				PageResult result = fetcher.fetch(request);

				transition = policy.next(session.state(), result);
				session.moveTo(transition.next());
				if (result.success()) {
					session.reportTotal(result.totalCount());
					if (page == 1) {
						logger.info("API reports {} reviews in total", result.totalCount());
					}
				}

				switch (transition.action()) {
					case ADVANCE -> accumulate(session, page, result.items());
					case RETRY -> reportRetry(page, result, transition);
					case STOP -> reportStop(page, result, transition);
				}
			} catch (RuntimeException e) {
				logger.error("Unexpected error on page {}: {}", page, e.getMessage(), e);
				return StopReason.UNEXPECTED_ERROR;
			}

			if (transition.action() == RetrievalPolicy.Action.STOP) {
				return transition.reason();
			}
			if (cancelled) {
				logger.info("Retrieval cancelled after page {}", page);
				return StopReason.CANCELLED;
			}

			if (transition.action() == RetrievalPolicy.Action.RETRY) {
				sleeper.sleep(transition.backoff());
			} else if (!config.pageLimitReached(session.page())) {
				Duration delay = pacingDelay();
				logger.debug("Waiting {} ms", delay.toMillis());
				sleeper.sleep(delay);
			}
		}
	}

	private void accumulate(RetrievalSession session, int page, List<JsonNode> items) {
		List<ReviewRecord> records = mapper.mapAll(items);
		session.append(records);
		logger.info(
				"Page {} gave {} reviews, {} collected so far", page, records.size(), session.records().size());
	}

	private void reportRetry(int page, PageResult result, RetrievalPolicy.Transition transition) {
		long seconds = transition.backoff().toSeconds();
		switch (result.failure()) {
			case TRANSIENT_HTTP -> logger.error(
					"Request for page {} failed with HTTP status {} ({} of {} failures), retrying in {}s",
					page,
					result.statusCode(),
					transition.next().consecutiveFailures(),
					config.maxFailureCount(),
					seconds);
			case GENERIC_REQUEST -> logger.error(
					"Request for page {} failed: {} ({} of {} failures), retrying in {}s",
					page,
					result.message(),
					transition.next().consecutiveFailures(),
					config.maxFailureCount(),
					seconds);
			case TIMEOUT -> logger.error("Request for page {} timed out, retrying in {}s", page, seconds);
			case CONNECTION -> logger.error(
					"Connection error on page {}: {}, retrying in {}s", page, result.message(), seconds);
			default -> logger.error("Page {} failed: {}, retrying in {}s", page, result, seconds);
		}
	}

	private void reportStop(int page, PageResult result, RetrievalPolicy.Transition transition) {
		switch (transition.reason()) {
			case END_OF_DATA -> logger.info("Page {} has no reviews, retrieval complete", page);
			case NO_REVIEWS -> logger.warn("POI {} has no reviews", config.poiId());
			case TOO_MANY_FAILURES -> logger.error(
					"Page {} failed {} times in a row ({}), giving up",
					page,
					transition.next().consecutiveFailures(),
					result.message());
			case MALFORMED_RESPONSE -> logger.error("Unexpected response format on page {}: {}", page, result.message());
			case DECODE_ERROR -> logger.error("Could not parse response for page {}: {}", page, result.message());
			default -> logger.error("Stopping on page {}: {}", page, transition.reason());
		}
	}

	private Duration pacingDelay() {
		long min = config.minDelay().toMillis();
		long max = config.maxDelay().toMillis();
		return Duration.ofMillis(min + (long) (random.nextDouble() * (max - min)));
	}
}
