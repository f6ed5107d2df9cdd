package dev.poireviews.scraper;

import java.time.Duration;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * Configuration record for one retrieval run. Encapsulates the target POI id, paging limits, the
 * pacing delay range, the failure ceiling, the retry backoffs and the logger to report progress to.
 *
 * @param maxPages maximum number of pages to fetch, or 0 for no limit
 */
public record RetrievalConfig(
		String poiId,
		int maxPages,
		int pageSize,
		Duration minDelay,
		Duration maxDelay,
		int maxFailureCount,
		Backoff backoff,
		Logger logger) {

	private static final Pattern NUMERIC_ID = Pattern.compile("\\d+");

	public static final Duration DEFAULT_MIN_DELAY = Duration.ofMillis(1500);
	public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(3000);
	public static final int DEFAULT_MAX_FAILURE_COUNT = 3;

	/** Fixed waits before retrying the same page after a failure */
	public record Backoff(Duration httpError, Duration requestError, Duration timeout, Duration connectionError) {
		public static final Backoff DEFAULT =
				new Backoff(Duration.ofSeconds(3), Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(10));
		public static final Backoff NONE = new Backoff(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);
	}

	public RetrievalConfig {
		if (poiId == null || !NUMERIC_ID.matcher(poiId).matches()) {
			throw new IllegalArgumentException("POI id must be numeric, got '" + poiId + "'");
		}
		try {
			Long.parseLong(poiId);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("POI id is out of range: " + poiId, e);
		}
		if (maxPages < 0) {
			throw new IllegalArgumentException("Max pages must not be negative");
		}
		if (pageSize < 1) {
			throw new IllegalArgumentException("Page size must be at least 1");
		}
		if (minDelay.isNegative() || maxDelay.isNegative() || minDelay.compareTo(maxDelay) > 0) {
			throw new IllegalArgumentException("Invalid delay range " + minDelay + " - " + maxDelay);
		}
		if (maxFailureCount < 1) {
			throw new IllegalArgumentException("Max failure count must be at least 1");
		}
	}

	public static RetrievalConfig defaults(String poiId, Logger logger) {
		return new RetrievalConfig(
				poiId,
				0,
				PageRequest.DEFAULT_PAGE_SIZE,
				DEFAULT_MIN_DELAY,
				DEFAULT_MAX_DELAY,
				DEFAULT_MAX_FAILURE_COUNT,
				Backoff.DEFAULT,
				logger);
	}

	public boolean pageLimitReached(int page) {
		return maxPages > 0 && page > maxPages;
	}

	public RetrievalConfig withMaxPages(int maxPages) {
		return new RetrievalConfig(poiId, maxPages, pageSize, minDelay, maxDelay, maxFailureCount, backoff, logger);
	}

	public RetrievalConfig withPageSize(int pageSize) {
		return new RetrievalConfig(poiId, maxPages, pageSize, minDelay, maxDelay, maxFailureCount, backoff, logger);
	}

	public RetrievalConfig withDelay(Duration minDelay, Duration maxDelay) {
		return new RetrievalConfig(poiId, maxPages, pageSize, minDelay, maxDelay, maxFailureCount, backoff, logger);
	}

	public RetrievalConfig withMaxFailureCount(int maxFailureCount) {
		return new RetrievalConfig(poiId, maxPages, pageSize, minDelay, maxDelay, maxFailureCount, backoff, logger);
	}

	public RetrievalConfig withBackoff(Backoff backoff) {
		return new RetrievalConfig(poiId, maxPages, pageSize, minDelay, maxDelay, maxFailureCount, backoff, logger);
	}
}
