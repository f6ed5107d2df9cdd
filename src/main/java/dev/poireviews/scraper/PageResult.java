package dev.poireviews.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Outcome of fetching one page: either the raw review items plus the total count reported by the
 * server, or a failure.
 */
public record PageResult(List<JsonNode> items, int totalCount, FetchFailure failure, int statusCode, String message) {

	public static PageResult success(List<JsonNode> items, int totalCount) {
		return new PageResult(List.copyOf(items), totalCount, null, 200, null);
	}

	public static PageResult failure(FetchFailure failure, String message) {
		return new PageResult(List.of(), 0, failure, -1, message);
	}

	public static PageResult httpError(int statusCode) {
		return new PageResult(List.of(), 0, FetchFailure.TRANSIENT_HTTP, statusCode, "HTTP status " + statusCode);
	}

	public boolean success() {
		return failure == null;
	}

	@Override
	public String toString() {
		return success()
				? "SUCCESS (%d items, total %d)".formatted(items.size(), totalCount)
				: "%s - %s".formatted(failure, message);
	}
}
