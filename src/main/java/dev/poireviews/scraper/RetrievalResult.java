package dev.poireviews.scraper;

import dev.poireviews.model.ReviewRecord;
import java.util.List;

/** Result of a retrieval run: the reviews collected so far and why the run ended */
public record RetrievalResult(
		List<ReviewRecord> records, int reportedTotal, StopReason stopReason, int requestsIssued, int pagesProcessed) {

	public boolean completed() {
		return stopReason.completed();
	}

	public boolean isEmpty() {
		return records.isEmpty();
	}

	@Override
	public String toString() {
		return "%s (%d reviews of %d reported, %d pages, %d requests)"
				.formatted(stopReason, records.size(), reportedTotal, pagesProcessed, requestsIssued);
	}
}
