package dev.poireviews.scraper;

import static org.assertj.core.api.Assertions.*;

import dev.poireviews.model.ReviewRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetrievalResultTest {

	@Test
	void testCompletedResult() {
		// When
		RetrievalResult result =
				new RetrievalResult(List.of(ReviewRecord.create().commentId("1")), 1, StopReason.END_OF_DATA, 2, 1);

		// Then
		assertThat(result.completed()).isTrue();
		assertThat(result.isEmpty()).isFalse();
		assertThat(result.toString()).isEqualTo("END_OF_DATA (1 reviews of 1 reported, 1 pages, 2 requests)");
	}

	@Test
	void testAbortedResult() {
		// When
		RetrievalResult result = new RetrievalResult(List.of(), 0, StopReason.TOO_MANY_FAILURES, 3, 0);

		// Then
		assertThat(result.completed()).isFalse();
		assertThat(result.isEmpty()).isTrue();
	}

	@Test
	void testCompletedStopReasons() {
		assertThat(StopReason.values())
				.filteredOn(StopReason::completed)
				.containsExactlyInAnyOrder(StopReason.END_OF_DATA, StopReason.NO_REVIEWS, StopReason.PAGE_LIMIT);
	}

	@Test
	void testPageResultToString() {
		assertThat(PageResult.httpError(500).toString()).isEqualTo("TRANSIENT_HTTP - HTTP status 500");
		assertThat(ScriptedPageFetcher.page(1, 2, 5).toString()).isEqualTo("SUCCESS (2 items, total 5)");
	}
}
