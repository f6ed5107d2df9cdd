package dev.poireviews.scraper;

import dev.poireviews.model.ReviewRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Mutable state of a single retrieval run. Owned by one {@link ReviewRetriever} call. */
public class RetrievalSession {
	private final List<ReviewRecord> records = new ArrayList<>();
	private RetrievalPolicy.State state = RetrievalPolicy.State.start();
	private Integer reportedTotal;
	private int requestsIssued;
	private int pagesProcessed;

	public RetrievalPolicy.State state() {
		return state;
	}

	void moveTo(RetrievalPolicy.State state) {
		this.state = state;
	}

	public int page() {
		return state.page();
	}

	public int consecutiveFailures() {
		return state.consecutiveFailures();
	}

	void requestIssued() {
		requestsIssued++;
	}

	/** Only the first reported total is kept */
	void reportTotal(int total) {
		if (reportedTotal == null) {
			reportedTotal = total;
		}
	}

	void append(List<ReviewRecord> pageRecords) {
		records.addAll(pageRecords);
		pagesProcessed++;
	}

	public List<ReviewRecord> records() {
		return Collections.unmodifiableList(records);
	}

	public int reportedTotal() {
		return reportedTotal != null ? reportedTotal : 0;
	}

	public int requestsIssued() {
		return requestsIssued;
	}

	public int pagesProcessed() {
		return pagesProcessed;
	}

	RetrievalResult finish(StopReason reason) {
		return new RetrievalResult(List.copyOf(records), reportedTotal(), reason, requestsIssued, pagesProcessed);
	}
}
