package dev.poireviews.scraper;

/** Why a retrieval run ended */
public enum StopReason {
	/** A page came back with no items: all reviews were retrieved */
	END_OF_DATA,
	/** The first page reported that the POI has no reviews */
	NO_REVIEWS,
	/** The configured page limit was reached */
	PAGE_LIMIT,
	/** Too many HTTP or request errors in a row */
	TOO_MANY_FAILURES,
	/** The response did not contain the expected envelope */
	MALFORMED_RESPONSE,
	/** The response was not valid JSON */
	DECODE_ERROR,
	/** Something went wrong that the retrieval loop does not know how to handle */
	UNEXPECTED_ERROR,
	CANCELLED,
	INTERRUPTED;

	/** Whether the run ended because there was nothing more to fetch or the limit was hit */
	public boolean completed() {
		return this == END_OF_DATA || this == NO_REVIEWS || this == PAGE_LIMIT;
	}
}
