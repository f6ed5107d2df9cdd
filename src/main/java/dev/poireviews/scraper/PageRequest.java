package dev.poireviews.scraper;

/** A request for one page of reviews. Pages are numbered from 1. */
public record PageRequest(String poiId, int pageIndex, int pageSize) {
	public static final int DEFAULT_PAGE_SIZE = 10;

	public PageRequest {
		if (poiId == null || poiId.isBlank()) {
			throw new IllegalArgumentException("POI id must not be empty");
		}
		if (pageIndex < 1) {
			throw new IllegalArgumentException("Page index must be at least 1, got " + pageIndex);
		}
		if (pageSize < 1) {
			throw new IllegalArgumentException("Page size must be at least 1, got " + pageSize);
		}
	}

	public static PageRequest of(String poiId, int pageIndex) {
		return new PageRequest(poiId, pageIndex, DEFAULT_PAGE_SIZE);
	}
}
