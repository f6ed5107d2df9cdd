package dev.poireviews.scraper;

/**
 * Fetches a single page of reviews. Implementations perform exactly one request per call and never
 * retry or sleep; all failures are reported through the returned {@link PageResult}.
 */
public interface PageFetcher {

	PageResult fetch(PageRequest request) throws InterruptedException;
}
