package dev.poireviews.scraper;

/** Thrown when a POI id cannot be resolved from an attraction page */
public class ResolutionException extends Exception {
	public ResolutionException(String message) {
		super(message);
	}

	public ResolutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
