package dev.poireviews.scraper;

/** Thrown when a single review field cannot be read. Always recovered with the field default. */
public class FieldExtractionException extends RuntimeException {
	public FieldExtractionException(String message) {
		super(message);
	}
}
