package dev.poireviews.scraper;

/** The ways a single page fetch can fail */
public enum FetchFailure {
	/** Server answered with a non-2xx status */
	TRANSIENT_HTTP,
	/** Connection could not be established */
	CONNECTION,
	/** Request or connect timed out */
	TIMEOUT,
	/** Any other I/O problem while sending the request */
	GENERIC_REQUEST,
	/** 2xx response without the {@code result} envelope */
	MALFORMED_RESPONSE,
	/** 2xx response whose body is not valid JSON */
	DECODE;

	/** Whether this failure counts toward the consecutive-failure ceiling */
	public boolean countable() {
		return this == TRANSIENT_HTTP || this == GENERIC_REQUEST;
	}
}
