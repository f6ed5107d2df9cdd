package dev.poireviews.scraper;

import java.time.Duration;

/** Blocks the retrieval thread between requests */
@FunctionalInterface
public interface Sleeper {
	Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;
}
