package dev.poireviews;

import dev.poireviews.scraper.HttpPageFetcher;
import dev.poireviews.scraper.PoiIdResolver;
import dev.poireviews.scraper.ResolutionException;
import dev.poireviews.scraper.RetrievalConfig;
import dev.poireviews.scraper.RetrievalResult;
import dev.poireviews.scraper.ReviewRetriever;
import dev.poireviews.util.CsvUtils;
import dev.poireviews.util.HttpUtils;
import dev.poireviews.util.StatisticsUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Fetch command to retrieve all reviews of a POI and save them as CSV */
@Command(
		name = "fetch",
		description = "Retrieve all reviews of a point of interest and save them as CSV",
		mixinStandardHelpOptions = true,
		footer = {
			"",
			"The run log goes to standard error. To keep it in a file, redirect it (2>>spider.log)",
			"or start the JVM with -Dorg.slf4j.simpleLogger.logFile=spider.log"
		})
public class FetchCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-u", "--url"},
			description = "Attraction page URL the POI id is resolved from (default: ${DEFAULT-VALUE})",
			defaultValue = "https://you.ctrip.com/sight/shanghai2/25506.html")
	private String url;

	@Option(
			names = {"-p", "--poi-id"},
			description = "POI id to use directly, skipping the page lookup")
	private String poiId;

	@Option(
			names = {"--max-pages"},
			description = "Maximum number of pages to fetch (default: unlimited)",
			defaultValue = "0")
	private int maxPages;

	@Option(
			names = {"-o", "--output"},
			description = "Output CSV file (default: comments_<poiId>_<timestamp>.csv)")
	private Path output;

	@Option(
			names = {"--min-delay"},
			description = "Minimum pause between pages in seconds (default: ${DEFAULT-VALUE})",
			defaultValue = "1.5")
	private double minDelay;

	@Option(
			names = {"--max-delay"},
			description = "Maximum pause between pages in seconds (default: ${DEFAULT-VALUE})",
			defaultValue = "3.0")
	private double maxDelay;

	@Option(
			names = {"--max-failures"},
			description = "Consecutive failed requests tolerated before giving up (default: ${DEFAULT-VALUE})",
			defaultValue = "3")
	private int maxFailures;

	@Option(
			names = {"--page-size"},
			description = "Number of reviews requested per page (default: ${DEFAULT-VALUE})",
			defaultValue = "10")
	private int pageSize;

	@Option(
			names = {"--timeout"},
			description = "Request timeout in seconds (default: ${DEFAULT-VALUE})",
			defaultValue = "30")
	private int timeoutSeconds;

	@Option(
			names = {"--api-url"},
			description = "Comment API endpoint (default: ${DEFAULT-VALUE})",
			defaultValue = HttpPageFetcher.COMMENT_API_URL)
	private String apiUrl;

	@Override
	public Integer call() throws Exception {
		if (timeoutSeconds < 1) {
			logger.error("Invalid configuration: timeout must be at least 1 second, got {}", timeoutSeconds);
			return 1;
		}
		HttpUtils httpUtils = new HttpUtils(Duration.ofSeconds(timeoutSeconds));

		String id = poiId;
		if (id == null || id.isBlank()) {
			try {
				id = new PoiIdResolver(httpUtils).resolve(url);
			} catch (ResolutionException e) {
				logger.error("Could not resolve POI id: {}", e.getMessage());
				logger.error("Check the URL or pass the POI id with --poi-id");
				return 1;
			}
		}

		RetrievalConfig config;
		try {
			config = new RetrievalConfig(
					id.trim(),
					maxPages,
					pageSize,
					seconds(minDelay),
					seconds(maxDelay),
					maxFailures,
					RetrievalConfig.Backoff.DEFAULT,
					LoggerFactory.getLogger("retriever"));
		} catch (IllegalArgumentException e) {
			logger.error("Invalid configuration: {}", e.getMessage());
			return 1;
		}

		logger.info("POI Review Scraper");
		logger.info("==================");
		logger.info("Page URL: {}", poiId != null ? "(not used)" : url);
		logger.info("POI id: {}", config.poiId());
		logger.info("Delay between pages: {}s - {}s", minDelay, maxDelay);
		if (maxPages > 0) {
			logger.info("Max pages: {}", maxPages);
		}
		logger.info("");

		ReviewRetriever retriever = new ReviewRetriever(new HttpPageFetcher(httpUtils, apiUrl), config);
		RetrievalResult result = retriever.retrieve();

		if (result.isEmpty()) {
			logger.warn("No reviews retrieved ({})", result.stopReason());
			logger.warn("Possible reasons: the POI has no reviews, the POI id is wrong, or the network failed");
			return result.completed() ? 0 : 1;
		}

		Path file = output != null ? output : CsvUtils.defaultOutputFile(config.poiId(), LocalDateTime.now());
		try {
			CsvUtils.writeReviews(file, result.records());
			logger.info("Saved {} reviews to {}", result.records().size(), file.toAbsolutePath());
		} catch (IOException e) {
			logger.error("Failed to save reviews to {}: {}", file, e.getMessage());
			return 1;
		}

		logger.info("");
		logger.info("Review Statistics");
		logger.info("=================");
		StatisticsUtils.describe(
				StatisticsUtils.compute(result.records(), result.reportedTotal()), line -> logger.info(line));
		return 0;
	}

	private static Duration seconds(double value) {
		if (Double.isNaN(value) || value < 0) {
			throw new IllegalArgumentException("Delay must not be negative, got " + value);
		}
		return Duration.ofMillis(Math.round(value * 1000));
	}
}
