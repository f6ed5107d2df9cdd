package dev.poireviews;

import dev.poireviews.scraper.PoiIdResolver;
import dev.poireviews.scraper.ResolutionException;
import dev.poireviews.util.HttpUtils;
import java.time.Duration;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Resolve command to look up the POI id of an attraction page */
@Command(
		name = "resolve",
		description = "Print the POI id embedded in an attraction page",
		mixinStandardHelpOptions = true)
public class ResolveCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-u", "--url"},
			description = "Attraction page URL",
			required = true)
	private String url;

	@Option(
			names = {"--timeout"},
			description = "Request timeout in seconds (default: 30)",
			defaultValue = "30")
	private int timeoutSeconds;

	@Override
	public Integer call() throws Exception {
		if (timeoutSeconds < 1) {
			logger.error("Timeout must be at least 1 second, got {}", timeoutSeconds);
			return 1;
		}
		try {
			String poiId = new PoiIdResolver(new HttpUtils(Duration.ofSeconds(timeoutSeconds))).resolve(url);
			System.out.println(poiId);
			return 0;
		} catch (ResolutionException e) {
			logger.error("Could not resolve POI id: {}", e.getMessage());
			return 1;
		}
	}
}
